/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.colstore.common.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Typed operations on {@link Datum} values. The type passed to every method
 * selects which width of the datum is read.
 */
public final class DatumUtils {

  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final int SECONDS_PER_DAY = 86400;

  private DatumUtils() {
  }

  /**
   * Compares two datums under the given type. Floating point values are
   * compared exactly.
   */
  public static boolean datumEqual(Datum a, Datum b, SqlTypeInfo type) {
    switch (type.getType()) {
      case BOOLEAN:
        return a.getBoolval() == b.getBoolval();
      case TINYINT:
        return a.getTinyintval() == b.getTinyintval();
      case SMALLINT:
        return a.getSmallintval() == b.getSmallintval();
      case INT:
        return a.getIntval() == b.getIntval();
      case BIGINT:
      case DECIMAL:
      case NUMERIC:
      case TIME:
      case TIMESTAMP:
      case DATE:
        return a.getBigintval() == b.getBigintval();
      case FLOAT:
        return a.getFloatval() == b.getFloatval();
      case DOUBLE:
        return a.getDoubleval() == b.getDoubleval();
      case CHAR:
      case VARCHAR:
      case TEXT:
        // unencoded strings carry no comparable value
        return !type.isDictEncodedString() || a.getIntval() == b.getIntval();
      default:
        throw new IllegalArgumentException("Cannot compare datums of type " + type);
    }
  }

  /**
   * Orders two datums under the given type.
   *
   * @throws IllegalArgumentException for types without a value ordering, such as unencoded strings
   */
  public static int compare(Datum a, Datum b, SqlTypeInfo type) {
    switch (type.getType()) {
      case BOOLEAN:
        return Boolean.compare(a.getBoolval(), b.getBoolval());
      case TINYINT:
        return Byte.compare(a.getTinyintval(), b.getTinyintval());
      case SMALLINT:
        return Short.compare(a.getSmallintval(), b.getSmallintval());
      case INT:
        return Integer.compare(a.getIntval(), b.getIntval());
      case BIGINT:
      case DECIMAL:
      case NUMERIC:
      case TIME:
      case TIMESTAMP:
      case DATE:
        return Long.compare(a.getBigintval(), b.getBigintval());
      case FLOAT:
        return Float.compare(a.getFloatval(), b.getFloatval());
      case DOUBLE:
        return Double.compare(a.getDoubleval(), b.getDoubleval());
      case CHAR:
      case VARCHAR:
      case TEXT:
        if (type.isDictEncodedString()) {
          return Integer.compare(a.getIntval(), b.getIntval());
        }
        throw new IllegalArgumentException("Unencoded strings have no datum ordering");
      default:
        throw new IllegalArgumentException("Cannot order datums of type " + type);
    }
  }

  public static String datumToString(Datum d, SqlTypeInfo type) {
    switch (type.getType()) {
      case BOOLEAN:
        return d.getBoolval() ? "t" : "f";
      case TINYINT:
        return Byte.toString(d.getTinyintval());
      case SMALLINT:
        return Short.toString(d.getSmallintval());
      case INT:
        return Integer.toString(d.getIntval());
      case BIGINT:
        return Long.toString(d.getBigintval());
      case DECIMAL:
      case NUMERIC:
        return BigDecimal.valueOf(d.getBigintval(), type.getScale()).toPlainString();
      case FLOAT:
        return Float.toString(d.getFloatval());
      case DOUBLE:
        return Double.toString(d.getDoubleval());
      case TIME:
        return LocalTime.ofSecondOfDay(Math.floorMod(d.getBigintval(), SECONDS_PER_DAY)).format(TIME_FORMAT);
      case TIMESTAMP:
        return LocalDateTime.ofEpochSecond(d.getBigintval(), 0, ZoneOffset.UTC).format(TIMESTAMP_FORMAT);
      case DATE:
        return LocalDate.ofEpochDay(Math.floorDiv(d.getBigintval(), SECONDS_PER_DAY)).toString();
      case CHAR:
      case VARCHAR:
      case TEXT:
        if (type.isDictEncodedString()) {
          return Integer.toString(d.getIntval());
        }
        return "<invalid>";
      default:
        throw new IllegalArgumentException("Cannot render datum of type " + type);
    }
  }

  /**
   * Parses the text form of a fixed width value.
   *
   * @throws IllegalArgumentException when the text is not a valid value of the type, or the type is
   *                                  not a fixed width scalar type
   */
  public static Datum stringToDatum(String s, SqlTypeInfo type) {
    String value = s.trim();
    try {
      switch (type.getType()) {
        case BOOLEAN:
          return Datum.ofBoolean(parseBoolean(value));
        case TINYINT:
          return Datum.ofTinyint(Byte.parseByte(value));
        case SMALLINT:
          return Datum.ofSmallint(Short.parseShort(value));
        case INT:
          return Datum.ofInt(Integer.parseInt(value));
        case BIGINT:
          return Datum.ofBigint(Long.parseLong(value));
        case DECIMAL:
        case NUMERIC:
          return Datum.ofBigint(new BigDecimal(value)
              .setScale(type.getScale(), RoundingMode.HALF_UP)
              .unscaledValue()
              .longValueExact());
        case FLOAT:
          return Datum.ofFloat(Float.parseFloat(value));
        case DOUBLE:
          return Datum.ofDouble(Double.parseDouble(value));
        case TIME:
          return Datum.ofBigint(LocalTime.parse(value).toSecondOfDay());
        case TIMESTAMP:
          return Datum.ofBigint(LocalDateTime.parse(value.replace(' ', 'T')).toEpochSecond(ZoneOffset.UTC));
        case DATE:
          return Datum.ofBigint(LocalDate.parse(value).toEpochDay() * SECONDS_PER_DAY);
        default:
          throw new IllegalArgumentException("Type " + type + " has no fixed width text conversion");
      }
    } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
      throw new IllegalArgumentException(String.format("Cannot parse '%s' as %s", s, type.getTypeName()), e);
    }
  }

  public static long extractIntTypeFromDatum(Datum d, SqlTypeInfo type) {
    switch (type.getType()) {
      case BOOLEAN:
      case TINYINT:
        return d.getTinyintval();
      case SMALLINT:
        return d.getSmallintval();
      case CHAR:
      case VARCHAR:
      case TEXT:
        if (!type.isDictEncodedString()) {
          throw new IllegalArgumentException("Unencoded strings have no integer representation");
        }
        return d.getIntval();
      case INT:
        return d.getIntval();
      case BIGINT:
      case DECIMAL:
      case NUMERIC:
      case TIME:
      case TIMESTAMP:
      case DATE:
        return d.getBigintval();
      default:
        throw new IllegalArgumentException("Type " + type + " is not an integer type");
    }
  }

  public static double extractFpTypeFromDatum(Datum d, SqlTypeInfo type) {
    switch (type.getType()) {
      case FLOAT:
        return d.getFloatval();
      case DOUBLE:
        return d.getDoubleval();
      default:
        throw new IllegalArgumentException("Type " + type + " is not a floating point type");
    }
  }

  private static boolean parseBoolean(String value) {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "t":
      case "true":
      case "y":
      case "yes":
      case "1":
        return true;
      case "f":
      case "false":
      case "n":
      case "no":
      case "0":
        return false;
      default:
        throw new NumberFormatException("Not a boolean: " + value);
    }
  }
}
