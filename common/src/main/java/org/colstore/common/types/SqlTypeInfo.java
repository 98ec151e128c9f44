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

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Logical type of a column: the SQL type, its element type when it is an
 * array, precision and scale, nullability and storage encoding.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class SqlTypeInfo {

  private static final int DEFAULT_DICT_BITS = 32;

  private final SqlTypeName type;
  private final SqlTypeInfo elemType;
  private final int precision;
  private final int scale;
  private final boolean notNull;
  private final EncodingType compression;
  private final int compParam;

  private SqlTypeInfo(SqlTypeName type, SqlTypeInfo elemType, int precision, int scale, boolean notNull,
                      EncodingType compression, int compParam) {
    this.type = type;
    this.elemType = elemType;
    this.precision = precision;
    this.scale = scale;
    this.notNull = notNull;
    this.compression = compression;
    this.compParam = compParam;
  }

  public static SqlTypeInfo of(SqlTypeName type) {
    Preconditions.checkArgument(type != SqlTypeName.ARRAY, "Use arrayOf() to declare array types");
    return new SqlTypeInfo(type, null, 0, 0, false, EncodingType.NONE, 0);
  }

  public static SqlTypeInfo decimal(int precision, int scale) {
    Preconditions.checkArgument(scale >= 0 && scale <= precision, "Invalid decimal scale %s for precision %s",
        scale, precision);
    return new SqlTypeInfo(SqlTypeName.DECIMAL, null, precision, scale, false, EncodingType.NONE, 0);
  }

  /**
   * @return a TEXT type stored as codes of a per-column string dictionary
   */
  public static SqlTypeInfo dictText() {
    return new SqlTypeInfo(SqlTypeName.TEXT, null, 0, 0, false, EncodingType.DICT, DEFAULT_DICT_BITS);
  }

  public static SqlTypeInfo arrayOf(SqlTypeInfo elemType) {
    Preconditions.checkArgument(!elemType.isArray(), "Nested arrays are not supported");
    return new SqlTypeInfo(SqlTypeName.ARRAY, elemType, 0, 0, false, EncodingType.NONE, 0);
  }

  public SqlTypeInfo withNotNull(boolean notNull) {
    return new SqlTypeInfo(type, elemType, precision, scale, notNull, compression, compParam);
  }

  public SqlTypeInfo withEncoding(EncodingType compression, int compParam) {
    return new SqlTypeInfo(type, elemType, precision, scale, notNull, compression, compParam);
  }

  public SqlTypeName getType() {
    return type;
  }

  /**
   * @return the element type of an array, the type itself otherwise
   */
  public SqlTypeInfo getElemType() {
    return isArray() ? elemType : this;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public boolean isNotNull() {
    return notNull;
  }

  public EncodingType getCompression() {
    return compression;
  }

  public int getCompParam() {
    return compParam;
  }

  public boolean isArray() {
    return type == SqlTypeName.ARRAY;
  }

  public boolean isString() {
    return type == SqlTypeName.TEXT || type == SqlTypeName.VARCHAR || type == SqlTypeName.CHAR;
  }

  public boolean isDictEncodedString() {
    return isString() && compression == EncodingType.DICT;
  }

  public boolean isInteger() {
    switch (type) {
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
        return true;
      default:
        return false;
    }
  }

  public boolean isDecimal() {
    return type == SqlTypeName.DECIMAL || type == SqlTypeName.NUMERIC;
  }

  public boolean isFp() {
    return type == SqlTypeName.FLOAT || type == SqlTypeName.DOUBLE;
  }

  public boolean isTime() {
    return type == SqlTypeName.TIME || type == SqlTypeName.TIMESTAMP || type == SqlTypeName.DATE;
  }

  /**
   * @return width in bytes of one stored value, or -1 for variable length types
   */
  public int getSize() {
    switch (type) {
      case BOOLEAN:
      case TINYINT:
        return 1;
      case SMALLINT:
        return 2;
      case INT:
      case FLOAT:
        return 4;
      case BIGINT:
      case DOUBLE:
      case DECIMAL:
      case NUMERIC:
      case TIME:
      case TIMESTAMP:
      case DATE:
        return compression == EncodingType.FIXED ? compParam / 8 : 8;
      case CHAR:
      case VARCHAR:
      case TEXT:
        return compression == EncodingType.DICT ? compParam / 8 : -1;
      default:
        return -1;
    }
  }

  public String getTypeName() {
    switch (type) {
      case INT:
        return "INTEGER";
      case DECIMAL:
      case NUMERIC:
        return type.name() + "(" + precision + "," + scale + ")";
      case ARRAY:
        return elemType.getTypeName() + "[]";
      default:
        return type.name();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SqlTypeInfo that = (SqlTypeInfo) o;
    return type == that.type
        && precision == that.precision
        && scale == that.scale
        && notNull == that.notNull
        && compression == that.compression
        && compParam == that.compParam
        && Objects.equals(elemType, that.elemType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, elemType, precision, scale, notNull, compression, compParam);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getTypeName());
    if (compression != EncodingType.NONE) {
      sb.append(" ENCODING ").append(compression).append('(').append(compParam).append(')');
    }
    if (notNull) {
      sb.append(" NOT NULL");
    }
    return sb.toString();
  }
}
