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

/**
 * A scalar value of any fixed width SQL type, stored in a single 64 bit
 * slot shared by all widths.
 * <p>
 * Writing through one width and reading through another behaves like a C
 * union: a value written with {@link #ofBigint(long)} and read back with
 * {@link #getTinyintval()} returns the low order byte. Dictionary encoded
 * strings are held as their integer code.
 */
public final class Datum {

  public static final Datum ZERO = new Datum(0L);

  private final long bits;

  private Datum(long bits) {
    this.bits = bits;
  }

  public static Datum ofBoolean(boolean value) {
    return new Datum(value ? 1L : 0L);
  }

  public static Datum ofTinyint(byte value) {
    return new Datum(value & 0xFFL);
  }

  public static Datum ofSmallint(short value) {
    return new Datum(value & 0xFFFFL);
  }

  public static Datum ofInt(int value) {
    return new Datum(value & 0xFFFFFFFFL);
  }

  public static Datum ofBigint(long value) {
    return new Datum(value);
  }

  public static Datum ofFloat(float value) {
    return new Datum(Float.floatToRawIntBits(value) & 0xFFFFFFFFL);
  }

  public static Datum ofDouble(double value) {
    return new Datum(Double.doubleToRawLongBits(value));
  }

  public boolean getBoolval() {
    return (byte) bits != 0;
  }

  public byte getTinyintval() {
    return (byte) bits;
  }

  public short getSmallintval() {
    return (short) bits;
  }

  public int getIntval() {
    return (int) bits;
  }

  public long getBigintval() {
    return bits;
  }

  public float getFloatval() {
    return Float.intBitsToFloat((int) bits);
  }

  public double getDoubleval() {
    return Double.longBitsToDouble(bits);
  }

  /**
   * Bitwise equality of the whole slot. Use {@link DatumUtils#datumEqual(Datum, Datum, SqlTypeInfo)}
   * to compare values of a given type.
   */
  @Override
  public boolean equals(Object o) {
    return o instanceof Datum && ((Datum) o).bits == bits;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(bits);
  }

  @Override
  public String toString() {
    return "Datum[0x" + Long.toHexString(bits) + "]";
  }
}
