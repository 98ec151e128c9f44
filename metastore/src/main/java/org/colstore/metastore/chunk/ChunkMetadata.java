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
package org.colstore.metastore.chunk;

import java.util.Objects;

import org.colstore.common.types.Datum;
import org.colstore.common.types.DatumUtils;
import org.colstore.common.types.SqlTypeInfo;

/**
 * Metadata of one chunk: its logical type, size in bytes, number of elements
 * and value statistics.
 * <p>
 * A chunk has a single writer. The writer that populates or updates the chunk
 * also fills its metadata; readers see it unchanged until the next write.
 * <p>
 * Equality is type aware: min and max are compared under the element type
 * of array columns and under the column type otherwise, so only the width of
 * that type participates in the comparison.
 */
public class ChunkMetadata {

  private SqlTypeInfo sqlType;
  private long numBytes;
  private long numElements;
  private ChunkStats chunkStats;

  public ChunkMetadata(SqlTypeInfo sqlType, long numBytes, long numElements, ChunkStats chunkStats) {
    this.sqlType = sqlType;
    this.numBytes = numBytes;
    this.numElements = numElements;
    this.chunkStats = chunkStats;
  }

  public ChunkMetadata(SqlTypeInfo sqlType) {
    this(sqlType, 0, 0, new ChunkStats());
  }

  public ChunkMetadata(ChunkMetadata other) {
    this(other.sqlType, other.numBytes, other.numElements, new ChunkStats(other.chunkStats));
  }

  /**
   * Narrows {@code min} and {@code max} into the datum width of the column
   * type. Dictionary encoded strings keep the dictionary codes. Types without
   * a fixed width representation leave min and max untouched and only record
   * null presence.
   */
  public void fillChunkStats(Number min, Number max, boolean hasNulls) {
    chunkStats.setHasNulls(hasNulls);
    SqlTypeInfo type = sqlType.getElemType();
    switch (type.getType()) {
      case BOOLEAN:
      case TINYINT:
        chunkStats.setMin(Datum.ofTinyint(min.byteValue()));
        chunkStats.setMax(Datum.ofTinyint(max.byteValue()));
        break;
      case SMALLINT:
        chunkStats.setMin(Datum.ofSmallint(min.shortValue()));
        chunkStats.setMax(Datum.ofSmallint(max.shortValue()));
        break;
      case INT:
        chunkStats.setMin(Datum.ofInt(min.intValue()));
        chunkStats.setMax(Datum.ofInt(max.intValue()));
        break;
      case BIGINT:
      case NUMERIC:
      case DECIMAL:
      case TIME:
      case TIMESTAMP:
      case DATE:
        chunkStats.setMin(Datum.ofBigint(min.longValue()));
        chunkStats.setMax(Datum.ofBigint(max.longValue()));
        break;
      case FLOAT:
        chunkStats.setMin(Datum.ofFloat(min.floatValue()));
        chunkStats.setMax(Datum.ofFloat(max.floatValue()));
        break;
      case DOUBLE:
        chunkStats.setMin(Datum.ofDouble(min.doubleValue()));
        chunkStats.setMax(Datum.ofDouble(max.doubleValue()));
        break;
      case VARCHAR:
      case CHAR:
      case TEXT:
        if (type.isDictEncodedString()) {
          chunkStats.setMin(Datum.ofInt(min.intValue()));
          chunkStats.setMax(Datum.ofInt(max.intValue()));
        }
        break;
      default:
        break;
    }
  }

  /**
   * Copies already narrowed values.
   */
  public void fillChunkStats(Datum min, Datum max, boolean hasNulls) {
    chunkStats.setHasNulls(hasNulls);
    chunkStats.setMin(min);
    chunkStats.setMax(max);
  }

  public SqlTypeInfo getSqlType() {
    return sqlType;
  }

  public void setSqlType(SqlTypeInfo sqlType) {
    this.sqlType = sqlType;
  }

  public long getNumBytes() {
    return numBytes;
  }

  public void setNumBytes(long numBytes) {
    this.numBytes = numBytes;
  }

  public long getNumElements() {
    return numElements;
  }

  public void setNumElements(long numElements) {
    this.numElements = numElements;
  }

  public ChunkStats getChunkStats() {
    return chunkStats;
  }

  public void setChunkStats(ChunkStats chunkStats) {
    this.chunkStats = chunkStats;
  }

  public static long extractMinStatIntType(ChunkStats stats, SqlTypeInfo type) {
    return DatumUtils.extractIntTypeFromDatum(stats.getMin(), type);
  }

  public static long extractMaxStatIntType(ChunkStats stats, SqlTypeInfo type) {
    return DatumUtils.extractIntTypeFromDatum(stats.getMax(), type);
  }

  public static double extractMinStatFpType(ChunkStats stats, SqlTypeInfo type) {
    return DatumUtils.extractFpTypeFromDatum(stats.getMin(), type);
  }

  public static double extractMaxStatFpType(ChunkStats stats, SqlTypeInfo type) {
    return DatumUtils.extractFpTypeFromDatum(stats.getMax(), type);
  }

  public String dump() {
    SqlTypeInfo type = sqlType.getElemType();
    String min;
    String max;
    if (type.isString() && !type.isDictEncodedString()) {
      // unencoded strings have no min/max
      min = "<invalid>";
      max = "<invalid>";
    } else if (type.isString()) {
      min = Integer.toString(chunkStats.getMin().getIntval());
      max = Integer.toString(chunkStats.getMax().getIntval());
    } else {
      min = DatumUtils.datumToString(chunkStats.getMin(), type);
      max = DatumUtils.datumToString(chunkStats.getMax(), type);
    }
    return "type: " + sqlType.getTypeName() + " numBytes: " + numBytes + " numElements " + numElements
        + " min: " + min + " max: " + max + " has_nulls: " + chunkStats.hasNulls();
  }

  @Override
  public String toString() {
    return dump();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ChunkMetadata that = (ChunkMetadata) o;
    SqlTypeInfo comparisonType = sqlType.getElemType();
    return Objects.equals(sqlType, that.sqlType)
        && numBytes == that.numBytes
        && numElements == that.numElements
        && chunkStats.hasNulls() == that.chunkStats.hasNulls()
        && DatumUtils.datumEqual(chunkStats.getMin(), that.chunkStats.getMin(), comparisonType)
        && DatumUtils.datumEqual(chunkStats.getMax(), that.chunkStats.getMax(), comparisonType);
  }

  /**
   * Only covers the fields compared exactly; min and max are left out since
   * equal values may differ outside the width of the comparison type.
   */
  @Override
  public int hashCode() {
    return Objects.hash(sqlType, numBytes, numElements, chunkStats.hasNulls());
  }
}
