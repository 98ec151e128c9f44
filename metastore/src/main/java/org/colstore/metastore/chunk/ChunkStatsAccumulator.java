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

import java.util.List;

import org.colstore.common.types.Datum;
import org.colstore.common.types.DatumUtils;
import org.colstore.common.types.SqlTypeInfo;

/**
 * Collects the statistics of a chunk while its values are appended.
 * <p>
 * Values are ordered under the element type for array columns. Unencoded
 * strings only contribute to null presence.
 */
public class ChunkStatsAccumulator {

  private final SqlTypeInfo columnType;
  private final SqlTypeInfo comparisonType;
  private final boolean tracksMinMax;

  private Datum min;
  private Datum max;
  private boolean hasNulls;

  public ChunkStatsAccumulator(SqlTypeInfo columnType) {
    this.columnType = columnType;
    this.comparisonType = columnType.getElemType();
    this.tracksMinMax = !comparisonType.isString() || comparisonType.isDictEncodedString();
  }

  public void addNull() {
    hasNulls = true;
  }

  /**
   * Adds a non null scalar value, or a dictionary code for encoded strings.
   */
  public void add(Datum value) {
    if (!tracksMinMax) {
      return;
    }
    if (min == null) {
      min = value;
      max = value;
      return;
    }
    if (DatumUtils.compare(value, min, comparisonType) < 0) {
      min = value;
    }
    if (DatumUtils.compare(value, max, comparisonType) > 0) {
      max = value;
    }
  }

  /**
   * Adds the elements of a non null array. Null elements mark the chunk as having nulls.
   */
  public void addArray(List<Datum> elements) {
    for (Datum element : elements) {
      if (element == null) {
        hasNulls = true;
      } else {
        add(element);
      }
    }
  }

  public SqlTypeInfo getColumnType() {
    return columnType;
  }

  public ChunkStats build() {
    return new ChunkStats(min == null ? Datum.ZERO : min, max == null ? Datum.ZERO : max, hasNulls);
  }
}
