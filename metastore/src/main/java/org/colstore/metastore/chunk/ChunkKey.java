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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/**
 * Identifies one chunk: database id, table id, column id and fragment id,
 * optionally followed by a sub key selecting the data or index buffer of a
 * variable length column.
 */
public final class ChunkKey implements Comparable<ChunkKey> {

  public static final int VARLEN_DATA_SUB_KEY = 1;
  public static final int VARLEN_INDEX_SUB_KEY = 2;

  private static final int DB_IDX = 0;
  private static final int TABLE_IDX = 1;
  private static final int COLUMN_IDX = 2;
  private static final int FRAGMENT_IDX = 3;
  private static final int VARLEN_IDX = 4;

  private final int[] parts;

  private ChunkKey(int[] parts) {
    this.parts = parts;
  }

  public static ChunkKey of(int dbId, int tableId, int columnId, int fragmentId) {
    return new ChunkKey(new int[] {dbId, tableId, columnId, fragmentId});
  }

  /**
   * @return key of the data or index buffer of a variable length chunk
   */
  public ChunkKey withVarlenSubKey(int subKey) {
    Preconditions.checkArgument(subKey == VARLEN_DATA_SUB_KEY || subKey == VARLEN_INDEX_SUB_KEY,
        "Invalid varlen sub key %s", subKey);
    Preconditions.checkState(!isVarlenKey(), "Key %s already has a varlen sub key", this);
    return new ChunkKey(new int[] {getDbId(), getTableId(), getColumnId(), getFragmentId(), subKey});
  }

  public int getDbId() {
    return parts[DB_IDX];
  }

  public int getTableId() {
    return parts[TABLE_IDX];
  }

  public int getColumnId() {
    return parts[COLUMN_IDX];
  }

  public int getFragmentId() {
    return parts[FRAGMENT_IDX];
  }

  public boolean isVarlenKey() {
    return parts.length > VARLEN_IDX;
  }

  public int getVarlenSubKey() {
    Preconditions.checkState(isVarlenKey(), "Key %s has no varlen sub key", this);
    return parts[VARLEN_IDX];
  }

  /**
   * @return true if this key belongs to the given table
   */
  public boolean isTableKey(int dbId, int tableId) {
    return getDbId() == dbId && getTableId() == tableId;
  }

  @Override
  public int compareTo(ChunkKey o) {
    return Ints.lexicographicalComparator().compare(parts, o.parts);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChunkKey && Arrays.equals(parts, ((ChunkKey) o).parts);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(parts);
  }

  @Override
  public String toString() {
    return Arrays.toString(parts);
  }
}
