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
package org.colstore.exec.fragmenter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.colstore.exec.chunk.ChunkBuffer;

/**
 * Whole chunks of one fragment to insert into a table. Only the rows listed in
 * {@code validRowIndices} are inserted.
 */
public class InsertChunks {
  private final int tableId;
  private final int dbId;
  private final Map<Integer, ChunkBuffer> chunks;
  private final List<Integer> validRowIndices;

  public InsertChunks(int tableId, int dbId, Map<Integer, ChunkBuffer> chunks, List<Integer> validRowIndices) {
    this.tableId = tableId;
    this.dbId = dbId;
    this.chunks = new TreeMap<>(chunks);
    this.validRowIndices = new ArrayList<>(validRowIndices);
  }

  public int getTableId() {
    return tableId;
  }

  public int getDbId() {
    return dbId;
  }

  /**
   * @return chunk buffers keyed by column id
   */
  public Map<Integer, ChunkBuffer> getChunks() {
    return Collections.unmodifiableMap(chunks);
  }

  public List<Integer> getValidRowIndices() {
    return Collections.unmodifiableList(validRowIndices);
  }

  public int getNumRows() {
    return validRowIndices.size();
  }
}
