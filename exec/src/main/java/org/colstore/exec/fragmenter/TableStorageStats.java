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

/**
 * Storage statistics of one table. Public fields are the columns of the storage stats system table.
 */
public class TableStorageStats {
  public final int database_id;
  public final int table_id;
  public final int fragment_count;
  public final long chunk_count;
  public final long row_count;
  public final long total_bytes;
  public final int staged_fragment_count;

  public TableStorageStats(int databaseId, int tableId, int fragmentCount, long chunkCount, long rowCount,
                           long totalBytes, int stagedFragmentCount) {
    this.database_id = databaseId;
    this.table_id = tableId;
    this.fragment_count = fragmentCount;
    this.chunk_count = chunkCount;
    this.row_count = rowCount;
    this.total_bytes = totalBytes;
    this.staged_fragment_count = stagedFragmentCount;
  }
}
