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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.colstore.exec.catalog.SessionInfo;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * Fragments of the tables stored on this node.
 * <p>
 * Inserted fragments are staged per session and only become visible once the
 * session checkpoints the table; a rollback discards them.
 */
public class LocalFragmentStore implements StorageStatsProvider {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LocalFragmentStore.class);

  // database id, table id
  private final Table<Integer, Integer, TableFragments> tables = HashBasedTable.create();

  public synchronized void stage(SessionInfo sessionInfo, int dbId, int tableId, Map<Integer, ChunkBuffer> chunks) {
    Preconditions.checkArgument(!chunks.isEmpty(), "A fragment needs at least one chunk");
    int numRows = chunks.values().iterator().next().size();
    for (ChunkBuffer chunk : chunks.values()) {
      Preconditions.checkArgument(chunk.size() == numRows, "Chunks of a fragment must have the same number of rows");
    }
    getOrCreateTable(dbId, tableId).staged
        .computeIfAbsent(sessionInfo.getSessionId(), sessionId -> new ArrayList<>())
        .add(new TreeMap<>(chunks));
    logger.debug("Staged fragment of {} rows for table {}.{} in session {}", numRows, dbId, tableId,
        sessionInfo.getSessionId());
  }

  /**
   * @return number of fragments made visible
   */
  public synchronized int checkpoint(SessionInfo sessionInfo, int tableId) {
    TableFragments table = tables.get(sessionInfo.getDatabaseId(), tableId);
    List<Map<Integer, ChunkBuffer>> staged = table == null ? null : table.staged.remove(sessionInfo.getSessionId());
    if (staged == null) {
      return 0;
    }
    for (Map<Integer, ChunkBuffer> chunks : staged) {
      table.committed.add(new Fragment(table.committed.size(), chunks));
    }
    logger.debug("Committed {} fragments of table {}.{}", staged.size(), sessionInfo.getDatabaseId(), tableId);
    return staged.size();
  }

  /**
   * @return number of fragments discarded
   */
  public synchronized int rollback(SessionInfo sessionInfo, int tableId) {
    TableFragments table = tables.get(sessionInfo.getDatabaseId(), tableId);
    List<Map<Integer, ChunkBuffer>> staged = table == null ? null : table.staged.remove(sessionInfo.getSessionId());
    int discarded = staged == null ? 0 : staged.size();
    logger.debug("Rolled back {} fragments of table {}.{}", discarded, sessionInfo.getDatabaseId(), tableId);
    return discarded;
  }

  /**
   * Dictionary shared by every fragment of a dictionary encoded string column.
   */
  public synchronized StringDictionary getDictionary(int dbId, int tableId, int columnId) {
    return getOrCreateTable(dbId, tableId).dictionaries.computeIfAbsent(columnId, id -> new StringDictionary());
  }

  public synchronized List<Fragment> getFragments(int dbId, int tableId) {
    TableFragments table = tables.get(dbId, tableId);
    return table == null ? Collections.emptyList() : new ArrayList<>(table.committed);
  }

  public synchronized ChunkMetadataVector getChunkMetadata(int dbId, int tableId) {
    ChunkMetadataVector metadata = new ChunkMetadataVector();
    for (Fragment fragment : getFragments(dbId, tableId)) {
      fragment.chunks.forEach((columnId, chunk) ->
          metadata.add(ChunkKey.of(dbId, tableId, columnId, fragment.fragmentId), chunk.getMetadata()));
    }
    return metadata;
  }

  public synchronized long getRowCount(int dbId, int tableId) {
    long rows = 0;
    for (Fragment fragment : getFragments(dbId, tableId)) {
      rows += fragment.getNumRows();
    }
    return rows;
  }

  @Override
  public synchronized List<TableStorageStats> getTableStorageStats() {
    List<TableStorageStats> stats = new ArrayList<>();
    for (Table.Cell<Integer, Integer, TableFragments> cell : tables.cellSet()) {
      TableFragments table = cell.getValue();
      long chunkCount = 0;
      long rowCount = 0;
      long totalBytes = 0;
      for (Fragment fragment : table.committed) {
        chunkCount += fragment.chunks.size();
        rowCount += fragment.getNumRows();
        for (ChunkBuffer chunk : fragment.chunks.values()) {
          totalBytes += chunk.getNumBytes();
        }
      }
      int stagedCount = table.staged.values().stream().mapToInt(List::size).sum();
      stats.add(new TableStorageStats(cell.getRowKey(), cell.getColumnKey(), table.committed.size(), chunkCount,
          rowCount, totalBytes, stagedCount));
    }
    return stats;
  }

  private TableFragments getOrCreateTable(int dbId, int tableId) {
    TableFragments table = tables.get(dbId, tableId);
    if (table == null) {
      table = new TableFragments();
      tables.put(dbId, tableId, table);
    }
    return table;
  }

  /**
   * A committed fragment: one chunk per column.
   */
  public static class Fragment {
    private final int fragmentId;
    private final Map<Integer, ChunkBuffer> chunks;

    Fragment(int fragmentId, Map<Integer, ChunkBuffer> chunks) {
      this.fragmentId = fragmentId;
      this.chunks = chunks;
    }

    public int getFragmentId() {
      return fragmentId;
    }

    public Map<Integer, ChunkBuffer> getChunks() {
      return Collections.unmodifiableMap(chunks);
    }

    public ChunkBuffer getChunk(int columnId) {
      return chunks.get(columnId);
    }

    public int getNumRows() {
      return chunks.values().iterator().next().size();
    }
  }

  private static class TableFragments {
    final List<Fragment> committed = new ArrayList<>();
    // session id -> staged fragments
    final Map<String, List<Map<Integer, ChunkBuffer>>> staged = new HashMap<>();
    final Map<Integer, StringDictionary> dictionaries = new HashMap<>();
  }
}
