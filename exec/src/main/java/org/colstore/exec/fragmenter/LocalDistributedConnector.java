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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.SessionInfo;
import org.colstore.exec.catalog.SysCatalog;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;

import com.google.common.base.Preconditions;

/**
 * Connector of a single node deployment: one leaf, backed by a {@link LocalFragmentStore}.
 */
public class LocalDistributedConnector implements DistributedConnector {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LocalDistributedConnector.class);

  private final LocalFragmentStore store;
  private final SysCatalog sysCatalog;

  public LocalDistributedConnector(LocalFragmentStore store, SysCatalog sysCatalog) {
    this.store = store;
    this.sysCatalog = sysCatalog;
  }

  @Override
  public int leafCount() {
    return 1;
  }

  @Override
  public void insertDataToLeaf(SessionInfo parentSessionInfo, int leafIdx, InsertData insertData) {
    checkLeaf(leafIdx);
    if (insertData.getNumRows() == 0) {
      return;
    }
    int dbId = insertData.getDatabaseId();
    int tableId = insertData.getTableId();
    TableDescriptor table = lookupTable(dbId, tableId);

    Map<Integer, ChunkBuffer> chunks = new LinkedHashMap<>();
    List<Integer> columnIds = insertData.getColumnIds();
    for (int i = 0; i < columnIds.size(); i++) {
      int columnId = columnIds.get(i);
      ColumnDescriptor column = table.getColumn(columnId);
      Preconditions.checkArgument(column != null, "Table %s has no column %s", tableId, columnId);
      SqlTypeInfo type = column.getColumnType();
      StringDictionary dictionary = type.getElemType().isDictEncodedString()
          ? store.getDictionary(dbId, tableId, columnId)
          : null;
      ChunkBuffer chunk = new ChunkBuffer(type, dictionary);
      for (Object value : insertData.getColumnValues(i)) {
        if (value instanceof String && dictionary != null) {
          chunk.appendDatum(Datum.ofInt(dictionary.getOrAdd((String) value)));
        } else {
          chunk.append(value);
        }
      }
      chunks.put(columnId, chunk);
    }
    store.stage(parentSessionInfo, dbId, tableId, chunks);
  }

  @Override
  public void insertChunksToLeaf(SessionInfo parentSessionInfo, int leafIdx, InsertChunks insertChunks) {
    checkLeaf(leafIdx);
    if (insertChunks.getNumRows() == 0) {
      return;
    }
    Map<Integer, ChunkBuffer> chunks = new LinkedHashMap<>();
    insertChunks.getChunks().forEach((columnId, chunk) ->
        chunks.put(columnId, chunk.select(insertChunks.getValidRowIndices())));
    store.stage(parentSessionInfo, insertChunks.getDbId(), insertChunks.getTableId(), chunks);
  }

  @Override
  public void checkpoint(SessionInfo parentSessionInfo, int tableId) {
    store.checkpoint(parentSessionInfo, tableId);
  }

  @Override
  public void rollback(SessionInfo parentSessionInfo, int tableId) {
    store.rollback(parentSessionInfo, tableId);
  }

  public LocalFragmentStore getStore() {
    return store;
  }

  private void checkLeaf(int leafIdx) {
    Preconditions.checkArgument(leafIdx == 0, "Leaf index %s is out of range for a single leaf", leafIdx);
  }

  private TableDescriptor lookupTable(int dbId, int tableId) {
    return sysCatalog.getCatalog(dbId)
        .flatMap(catalog -> catalog.getTable(tableId))
        .orElseThrow(() -> UserException.validationError()
            .message("Table %s does not exist in database %s.", tableId, dbId)
            .build(logger));
  }
}
