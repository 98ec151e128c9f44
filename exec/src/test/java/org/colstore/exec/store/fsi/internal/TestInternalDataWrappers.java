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
package org.colstore.exec.store.fsi.internal;

import static org.colstore.exec.store.fsi.ForeignTableFixtures.DB_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.foreignTable;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.options;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.server;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import org.colstore.common.config.ColstoreConfig;
import org.colstore.common.exceptions.ErrorType;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.InMemoryCatalog;
import org.colstore.exec.catalog.InMemorySysCatalog;
import org.colstore.exec.catalog.SessionInfo;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.fragmenter.LocalFragmentStore;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.exec.store.fsi.ForeignStorageContext;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;
import org.colstore.test.ColstoreTest;
import org.junit.Before;
import org.junit.Test;

public class TestInternalDataWrappers extends ColstoreTest {

  private static final int SYS_TABLE_ID = 100;

  private ForeignStorageContext context;
  private LocalFragmentStore store;

  @Before
  public void setUp() {
    InMemorySysCatalog sysCatalog = new InMemorySysCatalog();
    InMemoryCatalog catalog = new InMemoryCatalog(DB_ID, "sales");
    catalog.addTable(new TableDescriptor(3, "orders", 0, DB_ID, 1000L, Arrays.asList(
        new ColumnDescriptor(3, 1, "id", SqlTypeInfo.of(SqlTypeName.BIGINT)),
        new ColumnDescriptor(3, 2, "rowid", SqlTypeInfo.of(SqlTypeName.BIGINT), true))));
    sysCatalog.addCatalog(catalog);
    store = new LocalFragmentStore();
    context = new ForeignStorageContext(ColstoreConfig.create(new Properties()), sysCatalog, store);
  }

  private static ForeignTable systemTable(DataWrapperType type, ColumnDescriptor... columns) {
    return foreignTable(server(type),
        new TableDescriptor(SYS_TABLE_ID, "sys_" + type.name(), 0, DB_ID, 32_000_000L, Arrays.asList(columns)));
  }

  private static ColumnDescriptor column(int id, String name, SqlTypeInfo type) {
    return new ColumnDescriptor(SYS_TABLE_ID, id, name, type);
  }

  private static Map<ChunkKey, ChunkBuffer> read(InternalSystemDataWrapper<?> wrapper, ForeignTable table) {
    ChunkMetadataVector metadata = new ChunkMetadataVector();
    wrapper.populateChunkMetadata(metadata);
    Map<ChunkKey, ChunkBuffer> buffers = new LinkedHashMap<>();
    for (ColumnDescriptor column : table.getLogicalColumns()) {
      buffers.put(ChunkKey.of(DB_ID, SYS_TABLE_ID, column.getColumnId(), 0),
          new ChunkBuffer(column.getColumnType()));
    }
    assertEquals(buffers.keySet(), new HashSet<>(metadata.keys()));
    wrapper.populateChunkBuffers(buffers);
    return buffers;
  }

  private static ChunkBuffer chunk(Map<ChunkKey, ChunkBuffer> buffers, int columnId) {
    return buffers.get(ChunkKey.of(DB_ID, SYS_TABLE_ID, columnId, 0));
  }

  @Test
  public void testCatalogTable() {
    ForeignTable table = systemTable(DataWrapperType.INTERNAL_CATALOG,
        column(1, "database_name", SqlTypeInfo.dictText()),
        column(2, "table_name", SqlTypeInfo.of(SqlTypeName.TEXT)),
        column(3, "column_count", SqlTypeInfo.of(SqlTypeName.INT)),
        column(4, "is_foreign", SqlTypeInfo.of(SqlTypeName.BOOLEAN)),
        column(5, "comment", SqlTypeInfo.of(SqlTypeName.TEXT)));
    Map<ChunkKey, ChunkBuffer> buffers = read(new InternalCatalogDataWrapper(DB_ID, table, context), table);

    assertEquals("sales", chunk(buffers, 1).getDictionaryString(0));
    assertEquals("orders", chunk(buffers, 2).getValue(0));
    // system columns are not counted
    assertEquals(Datum.ofInt(1), chunk(buffers, 3).getValue(0));
    assertEquals(Datum.ofBoolean(false), chunk(buffers, 4).getValue(0));
    // columns without a matching field are null
    assertTrue(chunk(buffers, 5).isNull(0));
  }

  @Test
  public void testStorageStatsTable() {
    SessionInfo session = new SessionInfo("s", "admin", 0, DB_ID);
    ChunkBuffer ids = new ChunkBuffer(SqlTypeInfo.of(SqlTypeName.BIGINT));
    ids.appendDatum(Datum.ofBigint(1));
    ids.appendDatum(Datum.ofBigint(2));
    store.stage(session, DB_ID, 3, Collections.singletonMap(1, ids));
    store.checkpoint(session, 3);

    ForeignTable table = systemTable(DataWrapperType.INTERNAL_STORAGE_STATS,
        column(1, "TABLE_ID", SqlTypeInfo.of(SqlTypeName.INT)),
        column(2, "row_count", SqlTypeInfo.of(SqlTypeName.BIGINT)),
        column(3, "total_bytes", SqlTypeInfo.of(SqlTypeName.BIGINT)));
    Map<ChunkKey, ChunkBuffer> buffers = read(new InternalStorageStatsDataWrapper(DB_ID, table, context), table);

    assertEquals(Datum.ofInt(3), chunk(buffers, 1).getValue(0));
    assertEquals(Datum.ofBigint(2), chunk(buffers, 2).getValue(0));
    assertEquals(Datum.ofBigint(16), chunk(buffers, 3).getValue(0));
  }

  @Test
  public void testEmptyStorageStats() {
    ForeignTable table = systemTable(DataWrapperType.INTERNAL_STORAGE_STATS,
        column(1, "table_id", SqlTypeInfo.of(SqlTypeName.INT)));
    ChunkMetadataVector metadata = new ChunkMetadataVector();
    new InternalStorageStatsDataWrapper(DB_ID, table, context).populateChunkMetadata(metadata);
    assertTrue(metadata.isEmpty());
  }

  @Test
  public void testMemoryStatsTable() {
    ForeignTable table = systemTable(DataWrapperType.INTERNAL_MEMORY_STATS,
        column(1, "pool_name", SqlTypeInfo.of(SqlTypeName.TEXT)),
        column(2, "used_bytes", SqlTypeInfo.of(SqlTypeName.BIGINT)));
    Map<ChunkKey, ChunkBuffer> buffers = read(new InternalMemoryStatsDataWrapper(DB_ID, table, context), table);
    assertThat(chunk(buffers, 1).size(), greaterThan(0));
    assertEquals(chunk(buffers, 1).size(), chunk(buffers, 2).size());
  }

  @Test
  public void testValueDoesNotFitColumn() {
    ForeignTable table = systemTable(DataWrapperType.INTERNAL_CATALOG,
        column(1, "table_name", SqlTypeInfo.of(SqlTypeName.INT)));
    try {
      new InternalCatalogDataWrapper(DB_ID, table, context).populateChunkMetadata(new ChunkMetadataVector());
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("\"orders\""));
    }
  }

  @Test
  public void testOptionValidation() {
    InternalCatalogDataWrapper validator = new InternalCatalogDataWrapper();
    validator.validateServerOptions(server(DataWrapperType.INTERNAL_CATALOG));
    validator.validateTableOptions(foreignTable(server(DataWrapperType.INTERNAL_CATALOG),
        systemTable(DataWrapperType.INTERNAL_CATALOG), "FRAGMENT_SIZE", "10"));

    ForeignServer withOptions = server(DataWrapperType.INTERNAL_CATALOG, "BASE_PATH", "/tmp");
    expectError(ErrorType.VALIDATION, "take no options", () -> validator.validateServerOptions(withOptions));
    expectError(ErrorType.VALIDATION, "Invalid foreign table option \"FILE_PATH\".",
        () -> validator.validateTableOptions(foreignTable(withOptions, systemTable(DataWrapperType.INTERNAL_CATALOG),
            "FILE_PATH", "/tmp")));
    expectError(ErrorType.UNSUPPORTED_OPERATION, "User mappings are not supported",
        () -> validator.validateUserMappingOptions(new UserMapping(1, 0, 7, options()), withOptions));
  }

  @Test(expected = IllegalStateException.class)
  public void testValidationWrapperCannotRead() {
    new InternalMemoryStatsDataWrapper().populateChunkMetadata(new ChunkMetadataVector());
  }

  private static void expectError(ErrorType type, String message, Runnable action) {
    try {
      action.run();
      fail();
    } catch (UserException e) {
      assertEquals(type, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString(message));
    }
  }
}
