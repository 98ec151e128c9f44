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
package org.colstore.exec.store.fsi.parquet;

import static org.colstore.exec.store.fsi.ForeignTableFixtures.DB_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.TABLE_ID;
import static org.colstore.exec.store.fsi.parquet.ParquetFixtures.EVENTS_TABLE;
import static org.colstore.exec.store.fsi.parquet.ParquetFixtures.parquetTable;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

import java.io.File;
import java.util.Arrays;
import java.util.Optional;

import org.colstore.common.types.Datum;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.fragmenter.InsertChunks;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.metastore.chunk.ChunkMetadataVector;
import org.colstore.test.ColstoreTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestParquetImporter extends ColstoreTest {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testOneBatchPerRowGroup() throws Exception {
    File dir = folder.newFolder("events");
    ParquetFixtures.writeEvents(new File(dir, "a.parquet"),
        new Object[] {1, "x", 0L, 0},
        new Object[] {2, "y", 0L, 0});
    ParquetFixtures.writeEvents(new File(dir, "b.parquet"));
    ParquetFixtures.writeEvents(new File(dir, "c.parquet"),
        new Object[] {3, "x", 1000L, 1});

    try (ParquetImporter importer = new ParquetImporter(DB_ID, parquetTable(EVENTS_TABLE, dir.getPath()), null)) {
      assertEquals(DataWrapperType.PARQUET, importer.getDataWrapperType());
      assertNull(importer.getUserMapping());

      InsertChunks first = importer.getNextImportBatch().get();
      assertEquals(TABLE_ID, first.getTableId());
      assertEquals(DB_ID, first.getDbId());
      assertEquals(Arrays.asList(0, 1), first.getValidRowIndices());
      assertEquals(4, first.getChunks().size());

      // the empty file has no row group
      InsertChunks second = importer.getNextImportBatch().get();
      assertEquals(1, second.getNumRows());
      ChunkBuffer names = second.getChunks().get(2);
      assertEquals("x", names.getDictionaryString(0));
      assertEquals(first.getChunks().get(2).getValue(0), names.getValue(0));
      assertEquals(Datum.ofBigint(1L), second.getChunks().get(3).getValue(0));
      assertEquals(Datum.ofBigint(86400L), second.getChunks().get(4).getValue(0));

      Optional<InsertChunks> end = importer.getNextImportBatch();
      assertFalse(end.isPresent());
      assertFalse(importer.getNextImportBatch().isPresent());
    }
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testNoMetadataScan() throws Exception {
    File file = ParquetFixtures.writeEvents(new File(folder.getRoot(), "a.parquet"), new Object[] {1, "x", 0L, 0});
    try (ParquetImporter importer = new ParquetImporter(DB_ID, parquetTable(EVENTS_TABLE, file.getPath()), null)) {
      importer.populateChunkMetadata(new ChunkMetadataVector());
    }
  }
}
