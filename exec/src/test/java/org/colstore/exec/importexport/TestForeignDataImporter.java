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
package org.colstore.exec.importexport;

import static org.colstore.exec.store.fsi.ForeignTableFixtures.DB_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.TABLE_ID;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.colstore.common.config.ColstoreConfig;
import org.colstore.common.exceptions.ErrorType;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.InMemoryCatalog;
import org.colstore.exec.catalog.InMemorySysCatalog;
import org.colstore.exec.catalog.SessionInfo;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.fragmenter.LocalDistributedConnector;
import org.colstore.exec.fragmenter.LocalFragmentStore;
import org.colstore.exec.store.fsi.ForeignDataWrapperFactory;
import org.colstore.exec.store.fsi.ForeignStorageContext;
import org.colstore.exec.store.fsi.parquet.ParquetFixtures;
import org.colstore.test.ColstoreTest;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestForeignDataImporter extends ColstoreTest {

  // two rows per fragment
  private static final TableDescriptor TABLE = new TableDescriptor(TABLE_ID, "t", 0, DB_ID, 2, Arrays.asList(
      new ColumnDescriptor(TABLE_ID, 1, "id", SqlTypeInfo.of(SqlTypeName.INT)),
      new ColumnDescriptor(TABLE_ID, 2, "name", SqlTypeInfo.of(SqlTypeName.TEXT)),
      new ColumnDescriptor(TABLE_ID, 3, "tag", SqlTypeInfo.dictText())));

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private final SessionInfo session = new SessionInfo("import-1", "admin", 0, DB_ID);
  private LocalFragmentStore store;
  private ForeignDataImporter importer;

  @Before
  public void setUp() {
    InMemorySysCatalog sysCatalog = new InMemorySysCatalog();
    InMemoryCatalog catalog = new InMemoryCatalog(DB_ID, "db");
    catalog.addTable(TABLE);
    sysCatalog.addCatalog(catalog);
    store = new LocalFragmentStore();
    ForeignStorageContext context =
        new ForeignStorageContext(ColstoreConfig.create(new Properties()), sysCatalog, store);
    importer = new ForeignDataImporter(new ForeignDataWrapperFactory(context),
        new LocalDistributedConnector(store, sysCatalog));
  }

  private File write(String name, String... lines) throws IOException {
    File file = new File(folder.getRoot(), name);
    Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void testImportDelimitedFile() throws Exception {
    File file = write("trips.csv", "id,name,tag", "1,alpha,x", "2,beta,y", "3,\\N,x");

    ImportStatus status = importer.importGeneral(session, TABLE, file.getPath(), new CopyParams());

    assertEquals(3, status.getRowsCompleted());
    assertEquals(2, status.getFragmentsLoaded());
    assertEquals(3, store.getRowCount(DB_ID, TABLE_ID));

    List<LocalFragmentStore.Fragment> fragments = store.getFragments(DB_ID, TABLE_ID);
    assertEquals(2, fragments.size());
    assertEquals(Datum.ofInt(1), fragments.get(0).getChunk(1).getValue(0));
    assertEquals("beta", fragments.get(0).getChunk(2).getValue(1));
    assertEquals("y", fragments.get(0).getChunk(3).getDictionaryString(1));
    assertTrue(fragments.get(1).getChunk(2).isNull(0));
    assertEquals("x", fragments.get(1).getChunk(3).getDictionaryString(0));
  }

  @Test
  public void testImportWithoutHeaderAndCustomDelimiter() throws Exception {
    File file = write("trips.txt", "7|seven|z");
    CopyParams copyParams = new CopyParams();
    copyParams.delimiter = '|';
    copyParams.hasHeader = ImportHeaderRow.NO_HEADER;

    ImportStatus status = importer.importGeneral(session, TABLE, file.getPath(), copyParams);

    assertEquals(1, status.getRowsCompleted());
    assertEquals("seven", store.getFragments(DB_ID, TABLE_ID).get(0).getChunk(2).getValue(0));
  }

  @Test
  public void testFailedImportCommitsNothing() throws Exception {
    File file = write("bad.csv", "id,name,tag", "1,alpha,x", "2,beta");

    try {
      importer.importGeneral(session, TABLE, file.getPath(), new CopyParams());
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("Mismatched number"));
    }
    assertEquals(0, store.getRowCount(DB_ID, TABLE_ID));
  }

  @Test
  public void testImportRegexParsedFile() throws Exception {
    File file = write("app.log", "1 alpha x", "  continued", "2 beta y");
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.REGEX_PARSED_FILE;
    copyParams.lineRegex = "(\\d+) (\\w+)\\s.*?(\\w)";
    copyParams.lineStartRegex = "^\\d+";

    ImportStatus status = importer.importGeneral(session, TABLE, file.getPath(), copyParams);

    assertEquals(2, status.getRowsCompleted());
    List<LocalFragmentStore.Fragment> fragments = store.getFragments(DB_ID, TABLE_ID);
    assertEquals("alpha", fragments.get(0).getChunk(2).getValue(0));
    assertEquals(Datum.ofInt(2), fragments.get(0).getChunk(1).getValue(1));
  }

  @Test
  public void testImportParquetDirectory() throws Exception {
    File dir = folder.newFolder("events");
    ParquetFixtures.writeEvents(new File(dir, "a.parquet"),
        new Object[] {1, "open", 1_000L, 1}, new Object[] {2, null, 2_000L, 2});
    ParquetFixtures.writeEvents(new File(dir, "b.parquet"), new Object[] {3, "open", 3_000L, 3});
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.PARQUET_FILE;
    copyParams.regexPathFilter = ".*\\.parquet";

    ImportStatus status = importer.importGeneral(session, ParquetFixtures.EVENTS_TABLE, dir.getPath(), copyParams);

    assertEquals(3, status.getRowsCompleted());
    assertEquals(2, status.getFragmentsLoaded());
    List<LocalFragmentStore.Fragment> fragments = store.getFragments(DB_ID, TABLE_ID);
    assertEquals(2, fragments.size());
    assertEquals("open", fragments.get(0).getChunk(2).getDictionaryString(0));
    assertTrue(fragments.get(0).getChunk(2).isNull(1));
    assertEquals(Datum.ofInt(3), fragments.get(1).getChunk(1).getValue(0));
  }

  @Test
  public void testParquetFailureRollsBackStagedBatches() throws Exception {
    File dir = folder.newFolder("broken");
    ParquetFixtures.writeEvents(new File(dir, "a.parquet"), new Object[] {1, "open", 1_000L, 1});
    Files.write(new File(dir, "b.parquet").toPath(), "not parquet".getBytes(StandardCharsets.UTF_8));
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.PARQUET_FILE;
    copyParams.regexPathFilter = ".*\\.parquet";

    try {
      importer.importGeneral(session, ParquetFixtures.EVENTS_TABLE, dir.getPath(), copyParams);
      fail();
    } catch (RuntimeException e) {
      // first row group was staged before the second file failed
    }
    assertEquals(0, store.getRowCount(DB_ID, TABLE_ID));
    assertEquals(0, store.getTableStorageStats().get(0).staged_fragment_count);
  }

  @Test
  public void testRejectsOdbcSource() {
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.ODBC;
    try {
      importer.importGeneral(session, TABLE, "dsn", copyParams);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_OPERATION, e.getErrorType());
    }
  }
}
