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
package org.colstore.exec.store.fsi;

import static org.colstore.exec.store.fsi.ForeignTableFixtures.DB_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.context;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.foreignTable;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.localServer;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.server;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.table;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.colstore.common.exceptions.ErrorType;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.exec.ExecConstants;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.importexport.CopyParams;
import org.colstore.exec.importexport.ImportHeaderRow;
import org.colstore.exec.importexport.SourceType;
import org.colstore.exec.store.fsi.internal.InternalCatalogDataWrapper;
import org.colstore.exec.store.fsi.internal.InternalMemoryStatsDataWrapper;
import org.colstore.exec.store.fsi.internal.InternalStorageStatsDataWrapper;
import org.colstore.exec.store.fsi.parquet.ParquetDataWrapper;
import org.colstore.exec.store.fsi.text.CsvDataWrapper;
import org.colstore.exec.store.fsi.text.CsvReaderOptions;
import org.colstore.exec.store.fsi.text.RegexParserDataWrapper;
import org.colstore.exec.store.fsi.text.RegexReaderOptions;
import org.colstore.test.ColstoreTest;
import org.junit.Before;
import org.junit.Test;

public class TestForeignDataWrapperFactory extends ColstoreTest {

  private static final TableDescriptor TABLE =
      table(SqlTypeInfo.of(SqlTypeName.INT), SqlTypeInfo.of(SqlTypeName.TEXT));

  private ForeignDataWrapperFactory factory;

  @Before
  public void setUp() {
    factory = new ForeignDataWrapperFactory(context());
  }

  private static ForeignTable fileTable(DataWrapperType type, String... extraOptions) {
    return foreignTable(localServer(type), TABLE, extraOptions);
  }

  private static void assertUserError(ErrorType expectedType, String expectedMessage, Runnable action) {
    try {
      action.run();
      fail("Expected " + expectedType);
    } catch (UserException e) {
      assertEquals(expectedType, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString(expectedMessage));
    }
  }

  @Test
  public void testCreateEveryKind() {
    assertThat(factory.create(DataWrapperType.CSV, DB_ID, fileTable(DataWrapperType.CSV)),
        instanceOf(CsvDataWrapper.class));
    assertThat(factory.create(DataWrapperType.PARQUET, DB_ID, fileTable(DataWrapperType.PARQUET)),
        instanceOf(ParquetDataWrapper.class));
    assertThat(factory.create(DataWrapperType.REGEX_PARSER, DB_ID,
        fileTable(DataWrapperType.REGEX_PARSER, RegexReaderOptions.LINE_REGEX_KEY, "(\\d+) (.*)")),
        instanceOf(RegexParserDataWrapper.class));

    ForeignTable internal = foreignTable(server(DataWrapperType.INTERNAL_CATALOG), TABLE);
    assertThat(factory.create(DataWrapperType.INTERNAL_CATALOG, DB_ID, internal),
        instanceOf(InternalCatalogDataWrapper.class));
    assertThat(factory.create(DataWrapperType.INTERNAL_MEMORY_STATS, DB_ID, internal),
        instanceOf(InternalMemoryStatsDataWrapper.class));
    assertThat(factory.create(DataWrapperType.INTERNAL_STORAGE_STATS, DB_ID, internal),
        instanceOf(InternalStorageStatsDataWrapper.class));
  }

  @Test
  public void testCreateByName() {
    ForeignDataWrapper wrapper = factory.create("DELIMITED_FILE", DB_ID, fileTable(DataWrapperType.CSV));
    assertEquals(DataWrapperType.CSV, wrapper.getDataWrapperType());
    assertUserError(ErrorType.VALIDATION, "Invalid data wrapper type",
        () -> factory.create("ORC_FILE", DB_ID, fileTable(DataWrapperType.CSV)));
  }

  @Test
  public void testCreateRejectsS3SelectTables() {
    ForeignServer s3Server = server(DataWrapperType.CSV,
        AbstractFileStorageDataWrapper.STORAGE_TYPE_KEY, AbstractFileStorageDataWrapper.S3_STORAGE_TYPE);
    ForeignTable table = foreignTable(s3Server, TABLE,
        CsvDataWrapper.S3_ACCESS_TYPE_KEY, CsvDataWrapper.S3_SELECT_ACCESS_TYPE);
    try {
      factory.create(DataWrapperType.CSV, DB_ID, table);
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), containsString("S3 select"));
    }
  }

  @Test
  public void testValidationWrappersAreShared() {
    ForeignDataWrapper csv = factory.createForValidation(DataWrapperType.CSV, null);
    assertSame(csv, factory.createForValidation("DELIMITED_FILE", fileTable(DataWrapperType.CSV)));
    assertSame(factory.createForValidation(DataWrapperType.INTERNAL_CATALOG, null),
        factory.createForValidation(DataWrapperType.INTERNAL_CATALOG, null));
    assertNotSame(csv, factory.createForValidation(DataWrapperType.PARQUET, null));
  }

  @Test
  public void testS3SelectValidationWrapperIsDistinct() {
    ForeignServer s3Server = server(DataWrapperType.CSV,
        AbstractFileStorageDataWrapper.STORAGE_TYPE_KEY, AbstractFileStorageDataWrapper.S3_STORAGE_TYPE,
        CsvDataWrapper.S3_BUCKET_KEY, "bucket", CsvDataWrapper.AWS_REGION_KEY, "us-west-1");
    ForeignTable s3SelectTable = foreignTable(s3Server, TABLE,
        CsvDataWrapper.S3_ACCESS_TYPE_KEY, CsvDataWrapper.S3_SELECT_ACCESS_TYPE);

    ForeignDataWrapper s3Select = factory.createForValidation(DataWrapperType.CSV, s3SelectTable);
    ForeignDataWrapper plain = factory.createForValidation(DataWrapperType.CSV, null);
    assertNotSame(plain, s3Select);
    assertSame(s3Select, factory.createForValidation(DataWrapperType.CSV, s3SelectTable));
    assertTrue(((CsvDataWrapper) s3Select).isS3SelectValidation());
    assertFalse(((CsvDataWrapper) plain).isS3SelectValidation());
  }

  @Test
  public void testFailedValidationWrapperLookupIsRetried() {
    ForeignServer s3Server = server(DataWrapperType.CSV,
        AbstractFileStorageDataWrapper.STORAGE_TYPE_KEY, AbstractFileStorageDataWrapper.S3_STORAGE_TYPE);
    ForeignTable invalid = foreignTable(s3Server, TABLE, CsvDataWrapper.S3_ACCESS_TYPE_KEY, "S3_STREAM");
    assertUserError(ErrorType.VALIDATION, "Invalid value provided for the S3_ACCESS_TYPE option",
        () -> factory.createForValidation(DataWrapperType.CSV, invalid));

    ForeignTable s3SelectTable = foreignTable(s3Server, TABLE,
        CsvDataWrapper.S3_ACCESS_TYPE_KEY, CsvDataWrapper.S3_SELECT_ACCESS_TYPE);
    ForeignDataWrapper s3Select = factory.createForValidation(DataWrapperType.CSV, s3SelectTable);
    assertTrue(((CsvDataWrapper) s3Select).isS3SelectValidation());
    assertSame(s3Select, factory.createForValidation(DataWrapperType.CSV, s3SelectTable));
  }

  @Test
  public void testValidateDataWrapperType() {
    assertEquals(DataWrapperType.PARQUET, factory.validateDataWrapperType("PARQUET_FILE"));
    assertEquals(DataWrapperType.INTERNAL_CATALOG, factory.validateDataWrapperType("INTERNAL_CATALOG"));
    assertEquals(DataWrapperType.INTERNAL_MEMORY_STATS, factory.validateDataWrapperType("INTERNAL_MEMORY_STATS"));
    assertEquals(DataWrapperType.INTERNAL_STORAGE_STATS,
        factory.validateDataWrapperType("INTERNAL_STORAGE_STATS"));
    // internal wrappers are not listed
    assertUserError(ErrorType.VALIDATION,
        "must be one of the following: DELIMITED_FILE, PARQUET_FILE, REGEX_PARSED_FILE.",
        () -> factory.validateDataWrapperType("ORC_FILE"));
    assertUserError(ErrorType.VALIDATION, "Invalid data wrapper type",
        () -> factory.validateDataWrapperType("delimited_file"));
  }

  @Test
  public void testParquetDisabledByConfiguration() {
    Properties properties = new Properties();
    properties.setProperty(ExecConstants.FSI_PARQUET_ENABLED, "false");
    ForeignDataWrapperFactory noParquet = new ForeignDataWrapperFactory(context(properties));

    assertFalse(noParquet.getSupportedDataWrapperTypes().contains(DataWrapperType.PARQUET));
    assertUserError(ErrorType.VALIDATION, "Unsupported data wrapper",
        () -> noParquet.create(DataWrapperType.PARQUET, DB_ID, fileTable(DataWrapperType.PARQUET)));
    assertUserError(ErrorType.VALIDATION, "DELIMITED_FILE, REGEX_PARSED_FILE.",
        () -> noParquet.validateDataWrapperType("PARQUET_FILE"));
  }

  @Test
  public void testGeneralImportWrappers() {
    ForeignDataWrapper csv = factory.createForGeneralImport(DataWrapperType.CSV, DB_ID,
        fileTable(DataWrapperType.CSV), null);
    assertTrue(((CsvDataWrapper) csv).isCacheDisabled());
    ForeignDataWrapper parquet = factory.createForGeneralImport(DataWrapperType.PARQUET, DB_ID,
        fileTable(DataWrapperType.PARQUET), null);
    assertFalse(((ParquetDataWrapper) parquet).isMetadataStatsValidationEnabled());
    try {
      factory.createForGeneralImport(DataWrapperType.INTERNAL_CATALOG, DB_ID, fileTable(DataWrapperType.CSV), null);
      fail();
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("does not support imports"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBatchImporterOnlyForParquet() {
    factory.createForImport(DataWrapperType.CSV, DB_ID, fileTable(DataWrapperType.CSV), null);
  }

  @Test
  public void testServerProxy() {
    CopyParams copyParams = new CopyParams();
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 3, "/data/file.csv", copyParams);
    assertTrue(server.isTransient());
    assertEquals(3, server.getUserId());
    assertEquals(ForeignDataWrapperFactory.IMPORT_PROXY_SERVER_NAME, server.getName());
    assertEquals(DataWrapperType.CSV, server.getDataWrapper());
    assertEquals(AbstractFileStorageDataWrapper.LOCAL_FILE_STORAGE_TYPE,
        server.getOption(AbstractFileStorageDataWrapper.STORAGE_TYPE_KEY).get());
    assertNull(factory.createUserMappingProxyIfApplicable(DB_ID, 3, "/data/file.csv", copyParams, server));

    copyParams.sourceType = SourceType.REGEX_PARSED_FILE;
    assertEquals(DataWrapperType.REGEX_PARSER,
        factory.createForeignServerProxy(DB_ID, 3, "/data/file.log", copyParams).getDataWrapper());
  }

  @Test
  public void testDelimitedFileTableProxy() {
    CopyParams copyParams = new CopyParams();
    copyParams.delimiter = '|';
    copyParams.hasHeader = ImportHeaderRow.NO_HEADER;
    copyParams.quoted = false;
    copyParams.arrayBegin = '[';
    copyParams.arrayEnd = ']';
    copyParams.regexPathFilter = ".*\\.csv";
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/data", copyParams);
    ForeignTable table = factory.createForeignTableProxy(DB_ID, TABLE, "/data", copyParams, server);

    assertSame(server, table.getForeignServer());
    assertTrue(table.isForeignTable());
    assertEquals(TABLE.getLogicalColumns().size(), table.getLogicalColumns().size());
    assertEquals("/data", table.getOption(AbstractFileStorageDataWrapper.FILE_PATH_KEY).get());
    assertEquals(".*\\.csv", table.getOption(AbstractFileStorageDataWrapper.REGEX_PATH_FILTER_KEY).get());
    assertEquals("|", table.getOption(CsvReaderOptions.DELIMITER_KEY).get());
    assertEquals("FALSE", table.getOption(CsvReaderOptions.HEADER_KEY).get());
    assertEquals("FALSE", table.getOption(CsvReaderOptions.QUOTED_KEY).get());
    assertEquals("[]", table.getOption(CsvReaderOptions.ARRAY_MARKER_KEY).get());
    assertEquals("\\N", table.getOption(CsvReaderOptions.NULLS_KEY).get());
    assertEquals(Long.toString(CopyParams.DEFAULT_BUFFER_SIZE),
        table.getOption(CsvReaderOptions.BUFFER_SIZE_KEY).get());
    assertEquals("FALSE", table.getOption(CsvReaderOptions.GEO_EXPLODE_COLLECTIONS_KEY).get());
    assertFalse(table.hasOption(AbstractFileStorageDataWrapper.FILE_SORT_ORDER_BY_KEY));

    // the proxy must pass the options validation of its own wrapper
    factory.createForValidation(DataWrapperType.CSV, table).validateTableOptions(table);
  }

  @Test
  public void testDelimitedFileTableProxyWithHeader() {
    CopyParams copyParams = new CopyParams();
    copyParams.hasHeader = ImportHeaderRow.HAS_HEADER;
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/data/in.csv", copyParams);
    ForeignTable table = factory.createForeignTableProxy(DB_ID, TABLE, "/data/in.csv", copyParams, server);

    assertEquals("/data/in.csv", table.getOption(AbstractFileStorageDataWrapper.FILE_PATH_KEY).get());
    assertEquals("TRUE", table.getOption(CsvReaderOptions.HEADER_KEY).get());
    assertEquals("TRUE", table.getOption(CsvReaderOptions.QUOTED_KEY).get());
    assertEquals("\"", table.getOption(CsvReaderOptions.QUOTE_KEY).get());
    assertEquals("\"", table.getOption(CsvReaderOptions.ESCAPE_KEY).get());
    assertEquals(",", table.getOption(CsvReaderOptions.DELIMITER_KEY).get());
    assertEquals("TRUE", table.getOption(CsvReaderOptions.LONLAT_KEY).get());
    assertEquals("FALSE", table.getOption(CsvReaderOptions.GEO_EXPLODE_COLLECTIONS_KEY).get());
  }

  @Test
  public void testRegexTableProxy() {
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.REGEX_PARSED_FILE;
    copyParams.lineRegex = "(\\d+) (.*)";
    copyParams.lineStartRegex = "^\\d";
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/logs/app.log", copyParams);
    ForeignTable table = factory.createForeignTableProxy(DB_ID, TABLE, "/logs/app.log", copyParams, server);

    assertEquals("(\\d+) (.*)", table.getOption(RegexReaderOptions.LINE_REGEX_KEY).get());
    assertEquals("^\\d", table.getOption(RegexReaderOptions.LINE_START_REGEX_KEY).get());
    assertFalse(table.hasOption(CsvReaderOptions.DELIMITER_KEY));
  }

  @Test
  public void testRegexProxyRequiresLineRegex() {
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.REGEX_PARSED_FILE;
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/logs/app.log", copyParams);
    assertUserError(ErrorType.VALIDATION, "Regex parser options must contain a line regex.",
        () -> factory.createForeignTableProxy(DB_ID, TABLE, "/logs/app.log", copyParams, server));
  }

  @Test
  public void testRemoteSourcesRejected() {
    CopyParams copyParams = new CopyParams();
    assertUserError(ErrorType.UNSUPPORTED_OPERATION, "AWS storage not supported.",
        () -> factory.createForeignServerProxy(DB_ID, 0, "s3://bucket/file.csv", copyParams));
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/data/file.csv", copyParams);
    assertUserError(ErrorType.UNSUPPORTED_OPERATION, "AWS storage not supported.",
        () -> factory.createForeignTableProxy(DB_ID, TABLE, "S3://bucket/file.csv", copyParams, server));
  }

  @Test
  public void testOdbcSourcesRejected() {
    CopyParams copyParams = new CopyParams();
    copyParams.sourceType = SourceType.ODBC;
    assertUserError(ErrorType.UNSUPPORTED_OPERATION, "ODBC storage not supported.",
        () -> factory.createForeignServerProxy(DB_ID, 0, "dsn", copyParams));
  }

  @Test
  public void testGeoExplodeRejectedForDelimitedFiles() {
    CopyParams copyParams = new CopyParams();
    copyParams.geoExplodeCollections = true;
    ForeignServer server = factory.createForeignServerProxy(DB_ID, 0, "/data/file.csv", copyParams);
    assertUserError(ErrorType.UNSUPPORTED_OPERATION, "geo_explode_collections",
        () -> factory.createForeignTableProxy(DB_ID, TABLE, "/data/file.csv", copyParams, server));
  }
}
