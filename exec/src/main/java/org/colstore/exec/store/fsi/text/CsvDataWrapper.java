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
package org.colstore.exec.store.fsi.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.hadoop.fs.Path;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.store.fsi.DataWrapperType;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

/**
 * Reads delimited text files.
 * <p>
 * A separate validation-only flavor checks tables that read delimited files
 * through S3 select, which has its own server options.
 */
public class CsvDataWrapper extends AbstractTextFileDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CsvDataWrapper.class);

  public static final String S3_ACCESS_TYPE_KEY = "S3_ACCESS_TYPE";
  public static final String S3_DIRECT_ACCESS_TYPE = "S3_DIRECT";
  public static final String S3_SELECT_ACCESS_TYPE = "S3_SELECT";

  public static final String S3_BUCKET_KEY = "S3_BUCKET";
  public static final String AWS_REGION_KEY = "AWS_REGION";
  public static final String S3_ENDPOINT_KEY = "S3_ENDPOINT";

  private static final Set<String> FORMAT_TABLE_OPTIONS = ImmutableSet.<String>builder()
      .addAll(CsvReaderOptions.OPTION_KEYS)
      .add(S3_ACCESS_TYPE_KEY)
      .build();

  private static final Set<String> S3_SERVER_OPTIONS = ImmutableSet.<String>builder()
      .addAll(SUPPORTED_SERVER_OPTIONS)
      .add(S3_BUCKET_KEY, AWS_REGION_KEY, S3_ENDPOINT_KEY)
      .build();

  private final boolean s3SelectValidation;
  private final CsvReaderOptions readerOptions;

  /**
   * Creates a wrapper that only validates options.
   */
  public CsvDataWrapper() {
    this(false);
  }

  private CsvDataWrapper(boolean s3SelectValidation) {
    this.s3SelectValidation = s3SelectValidation;
    this.readerOptions = null;
  }

  public CsvDataWrapper(int dbId, ForeignTable foreignTable) {
    this(dbId, foreignTable, false);
  }

  public CsvDataWrapper(int dbId, ForeignTable foreignTable, boolean disableCache) {
    super(dbId, foreignTable, disableCache);
    this.s3SelectValidation = false;
    this.readerOptions = CsvReaderOptions.from(foreignTable);
  }

  /**
   * Creates a wrapper that validates the options of S3 select delimited file tables.
   */
  public static CsvDataWrapper forS3SelectValidation() {
    return new CsvDataWrapper(true);
  }

  public boolean isS3SelectValidation() {
    return s3SelectValidation;
  }

  /**
   * Tells whether the table reads its files through S3 select.
   *
   * @throws UserException validation error when the access type is invalid or
   *                       the table's server cannot serve it
   */
  public static boolean isS3Select(ForeignTable table) {
    Optional<String> accessType = table.getOption(S3_ACCESS_TYPE_KEY).map(value -> value.toUpperCase(Locale.ROOT));
    if (!accessType.isPresent()) {
      return false;
    }
    if (!accessType.get().equals(S3_DIRECT_ACCESS_TYPE) && !accessType.get().equals(S3_SELECT_ACCESS_TYPE)) {
      throw UserException.validationError()
          .message("Invalid value provided for the %s option. Value must be one of the following: %s, %s.",
              S3_ACCESS_TYPE_KEY, S3_DIRECT_ACCESS_TYPE, S3_SELECT_ACCESS_TYPE)
          .build(logger);
    }
    ForeignServer server = table.getForeignServer();
    if (!DataWrapperType.CSV.getName().equals(server.getDataWrapperType())) {
      throw UserException.validationError()
          .message("The %s option is only supported for %s data wrappers.", S3_ACCESS_TYPE_KEY,
              DataWrapperType.CSV.getName())
          .build(logger);
    }
    if (!server.getOption(STORAGE_TYPE_KEY).map(S3_STORAGE_TYPE::equals).orElse(false)) {
      throw UserException.validationError()
          .message("The %s option is only supported for foreign servers with %s storage type.",
              S3_ACCESS_TYPE_KEY, S3_STORAGE_TYPE)
          .build(logger);
    }
    return accessType.get().equals(S3_SELECT_ACCESS_TYPE);
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.CSV;
  }

  @Override
  protected Set<String> getFormatTableOptions() {
    return FORMAT_TABLE_OPTIONS;
  }

  @Override
  protected Set<String> getSupportedServerOptions() {
    return s3SelectValidation ? S3_SERVER_OPTIONS : super.getSupportedServerOptions();
  }

  @Override
  public void validateServerOptions(ForeignServer foreignServer) {
    super.validateServerOptions(foreignServer);
    if (s3SelectValidation) {
      for (String key : new String[] {S3_BUCKET_KEY, AWS_REGION_KEY}) {
        if (!foreignServer.getOption(key).isPresent()) {
          throw UserException.validationError()
              .message("%s option must be provided for foreign servers with %s storage type.", key, S3_STORAGE_TYPE)
              .addContext("Server", foreignServer.getName())
              .build(logger);
        }
      }
    }
  }

  @Override
  protected void validateStorageType(String storageType) {
    if (s3SelectValidation) {
      if (!storageType.equals(S3_STORAGE_TYPE)) {
        throw UserException.validationError()
            .message("S3 select is only supported for foreign servers with %s storage type.", S3_STORAGE_TYPE)
            .build(logger);
      }
      return;
    }
    super.validateStorageType(storageType);
  }

  @Override
  public void validateTableOptions(ForeignTable table) {
    super.validateTableOptions(table);
    CsvReaderOptions options = CsvReaderOptions.from(table);
    if (options.isGeoExplodeCollections()) {
      throw UserException.unsupportedError()
          .message("%s is not supported for delimited file tables.", CsvReaderOptions.GEO_EXPLODE_COLLECTIONS_KEY)
          .build(logger);
    }
    if (s3SelectValidation && !isS3Select(table)) {
      throw UserException.validationError()
          .message("Table \"%s\" does not use S3 select access.", table.getTableName())
          .build(logger);
    }
  }

  @Override
  protected void readRecords(Path file, RecordConsumer consumer) throws IOException {
    int bufferSize = Ints.saturatedCast(readerOptions.getBufferSize());
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(openFile(file), StandardCharsets.UTF_8), bufferSize)) {
      CsvLineParser parser = new CsvLineParser(reader, readerOptions);
      boolean skipHeader = readerOptions.hasHeader();
      List<String> fields;
      while ((fields = parser.nextRecord()) != null) {
        if (skipHeader) {
          skipHeader = false;
          continue;
        }
        consumer.accept(fields, parser.getRecordLineNumber());
      }
    }
  }

  @Override
  protected boolean isNullField(String field, SqlTypeInfo type) {
    return field.equals(readerOptions.getNulls()) || super.isNullField(field, type);
  }

  @Override
  protected char getArrayBegin() {
    return readerOptions.getArrayBegin();
  }

  @Override
  protected char getArrayEnd() {
    return readerOptions.getArrayEnd();
  }

  @Override
  protected char getArrayDelimiter() {
    return readerOptions.getArrayDelimiter();
  }

  public CsvReaderOptions getReaderOptions() {
    return readerOptions;
  }
}
