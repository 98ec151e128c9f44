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

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.colstore.common.config.ColstoreConfig;
import org.colstore.common.exceptions.UserException;
import org.colstore.exec.ExecConstants;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.importexport.CopyParams;
import org.colstore.exec.importexport.ImportHeaderRow;
import org.colstore.exec.importexport.SourceType;
import org.colstore.exec.store.fsi.internal.InternalCatalogDataWrapper;
import org.colstore.exec.store.fsi.internal.InternalMemoryStatsDataWrapper;
import org.colstore.exec.store.fsi.internal.InternalStorageStatsDataWrapper;
import org.colstore.exec.store.fsi.parquet.ParquetDataWrapper;
import org.colstore.exec.store.fsi.parquet.ParquetImporter;
import org.colstore.exec.store.fsi.text.CsvDataWrapper;
import org.colstore.exec.store.fsi.text.CsvReaderOptions;
import org.colstore.exec.store.fsi.text.RegexParserDataWrapper;
import org.colstore.exec.store.fsi.text.RegexReaderOptions;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Creates data wrappers by kind, and the transient server and table
 * descriptors that let an import read its source through a data wrapper.
 * <p>
 * Wrappers created for validation are shared: one instance per kind, created
 * on first use. The factory is safe for concurrent use.
 */
public class ForeignDataWrapperFactory {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForeignDataWrapperFactory.class);

  /** Cache key of the validation wrapper of S3 select delimited file tables. */
  static final String CSV_S3_SELECT_VALIDATION_KEY = "CSV_S3_SELECT";

  public static final String IMPORT_PROXY_SERVER_NAME = "import_proxy_server";

  private final ForeignStorageContext context;
  private final Set<DataWrapperType> supportedTypes;
  private final List<String> remoteUriPrefixes;
  private final Map<String, ForeignDataWrapper> validationDataWrappers = new ConcurrentHashMap<>();

  public ForeignDataWrapperFactory(ForeignStorageContext context) {
    this.context = context;
    ColstoreConfig config = context.getConfig();
    EnumSet<DataWrapperType> types = EnumSet.allOf(DataWrapperType.class);
    if (!config.getBoolean(ExecConstants.FSI_PARQUET_ENABLED)) {
      types.remove(DataWrapperType.PARQUET);
    }
    this.supportedTypes = Sets.immutableEnumSet(types);
    this.remoteUriPrefixes = ImmutableList.copyOf(config.getStringList(ExecConstants.FSI_REMOTE_URI_PREFIXES));
  }

  public Set<DataWrapperType> getSupportedDataWrapperTypes() {
    return supportedTypes;
  }

  /**
   * Resolves a wrapper name. Internal wrappers are accepted but left out of
   * the names listed in the error message.
   *
   * @throws UserException validation error for an unknown or disabled wrapper
   */
  public DataWrapperType validateDataWrapperType(String dataWrapperType) {
    return DataWrapperType.fromName(dataWrapperType)
        .filter(supportedTypes::contains)
        .orElseThrow(() -> UserException.validationError()
            .message("Invalid data wrapper type \"%s\". Data wrapper type must be one of the following: %s.",
                dataWrapperType, Joiner.on(", ").join(getUserDataWrapperNames()))
            .build(logger));
  }

  private List<String> getUserDataWrapperNames() {
    return supportedTypes.stream()
        .filter(type -> !type.isInternal())
        .map(DataWrapperType::getName)
        .collect(Collectors.toList());
  }

  /**
   * Creates a wrapper reading the given table.
   *
   * @throws UserException validation error for an unknown or disabled wrapper
   * @throws IllegalStateException for a delimited file table read through S3 select, which has no reader
   */
  public ForeignDataWrapper create(String dataWrapperType, int dbId, ForeignTable foreignTable) {
    return create(resolve(dataWrapperType), dbId, foreignTable);
  }

  public ForeignDataWrapper create(DataWrapperType dataWrapperType, int dbId, ForeignTable foreignTable) {
    checkSupported(dataWrapperType);
    logger.debug("Creating {} data wrapper for table {}", dataWrapperType, foreignTable.getTableName());
    switch (dataWrapperType) {
      case CSV:
        Preconditions.checkState(!CsvDataWrapper.isS3Select(foreignTable),
            "Reading delimited files through S3 select is not implemented");
        return new CsvDataWrapper(dbId, foreignTable);
      case PARQUET:
        return new ParquetDataWrapper(dbId, foreignTable);
      case REGEX_PARSER:
        return new RegexParserDataWrapper(dbId, foreignTable);
      case INTERNAL_CATALOG:
        return new InternalCatalogDataWrapper(dbId, foreignTable, context);
      case INTERNAL_MEMORY_STATS:
        return new InternalMemoryStatsDataWrapper(dbId, foreignTable, context);
      case INTERNAL_STORAGE_STATS:
        return new InternalStorageStatsDataWrapper(dbId, foreignTable, context);
      default:
        throw new IllegalStateException("Unknown data wrapper type " + dataWrapperType);
    }
  }

  /**
   * Returns the shared wrapper validating options of the given kind. For
   * delimited file tables read through S3 select, a dedicated wrapper with
   * its own rules is returned.
   *
   * @param foreignTable table whose options are about to be validated, may be null when validating a server
   */
  public ForeignDataWrapper createForValidation(String dataWrapperType, ForeignTable foreignTable) {
    return createForValidation(resolve(dataWrapperType), foreignTable);
  }

  public ForeignDataWrapper createForValidation(DataWrapperType dataWrapperType, ForeignTable foreignTable) {
    checkSupported(dataWrapperType);
    boolean s3Select = dataWrapperType == DataWrapperType.CSV && foreignTable != null
        && CsvDataWrapper.isS3Select(foreignTable);
    String key = s3Select ? CSV_S3_SELECT_VALIDATION_KEY : dataWrapperType.getName();
    return validationDataWrappers.computeIfAbsent(key, k -> {
      logger.debug("Creating validation data wrapper {}", k);
      if (s3Select) {
        return CsvDataWrapper.forS3SelectValidation();
      }
      return newValidationWrapper(dataWrapperType);
    });
  }

  private static ForeignDataWrapper newValidationWrapper(DataWrapperType dataWrapperType) {
    switch (dataWrapperType) {
      case CSV:
        return new CsvDataWrapper();
      case PARQUET:
        return new ParquetDataWrapper();
      case REGEX_PARSER:
        return new RegexParserDataWrapper();
      case INTERNAL_CATALOG:
        return new InternalCatalogDataWrapper();
      case INTERNAL_MEMORY_STATS:
        return new InternalMemoryStatsDataWrapper();
      case INTERNAL_STORAGE_STATS:
        return new InternalStorageStatsDataWrapper();
      default:
        throw new IllegalStateException("Unknown data wrapper type " + dataWrapperType);
    }
  }

  /**
   * Creates a wrapper reading a file source once, for an import. Parquet
   * wrappers skip the validation of footer statistics, text wrappers release
   * chunks once handed out.
   */
  public ForeignDataWrapper createForGeneralImport(DataWrapperType dataWrapperType, int dbId,
                                                   ForeignTable foreignTable, UserMapping userMapping) {
    checkSupported(dataWrapperType);
    logger.debug("Creating {} import data wrapper for table {}", dataWrapperType, foreignTable.getTableName());
    switch (dataWrapperType) {
      case CSV:
        return new CsvDataWrapper(dbId, foreignTable, true);
      case REGEX_PARSER:
        return new RegexParserDataWrapper(dbId, foreignTable, true);
      case PARQUET:
        return new ParquetDataWrapper(dbId, foreignTable, false);
      default:
        throw new IllegalArgumentException("Data wrapper " + dataWrapperType + " does not support imports");
    }
  }

  /**
   * Creates the batch importer of Parquet sources.
   */
  public ParquetImporter createForImport(DataWrapperType dataWrapperType, int dbId, ForeignTable foreignTable,
                                         UserMapping userMapping) {
    checkSupported(dataWrapperType);
    Preconditions.checkArgument(dataWrapperType == DataWrapperType.PARQUET,
        "Data wrapper %s has no batch importer", dataWrapperType);
    return new ParquetImporter(dbId, foreignTable, userMapping);
  }

  /**
   * Local file sources need no per user options.
   *
   * @return null
   */
  public UserMapping createUserMappingProxyIfApplicable(int dbId, int userId, String filePath,
                                                        CopyParams copyParams, ForeignServer server) {
    return null;
  }

  /**
   * Creates the transient server an import reads its source through.
   *
   * @throws UserException unsupported error for ODBC and cloud object storage sources
   */
  public ForeignServer createForeignServerProxy(int dbId, int userId, String filePath, CopyParams copyParams) {
    checkImportSource(filePath, copyParams);
    DataWrapperType dataWrapperType = getImportDataWrapperType(copyParams.sourceType);
    ForeignServer server = new ForeignServer(ForeignServer.TRANSIENT_ID, userId, IMPORT_PROXY_SERVER_NAME,
        dataWrapperType.getName(),
        Collections.singletonMap(AbstractFileStorageDataWrapper.STORAGE_TYPE_KEY,
            AbstractFileStorageDataWrapper.LOCAL_FILE_STORAGE_TYPE),
        0L);
    logger.debug("Created import server proxy {} for {}", server, filePath);
    return server;
  }

  /**
   * Creates the transient foreign table describing the source of an import
   * into {@code table}: same columns, options derived from the copy parameters.
   *
   * @throws UserException unsupported error for ODBC and cloud object storage
   *                       sources, validation error for a regex parsed source without line regex
   */
  public ForeignTable createForeignTableProxy(int dbId, TableDescriptor table, String copyFromSource,
                                             CopyParams copyParams, ForeignServer server) {
    checkImportSource(copyFromSource, copyParams);
    SourceType sourceType = copyParams.sourceType;
    Preconditions.checkNotNull(server, "Import server proxy is required");
    if (sourceType == SourceType.REGEX_PARSED_FILE && copyParams.lineRegex.isEmpty()) {
      throw UserException.validationError()
          .message("Regex parser options must contain a line regex.")
          .build(logger);
    }
    if (sourceType == SourceType.DELIMITED_FILE && copyParams.geoExplodeCollections) {
      throw UserException.unsupportedError()
          .message("geo_explode_collections is not yet supported for delimited file imports.")
          .build(logger);
    }

    ForeignTable foreignTable = new ForeignTable(table, server);
    if (copyParams.regexPathFilter != null) {
      foreignTable.setOption(AbstractFileStorageDataWrapper.REGEX_PATH_FILTER_KEY, copyParams.regexPathFilter);
    }
    if (copyParams.fileSortOrderBy != null) {
      foreignTable.setOption(AbstractFileStorageDataWrapper.FILE_SORT_ORDER_BY_KEY, copyParams.fileSortOrderBy);
    }
    if (copyParams.fileSortRegex != null) {
      foreignTable.setOption(AbstractFileStorageDataWrapper.FILE_SORT_REGEX_KEY, copyParams.fileSortRegex);
    }
    if (sourceType == SourceType.REGEX_PARSED_FILE) {
      foreignTable.setOption(RegexReaderOptions.LINE_REGEX_KEY, copyParams.lineRegex);
      if (!copyParams.lineStartRegex.isEmpty()) {
        foreignTable.setOption(RegexReaderOptions.LINE_START_REGEX_KEY, copyParams.lineStartRegex);
      }
    }
    foreignTable.setOption(AbstractFileStorageDataWrapper.FILE_PATH_KEY, copyFromSource);
    if (sourceType == SourceType.DELIMITED_FILE) {
      setDelimitedFileOptions(foreignTable, copyParams);
    }
    foreignTable.initializeOptions();
    logger.debug("Created import table proxy for {} with options {}", copyFromSource, foreignTable.getOptions());
    return foreignTable;
  }

  private static void setDelimitedFileOptions(ForeignTable foreignTable, CopyParams copyParams) {
    foreignTable.setOption(CsvReaderOptions.ARRAY_DELIMITER_KEY, String.valueOf(copyParams.arrayDelim));
    foreignTable.setOption(CsvReaderOptions.ARRAY_MARKER_KEY,
        String.valueOf(copyParams.arrayBegin) + copyParams.arrayEnd);
    foreignTable.setOption(CsvReaderOptions.DELIMITER_KEY, String.valueOf(copyParams.delimiter));
    foreignTable.setOption(CsvReaderOptions.ESCAPE_KEY, String.valueOf(copyParams.escape));
    foreignTable.setOption(CsvReaderOptions.HEADER_KEY,
        copyParams.hasHeader == ImportHeaderRow.NO_HEADER ? "FALSE" : "TRUE");
    foreignTable.setOption(CsvReaderOptions.LINE_DELIMITER_KEY, String.valueOf(copyParams.lineDelim));
    foreignTable.setOption(CsvReaderOptions.LONLAT_KEY, booleanOption(copyParams.lonlat));
    foreignTable.setOption(CsvReaderOptions.NULLS_KEY, copyParams.nullStr);
    foreignTable.setOption(CsvReaderOptions.QUOTE_KEY, String.valueOf(copyParams.quote));
    foreignTable.setOption(CsvReaderOptions.QUOTED_KEY, booleanOption(copyParams.quoted));
    foreignTable.setOption(CsvReaderOptions.BUFFER_SIZE_KEY, Long.toString(copyParams.bufferSize));
    foreignTable.setOption(CsvReaderOptions.GEO_ASSIGN_RENDER_GROUPS_KEY,
        booleanOption(copyParams.geoAssignRenderGroups));
    foreignTable.setOption(CsvReaderOptions.GEO_EXPLODE_COLLECTIONS_KEY,
        booleanOption(copyParams.geoExplodeCollections));
  }

  private static String booleanOption(boolean value) {
    return value ? "TRUE" : "FALSE";
  }

  /**
   * @return the wrapper kind reading sources of the given type
   */
  public DataWrapperType getImportDataWrapperType(SourceType sourceType) {
    switch (sourceType) {
      case DELIMITED_FILE:
        return DataWrapperType.CSV;
      case REGEX_PARSED_FILE:
        return DataWrapperType.REGEX_PARSER;
      case PARQUET_FILE:
        Preconditions.checkArgument(supportedTypes.contains(DataWrapperType.PARQUET),
            "Parquet imports are disabled by %s", ExecConstants.FSI_PARQUET_ENABLED);
        return DataWrapperType.PARQUET;
      default:
        throw new IllegalArgumentException("Source type " + sourceType + " cannot be imported through a data wrapper");
    }
  }

  private void checkImportSource(String filePath, CopyParams copyParams) {
    if (copyParams.sourceType == SourceType.ODBC) {
      throw UserException.unsupportedError()
          .message("ODBC storage not supported.")
          .build(logger);
    }
    // rejects unsupported source types
    getImportDataWrapperType(copyParams.sourceType);
    if (isRemoteUri(filePath)) {
      throw UserException.unsupportedError()
          .message("AWS storage not supported.")
          .addContext("Source", filePath)
          .build(logger);
    }
  }

  private boolean isRemoteUri(String path) {
    String lowerCasePath = path.toLowerCase(Locale.ROOT);
    return remoteUriPrefixes.stream().anyMatch(lowerCasePath::startsWith);
  }

  private DataWrapperType resolve(String dataWrapperType) {
    return DataWrapperType.fromName(dataWrapperType)
        .orElseThrow(() -> UserException.validationError()
            .message("Invalid data wrapper type \"%s\".", dataWrapperType)
            .build(logger));
  }

  /**
   * Rejects kinds left out of the supported set by configuration.
   */
  private void checkSupported(DataWrapperType dataWrapperType) {
    if (!supportedTypes.contains(dataWrapperType)) {
      throw UserException.validationError()
          .message("Unsupported data wrapper \"%s\".", dataWrapperType.getName())
          .build(logger);
    }
  }
}
