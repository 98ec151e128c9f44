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

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.LocatedFileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;
import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.UserMapping;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Base of the data wrappers reading files: server and table options naming
 * where the files are, and discovery of the files of a table.
 */
public abstract class AbstractFileStorageDataWrapper implements ForeignDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractFileStorageDataWrapper.class);

  public static final String STORAGE_TYPE_KEY = "STORAGE_TYPE";
  public static final String BASE_PATH_KEY = "BASE_PATH";
  public static final String FILE_PATH_KEY = "FILE_PATH";
  public static final String REGEX_PATH_FILTER_KEY = "REGEX_PATH_FILTER";
  public static final String FILE_SORT_ORDER_BY_KEY = "FILE_SORT_ORDER_BY";
  public static final String FILE_SORT_REGEX_KEY = "FILE_SORT_REGEX";

  public static final String LOCAL_FILE_STORAGE_TYPE = "LOCAL_FILE";
  public static final String S3_STORAGE_TYPE = "AWS_S3";

  public static final String PATHNAME_ORDER_TYPE = "PATHNAME";
  public static final String DATE_MODIFIED_ORDER_TYPE = "DATE_MODIFIED";
  public static final String REGEX_ORDER_TYPE = "REGEX";
  public static final String REGEX_DATE_ORDER_TYPE = "REGEX_DATE";
  public static final String REGEX_NUMBER_ORDER_TYPE = "REGEX_NUMBER";

  public static final List<String> FILE_SORT_ORDER_TYPES = ImmutableList.of(
      PATHNAME_ORDER_TYPE,
      DATE_MODIFIED_ORDER_TYPE,
      REGEX_ORDER_TYPE,
      REGEX_DATE_ORDER_TYPE,
      REGEX_NUMBER_ORDER_TYPE);

  protected static final Set<String> SUPPORTED_SERVER_OPTIONS = ImmutableSet.of(STORAGE_TYPE_KEY, BASE_PATH_KEY);

  protected static final Set<String> SUPPORTED_FILE_TABLE_OPTIONS = ImmutableSet.of(
      FILE_PATH_KEY,
      REGEX_PATH_FILTER_KEY,
      FILE_SORT_ORDER_BY_KEY,
      FILE_SORT_REGEX_KEY);

  private static final List<DateTimeFormatter> SORT_DATE_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.BASIC_ISO_DATE);

  protected final int dbId;
  protected final ForeignTable foreignTable;
  protected final Configuration fsConf = new Configuration();

  /**
   * Creates an instance that only validates options.
   */
  protected AbstractFileStorageDataWrapper() {
    this(-1, null);
  }

  protected AbstractFileStorageDataWrapper(int dbId, ForeignTable foreignTable) {
    this.dbId = dbId;
    this.foreignTable = foreignTable;
  }

  /**
   * @return table option keys specific to the file format
   */
  protected abstract Set<String> getFormatTableOptions();

  protected Set<String> getSupportedServerOptions() {
    return SUPPORTED_SERVER_OPTIONS;
  }

  @Override
  public Set<String> getSupportedTableOptions() {
    return ImmutableSet.<String>builder()
        .addAll(ForeignTable.SUPPORTED_OPTIONS)
        .addAll(SUPPORTED_FILE_TABLE_OPTIONS)
        .addAll(getFormatTableOptions())
        .build();
  }

  @Override
  public void validateServerOptions(ForeignServer foreignServer) {
    Set<String> supported = getSupportedServerOptions();
    for (String key : foreignServer.getOptions().keySet()) {
      if (!supported.contains(key)) {
        throw UserException.validationError()
            .message("Invalid foreign server option \"%s\". Option must be one of the following: %s.",
                key, Joiner.on(", ").join(supported))
            .addContext("Server", foreignServer.getName())
            .build(logger);
      }
    }
    String storageType = foreignServer.getOption(STORAGE_TYPE_KEY)
        .orElseThrow(() -> UserException.validationError()
            .message("No storage type found in options.")
            .addContext("Server", foreignServer.getName())
            .build(logger));
    validateStorageType(storageType);
  }

  protected void validateStorageType(String storageType) {
    if (storageType.equals(LOCAL_FILE_STORAGE_TYPE)) {
      return;
    }
    if (storageType.equals(S3_STORAGE_TYPE)) {
      throw UserException.unsupportedError()
          .message("Storage type \"%s\" is not supported.", S3_STORAGE_TYPE)
          .build(logger);
    }
    throw UserException.validationError()
        .message("Invalid storage type value \"%s\". Value must be one of the following: %s.",
            storageType, LOCAL_FILE_STORAGE_TYPE)
        .build(logger);
  }

  @Override
  public void validateTableOptions(ForeignTable table) {
    Set<String> supported = getSupportedTableOptions();
    for (String key : table.getOptions().keySet()) {
      if (!supported.contains(key)) {
        throw UserException.validationError()
            .message("Invalid foreign table option \"%s\".", key)
            .addContext("Table", table.getTableName())
            .build(logger);
      }
    }
    if (!table.hasOption(FILE_PATH_KEY) && !table.getForeignServer().getOption(BASE_PATH_KEY).isPresent()) {
      throw UserException.validationError()
          .message("No file_path found for foreign table \"%s\". A file_path must be specified when the "
              + "foreign server has no base_path.", table.getTableName())
          .build(logger);
    }
    table.getOption(REGEX_PATH_FILTER_KEY).ifPresent(regex -> compileOptionRegex(REGEX_PATH_FILTER_KEY, regex));
    validateFileSortOptions(table);
  }

  private void validateFileSortOptions(ForeignTable table) {
    String orderBy = getFileSortOrderBy(table);
    if (!FILE_SORT_ORDER_TYPES.contains(orderBy)) {
      throw UserException.validationError()
          .message("Invalid value \"%s\" for %s option. Value must be one of the following: %s.",
              orderBy, FILE_SORT_ORDER_BY_KEY, Joiner.on(", ").join(FILE_SORT_ORDER_TYPES))
          .build(logger);
    }
    Optional<String> sortRegex = table.getOption(FILE_SORT_REGEX_KEY);
    if (orderBy.startsWith(REGEX_ORDER_TYPE) && !sortRegex.isPresent()) {
      throw UserException.validationError()
          .message("%s option must be provided for %s \"%s\".", FILE_SORT_REGEX_KEY, FILE_SORT_ORDER_BY_KEY,
              orderBy)
          .build(logger);
    }
    sortRegex.ifPresent(regex -> compileOptionRegex(FILE_SORT_REGEX_KEY, regex));
  }

  /**
   * Local files take no per user options.
   */
  @Override
  public void validateUserMappingOptions(UserMapping userMapping, ForeignServer foreignServer) {
    if (!userMapping.getOptions().isEmpty()) {
      throw UserException.validationError()
          .message("User mapping options are not supported for storage type \"%s\".",
              foreignServer.getOption(STORAGE_TYPE_KEY).orElse(""))
          .addContext("Server", foreignServer.getName())
          .build(logger);
    }
  }

  protected ForeignTable getBoundTable() {
    Preconditions.checkState(foreignTable != null, "%s was created for option validation only",
        getClass().getSimpleName());
    return foreignTable;
  }

  /**
   * @return the table's file path, appended to the server base path when one is set
   */
  protected Path getFullFilePath() {
    ForeignTable table = getBoundTable();
    String filePath = table.getOption(FILE_PATH_KEY).orElse("");
    Optional<String> basePath = table.getForeignServer().getOption(BASE_PATH_KEY);
    if (!basePath.isPresent()) {
      return new Path(filePath);
    }
    return filePath.isEmpty() ? new Path(basePath.get()) : new Path(basePath.get() + Path.SEPARATOR + filePath);
  }

  protected FileSystem getFileSystem(Path path) {
    try {
      return path.getFileSystem(fsConf);
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Unable to access the file system of \"%s\".", path)
          .build(logger);
    }
  }

  /**
   * Opens one of the files returned by {@link #getAllFilePaths()}.
   */
  protected InputStream openFile(Path file) throws IOException {
    return getFileSystem(file).open(file);
  }

  /**
   * Lists the files of the table: the file path itself, or every file under it
   * when it is a directory, filtered and sorted by the table options.
   *
   * @throws UserException data read error when no file is found
   */
  protected List<Path> getAllFilePaths() {
    ForeignTable table = getBoundTable();
    Path path = getFullFilePath();
    FileSystem fs = getFileSystem(path);

    List<FileStatus> files = new ArrayList<>();
    try {
      if (!fs.exists(path)) {
        throw UserException.dataReadError()
            .message("File or directory \"%s\" does not exist.", path)
            .addContext("Table", table.getTableName())
            .build(logger);
      }
      RemoteIterator<LocatedFileStatus> statuses = fs.listFiles(path, true);
      while (statuses.hasNext()) {
        files.add(statuses.next());
      }
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Unable to list the files under \"%s\".", path)
          .addContext("Table", table.getTableName())
          .build(logger);
    }

    Optional<String> pathFilter = table.getOption(REGEX_PATH_FILTER_KEY);
    if (pathFilter.isPresent()) {
      Pattern filter = compileOptionRegex(REGEX_PATH_FILTER_KEY, pathFilter.get());
      files = files.stream()
          .filter(file -> filter.matcher(pathString(file)).matches())
          .collect(Collectors.toList());
    }
    if (files.isEmpty()) {
      throw UserException.dataReadError()
          .message(pathFilter.isPresent()
              ? "No files matched the regex file path \"" + pathFilter.get() + "\"."
              : "No files found under \"" + path + "\".")
          .addContext("Table", table.getTableName())
          .build(logger);
    }

    List<Path> sorted = sortFiles(files, getFileSortOrderBy(table), table.getOption(FILE_SORT_REGEX_KEY)).stream()
        .map(FileStatus::getPath)
        .collect(Collectors.toList());
    logger.debug("Found {} files for table {}", sorted.size(), table.getTableName());
    return sorted;
  }

  /**
   * @return the path of a listed file without the file system scheme
   */
  private static String pathString(FileStatus file) {
    return Path.getPathWithoutSchemeAndAuthority(file.getPath()).toString();
  }

  private static String getFileSortOrderBy(ForeignTable table) {
    return table.getOption(FILE_SORT_ORDER_BY_KEY)
        .map(value -> value.toUpperCase(Locale.ROOT))
        .orElse(PATHNAME_ORDER_TYPE);
  }

  private static List<FileStatus> sortFiles(List<FileStatus> files, String orderBy, Optional<String> sortRegex) {
    Comparator<FileStatus> byPath = Comparator.comparing(AbstractFileStorageDataWrapper::pathString);
    Comparator<FileStatus> order;
    switch (orderBy) {
      case DATE_MODIFIED_ORDER_TYPE:
        order = Comparator.comparingLong(FileStatus::getModificationTime).thenComparing(byPath);
        break;
      case REGEX_ORDER_TYPE:
        order = regexOrder(files, sortRegex.get(), Function.identity()).thenComparing(byPath);
        break;
      case REGEX_DATE_ORDER_TYPE:
        order = regexOrder(files, sortRegex.get(), AbstractFileStorageDataWrapper::parseSortDate)
            .thenComparing(byPath);
        break;
      case REGEX_NUMBER_ORDER_TYPE:
        order = regexOrder(files, sortRegex.get(), AbstractFileStorageDataWrapper::parseSortNumber)
            .thenComparing(byPath);
        break;
      default:
        order = byPath;
    }
    return files.stream().sorted(order).collect(Collectors.toList());
  }

  /**
   * Orders files by the first capture group of the sort regex found in their
   * path, or by the whole match when the regex has no group. Files without a
   * match come first.
   */
  private static <T extends Comparable<? super T>> Comparator<FileStatus> regexOrder(List<FileStatus> files,
                                                                                     String regex,
                                                                                     Function<String, T> parser) {
    Pattern pattern = compileOptionRegex(FILE_SORT_REGEX_KEY, regex);
    Map<Path, T> keys = new HashMap<>();
    for (FileStatus file : files) {
      Matcher matcher = pattern.matcher(pathString(file));
      if (matcher.find()) {
        String key = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
        if (key != null) {
          try {
            keys.put(file.getPath(), parser.apply(key));
          } catch (DateTimeParseException | NumberFormatException e) {
            throw UserException.dataReadError(e)
                .message("Unable to order file \"%s\" by \"%s\".", pathString(file), key)
                .build(logger);
          }
        }
      }
    }
    return Comparator.comparing(file -> keys.get(file.getPath()), Comparator.nullsFirst(Comparator.<T>naturalOrder()));
  }

  private static LocalDate parseSortDate(String value) {
    DateTimeParseException failure = null;
    for (DateTimeFormatter format : SORT_DATE_FORMATS) {
      try {
        return LocalDate.parse(value, format);
      } catch (DateTimeParseException e) {
        failure = e;
      }
    }
    throw failure;
  }

  private static BigDecimal parseSortNumber(String value) {
    return new BigDecimal(value);
  }

  protected static Pattern compileOptionRegex(String optionKey, String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw UserException.validationError(e)
          .message("Invalid regex \"%s\" for %s option.", regex, optionKey)
          .build(logger);
    }
  }
}
