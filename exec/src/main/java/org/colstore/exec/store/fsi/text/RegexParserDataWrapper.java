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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

import org.apache.hadoop.fs.Path;
import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.store.fsi.DataWrapperType;

/**
 * Reads text files whose records are parsed with a regex, one capture group per column.
 * <p>
 * With a line start regex, a line that does not match it continues the
 * previous record. Records that the line regex does not match become rows of
 * nulls.
 */
public class RegexParserDataWrapper extends AbstractTextFileDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RegexParserDataWrapper.class);

  private final RegexReaderOptions readerOptions;

  /**
   * Creates a wrapper that only validates options.
   */
  public RegexParserDataWrapper() {
    this.readerOptions = null;
  }

  public RegexParserDataWrapper(int dbId, ForeignTable foreignTable) {
    this(dbId, foreignTable, false);
  }

  public RegexParserDataWrapper(int dbId, ForeignTable foreignTable, boolean disableCache) {
    super(dbId, foreignTable, disableCache);
    this.readerOptions = RegexReaderOptions.from(foreignTable);
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.REGEX_PARSER;
  }

  @Override
  protected Set<String> getFormatTableOptions() {
    return RegexReaderOptions.OPTION_KEYS;
  }

  @Override
  public void validateTableOptions(ForeignTable table) {
    super.validateTableOptions(table);
    validateCaptureGroups(table, RegexReaderOptions.from(table));
  }

  private static void validateCaptureGroups(ForeignTable table, RegexReaderOptions options) {
    int columnCount = table.getLogicalColumns().size();
    if (options.getCaptureGroupCount() != columnCount) {
      throw UserException.validationError()
          .message("Mismatched number of logical columns in table and capture groups in %s: (%d columns, "
              + "%d capture groups).", RegexReaderOptions.LINE_REGEX_KEY, columnCount,
              options.getCaptureGroupCount())
          .addContext("Table", table.getTableName())
          .build(logger);
    }
  }

  @Override
  protected void readRecords(Path file, RecordConsumer consumer) throws IOException {
    validateCaptureGroups(getBoundTable(), readerOptions);
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(openFile(file), StandardCharsets.UTF_8))) {
      StringBuilder record = null;
      long recordLineNumber = 0;
      long lineNumber = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isEmpty()) {
          continue;
        }
        boolean startsRecord = !readerOptions.getLineStartRegex().isPresent()
            || readerOptions.getLineStartRegex().get().matcher(line).find()
            || record == null;
        if (startsRecord) {
          if (record != null) {
            consumer.accept(parseRecord(record.toString()), recordLineNumber);
          }
          record = new StringBuilder(line);
          recordLineNumber = lineNumber;
        } else {
          record.append('\n').append(line);
        }
      }
      if (record != null) {
        consumer.accept(parseRecord(record.toString()), recordLineNumber);
      }
    }
  }

  private List<String> parseRecord(String record) {
    Matcher matcher = readerOptions.getLineRegex().matcher(record);
    int groupCount = matcher.groupCount();
    if (!matcher.matches()) {
      return Collections.nCopies(groupCount, null);
    }
    List<String> fields = new ArrayList<>(groupCount);
    for (int i = 1; i <= groupCount; i++) {
      fields.add(matcher.group(i));
    }
    return fields;
  }
}
