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

import java.util.Locale;
import java.util.Set;

import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.importexport.CopyParams;

import com.google.common.collect.ImmutableSet;

/**
 * Typed reader options of a delimited file table, parsed from its table options.
 */
public class CsvReaderOptions {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CsvReaderOptions.class);

  public static final String ARRAY_DELIMITER_KEY = "ARRAY_DELIMITER";
  public static final String ARRAY_MARKER_KEY = "ARRAY_MARKER";
  public static final String BUFFER_SIZE_KEY = "BUFFER_SIZE";
  public static final String DELIMITER_KEY = "DELIMITER";
  public static final String ESCAPE_KEY = "ESCAPE";
  public static final String HEADER_KEY = "HEADER";
  public static final String LINE_DELIMITER_KEY = "LINE_DELIMITER";
  public static final String LONLAT_KEY = "LONLAT";
  public static final String NULLS_KEY = "NULLS";
  public static final String QUOTE_KEY = "QUOTE";
  public static final String QUOTED_KEY = "QUOTED";
  public static final String GEO_ASSIGN_RENDER_GROUPS_KEY = "GEO_ASSIGN_RENDER_GROUPS";
  public static final String GEO_EXPLODE_COLLECTIONS_KEY = "GEO_EXPLODE_COLLECTIONS";

  public static final Set<String> OPTION_KEYS = ImmutableSet.of(
      ARRAY_DELIMITER_KEY,
      ARRAY_MARKER_KEY,
      BUFFER_SIZE_KEY,
      DELIMITER_KEY,
      ESCAPE_KEY,
      HEADER_KEY,
      LINE_DELIMITER_KEY,
      LONLAT_KEY,
      NULLS_KEY,
      QUOTE_KEY,
      QUOTED_KEY,
      GEO_ASSIGN_RENDER_GROUPS_KEY,
      GEO_EXPLODE_COLLECTIONS_KEY);

  private char delimiter = ',';
  private String nulls = "\\N";
  private boolean header = true;
  private boolean quoted = true;
  private char quote = '"';
  private char escape = '"';
  private char lineDelimiter = '\n';
  private char arrayDelimiter = ',';
  private char arrayBegin = '{';
  private char arrayEnd = '}';
  private long bufferSize = CopyParams.DEFAULT_BUFFER_SIZE;
  private boolean lonlat = true;
  private boolean geoAssignRenderGroups = true;
  private boolean geoExplodeCollections;

  /**
   * @throws UserException validation error for an invalid option value
   */
  public static CsvReaderOptions from(ForeignTable table) {
    CsvReaderOptions options = new CsvReaderOptions();
    table.getOption(DELIMITER_KEY).ifPresent(value -> options.delimiter = parseDelimiter(DELIMITER_KEY, value));
    table.getOption(NULLS_KEY).ifPresent(value -> options.nulls = value);
    table.getOption(HEADER_KEY).ifPresent(value -> options.header = parseBoolean(HEADER_KEY, value));
    table.getOption(QUOTED_KEY).ifPresent(value -> options.quoted = parseBoolean(QUOTED_KEY, value));
    table.getOption(QUOTE_KEY).ifPresent(value -> options.quote = parseCharacter(QUOTE_KEY, value));
    table.getOption(ESCAPE_KEY).ifPresent(value -> options.escape = parseCharacter(ESCAPE_KEY, value));
    table.getOption(LINE_DELIMITER_KEY)
        .ifPresent(value -> options.lineDelimiter = parseDelimiter(LINE_DELIMITER_KEY, value));
    table.getOption(ARRAY_DELIMITER_KEY)
        .ifPresent(value -> options.arrayDelimiter = parseDelimiter(ARRAY_DELIMITER_KEY, value));
    table.getOption(ARRAY_MARKER_KEY).ifPresent(value -> {
      if (value.length() != 2) {
        throw UserException.validationError()
            .message("Invalid value specified for option \"%s\". Expected two characters, the array start "
                + "and end markers.", ARRAY_MARKER_KEY)
            .build(logger);
      }
      options.arrayBegin = value.charAt(0);
      options.arrayEnd = value.charAt(1);
    });
    table.getOption(BUFFER_SIZE_KEY).ifPresent(value -> options.bufferSize = parseBufferSize(value));
    table.getOption(LONLAT_KEY).ifPresent(value -> options.lonlat = parseBoolean(LONLAT_KEY, value));
    table.getOption(GEO_ASSIGN_RENDER_GROUPS_KEY)
        .ifPresent(value -> options.geoAssignRenderGroups = parseBoolean(GEO_ASSIGN_RENDER_GROUPS_KEY, value));
    table.getOption(GEO_EXPLODE_COLLECTIONS_KEY)
        .ifPresent(value -> options.geoExplodeCollections = parseBoolean(GEO_EXPLODE_COLLECTIONS_KEY, value));
    return options;
  }

  private static char parseDelimiter(String key, String value) {
    switch (value) {
      case "\\t":
        return '\t';
      case "\\n":
        return '\n';
      default:
        if (value.length() != 1) {
          throw UserException.validationError()
              .message("Invalid value specified for option \"%s\". Expected a single character, \"\\n\" or "
                  + "\"\\t\".", key)
              .build(logger);
        }
        return value.charAt(0);
    }
  }

  private static char parseCharacter(String key, String value) {
    if (value.length() != 1) {
      throw UserException.validationError()
          .message("Invalid value specified for option \"%s\". Expected a single character.", key)
          .build(logger);
    }
    return value.charAt(0);
  }

  private static boolean parseBoolean(String key, String value) {
    switch (value.toUpperCase(Locale.ROOT)) {
      case "TRUE":
        return true;
      case "FALSE":
        return false;
      default:
        throw UserException.validationError()
            .message("Invalid boolean value specified for \"%s\" foreign table option. Value must be either "
                + "'true' or 'false'.", key)
            .build(logger);
    }
  }

  private static long parseBufferSize(String value) {
    long bufferSize;
    try {
      bufferSize = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      bufferSize = 0;
    }
    if (bufferSize <= 0) {
      throw UserException.validationError()
          .message("Invalid value \"%s\" for %s option. Value must be a positive integer.", value, BUFFER_SIZE_KEY)
          .build(logger);
    }
    return bufferSize;
  }

  public char getDelimiter() {
    return delimiter;
  }

  public String getNulls() {
    return nulls;
  }

  public boolean hasHeader() {
    return header;
  }

  public boolean isQuoted() {
    return quoted;
  }

  public char getQuote() {
    return quote;
  }

  public char getEscape() {
    return escape;
  }

  public char getLineDelimiter() {
    return lineDelimiter;
  }

  public char getArrayDelimiter() {
    return arrayDelimiter;
  }

  public char getArrayBegin() {
    return arrayBegin;
  }

  public char getArrayEnd() {
    return arrayEnd;
  }

  public long getBufferSize() {
    return bufferSize;
  }

  public boolean isLonlat() {
    return lonlat;
  }

  public boolean isGeoAssignRenderGroups() {
    return geoAssignRenderGroups;
  }

  public boolean isGeoExplodeCollections() {
    return geoExplodeCollections;
  }
}
