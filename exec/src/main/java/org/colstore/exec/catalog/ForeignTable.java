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
package org.colstore.exec.catalog;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.colstore.common.exceptions.UserException;

import com.google.common.collect.ImmutableSet;

/**
 * A table whose data lives in a source reached through a foreign server.
 * <p>
 * {@link #initializeOptions()} has to be called once all options are set and
 * before the table is handed to a data wrapper.
 */
public class ForeignTable extends TableDescriptor {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForeignTable.class);

  public static final String FRAGMENT_SIZE_KEY = "FRAGMENT_SIZE";
  public static final String REFRESH_TIMING_TYPE_KEY = "REFRESH_TIMING_TYPE";
  public static final String REFRESH_START_DATE_TIME_KEY = "REFRESH_START_DATE_TIME";
  public static final String REFRESH_INTERVAL_KEY = "REFRESH_INTERVAL";
  public static final String REFRESH_UPDATE_TYPE_KEY = "REFRESH_UPDATE_TYPE";

  public static final String MANUAL_REFRESH_TIMING_TYPE = "MANUAL";
  public static final String SCHEDULE_REFRESH_TIMING_TYPE = "SCHEDULED";
  public static final String ALL_REFRESH_UPDATE_TYPE = "ALL";
  public static final String APPEND_REFRESH_UPDATE_TYPE = "APPEND";

  /** Options every foreign table accepts, whatever its data wrapper. */
  public static final Set<String> SUPPORTED_OPTIONS = ImmutableSet.of(
      FRAGMENT_SIZE_KEY,
      REFRESH_TIMING_TYPE_KEY,
      REFRESH_START_DATE_TIME_KEY,
      REFRESH_INTERVAL_KEY,
      REFRESH_UPDATE_TYPE_KEY);

  private static final DateTimeFormatter START_DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final Pattern INTERVAL_PATTERN = Pattern.compile("\\d+[SHD]");

  private final ForeignServer foreignServer;
  private final Map<String, String> options = new LinkedHashMap<>();

  /**
   * Creates a foreign table with the attributes of the given table.
   */
  public ForeignTable(TableDescriptor table, ForeignServer foreignServer) {
    super(table);
    this.foreignServer = foreignServer;
    setStorageType(FOREIGN_TABLE_STORAGE_TYPE);
  }

  public ForeignServer getForeignServer() {
    return foreignServer;
  }

  public void setOption(String key, String value) {
    options.put(key, value);
  }

  public void setOptions(Map<String, String> newOptions) {
    options.putAll(newOptions);
  }

  public Map<String, String> getOptions() {
    return Collections.unmodifiableMap(options);
  }

  public Optional<String> getOption(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public boolean hasOption(String key) {
    return options.containsKey(key);
  }

  /**
   * Normalizes option keys to upper case and validates the options common to
   * every foreign table. A valid {@code FRAGMENT_SIZE} becomes the maximum
   * number of rows of a fragment.
   *
   * @throws UserException validation error for an invalid option value
   */
  public void initializeOptions() {
    Map<String, String> normalized = new LinkedHashMap<>();
    options.forEach((key, value) -> normalized.put(key.toUpperCase(Locale.ROOT), value));
    options.clear();
    options.putAll(normalized);

    validateRefreshOptions();
    getOption(FRAGMENT_SIZE_KEY).ifPresent(value -> setMaxFragRows(parseFragmentSize(value)));
  }

  private void validateRefreshOptions() {
    String timingType = getOption(REFRESH_TIMING_TYPE_KEY).map(value -> value.toUpperCase(Locale.ROOT))
        .orElse(MANUAL_REFRESH_TIMING_TYPE);
    if (!timingType.equals(MANUAL_REFRESH_TIMING_TYPE) && !timingType.equals(SCHEDULE_REFRESH_TIMING_TYPE)) {
      throw invalidOption(REFRESH_TIMING_TYPE_KEY, "Value must be \"MANUAL\" or \"SCHEDULED\".");
    }
    if (timingType.equals(SCHEDULE_REFRESH_TIMING_TYPE)) {
      String startDateTime = getOption(REFRESH_START_DATE_TIME_KEY)
          .orElseThrow(() -> UserException.validationError()
              .message("REFRESH_START_DATE_TIME option must be provided for scheduled refreshes.")
              .build(logger));
      try {
        LocalDateTime.parse(startDateTime, START_DATE_TIME_FORMAT);
      } catch (DateTimeParseException e) {
        throw UserException.validationError(e)
            .message("Invalid value \"%s\" for REFRESH_START_DATE_TIME option. Expected format is "
                + "\"YYYY-MM-DD HH:MM:SS\".", startDateTime)
            .build(logger);
      }
      getOption(REFRESH_INTERVAL_KEY).ifPresent(interval -> {
        if (!INTERVAL_PATTERN.matcher(interval.toUpperCase(Locale.ROOT)).matches()) {
          throw invalidOption(REFRESH_INTERVAL_KEY, "Value must be a positive number followed by S, H or D.");
        }
      });
    }
    getOption(REFRESH_UPDATE_TYPE_KEY).ifPresent(updateType -> {
      String upper = updateType.toUpperCase(Locale.ROOT);
      if (!upper.equals(ALL_REFRESH_UPDATE_TYPE) && !upper.equals(APPEND_REFRESH_UPDATE_TYPE)) {
        throw invalidOption(REFRESH_UPDATE_TYPE_KEY, "Value must be \"APPEND\" or \"ALL\".");
      }
    });
  }

  private long parseFragmentSize(String value) {
    long fragmentSize;
    try {
      fragmentSize = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw invalidOption(FRAGMENT_SIZE_KEY, "Value must be a positive integer.");
    }
    if (fragmentSize <= 0) {
      throw invalidOption(FRAGMENT_SIZE_KEY, "Value must be a positive integer.");
    }
    return fragmentSize;
  }

  private UserException invalidOption(String key, String expectation) {
    return UserException.validationError()
        .message("Invalid value \"%s\" for %s option. %s", options.get(key), key, expectation)
        .addContext("Table", getTableName())
        .build(logger);
  }
}
