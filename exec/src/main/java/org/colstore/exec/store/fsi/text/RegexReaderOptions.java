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

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ForeignTable;

import com.google.common.collect.ImmutableSet;

/**
 * Compiled regexes of a regex parsed file table.
 */
public class RegexReaderOptions {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RegexReaderOptions.class);

  public static final String LINE_REGEX_KEY = "LINE_REGEX";
  public static final String LINE_START_REGEX_KEY = "LINE_START_REGEX";

  public static final Set<String> OPTION_KEYS = ImmutableSet.of(LINE_REGEX_KEY, LINE_START_REGEX_KEY);

  private final Pattern lineRegex;
  private final Optional<Pattern> lineStartRegex;

  private RegexReaderOptions(Pattern lineRegex, Optional<Pattern> lineStartRegex) {
    this.lineRegex = lineRegex;
    this.lineStartRegex = lineStartRegex;
  }

  /**
   * @throws UserException validation error when the line regex is missing or a regex does not compile
   */
  public static RegexReaderOptions from(ForeignTable table) {
    String lineRegex = table.getOption(LINE_REGEX_KEY)
        .filter(regex -> !regex.isEmpty())
        .orElseThrow(() -> UserException.validationError()
            .message("Foreign table options must contain \"%s\".", LINE_REGEX_KEY)
            .addContext("Table", table.getTableName())
            .build(logger));
    Optional<Pattern> lineStartRegex = table.getOption(LINE_START_REGEX_KEY)
        .filter(regex -> !regex.isEmpty())
        .map(regex -> compile(LINE_START_REGEX_KEY, regex));
    return new RegexReaderOptions(compile(LINE_REGEX_KEY, lineRegex), lineStartRegex);
  }

  private static Pattern compile(String key, String regex) {
    try {
      return Pattern.compile(regex, Pattern.DOTALL);
    } catch (PatternSyntaxException e) {
      throw UserException.validationError(e)
          .message("Invalid regex \"%s\" provided for the \"%s\" foreign table option.", regex, key)
          .build(logger);
    }
  }

  public Pattern getLineRegex() {
    return lineRegex;
  }

  public Optional<Pattern> getLineStartRegex() {
    return lineStartRegex;
  }

  public int getCaptureGroupCount() {
    return lineRegex.matcher("").groupCount();
  }
}
