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

import org.colstore.common.config.ColstoreConfig;
import org.colstore.exec.ExecConstants;

/**
 * Parameters of a COPY FROM import.
 * <p>
 * Fields are public and mutable: the statement handler fills in whatever the
 * user specified over the defaults below.
 */
public class CopyParams {
  public static final long DEFAULT_BUFFER_SIZE = 8L << 20;

  public SourceType sourceType = SourceType.DELIMITED_FILE;

  public char delimiter = ',';
  public String nullStr = "\\N";
  public ImportHeaderRow hasHeader = ImportHeaderRow.AUTO_DETECT;
  public boolean quoted = true;
  public char quote = '"';
  public char escape = '"';
  public char lineDelim = '\n';
  public char arrayDelim = ',';
  public char arrayBegin = '{';
  public char arrayEnd = '}';
  public long bufferSize = DEFAULT_BUFFER_SIZE;

  public boolean lonlat = true;
  public boolean geoAssignRenderGroups = true;
  public boolean geoExplodeCollections = false;

  /** Regex a whole record has to match, required for regex parsed files. */
  public String lineRegex = "";
  /** Regex marking the first line of a record, empty when every line is a record. */
  public String lineStartRegex = "";

  public String regexPathFilter;
  public String fileSortOrderBy;
  public String fileSortRegex;

  public CopyParams() {
  }

  /**
   * Creates parameters whose defaults come from the given configuration.
   */
  public CopyParams(ColstoreConfig config) {
    this.bufferSize = config.getLong(ExecConstants.IMPORT_BUFFER_SIZE);
  }
}
