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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits delimited text into records of fields.
 * <p>
 * Quoted fields may contain delimiters and line delimiters; inside them the
 * escape character followed by a quote is a literal quote, as is a doubled
 * quote when escape and quote are the same character. Delimiters inside an
 * unquoted field starting with the array begin marker do not end the field,
 * up to the matching end marker. Empty lines are
 * skipped.
 */
public class CsvLineParser {
  private static final int EOF = -1;

  private final Reader reader;
  private final CsvReaderOptions options;

  private int pending = EOF;
  private boolean pendingValid;
  private long lineNumber = 1;
  private long recordLineNumber;

  public CsvLineParser(Reader reader, CsvReaderOptions options) {
    this.reader = reader;
    this.options = options;
  }

  /**
   * @return fields of the next record, or null at the end of the input
   */
  public List<String> nextRecord() throws IOException {
    List<String> fields = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean inQuotes = false;
    int arrayDepth = 0;
    boolean sawAny = false;
    recordLineNumber = lineNumber;

    int c;
    while ((c = read()) != EOF) {
      char ch = (char) c;
      if (inQuotes) {
        if (ch == options.getEscape() && options.getEscape() != options.getQuote() && peek() == options.getQuote()) {
          field.append((char) read());
        } else if (ch == options.getQuote()) {
          if (options.getEscape() == options.getQuote() && peek() == options.getQuote()) {
            field.append((char) read());
          } else {
            inQuotes = false;
          }
        } else {
          if (ch == '\n') {
            lineNumber++;
          }
          field.append(ch);
        }
        continue;
      }

      if (ch == '\r' && options.getLineDelimiter() == '\n' && peek() == '\n') {
        continue;
      }
      if (ch == options.getLineDelimiter()) {
        if (ch == '\n') {
          lineNumber++;
        }
        if (!sawAny) {
          recordLineNumber = lineNumber;
          continue;
        }
        fields.add(field.toString());
        return fields;
      }

      sawAny = true;
      if (options.isQuoted() && ch == options.getQuote() && field.length() == 0 && arrayDepth == 0) {
        inQuotes = true;
      } else if (ch == options.getDelimiter() && arrayDepth == 0) {
        fields.add(field.toString());
        field.setLength(0);
      } else {
        boolean opensArray = field.length() == 0 || arrayDepth > 0;
        if (ch == options.getArrayBegin() && ch != options.getArrayEnd() && opensArray) {
          arrayDepth++;
        } else if (ch == options.getArrayEnd() && arrayDepth > 0) {
          arrayDepth--;
        }
        field.append(ch);
      }
    }

    if (!sawAny) {
      return null;
    }
    fields.add(field.toString());
    return fields;
  }

  /**
   * @return line number of the first line of the record last returned
   */
  public long getRecordLineNumber() {
    return recordLineNumber;
  }

  private int read() throws IOException {
    if (pendingValid) {
      pendingValid = false;
      return pending;
    }
    return reader.read();
  }

  private int peek() throws IOException {
    if (!pendingValid) {
      pending = reader.read();
      pendingValid = true;
    }
    return pending;
  }
}
