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

import static org.colstore.exec.store.fsi.ForeignTableFixtures.DB_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.TABLE_ID;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.foreignTable;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.localServer;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.table;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.colstore.common.exceptions.ErrorType;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.store.fsi.AbstractFileStorageDataWrapper;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;
import org.colstore.test.ColstoreTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestRegexParserDataWrapper extends ColstoreTest {

  private static final TableDescriptor TABLE = table(
      SqlTypeInfo.of(SqlTypeName.TIMESTAMP),
      SqlTypeInfo.dictText(),
      SqlTypeInfo.of(SqlTypeName.TEXT));

  private static final String LINE_REGEX = "(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}) (\\w+) (.*)";

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private ForeignTable logTable(String... options) throws Exception {
    File file = folder.newFile("app.log");
    Files.write(file.toPath(), Arrays.asList(
        "2024-01-01 10:00:00 INFO started",
        "2024-01-01 10:00:05 ERROR failed",
        "  at Foo.bar",
        "",
        "  at Foo.main",
        "garbage",
        "2024-01-01 10:01:00 WARN done"), StandardCharsets.UTF_8);
    String[] keyValues = Arrays.copyOf(options, options.length + 2);
    keyValues[options.length] = AbstractFileStorageDataWrapper.FILE_PATH_KEY;
    keyValues[options.length + 1] = file.getPath();
    return foreignTable(localServer(DataWrapperType.REGEX_PARSER), TABLE, keyValues);
  }

  private static Map<ChunkKey, ChunkBuffer> readAll(RegexParserDataWrapper wrapper) {
    ChunkMetadataVector metadata = new ChunkMetadataVector();
    wrapper.populateChunkMetadata(metadata);
    Map<ChunkKey, ChunkBuffer> buffers = new LinkedHashMap<>();
    for (int columnId = 1; columnId <= 3; columnId++) {
      buffers.put(ChunkKey.of(DB_ID, TABLE_ID, columnId, 0),
          new ChunkBuffer(TABLE.getColumn(columnId).getColumnType()));
    }
    wrapper.populateChunkBuffers(buffers);
    return buffers;
  }

  @Test
  public void testEveryLineIsARecord() throws Exception {
    Map<ChunkKey, ChunkBuffer> buffers = readAll(new RegexParserDataWrapper(DB_ID,
        logTable("LINE_REGEX", LINE_REGEX)));
    ChunkBuffer timestamps = buffers.get(ChunkKey.of(DB_ID, TABLE_ID, 1, 0));
    ChunkBuffer messages = buffers.get(ChunkKey.of(DB_ID, TABLE_ID, 3, 0));

    // empty lines are skipped, lines that do not match become null rows
    assertEquals(6, timestamps.size());
    assertEquals(Datum.ofBigint(1704103200L), timestamps.getValue(0));
    assertTrue(timestamps.isNull(2));
    assertTrue(messages.isNull(4));
    assertEquals("done", messages.getValue(5));
  }

  @Test
  public void testLineStartRegexJoinsLines() throws Exception {
    Map<ChunkKey, ChunkBuffer> buffers = readAll(new RegexParserDataWrapper(DB_ID,
        logTable("LINE_REGEX", LINE_REGEX, "LINE_START_REGEX", "^\\d{4}-")));
    ChunkBuffer levels = buffers.get(ChunkKey.of(DB_ID, TABLE_ID, 2, 0));
    ChunkBuffer messages = buffers.get(ChunkKey.of(DB_ID, TABLE_ID, 3, 0));

    assertEquals(3, messages.size());
    assertEquals("failed\n  at Foo.bar\n  at Foo.main\ngarbage", messages.getValue(1));
    assertEquals("WARN", levels.getDictionaryString(2));
  }

  @Test
  public void testCaptureGroupsMustMatchColumns() throws Exception {
    ForeignTable table = logTable("LINE_REGEX", "(\\S+) (.*)");
    try {
      new RegexParserDataWrapper().validateTableOptions(table);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("(3 columns, 2 capture groups)"));
    }
  }

  @Test
  public void testLineRegexRequired() throws Exception {
    ForeignTable table = logTable();
    try {
      new RegexParserDataWrapper().validateTableOptions(table);
      fail();
    } catch (UserException e) {
      assertThat(e.getOriginalMessage(), containsString("Foreign table options must contain \"LINE_REGEX\"."));
    }
  }

  @Test
  public void testInvalidRegex() throws Exception {
    ForeignTable table = logTable("LINE_REGEX", "(unclosed");
    try {
      new RegexParserDataWrapper().validateTableOptions(table);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("Invalid regex"));
    }
  }
}
