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

import static org.colstore.exec.store.fsi.ForeignTableFixtures.foreignTable;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.localServer;
import static org.colstore.exec.store.fsi.ForeignTableFixtures.table;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.test.ColstoreTest;
import org.junit.Test;

public class TestCsvLineParser extends ColstoreTest {

  private static CsvLineParser parser(String input, String... options) {
    CsvReaderOptions readerOptions = CsvReaderOptions.from(
        foreignTable(localServer(DataWrapperType.CSV), table(SqlTypeInfo.of(SqlTypeName.TEXT)), options));
    return new CsvLineParser(new StringReader(input), readerOptions);
  }

  @Test
  public void testQuotedFields() throws IOException {
    CsvLineParser parser = parser("a,\"b,c\",\"say \"\"hi\"\"\"\nd,,\"\"\n");
    assertEquals(Arrays.asList("a", "b,c", "say \"hi\""), parser.nextRecord());
    assertEquals(Arrays.asList("d", "", ""), parser.nextRecord());
    assertNull(parser.nextRecord());
  }

  @Test
  public void testQuotedLineBreakAndLineNumbers() throws IOException {
    CsvLineParser parser = parser("1,\"two\nlines\"\r\n\n3,x");
    assertEquals(Arrays.asList("1", "two\nlines"), parser.nextRecord());
    assertEquals(1, parser.getRecordLineNumber());
    assertEquals(Arrays.asList("3", "x"), parser.nextRecord());
    assertEquals(4, parser.getRecordLineNumber());
    assertNull(parser.nextRecord());
  }

  @Test
  public void testDistinctEscapeCharacter() throws IOException {
    CsvLineParser parser = parser("\"a\\\"b\",c", CsvReaderOptions.ESCAPE_KEY, "\\");
    assertEquals(Arrays.asList("a\"b", "c"), parser.nextRecord());
  }

  @Test
  public void testUnquotedMode() throws IOException {
    CsvLineParser parser = parser("\"a\",b", CsvReaderOptions.QUOTED_KEY, "false");
    assertEquals(Arrays.asList("\"a\"", "b"), parser.nextRecord());
  }

  @Test
  public void testArraysKeepDelimiters() throws IOException {
    CsvLineParser parser = parser("1,{2,3},x{4,5}");
    assertEquals(Arrays.asList("1", "{2,3}", "x{4", "5}"), parser.nextRecord());
  }

  @Test
  public void testCustomDelimiters() throws IOException {
    CsvLineParser parser = parser("a\tb;c\td;", CsvReaderOptions.DELIMITER_KEY, "\\t",
        CsvReaderOptions.LINE_DELIMITER_KEY, ";");
    assertEquals(Arrays.asList("a", "b"), parser.nextRecord());
    assertEquals(Arrays.asList("c", "d"), parser.nextRecord());
    assertNull(parser.nextRecord());
  }
}
