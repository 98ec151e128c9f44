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
package org.colstore.exec.chunk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.common.types.SqlTypeName;
import org.colstore.metastore.chunk.ChunkMetadata;
import org.colstore.test.ColstoreTest;
import org.junit.Test;

public class TestChunkBuffer extends ColstoreTest {

  @Test
  public void testFixedWidthMetadata() {
    ChunkBuffer buffer = new ChunkBuffer(SqlTypeInfo.of(SqlTypeName.INT));
    buffer.appendDatum(Datum.ofInt(5));
    buffer.appendNull();
    buffer.appendDatum(Datum.ofInt(-3));

    ChunkMetadata metadata = buffer.getMetadata();
    assertEquals(3, metadata.getNumElements());
    assertEquals(12, metadata.getNumBytes());
    assertEquals(-3, metadata.getChunkStats().getMin().getIntval());
    assertEquals(5, metadata.getChunkStats().getMax().getIntval());
    assertTrue(metadata.getChunkStats().hasNulls());
  }

  @Test
  public void testSelectKeepsDictionary() {
    StringDictionary dictionary = new StringDictionary();
    ChunkBuffer buffer = new ChunkBuffer(SqlTypeInfo.dictText(), dictionary);
    buffer.appendDatum(Datum.ofInt(dictionary.getOrAdd("red")));
    buffer.appendDatum(Datum.ofInt(dictionary.getOrAdd("blue")));
    buffer.appendDatum(Datum.ofInt(dictionary.getOrAdd("red")));
    assertEquals(2, dictionary.size());

    ChunkBuffer selected = buffer.select(Arrays.asList(2, 1));
    assertSame(dictionary, selected.getDictionary());
    assertEquals(2, selected.size());
    assertEquals("red", selected.getDictionaryString(0));
    assertEquals("blue", selected.getDictionaryString(1));
  }

  @Test
  public void testUnencodedStringsCountBytes() {
    ChunkBuffer buffer = new ChunkBuffer(SqlTypeInfo.of(SqlTypeName.TEXT));
    buffer.append("abc");
    buffer.append(null);
    buffer.append("é");
    assertEquals(5, buffer.getNumBytes());
    assertFalse(buffer.isNull(0));
    assertTrue(buffer.isNull(1));
  }

  @Test
  public void testCopyFromTakesOtherDictionary() {
    StringDictionary dictionary = new StringDictionary();
    ChunkBuffer source = new ChunkBuffer(SqlTypeInfo.dictText(), dictionary);
    source.appendDatum(Datum.ofInt(dictionary.getOrAdd("x")));
    ChunkBuffer target = new ChunkBuffer(SqlTypeInfo.dictText());
    target.copyFrom(source);
    assertEquals(1, target.size());
    assertEquals("x", target.getDictionaryString(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsScalarInArrayChunk() {
    new ChunkBuffer(SqlTypeInfo.arrayOf(SqlTypeInfo.of(SqlTypeName.INT))).appendDatum(Datum.ofInt(1));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testUnknownDictionaryCode() {
    new StringDictionary().getString(0);
  }
}
