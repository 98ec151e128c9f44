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
package org.colstore.common.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.colstore.test.ColstoreTest;
import org.junit.Test;

public class TestSqlTypeInfo extends ColstoreTest {

  @Test
  public void testArrayElementType() {
    SqlTypeInfo elem = SqlTypeInfo.of(SqlTypeName.SMALLINT);
    SqlTypeInfo array = SqlTypeInfo.arrayOf(elem);

    assertTrue(array.isArray());
    assertEquals(elem, array.getElemType());
    assertSame(elem, elem.getElemType());
    assertEquals("SMALLINT[]", array.getTypeName());
    assertEquals(-1, array.getSize());
  }

  @Test
  public void testSizes() {
    assertEquals(1, SqlTypeInfo.of(SqlTypeName.BOOLEAN).getSize());
    assertEquals(4, SqlTypeInfo.of(SqlTypeName.INT).getSize());
    assertEquals(8, SqlTypeInfo.decimal(18, 4).getSize());
    assertEquals(4, SqlTypeInfo.dictText().getSize());
    assertEquals(-1, SqlTypeInfo.of(SqlTypeName.TEXT).getSize());
    assertEquals(4, SqlTypeInfo.of(SqlTypeName.DATE).withEncoding(EncodingType.FIXED, 32).getSize());
  }

  @Test
  public void testEquality() {
    assertEquals(SqlTypeInfo.dictText(), SqlTypeInfo.dictText());
    assertNotEquals(SqlTypeInfo.dictText(), SqlTypeInfo.of(SqlTypeName.TEXT));
    assertNotEquals(SqlTypeInfo.of(SqlTypeName.INT), SqlTypeInfo.of(SqlTypeName.INT).withNotNull(true));
    assertFalse(SqlTypeInfo.of(SqlTypeName.TEXT).isDictEncodedString());
    assertEquals("DECIMAL(10,2)", SqlTypeInfo.decimal(10, 2).getTypeName());
  }
}
