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
package org.colstore.exec.fragmenter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Rows to insert into a table, laid out column by column.
 * <p>
 * Values use the row representations of {@link org.colstore.exec.chunk.ChunkBuffer};
 * dictionary encoded string columns may also carry plain strings, which are
 * encoded by the storage that receives them.
 */
public class InsertData {
  private final int databaseId;
  private final int tableId;
  private final List<Integer> columnIds;
  private final List<List<Object>> columnValues;
  private final int numRows;

  public InsertData(int databaseId, int tableId, List<Integer> columnIds, List<List<Object>> columnValues) {
    Preconditions.checkArgument(columnIds.size() == columnValues.size(),
        "%s column ids given for %s columns of values", columnIds.size(), columnValues.size());
    this.databaseId = databaseId;
    this.tableId = tableId;
    this.columnIds = new ArrayList<>(columnIds);
    this.columnValues = new ArrayList<>(columnValues);
    this.numRows = columnValues.isEmpty() ? 0 : columnValues.get(0).size();
    for (List<Object> values : columnValues) {
      Preconditions.checkArgument(values.size() == numRows, "Columns of an insert must have the same number of rows");
    }
  }

  public int getDatabaseId() {
    return databaseId;
  }

  public int getTableId() {
    return tableId;
  }

  public List<Integer> getColumnIds() {
    return Collections.unmodifiableList(columnIds);
  }

  public List<Object> getColumnValues(int columnIndex) {
    return Collections.unmodifiableList(columnValues.get(columnIndex));
  }

  public int getNumRows() {
    return numRows;
  }
}
