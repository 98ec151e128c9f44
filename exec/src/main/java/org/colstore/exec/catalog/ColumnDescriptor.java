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

import org.colstore.common.types.SqlTypeInfo;

public class ColumnDescriptor {
  private final int tableId;
  private final int columnId;
  private final String columnName;
  private final SqlTypeInfo columnType;
  private final boolean systemColumn;

  public ColumnDescriptor(int tableId, int columnId, String columnName, SqlTypeInfo columnType) {
    this(tableId, columnId, columnName, columnType, false);
  }

  public ColumnDescriptor(int tableId, int columnId, String columnName, SqlTypeInfo columnType,
                          boolean systemColumn) {
    this.tableId = tableId;
    this.columnId = columnId;
    this.columnName = columnName;
    this.columnType = columnType;
    this.systemColumn = systemColumn;
  }

  public int getTableId() {
    return tableId;
  }

  public int getColumnId() {
    return columnId;
  }

  public String getColumnName() {
    return columnName;
  }

  public SqlTypeInfo getColumnType() {
    return columnType;
  }

  /**
   * System columns (such as the row id) are maintained by storage and never read from a source.
   */
  public boolean isSystemColumn() {
    return systemColumn;
  }

  @Override
  public String toString() {
    return columnName + " " + columnType + " (id " + columnId + ")";
  }
}
