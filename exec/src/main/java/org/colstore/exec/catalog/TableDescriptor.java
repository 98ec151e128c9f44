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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Describes a table: identity, owner and its columns.
 */
public class TableDescriptor {
  public static final String FOREIGN_TABLE_STORAGE_TYPE = "FOREIGN_TABLE";

  private final int tableId;
  private final String tableName;
  private final int userId;
  private final int dbId;
  private final List<ColumnDescriptor> columns;
  private long maxFragRows;
  private String storageType = "";
  private boolean view;

  public TableDescriptor(int tableId, String tableName, int userId, int dbId, long maxFragRows,
                         List<ColumnDescriptor> columns) {
    this.tableId = tableId;
    this.tableName = tableName;
    this.userId = userId;
    this.dbId = dbId;
    this.maxFragRows = maxFragRows;
    this.columns = new ArrayList<>(columns);
  }

  /**
   * Copies every attribute of the given descriptor.
   */
  public TableDescriptor(TableDescriptor other) {
    this(other.tableId, other.tableName, other.userId, other.dbId, other.maxFragRows, other.columns);
    this.storageType = other.storageType;
    this.view = other.view;
  }

  public int getTableId() {
    return tableId;
  }

  public String getTableName() {
    return tableName;
  }

  public int getUserId() {
    return userId;
  }

  public int getDbId() {
    return dbId;
  }

  public long getMaxFragRows() {
    return maxFragRows;
  }

  public void setMaxFragRows(long maxFragRows) {
    this.maxFragRows = maxFragRows;
  }

  public String getStorageType() {
    return storageType;
  }

  public void setStorageType(String storageType) {
    this.storageType = storageType;
  }

  public boolean isView() {
    return view;
  }

  public void setView(boolean view) {
    this.view = view;
  }

  public boolean isForeignTable() {
    return FOREIGN_TABLE_STORAGE_TYPE.equals(storageType);
  }

  public List<ColumnDescriptor> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  /**
   * @return the columns values are read into, in declaration order
   */
  public List<ColumnDescriptor> getLogicalColumns() {
    return columns.stream()
        .filter(column -> !column.isSystemColumn())
        .collect(Collectors.toList());
  }

  public ColumnDescriptor getColumn(int columnId) {
    for (ColumnDescriptor column : columns) {
      if (column.getColumnId() == columnId) {
        return column;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "TableDescriptor [tableId=" + tableId + ", tableName=" + tableName + ", dbId=" + dbId
        + ", maxFragRows=" + maxFragRows + ", columns=" + columns + "]";
  }
}
