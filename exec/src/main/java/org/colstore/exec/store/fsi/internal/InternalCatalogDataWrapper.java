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
package org.colstore.exec.store.fsi.internal;

import java.util.ArrayList;
import java.util.List;

import org.colstore.exec.catalog.Catalog;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.exec.store.fsi.ForeignStorageContext;

/**
 * Lists the tables of every database.
 */
public class InternalCatalogDataWrapper extends InternalSystemDataWrapper<InternalCatalogDataWrapper.TableInfo> {

  public InternalCatalogDataWrapper() {
    super(TableInfo.class);
  }

  public InternalCatalogDataWrapper(int dbId, ForeignTable foreignTable, ForeignStorageContext context) {
    super(TableInfo.class, dbId, foreignTable, context);
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.INTERNAL_CATALOG;
  }

  @Override
  protected List<TableInfo> getRecords() {
    List<TableInfo> records = new ArrayList<>();
    for (Catalog catalog : context.getSysCatalog().getCatalogs()) {
      for (TableDescriptor table : catalog.getTables()) {
        TableInfo info = new TableInfo();
        info.database_id = catalog.getDatabaseId();
        info.database_name = catalog.getDatabaseName();
        info.table_id = table.getTableId();
        info.table_name = table.getTableName();
        info.column_count = table.getLogicalColumns().size();
        info.is_foreign = table.isForeignTable();
        info.max_fragment_size = table.getMaxFragRows();
        records.add(info);
      }
    }
    return records;
  }

  public static class TableInfo {
    public int database_id;
    public String database_name;
    public int table_id;
    public String table_name;
    public int column_count;
    public boolean is_foreign;
    public long max_fragment_size;
  }
}
