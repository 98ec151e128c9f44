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

import java.util.List;

import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.fragmenter.TableStorageStats;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.exec.store.fsi.ForeignStorageContext;

/**
 * Fragment, chunk and row counts of the tables stored on this node.
 */
public class InternalStorageStatsDataWrapper extends InternalSystemDataWrapper<TableStorageStats> {

  public InternalStorageStatsDataWrapper() {
    super(TableStorageStats.class);
  }

  public InternalStorageStatsDataWrapper(int dbId, ForeignTable foreignTable, ForeignStorageContext context) {
    super(TableStorageStats.class, dbId, foreignTable, context);
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.INTERNAL_STORAGE_STATS;
  }

  @Override
  protected List<TableStorageStats> getRecords() {
    return context.getStorageStatsProvider().getTableStorageStats();
  }
}
