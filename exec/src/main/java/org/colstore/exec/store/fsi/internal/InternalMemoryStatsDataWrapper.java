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

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryUsage;
import java.util.ArrayList;
import java.util.List;

import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.exec.store.fsi.ForeignStorageContext;

/**
 * Memory usage of the JVM memory pools of this node.
 */
public class InternalMemoryStatsDataWrapper
    extends InternalSystemDataWrapper<InternalMemoryStatsDataWrapper.MemoryPoolInfo> {

  public InternalMemoryStatsDataWrapper() {
    super(MemoryPoolInfo.class);
  }

  public InternalMemoryStatsDataWrapper(int dbId, ForeignTable foreignTable, ForeignStorageContext context) {
    super(MemoryPoolInfo.class, dbId, foreignTable, context);
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.INTERNAL_MEMORY_STATS;
  }

  @Override
  protected List<MemoryPoolInfo> getRecords() {
    List<MemoryPoolInfo> records = new ArrayList<>();
    for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
      MemoryUsage usage = pool.getUsage();
      if (usage == null) {
        // pool is no longer valid
        continue;
      }
      MemoryPoolInfo info = new MemoryPoolInfo();
      info.pool_name = pool.getName();
      info.pool_type = pool.getType().name();
      info.used_bytes = usage.getUsed();
      info.committed_bytes = usage.getCommitted();
      info.max_bytes = usage.getMax();
      records.add(info);
    }
    return records;
  }

  public static class MemoryPoolInfo {
    public String pool_name;
    public String pool_type;
    public long used_bytes;
    public long committed_bytes;
    public long max_bytes;
  }
}
