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
package org.colstore.exec.store.fsi;

import org.colstore.common.config.ColstoreConfig;
import org.colstore.exec.catalog.SysCatalog;
import org.colstore.exec.fragmenter.StorageStatsProvider;

/**
 * Node level services data wrappers are created with.
 */
public class ForeignStorageContext {
  private final ColstoreConfig config;
  private final SysCatalog sysCatalog;
  private final StorageStatsProvider storageStatsProvider;

  public ForeignStorageContext(ColstoreConfig config, SysCatalog sysCatalog,
                               StorageStatsProvider storageStatsProvider) {
    this.config = config;
    this.sysCatalog = sysCatalog;
    this.storageStatsProvider = storageStatsProvider;
  }

  public ColstoreConfig getConfig() {
    return config;
  }

  public SysCatalog getSysCatalog() {
    return sysCatalog;
  }

  public StorageStatsProvider getStorageStatsProvider() {
    return storageStatsProvider;
  }
}
