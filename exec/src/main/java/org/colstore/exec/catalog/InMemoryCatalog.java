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

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryCatalog implements Catalog {
  private final int databaseId;
  private final String databaseName;
  private final Map<Integer, TableDescriptor> tables = new ConcurrentSkipListMap<>();
  private final Map<String, ForeignServer> foreignServers = new ConcurrentHashMap<>();

  public InMemoryCatalog(int databaseId, String databaseName) {
    this.databaseId = databaseId;
    this.databaseName = databaseName;
  }

  @Override
  public int getDatabaseId() {
    return databaseId;
  }

  @Override
  public String getDatabaseName() {
    return databaseName;
  }

  @Override
  public Collection<TableDescriptor> getTables() {
    return Collections.unmodifiableCollection(tables.values());
  }

  @Override
  public Optional<TableDescriptor> getTable(int tableId) {
    return Optional.ofNullable(tables.get(tableId));
  }

  @Override
  public Optional<ForeignServer> getForeignServer(String serverName) {
    return Optional.ofNullable(foreignServers.get(serverName.toLowerCase(Locale.ROOT)));
  }

  @Override
  public void addTable(TableDescriptor table) {
    tables.put(table.getTableId(), table);
  }

  @Override
  public void addForeignServer(ForeignServer server) {
    foreignServers.put(server.getName().toLowerCase(Locale.ROOT), server);
  }
}
