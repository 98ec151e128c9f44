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

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of data wrapper kinds. The name is what foreign server
 * definitions and import sources refer to.
 */
public enum DataWrapperType {
  CSV("DELIMITED_FILE", false),
  PARQUET("PARQUET_FILE", false),
  REGEX_PARSER("REGEX_PARSED_FILE", false),
  INTERNAL_CATALOG("INTERNAL_CATALOG", true),
  INTERNAL_MEMORY_STATS("INTERNAL_MEMORY_STATS", true),
  INTERNAL_STORAGE_STATS("INTERNAL_STORAGE_STATS", true);

  private final String name;
  private final boolean internal;

  DataWrapperType(String name, boolean internal) {
    this.name = name;
    this.internal = internal;
  }

  public String getName() {
    return name;
  }

  /**
   * Internal wrappers expose system tables and cannot be used by user defined servers.
   */
  public boolean isInternal() {
    return internal;
  }

  /**
   * Case sensitive lookup by wrapper name.
   */
  public static Optional<DataWrapperType> fromName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.name.equals(name))
        .findFirst();
  }

  @Override
  public String toString() {
    return name;
  }
}
