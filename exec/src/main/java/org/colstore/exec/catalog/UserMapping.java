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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per user options, typically credentials, of a foreign server.
 */
public class UserMapping {
  private final int id;
  private final int userId;
  private final int foreignServerId;
  private final Map<String, String> options;

  @JsonCreator
  public UserMapping(@JsonProperty("id") int id,
                     @JsonProperty("userId") int userId,
                     @JsonProperty("foreignServerId") int foreignServerId,
                     @JsonProperty("options") Map<String, String> options) {
    this.id = id;
    this.userId = userId;
    this.foreignServerId = foreignServerId;
    this.options = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
  }

  public int getId() {
    return id;
  }

  public int getUserId() {
    return userId;
  }

  public int getForeignServerId() {
    return foreignServerId;
  }

  public Map<String, String> getOptions() {
    return Collections.unmodifiableMap(options);
  }
}
