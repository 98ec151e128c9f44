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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.colstore.common.exceptions.UserException;
import org.colstore.exec.store.fsi.DataWrapperType;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named foreign server: the data wrapper used to reach a source and the
 * options shared by every foreign table defined on it.
 * <p>
 * Option keys are kept upper case.
 */
public class ForeignServer {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForeignServer.class);

  /** Id of servers that only exist for the duration of one operation. */
  public static final int TRANSIENT_ID = -1;

  private final int id;
  private final int userId;
  private final String name;
  private final String dataWrapperType;
  private final Map<String, String> options;
  private final long createTime;

  @JsonCreator
  public ForeignServer(@JsonProperty("id") int id,
                       @JsonProperty("userId") int userId,
                       @JsonProperty("name") String name,
                       @JsonProperty("dataWrapperType") String dataWrapperType,
                       @JsonProperty("options") Map<String, String> options,
                       @JsonProperty("createTime") long createTime) {
    this.id = id;
    this.userId = userId;
    this.name = name;
    this.dataWrapperType = dataWrapperType;
    this.options = new LinkedHashMap<>();
    if (options != null) {
      options.forEach((key, value) -> this.options.put(key.toUpperCase(Locale.ROOT), value));
    }
    this.createTime = createTime;
  }

  public int getId() {
    return id;
  }

  public int getUserId() {
    return userId;
  }

  public String getName() {
    return name;
  }

  public String getDataWrapperType() {
    return dataWrapperType;
  }

  /**
   * Converts the stored wrapper type name to the closed set of wrapper kinds.
   */
  @JsonIgnore
  public DataWrapperType getDataWrapper() {
    return DataWrapperType.fromName(dataWrapperType)
        .orElseThrow(() -> UserException.validationError()
            .message("Foreign server \"%s\" refers to unknown data wrapper type \"%s\".", name, dataWrapperType)
            .build(logger));
  }

  public Map<String, String> getOptions() {
    return Collections.unmodifiableMap(options);
  }

  public Optional<String> getOption(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public long getCreateTime() {
    return createTime;
  }

  @JsonIgnore
  public boolean isTransient() {
    return id == TRANSIENT_ID;
  }

  @Override
  public String toString() {
    return "ForeignServer [id=" + id + ", name=" + name + ", dataWrapperType=" + dataWrapperType
        + ", options=" + options + "]";
  }
}
