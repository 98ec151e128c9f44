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
package org.colstore.exec.chunk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Assigns dense integer codes to the distinct strings of a dictionary encoded column.
 */
public class StringDictionary {
  private final Map<String, Integer> codes = new HashMap<>();
  private final List<String> strings = new ArrayList<>();

  public synchronized int getOrAdd(String value) {
    Integer code = codes.get(value);
    if (code == null) {
      code = strings.size();
      strings.add(value);
      codes.put(value, code);
    }
    return code;
  }

  public synchronized String getString(int code) {
    Preconditions.checkElementIndex(code, strings.size(), "dictionary code");
    return strings.get(code);
  }

  public synchronized int size() {
    return strings.size();
  }
}
