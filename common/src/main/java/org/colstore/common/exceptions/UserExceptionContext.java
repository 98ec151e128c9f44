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
package org.colstore.common.exceptions;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Holds context information about a {@link UserException}. Context lines are
 * appended to the error message shown to the caller.
 */
public class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  UserExceptionContext() {
    errorId = UUID.randomUUID().toString();
    contextList = new ArrayList<>();
  }

  /**
   * adds a context line to the bottom of the context list
   * @param context context line
   */
  public UserExceptionContext add(String context) {
    contextList.add(context);
    return this;
  }

  /**
   * adds a string value to the bottom of the context list
   * @param context context prefix string
   * @param value string value
   */
  public UserExceptionContext add(String context, String value) {
    add(context + ": " + value);
    return this;
  }

  /**
   * adds a long to the bottom of the context list
   * @param context context prefix string
   * @param value long value
   */
  public UserExceptionContext add(String context, long value) {
    add(context + ": " + value);
    return this;
  }

  /**
   * adds a context line at the top of the context list
   * @param context context line
   */
  public UserExceptionContext push(String context) {
    contextList.add(0, context);
    return this;
  }

  /**
   * adds a string value at the top of the context list
   * @param context context prefix string
   * @param value string value
   */
  public UserExceptionContext push(String context, String value) {
    push(context + ": " + value);
    return this;
  }

  String getErrorId() {
    return errorId;
  }

  List<String> getContextLines() {
    return contextList;
  }

  /**
   * generate a context message
   * @param includeErrorId whether the error id should close the message
   * @return string containing all context information concatenated
   */
  String generateContextMessage(boolean includeErrorId) {
    StringBuilder sb = new StringBuilder();

    for (String context : contextList) {
      sb.append(context).append("\n");
    }

    if (includeErrorId) {
      sb.append("\n[Error Id: ").append(errorId).append("]");
    }

    return sb.toString();
  }
}
