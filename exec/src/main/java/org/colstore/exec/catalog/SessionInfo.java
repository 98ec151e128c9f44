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

/**
 * Identity of the session an operation runs on behalf of.
 */
public class SessionInfo {
  private final String sessionId;
  private final String userName;
  private final int userId;
  private final int databaseId;

  public SessionInfo(String sessionId, String userName, int userId, int databaseId) {
    this.sessionId = sessionId;
    this.userName = userName;
    this.userId = userId;
    this.databaseId = databaseId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserName() {
    return userName;
  }

  public int getUserId() {
    return userId;
  }

  public int getDatabaseId() {
    return databaseId;
  }

  @Override
  public String toString() {
    return userName + "@" + databaseId + " [" + sessionId + "]";
  }
}
