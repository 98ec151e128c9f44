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
package org.colstore.exec.fragmenter;

import org.colstore.exec.catalog.SessionInfo;

/**
 * Delivers insert batches to the leaves of a cluster. Leaves are numbered
 * {@code 0} to {@code leafCount() - 1}.
 */
public interface DistributedConnector {

  int leafCount();

  void insertDataToLeaf(SessionInfo parentSessionInfo, int leafIdx, InsertData insertData);

  void insertChunksToLeaf(SessionInfo parentSessionInfo, int leafIdx, InsertChunks insertChunks);

  /**
   * Makes everything inserted into the table by the session visible.
   */
  void checkpoint(SessionInfo parentSessionInfo, int tableId);

  /**
   * Discards everything inserted into the table by the session since its last checkpoint.
   */
  void rollback(SessionInfo parentSessionInfo, int tableId);
}
