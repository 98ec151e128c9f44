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

import java.util.concurrent.locks.ReentrantLock;

import org.colstore.exec.catalog.SessionInfo;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Spreads insert batches over the leaves of a connector in round robin order.
 * <p>
 * Safe for concurrent use: only the choice of the next leaf is serialized,
 * deliveries to the connector run concurrently.
 */
public class InsertDataLoader {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(InsertDataLoader.class);

  private final DistributedConnector connector;
  private final int leafCount;
  private final ReentrantLock currentLeafIndexLock = new ReentrantLock();
  private int currentLeafIndex;

  public InsertDataLoader(DistributedConnector connector) {
    this.connector = connector;
    this.leafCount = connector.leafCount();
    Preconditions.checkArgument(leafCount > 0, "Connector reports %s leaves", leafCount);
  }

  public void insertData(SessionInfo sessionInfo, InsertData insertData) {
    int leafIdx = nextLeaf();
    logger.trace("Routing {} rows of table {} to leaf {}", insertData.getNumRows(), insertData.getTableId(), leafIdx);
    connector.insertDataToLeaf(sessionInfo, leafIdx, insertData);
  }

  public void insertChunks(SessionInfo sessionInfo, InsertChunks insertChunks) {
    int leafIdx = nextLeaf();
    logger.trace("Routing chunks of {} rows of table {} to leaf {}", insertChunks.getNumRows(),
        insertChunks.getTableId(), leafIdx);
    connector.insertChunksToLeaf(sessionInfo, leafIdx, insertChunks);
  }

  public int getLeafCount() {
    return leafCount;
  }

  private int nextLeaf() {
    return leafCount == 1 ? 0 : moveToNextLeaf();
  }

  /**
   * Returns the current leaf and advances to the next one, wrapping after the last.
   */
  @VisibleForTesting
  int moveToNextLeaf() {
    currentLeafIndexLock.lock();
    try {
      int leafIdx = currentLeafIndex;
      currentLeafIndex = (currentLeafIndex + 1) % leafCount;
      return leafIdx;
    } finally {
      currentLeafIndexLock.unlock();
    }
  }
}
