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
package org.colstore.metastore.chunk;

import org.colstore.common.types.Datum;

/**
 * Value statistics of a chunk: minimum, maximum and whether any value is null.
 */
public class ChunkStats {

  private Datum min;
  private Datum max;
  private boolean hasNulls;

  public ChunkStats() {
    this(Datum.ZERO, Datum.ZERO, false);
  }

  public ChunkStats(Datum min, Datum max, boolean hasNulls) {
    this.min = min;
    this.max = max;
    this.hasNulls = hasNulls;
  }

  public ChunkStats(ChunkStats other) {
    this(other.min, other.max, other.hasNulls);
  }

  public Datum getMin() {
    return min;
  }

  public void setMin(Datum min) {
    this.min = min;
  }

  public Datum getMax() {
    return max;
  }

  public void setMax(Datum max) {
    this.max = max;
  }

  public boolean hasNulls() {
    return hasNulls;
  }

  public void setHasNulls(boolean hasNulls) {
    this.hasNulls = hasNulls;
  }
}
