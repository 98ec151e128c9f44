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
package org.colstore.exec.importexport;

/**
 * Outcome of an import.
 */
public class ImportStatus {
  private final long rowsCompleted;
  private final int fragmentsLoaded;
  private final long elapsedMillis;

  public ImportStatus(long rowsCompleted, int fragmentsLoaded, long elapsedMillis) {
    this.rowsCompleted = rowsCompleted;
    this.fragmentsLoaded = fragmentsLoaded;
    this.elapsedMillis = elapsedMillis;
  }

  public long getRowsCompleted() {
    return rowsCompleted;
  }

  public int getFragmentsLoaded() {
    return fragmentsLoaded;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override
  public String toString() {
    return "Loaded: " + rowsCompleted + " recs in " + fragmentsLoaded + " fragments, Elapsed: " + elapsedMillis
        + " ms";
  }
}
