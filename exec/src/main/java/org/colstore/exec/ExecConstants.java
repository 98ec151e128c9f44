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
package org.colstore.exec;

public final class ExecConstants {
  private ExecConstants() {
  }

  /** Whether the columnar archive (Parquet) data wrapper is part of the supported registry. */
  public static final String FSI_PARQUET_ENABLED = "colstore.exec.fsi.parquet.enabled";

  /** Path prefixes recognized as cloud object storage locations, which local imports reject. */
  public static final String FSI_REMOTE_URI_PREFIXES = "colstore.exec.fsi.remote_uri_prefixes";

  /** Default read buffer size of an import, in bytes. */
  public static final String IMPORT_BUFFER_SIZE = "colstore.exec.import.buffer_size";

  /** Default maximum number of rows of a fragment. */
  public static final String STORAGE_FRAGMENT_SIZE = "colstore.exec.storage.fragment_size";
}
