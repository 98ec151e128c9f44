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
package org.colstore.exec.store.fsi;

import java.util.Map;
import java.util.Set;

import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

/**
 * Reads the data of a foreign table from its source.
 * <p>
 * Instances created for validation are not bound to a table and only support
 * the {@code validate*} methods.
 */
public interface ForeignDataWrapper {

  /**
   * Scans the source and adds the metadata of every chunk of the table.
   */
  void populateChunkMetadata(ChunkMetadataVector chunkMetadataVector);

  /**
   * Fills in the given buffers. Keys must have been reported by a preceding
   * {@link #populateChunkMetadata(ChunkMetadataVector)} call on this instance.
   */
  void populateChunkBuffers(Map<ChunkKey, ChunkBuffer> requiredBuffers);

  void validateServerOptions(ForeignServer foreignServer);

  void validateTableOptions(ForeignTable foreignTable);

  void validateUserMappingOptions(UserMapping userMapping, ForeignServer foreignServer);

  /**
   * @return keys of the table options this wrapper accepts
   */
  Set<String> getSupportedTableOptions();

  DataWrapperType getDataWrapperType();
}
