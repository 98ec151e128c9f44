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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.Maps;

/**
 * Ordered list of chunk keys and their metadata, as produced by a scan of a
 * table's storage.
 */
public class ChunkMetadataVector implements Iterable<Map.Entry<ChunkKey, ChunkMetadata>> {

  private final List<Map.Entry<ChunkKey, ChunkMetadata>> entries = new ArrayList<>();

  public void add(ChunkKey key, ChunkMetadata metadata) {
    entries.add(Maps.immutableEntry(key, metadata));
  }

  public Map.Entry<ChunkKey, ChunkMetadata> get(int index) {
    return entries.get(index);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public List<ChunkKey> keys() {
    List<ChunkKey> keys = new ArrayList<>(entries.size());
    for (Map.Entry<ChunkKey, ChunkMetadata> entry : entries) {
      keys.add(entry.getKey());
    }
    return keys;
  }

  /**
   * Groups the metadata by fragment id, then by column id.
   *
   * @return fragment id to a {@code column id -> metadata} map, both in ascending order
   */
  public SortedMap<Integer, SortedMap<Integer, ChunkMetadata>> byFragment() {
    SortedMap<Integer, SortedMap<Integer, ChunkMetadata>> fragments = new TreeMap<>();
    for (Map.Entry<ChunkKey, ChunkMetadata> entry : entries) {
      ChunkKey key = entry.getKey();
      fragments.computeIfAbsent(key.getFragmentId(), id -> new TreeMap<>())
          .put(key.getColumnId(), entry.getValue());
    }
    return fragments;
  }

  @Override
  public Iterator<Map.Entry<ChunkKey, ChunkMetadata>> iterator() {
    return Collections.unmodifiableList(entries).iterator();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
