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
package org.colstore.exec.store.fsi.parquet;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.hadoop.fs.Path;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.exec.store.fsi.AbstractFileStorageDataWrapper;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

import com.google.common.base.Preconditions;

/**
 * Reads Parquet files. Every non empty row group of every file is one
 * fragment; chunk metadata comes from the footer statistics without reading
 * any data page.
 */
public class ParquetDataWrapper extends AbstractFileStorageDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ParquetDataWrapper.class);

  private final boolean doMetadataStatsValidation;
  private final Map<Integer, StringDictionary> dictionaries = new HashMap<>();
  // fragment id -> location of its row group
  private final Map<Integer, RowGroupLocation> fragments = new HashMap<>();

  /**
   * Creates a wrapper that only validates options.
   */
  public ParquetDataWrapper() {
    this.doMetadataStatsValidation = true;
  }

  public ParquetDataWrapper(int dbId, ForeignTable foreignTable) {
    this(dbId, foreignTable, true);
  }

  /**
   * @param doMetadataStatsValidation whether row groups whose statistics exceed the range of the column
   *                                  type are rejected while reading metadata
   */
  public ParquetDataWrapper(int dbId, ForeignTable foreignTable, boolean doMetadataStatsValidation) {
    super(dbId, foreignTable);
    this.doMetadataStatsValidation = doMetadataStatsValidation;
  }

  public boolean isMetadataStatsValidationEnabled() {
    return doMetadataStatsValidation;
  }

  @Override
  public DataWrapperType getDataWrapperType() {
    return DataWrapperType.PARQUET;
  }

  @Override
  protected Set<String> getFormatTableOptions() {
    return Collections.emptySet();
  }

  @Override
  public void populateChunkMetadata(ChunkMetadataVector chunkMetadataVector) {
    ForeignTable table = getBoundTable();
    List<ColumnDescriptor> columns = table.getLogicalColumns();
    fragments.clear();
    int fragmentId = 0;
    for (Path file : getAllFilePaths()) {
      try (ParquetRowGroupReader reader = new ParquetRowGroupReader(file, fsConf)) {
        List<ParquetColumnConverter> converters = ParquetColumnConverter.forColumns(reader.getSchema(), columns, file);
        List<BlockMetaData> rowGroups = reader.getRowGroups();
        for (int rowGroupIndex = 0; rowGroupIndex < rowGroups.size(); rowGroupIndex++) {
          BlockMetaData rowGroup = rowGroups.get(rowGroupIndex);
          if (rowGroup.getRowCount() == 0) {
            continue;
          }
          for (ParquetColumnConverter converter : converters) {
            ChunkKey key = ChunkKey.of(dbId, table.getTableId(), converter.getColumn().getColumnId(), fragmentId);
            chunkMetadataVector.add(key, converter.getChunkMetadata(rowGroup, doMetadataStatsValidation, file));
          }
          fragments.put(fragmentId, new RowGroupLocation(file, rowGroupIndex));
          fragmentId++;
        }
      } catch (IOException e) {
        throw readError(e, file);
      }
    }
    logger.debug("Found {} row groups for table {}", fragmentId, table.getTableName());
  }

  @Override
  public void populateChunkBuffers(Map<ChunkKey, ChunkBuffer> requiredBuffers) {
    ForeignTable table = getBoundTable();
    // file -> row group index -> keys of the row group
    Map<Path, SortedMap<Integer, Map<ChunkKey, ChunkBuffer>>> byFile = new HashMap<>();
    requiredBuffers.forEach((key, buffer) -> {
      RowGroupLocation location = fragments.get(key.getFragmentId());
      Preconditions.checkArgument(location != null, "Chunk %s is not a chunk of this data wrapper", key);
      byFile.computeIfAbsent(location.file, file -> new TreeMap<>())
          .computeIfAbsent(location.rowGroupIndex, index -> new HashMap<>())
          .put(key, buffer);
    });

    for (Map.Entry<Path, SortedMap<Integer, Map<ChunkKey, ChunkBuffer>>> entry : byFile.entrySet()) {
      Path file = entry.getKey();
      try (ParquetRowGroupReader reader = new ParquetRowGroupReader(file, fsConf)) {
        List<ParquetColumnConverter> converters =
            ParquetColumnConverter.forColumns(reader.getSchema(), table.getLogicalColumns(), file);
        for (Map.Entry<Integer, Map<ChunkKey, ChunkBuffer>> rowGroup : entry.getValue().entrySet()) {
          while (reader.getNextRowGroupIndex() < rowGroup.getKey()) {
            reader.skipNextRowGroup();
          }
          Map<Integer, ChunkBuffer> chunks = reader.readNextRowGroup(converters, this::getDictionary);
          Preconditions.checkState(chunks != null, "Row group %s of %s disappeared", rowGroup.getKey(), file);
          rowGroup.getValue().forEach((key, buffer) -> {
            ChunkBuffer chunk = chunks.get(key.getColumnId());
            Preconditions.checkArgument(chunk != null, "Chunk %s is not a chunk of this data wrapper", key);
            buffer.copyFrom(chunk);
          });
        }
      } catch (IOException e) {
        throw readError(e, file);
      }
    }
  }

  private StringDictionary getDictionary(ColumnDescriptor column) {
    return dictionaries.computeIfAbsent(column.getColumnId(), id -> new StringDictionary());
  }

  static UserException readError(IOException e, Path file) {
    return UserException.dataReadError(e)
        .message("Unable to read Parquet file \"%s\".", file)
        .build(logger);
  }

  private static class RowGroupLocation {
    final Path file;
    final int rowGroupIndex;

    RowGroupLocation(Path file, int rowGroupIndex) {
      this.file = file;
      this.rowGroupIndex = rowGroupIndex;
    }
  }
}
