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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.hadoop.fs.Path;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.exec.fragmenter.InsertChunks;
import org.colstore.exec.store.fsi.AbstractFileStorageDataWrapper;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

/**
 * Imports Parquet files row group by row group, without the metadata scan of
 * {@link ParquetDataWrapper}. Each call to {@link #getNextImportBatch()}
 * decodes one row group.
 */
public class ParquetImporter extends AbstractFileStorageDataWrapper implements Closeable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ParquetImporter.class);

  private final UserMapping userMapping;
  private final Map<Integer, StringDictionary> dictionaries = new HashMap<>();

  private Iterator<Path> files;
  private ParquetRowGroupReader currentReader;
  private List<ParquetColumnConverter> converters;
  private int batchCount;

  public ParquetImporter(int dbId, ForeignTable foreignTable, UserMapping userMapping) {
    super(dbId, foreignTable);
    this.userMapping = userMapping;
  }

  public UserMapping getUserMapping() {
    return userMapping;
  }

  /**
   * @return the rows of the next non empty row group, or empty when every file has been read
   */
  public Optional<InsertChunks> getNextImportBatch() {
    ForeignTable table = getBoundTable();
    if (files == null) {
      files = getAllFilePaths().iterator();
    }
    while (true) {
      if (currentReader == null) {
        if (!files.hasNext()) {
          logger.debug("Imported {} row groups into table {}", batchCount, table.getTableName());
          return Optional.empty();
        }
        openNextFile(table);
      }
      Map<Integer, ChunkBuffer> chunks;
      try {
        chunks = currentReader.readNextRowGroup(converters, this::getDictionary);
      } catch (IOException e) {
        throw ParquetDataWrapper.readError(e, currentReader.getFile());
      }
      if (chunks == null) {
        closeCurrentReader();
        continue;
      }
      int numRows = chunks.values().iterator().next().size();
      if (numRows == 0) {
        continue;
      }
      batchCount++;
      List<Integer> validRows = IntStream.range(0, numRows).boxed().collect(Collectors.toList());
      return Optional.of(new InsertChunks(table.getTableId(), dbId, chunks, validRows));
    }
  }

  private void openNextFile(ForeignTable table) {
    Path file = files.next();
    try {
      currentReader = new ParquetRowGroupReader(file, fsConf);
    } catch (IOException e) {
      throw ParquetDataWrapper.readError(e, file);
    }
    converters = ParquetColumnConverter.forColumns(currentReader.getSchema(), table.getLogicalColumns(), file);
  }

  private void closeCurrentReader() {
    try {
      currentReader.close();
    } catch (IOException e) {
      throw ParquetDataWrapper.readError(e, currentReader.getFile());
    } finally {
      currentReader = null;
    }
  }

  private StringDictionary getDictionary(ColumnDescriptor column) {
    return dictionaries.computeIfAbsent(column.getColumnId(), id -> new StringDictionary());
  }

  @Override
  public void populateChunkMetadata(ChunkMetadataVector chunkMetadataVector) {
    throw new UnsupportedOperationException("Parquet importer only produces import batches");
  }

  @Override
  public void populateChunkBuffers(Map<ChunkKey, ChunkBuffer> requiredBuffers) {
    throw new UnsupportedOperationException("Parquet importer only produces import batches");
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
  public void close() throws IOException {
    if (currentReader != null) {
      ParquetRowGroupReader reader = currentReader;
      currentReader = null;
      reader.close();
    }
  }
}
