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

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.colstore.common.exceptions.UserException;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.SessionInfo;
import org.colstore.exec.catalog.TableDescriptor;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.fragmenter.DistributedConnector;
import org.colstore.exec.fragmenter.InsertChunks;
import org.colstore.exec.fragmenter.InsertDataLoader;
import org.colstore.exec.store.fsi.AbstractFileStorageDataWrapper;
import org.colstore.exec.store.fsi.DataWrapperType;
import org.colstore.exec.store.fsi.ForeignDataWrapper;
import org.colstore.exec.store.fsi.ForeignDataWrapperFactory;
import org.colstore.exec.store.fsi.parquet.ParquetImporter;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadata;
import org.colstore.metastore.chunk.ChunkMetadataVector;

import com.google.common.base.Stopwatch;

/**
 * Imports a file source into a table by reading it through a data wrapper.
 * <p>
 * Every fragment read from the source is handed to an {@link InsertDataLoader}.
 * The table is checkpointed once all fragments are loaded, or rolled back
 * when any step fails.
 */
public class ForeignDataImporter {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForeignDataImporter.class);

  private final ForeignDataWrapperFactory dataWrapperFactory;
  private final DistributedConnector connector;
  private final InsertDataLoader insertDataLoader;

  public ForeignDataImporter(ForeignDataWrapperFactory dataWrapperFactory, DistributedConnector connector) {
    this.dataWrapperFactory = dataWrapperFactory;
    this.connector = connector;
    this.insertDataLoader = new InsertDataLoader(connector);
  }

  /**
   * @param table           table the rows are imported into
   * @param copyFromSource  path of the source file or directory
   * @throws UserException when the source cannot be read or its options are invalid
   */
  public ImportStatus importGeneral(SessionInfo sessionInfo, TableDescriptor table, String copyFromSource,
                                    CopyParams copyParams) {
    Stopwatch watch = Stopwatch.createStarted();
    int dbId = sessionInfo.getDatabaseId();
    ForeignServer server =
        dataWrapperFactory.createForeignServerProxy(dbId, sessionInfo.getUserId(), copyFromSource, copyParams);
    UserMapping userMapping = dataWrapperFactory.createUserMappingProxyIfApplicable(dbId, sessionInfo.getUserId(),
        copyFromSource, copyParams, server);
    ForeignTable foreignTable =
        dataWrapperFactory.createForeignTableProxy(dbId, table, copyFromSource, copyParams, server);
    DataWrapperType dataWrapperType = server.getDataWrapper();

    LoadCounter counter = new LoadCounter();
    try {
      if (dataWrapperType == DataWrapperType.PARQUET) {
        importParquet(sessionInfo, dbId, foreignTable, userMapping, counter);
      } else {
        importFragments(sessionInfo, dbId, foreignTable, userMapping, dataWrapperType, counter);
      }
      connector.checkpoint(sessionInfo, table.getTableId());
    } catch (RuntimeException e) {
      logger.debug("Import of {} into table {} failed, rolling back", copyFromSource, table.getTableName(), e);
      connector.rollback(sessionInfo, table.getTableId());
      throw e;
    }

    ImportStatus status = new ImportStatus(counter.rows, counter.fragments, watch.elapsed(TimeUnit.MILLISECONDS));
    logger.info("Imported {} into table {}. {}", copyFromSource, table.getTableName(), status);
    return status;
  }

  private void importFragments(SessionInfo sessionInfo, int dbId, ForeignTable foreignTable, UserMapping userMapping,
                               DataWrapperType dataWrapperType, LoadCounter counter) {
    ForeignDataWrapper dataWrapper =
        dataWrapperFactory.createForGeneralImport(dataWrapperType, dbId, foreignTable, userMapping);
    ChunkMetadataVector metadata = new ChunkMetadataVector();
    dataWrapper.populateChunkMetadata(metadata);

    for (Map.Entry<Integer, SortedMap<Integer, ChunkMetadata>> fragment : metadata.byFragment().entrySet()) {
      Map<ChunkKey, ChunkBuffer> buffers = new LinkedHashMap<>();
      Map<Integer, ChunkBuffer> chunks = new LinkedHashMap<>();
      for (Integer columnId : fragment.getValue().keySet()) {
        ColumnDescriptor column = foreignTable.getColumn(columnId);
        ChunkBuffer buffer = new ChunkBuffer(column.getColumnType());
        buffers.put(ChunkKey.of(dbId, foreignTable.getTableId(), columnId, fragment.getKey()), buffer);
        chunks.put(columnId, buffer);
      }
      dataWrapper.populateChunkBuffers(buffers);
      load(sessionInfo, new InsertChunks(foreignTable.getTableId(), dbId, chunks, allRows(chunks)), counter);
    }
  }

  private void importParquet(SessionInfo sessionInfo, int dbId, ForeignTable foreignTable, UserMapping userMapping,
                             LoadCounter counter) {
    try (ParquetImporter importer =
             dataWrapperFactory.createForImport(DataWrapperType.PARQUET, dbId, foreignTable, userMapping)) {
      Optional<InsertChunks> batch;
      while ((batch = importer.getNextImportBatch()).isPresent()) {
        load(sessionInfo, batch.get(), counter);
      }
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Unable to close the import of \"%s\".",
              foreignTable.getOption(AbstractFileStorageDataWrapper.FILE_PATH_KEY).orElse(""))
          .build(logger);
    }
  }

  private void load(SessionInfo sessionInfo, InsertChunks insertChunks, LoadCounter counter) {
    insertDataLoader.insertChunks(sessionInfo, insertChunks);
    counter.rows += insertChunks.getNumRows();
    counter.fragments++;
  }

  private static List<Integer> allRows(Map<Integer, ChunkBuffer> chunks) {
    int numRows = chunks.isEmpty() ? 0 : chunks.values().iterator().next().size();
    return IntStream.range(0, numRows).boxed().collect(Collectors.toList());
  }

  private static class LoadCounter {
    long rows;
    int fragments;
  }
}
