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
package org.colstore.exec.store.fsi.internal;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.DatumUtils;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignServer;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.catalog.UserMapping;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.exec.store.fsi.ForeignDataWrapper;
import org.colstore.exec.store.fsi.ForeignStorageContext;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

import com.google.common.base.Preconditions;

/**
 * Base of the wrappers exposing node state as read only system tables.
 * <p>
 * Rows are POJOs whose public fields are the columns. A table column is
 * filled from the field of the same name, ignoring case, and is null when the
 * record has no such field. All rows form a single fragment.
 */
public abstract class InternalSystemDataWrapper<T> implements ForeignDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(InternalSystemDataWrapper.class);

  protected final int dbId;
  protected final ForeignTable foreignTable;
  protected final ForeignStorageContext context;

  private final Class<T> recordClass;
  private final Map<ChunkKey, ChunkBuffer> chunks = new HashMap<>();

  /**
   * Creates a wrapper that only validates options.
   */
  protected InternalSystemDataWrapper(Class<T> recordClass) {
    this(recordClass, -1, null, null);
  }

  protected InternalSystemDataWrapper(Class<T> recordClass, int dbId, ForeignTable foreignTable,
                                      ForeignStorageContext context) {
    this.recordClass = recordClass;
    this.dbId = dbId;
    this.foreignTable = foreignTable;
    this.context = context;
  }

  /**
   * Takes a snapshot of the rows of the table.
   */
  protected abstract List<T> getRecords();

  @Override
  public void populateChunkMetadata(ChunkMetadataVector chunkMetadataVector) {
    Preconditions.checkState(foreignTable != null && context != null,
        "%s was created for option validation only", getClass().getSimpleName());
    chunks.clear();
    List<T> records = getRecords();
    if (records.isEmpty()) {
      return;
    }
    Map<String, Field> fields = getRecordFields();
    for (ColumnDescriptor column : foreignTable.getLogicalColumns()) {
      Field field = fields.get(column.getColumnName().toLowerCase(Locale.ROOT));
      SqlTypeInfo type = column.getColumnType();
      ChunkBuffer chunk = new ChunkBuffer(type, type.isDictEncodedString() ? new StringDictionary() : null);
      for (T record : records) {
        appendValue(chunk, column, field == null ? null : readField(field, record));
      }
      ChunkKey key = ChunkKey.of(dbId, foreignTable.getTableId(), column.getColumnId(), 0);
      chunkMetadataVector.add(key, chunk.getMetadata());
      chunks.put(key, chunk);
    }
    logger.debug("Read {} rows for system table {}", records.size(), foreignTable.getTableName());
  }

  @Override
  public void populateChunkBuffers(Map<ChunkKey, ChunkBuffer> requiredBuffers) {
    requiredBuffers.forEach((key, buffer) -> {
      ChunkBuffer chunk = chunks.get(key);
      Preconditions.checkArgument(chunk != null, "Chunk %s is not a chunk of this data wrapper", key);
      buffer.copyFrom(chunk);
    });
  }

  private Map<String, Field> getRecordFields() {
    Map<String, Field> fields = new HashMap<>();
    for (Field field : recordClass.getDeclaredFields()) {
      if (!Modifier.isStatic(field.getModifiers()) && Modifier.isPublic(field.getModifiers())) {
        fields.put(field.getName().toLowerCase(Locale.ROOT), field);
      }
    }
    return fields;
  }

  private Object readField(Field field, T record) {
    try {
      return field.get(record);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Field " + field + " of a system table record is not public", e);
    }
  }

  private void appendValue(ChunkBuffer chunk, ColumnDescriptor column, Object value) {
    SqlTypeInfo type = column.getColumnType();
    if (value == null) {
      chunk.appendNull();
      return;
    }
    try {
      if (type.isDictEncodedString()) {
        chunk.appendDatum(Datum.ofInt(chunk.getDictionary().getOrAdd(String.valueOf(value))));
      } else if (type.isString()) {
        chunk.appendString(String.valueOf(value));
      } else {
        chunk.appendDatum(DatumUtils.stringToDatum(String.valueOf(value), type));
      }
    } catch (IllegalArgumentException e) {
      throw UserException.dataReadError(e)
          .message("Value \"%s\" cannot be stored in column \"%s\" of type %s.", value, column.getColumnName(),
              type.getTypeName())
          .addContext("Table", foreignTable.getTableName())
          .build(logger);
    }
  }

  @Override
  public void validateServerOptions(ForeignServer foreignServer) {
    if (!foreignServer.getOptions().isEmpty()) {
      throw UserException.validationError()
          .message("Foreign servers of data wrapper \"%s\" take no options.", getDataWrapperType().getName())
          .addContext("Server", foreignServer.getName())
          .build(logger);
    }
  }

  @Override
  public void validateTableOptions(ForeignTable table) {
    for (String key : table.getOptions().keySet()) {
      if (!ForeignTable.SUPPORTED_OPTIONS.contains(key)) {
        throw UserException.validationError()
            .message("Invalid foreign table option \"%s\".", key)
            .addContext("Table", table.getTableName())
            .build(logger);
      }
    }
  }

  @Override
  public void validateUserMappingOptions(UserMapping userMapping, ForeignServer foreignServer) {
    throw UserException.unsupportedError()
        .message("User mappings are not supported for data wrapper \"%s\".", getDataWrapperType().getName())
        .build(logger);
  }

  @Override
  public Set<String> getSupportedTableOptions() {
    return ForeignTable.SUPPORTED_OPTIONS;
  }
}
