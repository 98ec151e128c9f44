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
package org.colstore.exec.store.fsi.text;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.fs.Path;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.DatumUtils;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.catalog.ForeignTable;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.exec.store.fsi.AbstractFileStorageDataWrapper;
import org.colstore.metastore.chunk.ChunkKey;
import org.colstore.metastore.chunk.ChunkMetadataVector;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;

/**
 * Base of the wrappers reading text files record by record. Subclasses split
 * files into records of field strings; this class converts the fields to the
 * column types and packs the rows into fragments of at most
 * {@link ForeignTable#getMaxFragRows()} rows.
 */
public abstract class AbstractTextFileDataWrapper extends AbstractFileStorageDataWrapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractTextFileDataWrapper.class);

  /**
   * Receives the records of a file. A {@code null} field is a null value.
   */
  protected interface RecordConsumer {
    void accept(List<String> fields, long lineNumber);
  }

  private final boolean disableCache;
  private final Map<Integer, StringDictionary> dictionaries = new HashMap<>();
  private final Map<ChunkKey, ChunkBuffer> parsedChunks = new HashMap<>();

  protected AbstractTextFileDataWrapper() {
    this.disableCache = false;
  }

  /**
   * @param disableCache whether chunks are released once handed out, for instances that serve a single import
   */
  protected AbstractTextFileDataWrapper(int dbId, ForeignTable foreignTable, boolean disableCache) {
    super(dbId, foreignTable);
    this.disableCache = disableCache;
  }

  /**
   * Splits a file into records.
   */
  protected abstract void readRecords(Path file, RecordConsumer consumer) throws IOException;

  protected boolean isNullField(String field, SqlTypeInfo type) {
    return field.isEmpty() && !type.isString();
  }

  protected char getArrayBegin() {
    return '{';
  }

  protected char getArrayEnd() {
    return '}';
  }

  protected char getArrayDelimiter() {
    return ',';
  }

  public boolean isCacheDisabled() {
    return disableCache;
  }

  @Override
  public void populateChunkMetadata(ChunkMetadataVector chunkMetadataVector) {
    ForeignTable table = getBoundTable();
    Stopwatch watch = Stopwatch.createStarted();
    parsedChunks.clear();

    List<ColumnDescriptor> columns = table.getLogicalColumns();
    checkColumnTypes(columns);
    FragmentBuilder fragment = new FragmentBuilder(columns, chunkMetadataVector);
    for (Path file : getAllFilePaths()) {
      logger.debug("Reading {} for table {}", file, table.getTableName());
      try {
        readRecords(file, (fields, lineNumber) -> {
          fragment.addRow(fields, file, lineNumber);
          if (fragment.numRows >= table.getMaxFragRows()) {
            fragment.flush();
          }
        });
      } catch (IOException e) {
        throw UserException.dataReadError(e)
            .message("Unable to read file \"%s\".", file)
            .addContext("Table", table.getTableName())
            .build(logger);
      }
    }
    fragment.flush();
    logger.debug("Parsed {} fragments of table {} in {}", fragment.fragmentId, table.getTableName(), watch);
  }

  @Override
  public void populateChunkBuffers(Map<ChunkKey, ChunkBuffer> requiredBuffers) {
    requiredBuffers.forEach((key, buffer) -> {
      ChunkBuffer parsed = disableCache ? parsedChunks.remove(key) : parsedChunks.get(key);
      Preconditions.checkArgument(parsed != null, "Chunk %s is not a chunk of this data wrapper", key);
      buffer.copyFrom(parsed);
    });
  }

  private void checkColumnTypes(List<ColumnDescriptor> columns) {
    for (ColumnDescriptor column : columns) {
      SqlTypeInfo type = column.getColumnType();
      if (type.isArray() && type.getElemType().isString() && !type.getElemType().isDictEncodedString()) {
        throw UserException.unsupportedError()
            .message("Column \"%s\" is an array of unencoded strings, which text files cannot be read into.",
                column.getColumnName())
            .build(logger);
      }
    }
  }

  private StringDictionary getDictionary(ColumnDescriptor column) {
    return dictionaries.computeIfAbsent(column.getColumnId(), id -> new StringDictionary());
  }

  private void appendField(ChunkBuffer chunk, ColumnDescriptor column, String field) {
    SqlTypeInfo type = column.getColumnType();
    if (field == null || isNullField(field, type)) {
      chunk.appendNull();
    } else if (type.isArray()) {
      chunk.appendArray(parseArray(field, column));
    } else if (type.isDictEncodedString()) {
      chunk.appendDatum(Datum.ofInt(getDictionary(column).getOrAdd(field)));
    } else if (type.isString()) {
      chunk.appendString(field);
    } else {
      chunk.appendDatum(DatumUtils.stringToDatum(field, type));
    }
  }

  private List<Datum> parseArray(String field, ColumnDescriptor column) {
    SqlTypeInfo elemType = column.getColumnType().getElemType();
    String value = field.trim();
    if (value.length() < 2 || value.charAt(0) != getArrayBegin() || value.charAt(value.length() - 1) != getArrayEnd()) {
      throw new IllegalArgumentException(String.format("Array value '%s' must be enclosed in %s and %s",
          field, getArrayBegin(), getArrayEnd()));
    }
    String inner = value.substring(1, value.length() - 1);
    List<Datum> elements = new ArrayList<>();
    if (inner.trim().isEmpty()) {
      return elements;
    }
    for (String element : Splitter.on(getArrayDelimiter()).trimResults().split(inner)) {
      if (isNullField(element, elemType) || element.equalsIgnoreCase("NULL")) {
        elements.add(null);
      } else if (elemType.isDictEncodedString()) {
        elements.add(Datum.ofInt(getDictionary(column).getOrAdd(element)));
      } else {
        elements.add(DatumUtils.stringToDatum(element, elemType));
      }
    }
    return elements;
  }

  /**
   * Accumulates the rows of the fragment being read.
   */
  private class FragmentBuilder {
    private final List<ColumnDescriptor> columns;
    private final ChunkMetadataVector chunkMetadataVector;
    private Map<Integer, ChunkBuffer> chunks;
    private int fragmentId;
    private long numRows;

    FragmentBuilder(List<ColumnDescriptor> columns, ChunkMetadataVector chunkMetadataVector) {
      this.columns = columns;
      this.chunkMetadataVector = chunkMetadataVector;
      reset();
    }

    void addRow(List<String> fields, Path file, long lineNumber) {
      if (fields.size() != columns.size()) {
        throw UserException.dataReadError()
            .message("Mismatched number of logical columns: (expected %d columns, has %d).",
                columns.size(), fields.size())
            .addContext("File", file.toString())
            .addContext("Line", lineNumber)
            .build(logger);
      }
      for (int i = 0; i < columns.size(); i++) {
        ColumnDescriptor column = columns.get(i);
        try {
          appendField(chunks.get(column.getColumnId()), column, fields.get(i));
        } catch (IllegalArgumentException e) {
          throw UserException.dataReadError(e)
              .message("Unable to parse value \"%s\" of column \"%s\".", fields.get(i), column.getColumnName())
              .addContext("File", file.toString())
              .addContext("Line", lineNumber)
              .build(logger);
        }
      }
      numRows++;
    }

    void flush() {
      if (numRows == 0) {
        return;
      }
      ForeignTable table = getBoundTable();
      for (ColumnDescriptor column : columns) {
        ChunkKey key = ChunkKey.of(dbId, table.getTableId(), column.getColumnId(), fragmentId);
        ChunkBuffer chunk = chunks.get(column.getColumnId());
        chunkMetadataVector.add(key, chunk.getMetadata());
        parsedChunks.put(key, chunk);
      }
      fragmentId++;
      reset();
    }

    private void reset() {
      chunks = new LinkedHashMap<>();
      for (ColumnDescriptor column : columns) {
        SqlTypeInfo type = column.getColumnType();
        chunks.put(column.getColumnId(),
            new ChunkBuffer(type, type.getElemType().isDictEncodedString() ? getDictionary(column) : null));
      }
      numRows = 0;
    }
  }
}
