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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.hadoop.fs.Path;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ColumnChunkMetaData;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.colstore.common.exceptions.UserException;
import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;
import org.colstore.metastore.chunk.ChunkMetadata;

/**
 * Maps a flat Parquet column to a table column: type compatibility, footer
 * statistics and value conversion.
 */
public class ParquetColumnConverter {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ParquetColumnConverter.class);

  private static final long SECONDS_PER_DAY = 86400L;

  private final ColumnDescriptor column;
  private final SqlTypeInfo type;
  private final PrimitiveType parquetType;
  private final int fieldIndex;

  private ParquetColumnConverter(ColumnDescriptor column, PrimitiveType parquetType, int fieldIndex) {
    this.column = column;
    this.type = column.getColumnType();
    this.parquetType = parquetType;
    this.fieldIndex = fieldIndex;
  }

  /**
   * Matches every column of the table with the file column of the same name, ignoring case.
   *
   * @throws UserException data read error when a column is missing or of an incompatible type
   */
  public static List<ParquetColumnConverter> forColumns(MessageType schema, List<ColumnDescriptor> columns,
                                                        Path file) {
    Map<String, Integer> fieldIndexes = new HashMap<>();
    for (int i = 0; i < schema.getFieldCount(); i++) {
      Type field = schema.getType(i);
      if (!field.isPrimitive() || field.isRepetition(Type.Repetition.REPEATED)) {
        throw UserException.dataReadError()
            .message("Parquet column \"%s\" is not a flat column. Only flat schemas are supported.", field.getName())
            .addContext("File", file.toString())
            .build(logger);
      }
      fieldIndexes.put(field.getName().toLowerCase(Locale.ROOT), i);
    }

    List<ParquetColumnConverter> converters = new ArrayList<>();
    for (ColumnDescriptor column : columns) {
      Integer fieldIndex = fieldIndexes.get(column.getColumnName().toLowerCase(Locale.ROOT));
      if (fieldIndex == null) {
        throw UserException.dataReadError()
            .message("Column \"%s\" is missing from the Parquet file.", column.getColumnName())
            .addContext("File", file.toString())
            .build(logger);
      }
      ParquetColumnConverter converter =
          new ParquetColumnConverter(column, schema.getType(fieldIndex).asPrimitiveType(), fieldIndex);
      if (!converter.isCompatible()) {
        throw UserException.dataReadError()
            .message("Conversion from Parquet type \"%s\" to column type \"%s\" is not supported for column \"%s\".",
                converter.parquetType, converter.type.getTypeName(), column.getColumnName())
            .addContext("File", file.toString())
            .build(logger);
      }
      converters.add(converter);
    }
    return converters;
  }

  public ColumnDescriptor getColumn() {
    return column;
  }

  private boolean isCompatible() {
    PrimitiveTypeName physical = parquetType.getPrimitiveTypeName();
    LogicalTypeAnnotation logical = parquetType.getLogicalTypeAnnotation();
    boolean plainInteger = logical == null || logical instanceof LogicalTypeAnnotation.IntLogicalTypeAnnotation;
    switch (type.getType()) {
      case BOOLEAN:
        return physical == PrimitiveTypeName.BOOLEAN;
      case TINYINT:
      case SMALLINT:
      case INT:
        return physical == PrimitiveTypeName.INT32 && plainInteger;
      case BIGINT:
        return (physical == PrimitiveTypeName.INT32 || physical == PrimitiveTypeName.INT64) && plainInteger;
      case FLOAT:
        return physical == PrimitiveTypeName.FLOAT;
      case DOUBLE:
        return physical == PrimitiveTypeName.FLOAT || physical == PrimitiveTypeName.DOUBLE;
      case DECIMAL:
      case NUMERIC:
        return (physical == PrimitiveTypeName.INT32 || physical == PrimitiveTypeName.INT64)
            && logical instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation
            && ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) logical).getScale() == type.getScale();
      case DATE:
        return physical == PrimitiveTypeName.INT32
            && logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation;
      case TIMESTAMP:
        return physical == PrimitiveTypeName.INT64
            && logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
      case TIME:
        return (physical == PrimitiveTypeName.INT32 || physical == PrimitiveTypeName.INT64)
            && logical instanceof LogicalTypeAnnotation.TimeLogicalTypeAnnotation;
      case CHAR:
      case VARCHAR:
      case TEXT:
        return physical == PrimitiveTypeName.BINARY
            && (logical == null || logical instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation);
      default:
        return false;
    }
  }

  /**
   * Builds the metadata of the column's chunk in a row group from the footer statistics.
   *
   * @param validateStats whether statistics outside the range of the column type are rejected
   */
  public ChunkMetadata getChunkMetadata(BlockMetaData rowGroup, boolean validateStats, Path file) {
    ColumnChunkMetaData columnChunk = rowGroup.getColumns().get(fieldIndex);
    ChunkMetadata metadata = new ChunkMetadata(type);
    metadata.setNumElements(rowGroup.getRowCount());
    metadata.setNumBytes(type.getSize() > 0
        ? rowGroup.getRowCount() * type.getSize()
        : columnChunk.getTotalUncompressedSize());

    Statistics<?> stats = columnChunk.getStatistics();
    boolean statsAvailable = stats != null && !stats.isEmpty();
    // unknown null counts are reported as nulls present
    boolean hasNulls = !statsAvailable || !stats.isNumNullsSet() || stats.getNumNulls() > 0;
    if (!statsAvailable || !stats.hasNonNullValue() || type.isString()) {
      metadata.getChunkStats().setHasNulls(hasNulls);
      return metadata;
    }

    Number min = toNumber(stats.genericGetMin());
    Number max = toNumber(stats.genericGetMax());
    if (validateStats) {
      validateRange(min, file);
      validateRange(max, file);
    }
    metadata.fillChunkStats(min, max, hasNulls);
    return metadata;
  }

  /**
   * Appends the column's value of a record.
   */
  public void appendValue(Group record, ChunkBuffer chunk, StringDictionary dictionary) {
    if (record.getFieldRepetitionCount(fieldIndex) == 0) {
      chunk.appendNull();
      return;
    }
    if (type.isString()) {
      String value = record.getString(fieldIndex, 0);
      if (type.isDictEncodedString()) {
        chunk.appendDatum(Datum.ofInt(dictionary.getOrAdd(value)));
      } else {
        chunk.appendString(value);
      }
      return;
    }
    Object value;
    switch (parquetType.getPrimitiveTypeName()) {
      case BOOLEAN:
        value = record.getBoolean(fieldIndex, 0);
        break;
      case INT32:
        value = record.getInteger(fieldIndex, 0);
        break;
      case INT64:
        value = record.getLong(fieldIndex, 0);
        break;
      case FLOAT:
        value = record.getFloat(fieldIndex, 0);
        break;
      case DOUBLE:
        value = record.getDouble(fieldIndex, 0);
        break;
      default:
        throw new IllegalStateException("Unexpected Parquet type " + parquetType);
    }
    chunk.appendDatum(toDatum(toNumber(value)));
  }

  private Datum toDatum(Number value) {
    switch (type.getType()) {
      case BOOLEAN:
        return Datum.ofBoolean(value.longValue() != 0);
      case TINYINT:
        return Datum.ofTinyint((byte) checkRange(value.longValue(), Byte.MIN_VALUE, Byte.MAX_VALUE));
      case SMALLINT:
        return Datum.ofSmallint((short) checkRange(value.longValue(), Short.MIN_VALUE, Short.MAX_VALUE));
      case INT:
        return Datum.ofInt(value.intValue());
      case FLOAT:
        return Datum.ofFloat(value.floatValue());
      case DOUBLE:
        return Datum.ofDouble(value.doubleValue());
      default:
        return Datum.ofBigint(value.longValue());
    }
  }

  private long checkRange(long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(String.format("Value %d of column \"%s\" is out of the range of %s",
          value, column.getColumnName(), type.getTypeName()));
    }
    return value;
  }

  private void validateRange(Number value, Path file) {
    try {
      toDatum(value);
    } catch (IllegalArgumentException e) {
      throw UserException.dataReadError(e)
          .message("Parquet column contains values that are outside the range of the column type. Column "
              + "\"%s\" of type %s has statistic %s.", column.getColumnName(), type.getTypeName(), value)
          .addContext("File", file.toString())
          .build(logger);
    }
  }

  /**
   * Converts a Parquet value to the number stored by the column: epoch seconds
   * for dates and times, 0 or 1 for booleans.
   */
  private Number toNumber(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value ? 1L : 0L;
    }
    if (value instanceof Float || value instanceof Double) {
      return (Number) value;
    }
    if (value instanceof Binary) {
      throw new IllegalStateException("Binary values have no numeric form");
    }
    long longValue = ((Number) value).longValue();
    LogicalTypeAnnotation logical = parquetType.getLogicalTypeAnnotation();
    if (logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation) {
      return longValue * SECONDS_PER_DAY;
    }
    if (logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) {
      return toSeconds(longValue, ((LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) logical).getUnit());
    }
    if (logical instanceof LogicalTypeAnnotation.TimeLogicalTypeAnnotation) {
      return toSeconds(longValue, ((LogicalTypeAnnotation.TimeLogicalTypeAnnotation) logical).getUnit());
    }
    return longValue;
  }

  private static long toSeconds(long value, LogicalTypeAnnotation.TimeUnit unit) {
    switch (unit) {
      case MILLIS:
        return Math.floorDiv(value, 1_000L);
      case MICROS:
        return Math.floorDiv(value, 1_000_000L);
      default:
        return Math.floorDiv(value, 1_000_000_000L);
    }
  }
}
