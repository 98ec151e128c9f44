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
package org.colstore.exec.chunk;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.colstore.common.types.Datum;
import org.colstore.common.types.SqlTypeInfo;
import org.colstore.metastore.chunk.ChunkMetadata;
import org.colstore.metastore.chunk.ChunkStatsAccumulator;

import com.google.common.base.Preconditions;

/**
 * The values of one column of one fragment.
 * <p>
 * Each row holds {@code null}, a {@link Datum} (fixed width values and
 * dictionary codes), a {@link String} (unencoded strings) or a list of datums
 * (arrays, whose elements may be {@code null}). Statistics and the byte size
 * are maintained as rows are appended.
 */
public class ChunkBuffer {
  private final SqlTypeInfo type;
  private StringDictionary dictionary;
  private final List<Object> values = new ArrayList<>();
  private ChunkStatsAccumulator stats;
  private long numBytes;

  public ChunkBuffer(SqlTypeInfo type) {
    this(type, null);
  }

  /**
   * @param dictionary decodes the codes of a dictionary encoded string column, may be null
   */
  public ChunkBuffer(SqlTypeInfo type, StringDictionary dictionary) {
    this.type = type;
    this.dictionary = dictionary;
    this.stats = new ChunkStatsAccumulator(type);
  }

  public SqlTypeInfo getType() {
    return type;
  }

  public StringDictionary getDictionary() {
    return dictionary;
  }

  public int size() {
    return values.size();
  }

  public long getNumBytes() {
    return numBytes;
  }

  public void appendNull() {
    values.add(null);
    stats.addNull();
    if (!type.isArray() && type.getSize() > 0) {
      // fixed width nulls still occupy a slot
      numBytes += type.getSize();
    }
  }

  public void appendDatum(Datum value) {
    Preconditions.checkArgument(!type.isArray() && (!type.isString() || type.isDictEncodedString()),
        "Cannot append a scalar value to a %s chunk", type);
    values.add(value);
    stats.add(value);
    numBytes += type.getSize();
  }

  public void appendString(String value) {
    Preconditions.checkArgument(type.isString() && !type.isDictEncodedString(),
        "Cannot append an unencoded string to a %s chunk", type);
    values.add(value);
    numBytes += value.getBytes(StandardCharsets.UTF_8).length;
  }

  public void appendArray(List<Datum> elements) {
    Preconditions.checkArgument(type.isArray(), "Cannot append an array to a %s chunk", type);
    values.add(Collections.unmodifiableList(new ArrayList<>(elements)));
    stats.addArray(elements);
    numBytes += (long) elements.size() * type.getElemType().getSize();
  }

  /**
   * Appends a value in any of the row representations of this class.
   */
  @SuppressWarnings("unchecked")
  public void append(Object value) {
    if (value == null) {
      appendNull();
    } else if (value instanceof Datum) {
      appendDatum((Datum) value);
    } else if (value instanceof String) {
      appendString((String) value);
    } else if (value instanceof List) {
      appendArray((List<Datum>) value);
    } else {
      throw new IllegalArgumentException("Unsupported chunk value " + value.getClass().getName());
    }
  }

  public Object getValue(int row) {
    return values.get(row);
  }

  public boolean isNull(int row) {
    return values.get(row) == null;
  }

  /**
   * Decodes a dictionary encoded string row.
   */
  public String getDictionaryString(int row) {
    Preconditions.checkState(dictionary != null, "Chunk of type %s has no dictionary", type);
    Object value = values.get(row);
    return value == null ? null : dictionary.getString(((Datum) value).getIntval());
  }

  public ChunkMetadata getMetadata() {
    return new ChunkMetadata(type, numBytes, values.size(), stats.build());
  }

  /**
   * @return a new buffer holding the given rows of this buffer, in the given order
   */
  public ChunkBuffer select(List<Integer> rows) {
    ChunkBuffer selected = new ChunkBuffer(type, dictionary);
    for (int row : rows) {
      selected.append(values.get(row));
    }
    return selected;
  }

  /**
   * Replaces the contents of this buffer with the rows of another buffer of the
   * same type. Dictionary codes keep referring to the dictionary of the other buffer.
   */
  public void copyFrom(ChunkBuffer other) {
    Preconditions.checkArgument(type.equals(other.type), "Cannot copy a %s chunk into a %s chunk",
        other.type, type);
    values.clear();
    numBytes = 0;
    dictionary = other.dictionary;
    stats = new ChunkStatsAccumulator(type);
    for (Object value : other.values) {
      append(value);
    }
  }

  @Override
  public String toString() {
    return "ChunkBuffer [type=" + type + ", rows=" + values.size() + ", numBytes=" + numBytes + "]";
  }
}
