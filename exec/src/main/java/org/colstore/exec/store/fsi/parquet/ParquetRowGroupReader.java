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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.colstore.exec.catalog.ColumnDescriptor;
import org.colstore.exec.chunk.ChunkBuffer;
import org.colstore.exec.chunk.StringDictionary;

/**
 * Reads the row groups of a Parquet file in file order.
 */
public class ParquetRowGroupReader implements Closeable {
  private final Path file;
  private final ParquetFileReader reader;
  private final MessageType schema;
  private int nextRowGroup;

  public ParquetRowGroupReader(Path file, Configuration conf) throws IOException {
    this.file = file;
    this.reader = ParquetFileReader.open(HadoopInputFile.fromPath(file, conf));
    this.schema = reader.getFooter().getFileMetaData().getSchema();
  }

  public Path getFile() {
    return file;
  }

  public MessageType getSchema() {
    return schema;
  }

  public List<BlockMetaData> getRowGroups() {
    return reader.getRowGroups();
  }

  /**
   * @return index, in the file, of the row group the next read returns
   */
  public int getNextRowGroupIndex() {
    return nextRowGroup;
  }

  /**
   * Reads the next row group into one chunk per converter, keyed by column id.
   *
   * @return the chunks, or null when every row group has been read
   */
  public Map<Integer, ChunkBuffer> readNextRowGroup(List<ParquetColumnConverter> converters,
                                                    Function<ColumnDescriptor, StringDictionary> dictionaries)
      throws IOException {
    PageReadStore pages = reader.readNextRowGroup();
    if (pages == null) {
      return null;
    }
    nextRowGroup++;

    Map<Integer, ChunkBuffer> chunks = new LinkedHashMap<>();
    for (ParquetColumnConverter converter : converters) {
      ColumnDescriptor column = converter.getColumn();
      chunks.put(column.getColumnId(), new ChunkBuffer(column.getColumnType(), dictionaryFor(column, dictionaries)));
    }

    MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
    RecordReader<Group> recordReader = columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
    for (long row = 0; row < pages.getRowCount(); row++) {
      Group record = recordReader.read();
      for (ParquetColumnConverter converter : converters) {
        ColumnDescriptor column = converter.getColumn();
        converter.appendValue(record, chunks.get(column.getColumnId()), dictionaryFor(column, dictionaries));
      }
    }
    return chunks;
  }

  /**
   * Skips the next row group without decoding it.
   */
  public boolean skipNextRowGroup() throws IOException {
    if (reader.readNextRowGroup() == null) {
      return false;
    }
    nextRowGroup++;
    return true;
  }

  private static StringDictionary dictionaryFor(ColumnDescriptor column,
                                                Function<ColumnDescriptor, StringDictionary> dictionaries) {
    return column.getColumnType().isDictEncodedString() ? dictionaries.apply(column) : null;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
