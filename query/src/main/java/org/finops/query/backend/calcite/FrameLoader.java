/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.finops.query.backend.calcite;

import org.finops.query.config.FileFormat;
import org.finops.query.result.ColumnType;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultTable;
import org.finops.query.storage.StorageProvider;
import org.finops.query.storage.StorageProviderInputFile;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Loads data files into one in-memory {@link ResultTable}.
 *
 * <p>Parquet files are read with parquet-avro over a {@link StorageProvider};
 * gzip CSV files are read with OpenCSV and their column types inferred.
 * Files are unioned by column name: a column missing from a file is null
 * for that file's rows, and a column whose type differs between files is
 * widened (to BIGINT or DOUBLE for numbers, to VARCHAR otherwise).
 *
 * <p>Dates and timestamps are kept as wall-clock values, matching what the
 * DuckDB backend returns for the same files.
 */
public class FrameLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(FrameLoader.class);

  /** Length of a legacy INT96 timestamp read as a fixed value. */
  private static final int INT96_LENGTH = 12;

  private static final long JULIAN_EPOCH_DAY = 2_440_588L;

  private final StorageProvider storage;
  private final Configuration conf;

  public FrameLoader(StorageProvider storage) {
    this.storage = storage;
    this.conf = new Configuration(false);
    this.conf.setBoolean("parquet.avro.readInt96AsFixed", true);
  }

  /**
   * Reads and unions the files.
   *
   * @throws IOException if a file cannot be read
   */
  public ResultTable load(FileFormat format, List<String> files) throws IOException {
    List<ResultTable> parts = new ArrayList<>(files.size());
    for (String file : files) {
      parts.add(format == FileFormat.PARQUET ? readParquet(file) : readCsvGzip(file));
    }
    ResultTable union = union(parts);
    LOGGER.debug("Loaded {} rows, {} columns from {} files", union.getRowCount(),
        union.getColumnCount(), files.size());
    return union;
  }

  ResultTable readParquet(String path) throws IOException {
    InputFile inputFile = new StorageProviderInputFile(storage, path);
    MessageType messageType;
    Schema schema;
    try (ParquetFileReader fileReader = ParquetFileReader.open(inputFile)) {
      messageType = fileReader.getFooter().getFileMetaData().getSchema();
      schema = new AvroSchemaConverter(conf).convert(messageType);
    }

    List<Schema.Field> fields = schema.getFields();
    List<ResultColumn> columns = new ArrayList<>(fields.size());
    List<Schema> fieldSchemas = new ArrayList<>(fields.size());
    // Avro has no decimal over int/long, so those come through as unscaled numbers
    int[] intDecimalScales = new int[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      Schema.Field field = fields.get(i);
      Schema fieldSchema = nonNull(field.schema());
      fieldSchemas.add(fieldSchema);
      intDecimalScales[i] = intDecimalScale(messageType, field.name());
      ColumnType type = intDecimalScales[i] >= 0 ? ColumnType.DECIMAL : columnType(fieldSchema);
      columns.add(new ResultColumn(field.name(), type));
    }

    List<Object[]> rows = new ArrayList<>();
    try (ParquetReader<GenericRecord> reader =
             AvroParquetReader.<GenericRecord>builder(inputFile).withConf(conf).build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        Object[] row = new Object[columns.size()];
        for (int i = 0; i < row.length; i++) {
          Object value = record.get(i);
          if (intDecimalScales[i] >= 0 && value instanceof Number) {
            row[i] = BigDecimal.valueOf(((Number) value).longValue(), intDecimalScales[i]);
          } else {
            row[i] = convertAvro(value, fieldSchemas.get(i), columns.get(i).getType());
          }
        }
        rows.add(row);
      }
    }
    return new ResultTable(columns, rows);
  }

  ResultTable readCsvGzip(String path) throws IOException {
    List<String[]> lines = new ArrayList<>();
    String[] header;
    try (CSVReader reader = new CSVReader(new InputStreamReader(
        new GZIPInputStream(storage.openInputStream(path)), StandardCharsets.UTF_8))) {
      header = reader.readNext();
      if (header == null) {
        return new ResultTable(new ArrayList<>(), new ArrayList<>());
      }
      String[] line;
      while ((line = reader.readNext()) != null) {
        lines.add(line);
      }
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV in " + path + ": " + e.getMessage(), e);
    }

    List<ResultColumn> columns = new ArrayList<>(header.length);
    for (int c = 0; c < header.length; c++) {
      columns.add(new ResultColumn(header[c].trim(), inferCsvType(lines, c)));
    }
    List<Object[]> rows = new ArrayList<>(lines.size());
    for (String[] line : lines) {
      Object[] row = new Object[header.length];
      for (int c = 0; c < header.length; c++) {
        String text = c < line.length ? line[c] : null;
        row[c] = text == null || text.isEmpty() ? null : parseCsv(text, columns.get(c).getType());
      }
      rows.add(row);
    }
    return new ResultTable(columns, rows);
  }

  private static ColumnType inferCsvType(List<String[]> lines, int column) {
    boolean allLong = true;
    boolean allDouble = true;
    boolean any = false;
    for (String[] line : lines) {
      if (column >= line.length || line[column].isEmpty()) {
        continue;
      }
      any = true;
      String text = line[column];
      if (allLong) {
        try {
          Long.parseLong(text);
        } catch (NumberFormatException e) {
          allLong = false;
        }
      }
      if (allDouble && !allLong) {
        try {
          Double.parseDouble(text);
        } catch (NumberFormatException e) {
          allDouble = false;
        }
      }
      if (!allDouble) {
        break;
      }
    }
    if (!any) {
      return ColumnType.VARCHAR;
    }
    return allLong ? ColumnType.BIGINT : allDouble ? ColumnType.DOUBLE : ColumnType.VARCHAR;
  }

  private static Object parseCsv(String text, ColumnType type) {
    switch (type) {
    case BIGINT:
      return Long.parseLong(text);
    case DOUBLE:
      return Double.parseDouble(text);
    default:
      return text;
    }
  }

  /** Scale of an INT32/INT64 decimal column, or -1 for any other column. */
  private static int intDecimalScale(MessageType messageType, String name) {
    if (!messageType.containsField(name)) {
      return -1;
    }
    Type type = messageType.getType(name);
    if (!type.isPrimitive()) {
      return -1;
    }
    PrimitiveType.PrimitiveTypeName primitive = type.asPrimitiveType().getPrimitiveTypeName();
    LogicalTypeAnnotation annotation = type.getLogicalTypeAnnotation();
    if ((primitive == PrimitiveType.PrimitiveTypeName.INT32
        || primitive == PrimitiveType.PrimitiveTypeName.INT64)
        && annotation instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) {
      return ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) annotation).getScale();
    }
    return -1;
  }

  private static Schema nonNull(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    Schema single = null;
    for (Schema member : schema.getTypes()) {
      if (member.getType() == Schema.Type.NULL) {
        continue;
      }
      if (single != null) {
        // multi-type unions are rendered as text
        return Schema.create(Schema.Type.STRING);
      }
      single = member;
    }
    return single == null ? Schema.create(Schema.Type.STRING) : single;
  }

  static ColumnType columnType(Schema schema) {
    LogicalType logical = schema.getLogicalType();
    switch (schema.getType()) {
    case BOOLEAN:
      return ColumnType.BOOLEAN;
    case INT:
      if (logical instanceof LogicalTypes.Date) {
        return ColumnType.DATE;
      }
      return logical == null ? ColumnType.INTEGER : ColumnType.VARCHAR;
    case LONG:
      if (isTimestamp(logical)) {
        return ColumnType.TIMESTAMP;
      }
      return logical == null ? ColumnType.BIGINT : ColumnType.VARCHAR;
    case FLOAT:
      return ColumnType.FLOAT;
    case DOUBLE:
      return ColumnType.DOUBLE;
    case BYTES:
      return logical instanceof LogicalTypes.Decimal ? ColumnType.DECIMAL : ColumnType.BINARY;
    case FIXED:
      if (logical instanceof LogicalTypes.Decimal) {
        return ColumnType.DECIMAL;
      }
      return schema.getFixedSize() == INT96_LENGTH ? ColumnType.TIMESTAMP : ColumnType.BINARY;
    case STRING:
    case ENUM:
    default:
      return ColumnType.VARCHAR;
    }
  }

  private static boolean isTimestamp(@Nullable LogicalType logical) {
    return logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.TimestampMicros
        || logical instanceof LogicalTypes.LocalTimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMicros;
  }

  private static @Nullable Object convertAvro(@Nullable Object value, Schema schema,
      ColumnType type) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case BOOLEAN:
      return value;
    case INTEGER:
    case BIGINT:
    case FLOAT:
    case DOUBLE:
      return value;
    case DATE:
      if (value instanceof LocalDate) {
        return Date.valueOf((LocalDate) value);
      }
      return Date.valueOf(LocalDate.ofEpochDay(((Number) value).longValue()));
    case TIMESTAMP:
      return toTimestamp(value, schema);
    case DECIMAL:
      return toDecimal(value, schema);
    case BINARY:
      if (value instanceof ByteBuffer) {
        ByteBuffer buffer = ((ByteBuffer) value).duplicate();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
      }
      return ((GenericFixed) value).bytes().clone();
    case VARCHAR:
    default:
      // Utf8, enum symbols, and nested records/arrays/maps rendered as JSON-like text
      return value.toString();
    }
  }

  private static Timestamp toTimestamp(Object value, Schema schema) {
    if (value instanceof LocalDateTime) {
      return Timestamp.valueOf((LocalDateTime) value);
    }
    if (value instanceof Instant) {
      return Timestamp.valueOf(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
    }
    if (value instanceof GenericFixed) {
      return fromInt96(((GenericFixed) value).bytes());
    }
    long raw = ((Number) value).longValue();
    LogicalType logical = schema.getLogicalType();
    long seconds;
    long nanos;
    if (logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMillis) {
      seconds = Math.floorDiv(raw, 1000L);
      nanos = Math.floorMod(raw, 1000L) * 1_000_000L;
    } else {
      seconds = Math.floorDiv(raw, 1_000_000L);
      nanos = Math.floorMod(raw, 1_000_000L) * 1000L;
    }
    return Timestamp.valueOf(LocalDateTime.ofEpochSecond(seconds, (int) nanos, ZoneOffset.UTC));
  }

  /** INT96: nanoseconds of day (8 bytes) then Julian day (4 bytes), little-endian. */
  private static Timestamp fromInt96(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    long nanosOfDay = buffer.getLong();
    long julianDay = buffer.getInt() & 0xFFFFFFFFL;
    LocalDateTime dateTime = LocalDate.ofEpochDay(julianDay - JULIAN_EPOCH_DAY)
        .atStartOfDay().plusNanos(nanosOfDay);
    return Timestamp.valueOf(dateTime);
  }

  private static BigDecimal toDecimal(Object value, Schema schema) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    int scale = ((LogicalTypes.Decimal) schema.getLogicalType()).getScale();
    byte[] bytes;
    if (value instanceof ByteBuffer) {
      ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
    } else {
      bytes = ((GenericFixed) value).bytes();
    }
    return new BigDecimal(new BigInteger(bytes), scale);
  }

  /** Unions tables by column name, in order of first appearance. */
  static ResultTable union(List<ResultTable> parts) {
    if (parts.size() == 1) {
      return parts.get(0);
    }
    Map<String, ColumnType> merged = new LinkedHashMap<>();
    for (ResultTable part : parts) {
      for (ResultColumn column : part.getColumns()) {
        ColumnType existing = merged.get(column.getName());
        merged.put(column.getName(),
            existing == null ? column.getType() : widen(existing, column.getType()));
      }
    }
    List<ResultColumn> columns = new ArrayList<>(merged.size());
    List<String> names = new ArrayList<>(merged.keySet());
    for (String name : names) {
      columns.add(new ResultColumn(name, merged.get(name)));
    }

    List<Object[]> rows = new ArrayList<>();
    for (ResultTable part : parts) {
      int[] target = new int[part.getColumnCount()];
      for (int i = 0; i < target.length; i++) {
        target[i] = names.indexOf(part.getColumns().get(i).getName());
      }
      for (Object[] source : part.getRows()) {
        Object[] row = new Object[columns.size()];
        for (int i = 0; i < source.length; i++) {
          row[target[i]] = coerce(source[i], columns.get(target[i]).getType());
        }
        rows.add(row);
      }
    }
    return new ResultTable(columns, rows);
  }

  static ColumnType widen(ColumnType a, ColumnType b) {
    if (a == b) {
      return a;
    }
    boolean aIntegral = a == ColumnType.INTEGER || a == ColumnType.BIGINT;
    boolean bIntegral = b == ColumnType.INTEGER || b == ColumnType.BIGINT;
    if (aIntegral && bIntegral) {
      return ColumnType.BIGINT;
    }
    if ((aIntegral || a.isFloatingPoint()) && (bIntegral || b.isFloatingPoint())) {
      return ColumnType.DOUBLE;
    }
    return ColumnType.VARCHAR;
  }

  private static @Nullable Object coerce(@Nullable Object value, ColumnType type) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case BIGINT:
      return value instanceof Number ? ((Number) value).longValue() : value;
    case DOUBLE:
      return value instanceof Number ? ((Number) value).doubleValue() : value;
    case VARCHAR:
      return value.toString();
    default:
      return value;
    }
  }
}
