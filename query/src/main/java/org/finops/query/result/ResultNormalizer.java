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
package org.finops.query.result;

import com.opencsv.CSVWriter;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampMicroVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a {@link ResultTable} into the requested {@link OutputFormat}.
 *
 * <p>Rows are never dropped. RECORDS and CSV replace NaN and infinite
 * floating-point values with null (an empty CSV field); TABLE, COLUMNAR and
 * NATIVE keep them unchanged.
 */
public final class ResultNormalizer {
  private static final RootAllocator ALLOCATOR = new RootAllocator(Long.MAX_VALUE);

  private static final int MAX_DECIMAL_PRECISION = 38;

  private ResultNormalizer() {
  }

  /** Allocator shared by every Arrow result of this process. */
  public static BufferAllocator allocator() {
    return ALLOCATOR;
  }

  /**
   * Converts a table to the requested shape.
   *
   * @param nativeHandle object returned for {@link OutputFormat#NATIVE}; when
   *     null, the table's raw rows are returned
   */
  public static QueryResult normalize(ResultTable table, OutputFormat format,
      @Nullable Object nativeHandle) {
    switch (format) {
    case RECORDS:
      return QueryResult.records(toRecords(table));
    case TABLE:
      return QueryResult.table(table);
    case CSV:
      return QueryResult.csv(toCsv(table));
    case COLUMNAR:
      return QueryResult.columnar(toColumnar(table, ALLOCATOR));
    case NATIVE:
      return QueryResult.nativeResult(nativeHandle != null ? nativeHandle : table.getRows());
    default:
      throw new AssertionError("unknown format " + format);
    }
  }

  public static List<Map<String, Object>> toRecords(ResultTable table) {
    List<ResultColumn> columns = table.getColumns();
    List<Map<String, Object>> records = new ArrayList<>(table.getRowCount());
    for (Object[] row : table.getRows()) {
      Map<String, Object> record = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        record.put(columns.get(i).getName(), finiteOrNull(row[i]));
      }
      records.add(record);
    }
    return records;
  }

  public static String toCsv(ResultTable table) {
    List<ResultColumn> columns = table.getColumns();
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out)) {
      String[] header = new String[columns.size()];
      for (int i = 0; i < header.length; i++) {
        header[i] = columns.get(i).getName();
      }
      writer.writeNext(header, false);
      for (Object[] row : table.getRows()) {
        String[] line = new String[row.length];
        for (int i = 0; i < row.length; i++) {
          line[i] = csvText(finiteOrNull(row[i]));
        }
        writer.writeNext(line, false);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  public static ResultTable toTable(ResultTable table) {
    return table;
  }

  /**
   * Copies a table into Arrow vectors. The caller owns the returned root.
   */
  public static VectorSchemaRoot toColumnar(ResultTable table, BufferAllocator allocator) {
    List<ResultColumn> columns = table.getColumns();
    int[] decimalScales = new int[columns.size()];
    List<Field> fields = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      ResultColumn column = columns.get(i);
      if (column.getType() == ColumnType.DECIMAL) {
        decimalScales[i] = maxScale(table, i);
      }
      fields.add(Field.nullable(column.getName(), arrowType(column.getType(), decimalScales[i])));
    }

    VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
    try {
      root.allocateNew();
      int rowCount = table.getRowCount();
      for (int c = 0; c < columns.size(); c++) {
        FieldVector vector = root.getVector(c);
        for (int r = 0; r < rowCount; r++) {
          Object value = table.getRows().get(r)[c];
          if (value != null) {
            setValue(vector, columns.get(c).getType(), r, value, decimalScales[c]);
          }
        }
        vector.setValueCount(rowCount);
      }
      root.setRowCount(rowCount);
      return root;
    } catch (RuntimeException e) {
      root.close();
      throw e;
    }
  }

  private static ArrowType arrowType(ColumnType type, int scale) {
    switch (type) {
    case BOOLEAN:
      return ArrowType.Bool.INSTANCE;
    case INTEGER:
      return new ArrowType.Int(32, true);
    case BIGINT:
      return new ArrowType.Int(64, true);
    case FLOAT:
      return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
    case DOUBLE:
      return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    case DECIMAL:
      return new ArrowType.Decimal(MAX_DECIMAL_PRECISION, scale, 128);
    case DATE:
      return new ArrowType.Date(DateUnit.DAY);
    case TIMESTAMP:
      return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
    case BINARY:
      return ArrowType.Binary.INSTANCE;
    case VARCHAR:
    default:
      return ArrowType.Utf8.INSTANCE;
    }
  }

  private static void setValue(FieldVector vector, ColumnType type, int index, Object value,
      int scale) {
    switch (type) {
    case BOOLEAN:
      ((BitVector) vector).setSafe(index, ((Boolean) value) ? 1 : 0);
      break;
    case INTEGER:
      ((IntVector) vector).setSafe(index, ((Number) value).intValue());
      break;
    case BIGINT:
      ((BigIntVector) vector).setSafe(index, ((Number) value).longValue());
      break;
    case FLOAT:
      ((Float4Vector) vector).setSafe(index, ((Number) value).floatValue());
      break;
    case DOUBLE:
      ((Float8Vector) vector).setSafe(index, ((Number) value).doubleValue());
      break;
    case DECIMAL:
      ((DecimalVector) vector).setSafe(index, ((BigDecimal) value).setScale(scale));
      break;
    case DATE:
      ((DateDayVector) vector).setSafe(index, (int) ((Date) value).toLocalDate().toEpochDay());
      break;
    case TIMESTAMP:
      LocalDateTime ts = ((Timestamp) value).toLocalDateTime();
      long micros = ts.toEpochSecond(ZoneOffset.UTC) * 1_000_000L + ts.getNano() / 1000;
      ((TimeStampMicroVector) vector).setSafe(index, micros);
      break;
    case BINARY:
      ((VarBinaryVector) vector).setSafe(index, (byte[]) value);
      break;
    case VARCHAR:
    default:
      ((VarCharVector) vector).setSafe(index, value.toString().getBytes(StandardCharsets.UTF_8));
      break;
    }
  }

  private static int maxScale(ResultTable table, int column) {
    int scale = 0;
    for (Object[] row : table.getRows()) {
      if (row[column] instanceof BigDecimal) {
        scale = Math.max(scale, ((BigDecimal) row[column]).scale());
      }
    }
    return scale;
  }

  static @Nullable Object finiteOrNull(@Nullable Object value) {
    if (value instanceof Double) {
      double d = (Double) value;
      return Double.isNaN(d) || Double.isInfinite(d) ? null : value;
    }
    if (value instanceof Float) {
      float f = (Float) value;
      return Float.isNaN(f) || Float.isInfinite(f) ? null : value;
    }
    return value;
  }

  private static String csvText(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof byte[]) {
      return Base64.getEncoder().encodeToString((byte[]) value);
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (value instanceof Timestamp) {
      String text = value.toString();
      return text.endsWith(".0") ? text.substring(0, text.length() - 2) : text;
    }
    return value.toString();
  }
}
