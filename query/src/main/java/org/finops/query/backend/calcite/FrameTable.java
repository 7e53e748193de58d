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

import org.finops.query.result.ColumnType;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultTable;

import org.apache.calcite.DataContext;
import org.apache.calcite.avatica.util.ByteString;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Scannable table over an in-memory {@link ResultTable}.
 *
 * <p>Values are converted once to Calcite's internal representation: dates
 * as days since epoch, timestamps as wall-clock milliseconds since epoch,
 * binary values as {@link ByteString}.
 */
public class FrameTable extends AbstractTable implements ScannableTable {
  private static final int DECIMAL_PRECISION = 38;

  private final List<ResultColumn> columns;
  private final int[] decimalScales;
  private final List<@Nullable Object[]> rows;

  public FrameTable(ResultTable frame) {
    this.columns = frame.getColumns();
    this.decimalScales = new int[columns.size()];
    this.rows = new ArrayList<>(frame.getRowCount());
    for (Object[] source : frame.getRows()) {
      Object[] row = new Object[source.length];
      for (int i = 0; i < source.length; i++) {
        row[i] = toInternal(source[i], columns.get(i).getType());
        if (row[i] instanceof BigDecimal) {
          decimalScales[i] = Math.max(decimalScales[i], ((BigDecimal) row[i]).scale());
        }
      }
      rows.add(row);
    }
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (int i = 0; i < columns.size(); i++) {
      ResultColumn column = columns.get(i);
      RelDataType type;
      if (column.getType() == ColumnType.DECIMAL) {
        type = typeFactory.createSqlType(SqlTypeName.DECIMAL, DECIMAL_PRECISION,
            decimalScales[i]);
      } else {
        type = typeFactory.createSqlType(sqlTypeName(column.getType()));
      }
      builder.add(column.getName(), typeFactory.createTypeWithNullability(type, true));
    }
    return builder.build();
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    return Linq4j.asEnumerable(rows);
  }

  static SqlTypeName sqlTypeName(ColumnType type) {
    switch (type) {
    case BOOLEAN:
      return SqlTypeName.BOOLEAN;
    case INTEGER:
      return SqlTypeName.INTEGER;
    case BIGINT:
      return SqlTypeName.BIGINT;
    case FLOAT:
      return SqlTypeName.REAL;
    case DOUBLE:
      return SqlTypeName.DOUBLE;
    case DECIMAL:
      return SqlTypeName.DECIMAL;
    case DATE:
      return SqlTypeName.DATE;
    case TIMESTAMP:
      return SqlTypeName.TIMESTAMP;
    case BINARY:
      return SqlTypeName.VARBINARY;
    case VARCHAR:
    default:
      return SqlTypeName.VARCHAR;
    }
  }

  private static @Nullable Object toInternal(@Nullable Object value, ColumnType type) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case DATE:
      return (int) ((Date) value).toLocalDate().toEpochDay();
    case TIMESTAMP:
      return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC).toEpochMilli();
    case BINARY:
      return new ByteString((byte[]) value);
    default:
      return value;
    }
  }
}
