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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a JDBC {@link ResultSet} into a {@link ResultTable}.
 *
 * <p>Columns of types without a flat representation (structs, lists, maps,
 * engine-specific objects) and columns whose values cannot be read with
 * their declared type are converted to text, row by row, and reported as
 * VARCHAR. Such columns are logged once per result.
 */
public final class JdbcResultReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcResultReader.class);

  /**
   * Integer types wider than BIGINT, reported by DuckDB as JAVA_OBJECT.
   * {@code SUM} over INTEGER and BIGINT columns returns HUGEINT.
   */
  private static final Set<String> WIDE_INTEGER_TYPES =
      ImmutableSet.of("HUGEINT", "UBIGINT", "UHUGEINT");

  private JdbcResultReader() {
  }

  public static ResultTable read(ResultSet resultSet) throws SQLException {
    ResultSetMetaData metaData = resultSet.getMetaData();
    int columnCount = metaData.getColumnCount();
    String[] names = new String[columnCount];
    ColumnType[] types = new ColumnType[columnCount];
    boolean[] coerced = new boolean[columnCount];
    for (int i = 0; i < columnCount; i++) {
      names[i] = metaData.getColumnLabel(i + 1);
      types[i] = columnType(metaData, i + 1);
      if (types[i] == null) {
        coerced[i] = true;
      }
    }

    List<Object[]> rows = new ArrayList<>();
    while (resultSet.next()) {
      Object[] row = new Object[columnCount];
      for (int i = 0; i < columnCount; i++) {
        if (coerced[i]) {
          row[i] = resultSet.getString(i + 1);
          continue;
        }
        try {
          row[i] = readTyped(resultSet, i + 1, types[i]);
        } catch (SQLException | RuntimeException e) {
          LOGGER.debug("Typed read of column {} as {} failed: {}", names[i], types[i],
              e.getMessage());
          coerced[i] = true;
          row[i] = resultSet.getString(i + 1);
        }
      }
      rows.add(row);
    }

    List<ResultColumn> columns = new ArrayList<>(columnCount);
    List<String> coercedNames = new ArrayList<>();
    for (int i = 0; i < columnCount; i++) {
      if (coerced[i]) {
        coercedNames.add(names[i]);
        // values read before the first failure are still typed
        for (Object[] row : rows) {
          if (row[i] != null && !(row[i] instanceof String)) {
            row[i] = row[i].toString();
          }
        }
        columns.add(new ResultColumn(names[i], ColumnType.VARCHAR));
      } else {
        columns.add(new ResultColumn(names[i], types[i]));
      }
    }
    if (!coercedNames.isEmpty()) {
      LOGGER.warn("Columns converted to text because they have no flat type: {}", coercedNames);
    }
    return new ResultTable(columns, rows);
  }

  /**
   * Type of a result column; null for columns read as text.
   *
   * @param column 1-based column index
   */
  static @Nullable ColumnType columnType(ResultSetMetaData metaData, int column)
      throws SQLException {
    String typeName = metaData.getColumnTypeName(column);
    if (typeName != null && WIDE_INTEGER_TYPES.contains(typeName.toUpperCase(Locale.ROOT))) {
      return ColumnType.DECIMAL;
    }
    return ColumnType.fromJdbcType(metaData.getColumnType(column));
  }

  private static Object readTyped(ResultSet rs, int index, ColumnType type)
      throws SQLException {
    Object value;
    switch (type) {
    case BOOLEAN:
      value = rs.getBoolean(index);
      break;
    case INTEGER:
      value = rs.getInt(index);
      break;
    case BIGINT:
      value = rs.getLong(index);
      break;
    case FLOAT:
      value = rs.getFloat(index);
      break;
    case DOUBLE:
      value = rs.getDouble(index);
      break;
    case DECIMAL:
      value = toBigDecimal(rs.getObject(index));
      break;
    case DATE:
      value = rs.getDate(index);
      break;
    case TIMESTAMP:
      value = rs.getTimestamp(index);
      break;
    case BINARY:
      value = rs.getBytes(index);
      break;
    case VARCHAR:
    default:
      value = rs.getString(index);
      break;
    }
    return rs.wasNull() ? null : value;
  }

  private static @Nullable BigDecimal toBigDecimal(@Nullable Object value) {
    if (value == null || value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    return new BigDecimal(value.toString());
  }
}
