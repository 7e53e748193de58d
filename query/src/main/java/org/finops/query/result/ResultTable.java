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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A typed, row-oriented in-memory table.
 *
 * <p>Each row is an array with one value per column, either null or an
 * instance of the column type's {@link ColumnType#getJavaClass() Java class}.
 */
public final class ResultTable {
  private final List<ResultColumn> columns;
  private final List<Object[]> rows;

  public ResultTable(List<ResultColumn> columns, List<Object[]> rows) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
    for (Object[] row : this.rows) {
      if (row.length != this.columns.size()) {
        throw new IllegalArgumentException("Row has " + row.length + " values, expected "
            + this.columns.size());
      }
    }
  }

  public List<ResultColumn> getColumns() {
    return columns;
  }

  public List<Object[]> getRows() {
    return rows;
  }

  public int getRowCount() {
    return rows.size();
  }

  public int getColumnCount() {
    return columns.size();
  }

  /** Index of the column with the given name, or -1. */
  public int columnIndex(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  public @Nullable Object getValue(int row, int column) {
    return rows.get(row)[column];
  }

  public @Nullable Object getValue(int row, String column) {
    int index = columnIndex(column);
    if (index < 0) {
      throw new IllegalArgumentException("No column '" + column + "' in " + columns);
    }
    return getValue(row, index);
  }

  @Override public String toString() {
    return "ResultTable" + columns + " (" + rows.size() + " rows)";
  }
}
