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

import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one query, in exactly one of the shapes named by
 * {@link OutputFormat}.
 *
 * <p>The set of shapes is closed: the constructor is private and every
 * variant is a nested final class. Consumers dispatch with
 * {@link #accept(Visitor)}. A {@link Columnar} result owns Arrow memory and
 * must be closed; closing the other shapes does nothing.
 */
public abstract class QueryResult implements AutoCloseable {

  private QueryResult() {
  }

  public abstract OutputFormat getFormat();

  public abstract <R> R accept(Visitor<R> visitor);

  @Override public void close() {
  }

  public static Records records(List<Map<String, Object>> rows) {
    return new Records(rows);
  }

  public static Table table(ResultTable table) {
    return new Table(table);
  }

  public static Csv csv(String text) {
    return new Csv(text);
  }

  public static Columnar columnar(VectorSchemaRoot root) {
    return new Columnar(root);
  }

  public static Native nativeResult(Object handle) {
    return new Native(handle);
  }

  /** Callback per result shape. */
  public interface Visitor<R> {
    R visit(Records records);

    R visit(Table table);

    R visit(Csv csv);

    R visit(Columnar columnar);

    R visit(Native nativeResult);
  }

  /** Rows as column-name to value maps, in column order. */
  public static final class Records extends QueryResult {
    private final List<Map<String, Object>> rows;

    private Records(List<Map<String, Object>> rows) {
      this.rows = Objects.requireNonNull(rows, "rows");
    }

    public List<Map<String, Object>> getRows() {
      return rows;
    }

    @Override public OutputFormat getFormat() {
      return OutputFormat.RECORDS;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** A typed table. */
  public static final class Table extends QueryResult {
    private final ResultTable table;

    private Table(ResultTable table) {
      this.table = Objects.requireNonNull(table, "table");
    }

    public ResultTable getTable() {
      return table;
    }

    @Override public OutputFormat getFormat() {
      return OutputFormat.TABLE;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** CSV text with a header row. */
  public static final class Csv extends QueryResult {
    private final String text;

    private Csv(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
      return text;
    }

    @Override public OutputFormat getFormat() {
      return OutputFormat.CSV;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Arrow vectors; owns their memory until closed. */
  public static final class Columnar extends QueryResult {
    private final VectorSchemaRoot root;

    private Columnar(VectorSchemaRoot root) {
      this.root = Objects.requireNonNull(root, "root");
    }

    public VectorSchemaRoot getRoot() {
      return root;
    }

    @Override public OutputFormat getFormat() {
      return OutputFormat.COLUMNAR;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public void close() {
      root.close();
    }
  }

  /**
   * The backend's own result: raw rows ({@code List<Object[]>}) for the
   * embedded engines, an {@code AthenaQueryHandle} for Athena.
   */
  public static final class Native extends QueryResult {
    private final Object handle;

    private Native(Object handle) {
      this.handle = Objects.requireNonNull(handle, "handle");
    }

    public Object getHandle() {
      return handle;
    }

    @Override public OutputFormat getFormat() {
      return OutputFormat.NATIVE;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
