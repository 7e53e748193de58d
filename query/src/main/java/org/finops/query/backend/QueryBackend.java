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
package org.finops.query.backend;

import org.finops.query.config.DatasetConfig;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultColumn;

import java.util.List;
import java.util.Map;

/**
 * A SQL execution engine over one billing dataset.
 *
 * <p>The dataset is exposed to SQL as a single relation named after the
 * configured table name ({@code CUR} by default). Every call to
 * {@link #execute(QueryRequest)} runs the query anew; results are not cached.
 */
public interface QueryBackend extends AutoCloseable {

  /** Registry name, e.g. {@code duckdb}. */
  String name();

  boolean supportsRemoteDirect();

  boolean supportsLocalCache();

  default BackendDescriptor descriptor() {
    return new BackendDescriptor(name(), supportsRemoteDirect(), supportsLocalCache());
  }

  DatasetConfig getConfig();

  /** Whether a local mirror is configured and holds data in the date range. */
  boolean hasLocalData();

  /**
   * Columns of the dataset relation. Read once and cached for the
   * lifetime of the backend.
   */
  List<ResultColumn> schema();

  /** Summary of the backend and its dataset, for display. */
  Map<String, Object> catalog();

  /**
   * Runs a query.
   *
   * @throws org.finops.query.DataNotFoundException if no data files match
   * @throws org.finops.query.QueryExecutionException if the engine fails the query
   * @throws org.finops.query.QueryTimeoutException if a remote job exceeds its budget
   */
  QueryResult execute(QueryRequest request);

  default QueryResult execute(String sql, OutputFormat format, boolean forceRemote) {
    return execute(new QueryRequest(sql, format, forceRemote));
  }

  default QueryResult execute(String sql, OutputFormat format) {
    return execute(sql, format, false);
  }

  /** Returns the first {@code n} rows of the dataset relation. */
  default QueryResult sample(int n, OutputFormat format) {
    if (n < 0) {
      throw new IllegalArgumentException("Sample size must not be negative: " + n);
    }
    return execute("SELECT * FROM " + getConfig().getTableName() + " LIMIT " + n, format);
  }

  /** Releases clients and threads held by the backend. */
  @Override default void close() {
  }
}
