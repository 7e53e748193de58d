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
package org.finops.query.backend.duckdb;

import org.finops.query.QueryExecutionException;
import org.finops.query.backend.AbstractEmbeddedBackend;
import org.finops.query.backend.QueryRequest;
import org.finops.query.config.DatasetConfig;
import org.finops.query.config.DatasetLocation;
import org.finops.query.config.DuckDBSettings;
import org.finops.query.config.FileFormat;
import org.finops.query.credentials.CredentialProvider;
import org.finops.query.result.JdbcResultReader;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultNormalizer;
import org.finops.query.result.ResultTable;
import org.finops.query.sidetable.NamedTable;
import org.finops.query.sidetable.SideTableProvider;

import com.google.common.collect.ImmutableSet;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.util.VectorSchemaRootAppender;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Backend on an embedded, in-memory DuckDB database.
 *
 * <p>Each query opens a private database, defines the dataset as a view
 * over {@code read_parquet} (or {@code read_csv_auto}), attaches side
 * tables, runs the SQL and closes the database. Remote files are read
 * through the httpfs extension. Columnar results come straight from
 * DuckDB's Arrow export.
 */
public class DuckDBQueryBackend extends AbstractEmbeddedBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBQueryBackend.class);

  public static final String NAME = "duckdb";

  private static final long ARROW_BATCH_SIZE = 8192;
  private static final Set<String> NON_ARROW_TYPES =
      ImmutableSet.of("UHUGEINT", "VARINT", "BIT");

  private final DuckDBDialect dialect = DuckDBDialect.INSTANCE;

  public DuckDBQueryBackend(DatasetConfig config) {
    this(config, null);
  }

  public DuckDBQueryBackend(DatasetConfig config, @Nullable SideTableProvider sideTables) {
    super(config, sideTables);
    LOGGER.info("Initialized {}", describe());
  }

  public DuckDBQueryBackend(DatasetConfig config, @Nullable SideTableProvider sideTables,
      CredentialProvider credentialProvider, Clock clock) {
    super(config, sideTables, credentialProvider, clock);
    LOGGER.info("Initialized {}", describe());
  }

  @Override public String name() {
    return NAME;
  }

  @Override protected QueryResult executeOver(QueryRequest request, DatasetLocation location,
      FileFormat format, List<String> files) {
    try (Connection connection = DriverManager.getConnection(dialect.buildJdbcUrl());
         Statement statement = connection.createStatement()) {
      applyEngineSettings(statement);
      if (location.isRemote()) {
        configureRemoteAccess(statement);
      }
      statement.execute(dialect.createOrReplaceViewSql(config.getTableName(), format, files));
      attachSideTables(connection);

      if (request.getFormat() == OutputFormat.COLUMNAR) {
        return executeColumnar(connection, request.getSql());
      }
      try (ResultSet resultSet = statement.executeQuery(request.getSql())) {
        ResultTable table = JdbcResultReader.read(resultSet);
        return ResultNormalizer.normalize(table, request.getFormat(), null);
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(dialect.getName(), e.getMessage(), e);
    }
  }

  private void applyEngineSettings(Statement statement) throws SQLException {
    DuckDBSettings settings = config.getDuckdb();
    if (settings.getMemoryLimit() != null) {
      statement.execute(dialect.setSql("memory_limit", settings.getMemoryLimit()));
    }
    if (settings.getThreads() != null) {
      statement.execute("SET threads=" + settings.getThreads());
    }
  }

  private void configureRemoteAccess(Statement statement) throws SQLException {
    try {
      statement.execute("INSTALL httpfs");
      statement.execute("LOAD httpfs");
    } catch (SQLException e) {
      LOGGER.warn("Could not load the httpfs extension, remote reads may fail: {}",
          e.getMessage());
    }
    for (String sql : dialect.s3SettingsSql(credentials(), config.getAws().getEndpoint())) {
      statement.execute(sql);
    }
  }

  private void attachSideTables(Connection connection) {
    for (NamedTable table : sideTables()) {
      try {
        createTable(connection, table);
        LOGGER.debug("Attached side table {} ({} rows)", table.getName(),
            table.getTable().getRowCount());
      } catch (SQLException e) {
        LOGGER.warn("Failed to attach side table {}: {}", table.getName(), e.getMessage());
      }
    }
  }

  private void createTable(Connection connection, NamedTable table) throws SQLException {
    ResultTable data = table.getTable();
    try (Statement statement = connection.createStatement()) {
      statement.execute(dialect.createTableSql(table.getName(), data.getColumns()));
    }
    if (data.getRowCount() == 0) {
      return;
    }
    try (PreparedStatement insert = connection.prepareStatement(
        dialect.insertSql(table.getName(), data.getColumnCount()))) {
      for (Object[] row : data.getRows()) {
        for (int i = 0; i < row.length; i++) {
          insert.setObject(i + 1, row[i]);
        }
        insert.addBatch();
      }
      insert.executeBatch();
    }
  }

  /**
   * Runs the query once. Results whose columns all have an Arrow mapping are
   * exported through DuckDB's Arrow stream; the rest are converted row by row.
   */
  private QueryResult executeColumnar(Connection connection, String sql) throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet resultSet = statement.executeQuery(sql)) {
      if (needsRowConversion(resultSet.getMetaData())) {
        LOGGER.debug("Result has types without an Arrow mapping, converting rows");
        return ResultNormalizer.normalize(JdbcResultReader.read(resultSet),
            OutputFormat.COLUMNAR, null);
      }
      try {
        return QueryResult.columnar(exportArrow(resultSet));
      } catch (IOException e) {
        throw new SQLException("Arrow export failed: " + e.getMessage(), e);
      }
    }
  }

  /** Whether any result column has a DuckDB type the Arrow export rejects. */
  static boolean needsRowConversion(ResultSetMetaData metaData) throws SQLException {
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      String typeName = metaData.getColumnTypeName(i);
      if (typeName != null
          && NON_ARROW_TYPES.contains(typeName.toUpperCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  private static VectorSchemaRoot exportArrow(ResultSet resultSet)
      throws SQLException, IOException {
    BufferAllocator allocator = ResultNormalizer.allocator();
    DuckDBResultSet duckResultSet = resultSet.unwrap(DuckDBResultSet.class);
    try (ArrowReader reader =
             (ArrowReader) duckResultSet.arrowExportStream(allocator, ARROW_BATCH_SIZE)) {
      VectorSchemaRoot batch = reader.getVectorSchemaRoot();
      VectorSchemaRoot result = VectorSchemaRoot.create(batch.getSchema(), allocator);
      try {
        while (reader.loadNextBatch()) {
          VectorSchemaRootAppender.append(result, batch);
        }
        return result;
      } catch (IOException | RuntimeException e) {
        result.close();
        throw e;
      }
    }
  }
}
