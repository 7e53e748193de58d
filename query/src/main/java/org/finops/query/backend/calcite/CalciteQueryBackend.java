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

import org.finops.query.QueryExecutionException;
import org.finops.query.backend.AbstractEmbeddedBackend;
import org.finops.query.backend.QueryRequest;
import org.finops.query.config.DatasetConfig;
import org.finops.query.config.DatasetLocation;
import org.finops.query.config.FileFormat;
import org.finops.query.credentials.CredentialProvider;
import org.finops.query.result.JdbcResultReader;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultNormalizer;
import org.finops.query.result.ResultTable;
import org.finops.query.sidetable.NamedTable;
import org.finops.query.sidetable.SideTableProvider;

import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.Properties;

/**
 * Backend that loads the dataset into an in-memory frame and queries it with
 * Calcite.
 *
 * <p>Each query reads the discovered files into a {@link FrameTable},
 * registers it (and any side tables) in a fresh Calcite connection's root
 * schema, runs the SQL and closes the connection. Identifiers are matched
 * case-insensitively and keep their original case.
 */
public class CalciteQueryBackend extends AbstractEmbeddedBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(CalciteQueryBackend.class);

  public static final String NAME = "calcite";

  private static final String ENGINE = "Calcite";

  public CalciteQueryBackend(DatasetConfig config) {
    this(config, null);
  }

  public CalciteQueryBackend(DatasetConfig config, @Nullable SideTableProvider sideTables) {
    super(config, sideTables);
    LOGGER.info("Initialized {}", describe());
  }

  public CalciteQueryBackend(DatasetConfig config, @Nullable SideTableProvider sideTables,
      CredentialProvider credentialProvider, Clock clock) {
    super(config, sideTables, credentialProvider, clock);
    LOGGER.info("Initialized {}", describe());
  }

  @Override public String name() {
    return NAME;
  }

  @Override protected QueryResult executeOver(QueryRequest request, DatasetLocation location,
      FileFormat format, List<String> files) {
    ResultTable frame;
    try {
      frame = new FrameLoader(storageFor(location)).load(format, files);
    } catch (IOException e) {
      throw new QueryExecutionException(ENGINE,
          "Failed to load data under " + location.getBasePath() + ": " + e.getMessage(), e);
    }

    try (Connection connection =
             DriverManager.getConnection("jdbc:calcite:", connectionProperties())) {
      SchemaPlus rootSchema = connection.unwrap(CalciteConnection.class).getRootSchema();
      rootSchema.add(config.getTableName(), new FrameTable(frame));
      for (NamedTable table : sideTables()) {
        try {
          rootSchema.add(table.getName(), new FrameTable(table.getTable()));
        } catch (RuntimeException e) {
          LOGGER.warn("Failed to attach side table {}: {}", table.getName(), e.getMessage());
        }
      }

      try (Statement statement = connection.createStatement();
           ResultSet resultSet = statement.executeQuery(request.getSql())) {
        ResultTable table = JdbcResultReader.read(resultSet);
        return ResultNormalizer.normalize(table, request.getFormat(), null);
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(ENGINE, e.getMessage(), e);
    }
  }

  private static Properties connectionProperties() {
    Properties info = new Properties();
    info.setProperty("caseSensitive", "false");
    info.setProperty("unquotedCasing", "UNCHANGED");
    info.setProperty("quotedCasing", "UNCHANGED");
    info.setProperty("quoting", "DOUBLE_QUOTE");
    info.setProperty("conformance", "LENIENT");
    return info;
  }
}
