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

import org.finops.query.config.FileFormat;
import org.finops.query.credentials.AwsSessionCredentials;
import org.finops.query.result.ColumnType;
import org.finops.query.result.ResultColumn;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL text for DuckDB: the dataset view over Parquet or gzip CSV files, S3
 * settings for the httpfs extension, and side table DDL.
 *
 * <p>Example usage:
 * <pre>{@code
 * String sql = DuckDBDialect.INSTANCE.createOrReplaceViewSql("CUR", FileFormat.PARQUET,
 *     Arrays.asList("s3://bucket/a.parquet", "s3://bucket/b.parquet"));
 * // CREATE OR REPLACE VIEW CUR AS SELECT * FROM
 * //     read_parquet(['s3://bucket/a.parquet', 's3://bucket/b.parquet'], union_by_name=true)
 * }</pre>
 */
public class DuckDBDialect {

  /** Singleton instance for reuse. */
  public static final DuckDBDialect INSTANCE = new DuckDBDialect();

  /** URL of a private in-memory database. */
  public String buildJdbcUrl() {
    return "jdbc:duckdb:";
  }

  /**
   * Table function call reading the files. A single file is read directly;
   * several files are read as a list and unioned by column name.
   */
  public String readFilesSql(FileFormat format, List<String> files) {
    String function = format == FileFormat.PARQUET ? "read_parquet" : "read_csv_auto";
    if (files.size() == 1) {
      return function + "(" + literal(files.get(0)) + ")";
    }
    StringBuilder sb = new StringBuilder(function).append("([");
    for (int i = 0; i < files.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(literal(files.get(i)));
    }
    return sb.append("], union_by_name=true)").toString();
  }

  public String createOrReplaceViewSql(String viewName, FileFormat format, List<String> files) {
    return "CREATE OR REPLACE VIEW " + viewName + " AS SELECT * FROM "
        + readFilesSql(format, files);
  }

  /** SET statements that let httpfs read {@code s3://} paths. */
  public List<String> s3SettingsSql(AwsSessionCredentials credentials,
      @Nullable String endpoint) {
    List<String> statements = new ArrayList<>();
    statements.add(setSql("s3_region", credentials.getRegion()));
    statements.add(setSql("s3_access_key_id", credentials.getAccessKeyId()));
    statements.add(setSql("s3_secret_access_key", credentials.getSecretAccessKey()));
    if (credentials.getSessionToken() != null) {
      statements.add(setSql("s3_session_token", credentials.getSessionToken()));
    }
    if (endpoint != null) {
      String host = endpoint;
      boolean ssl = true;
      if (host.startsWith("http://")) {
        host = host.substring("http://".length());
        ssl = false;
      } else if (host.startsWith("https://")) {
        host = host.substring("https://".length());
      }
      if (host.endsWith("/")) {
        host = host.substring(0, host.length() - 1);
      }
      statements.add(setSql("s3_endpoint", host));
      statements.add(setSql("s3_url_style", "path"));
      statements.add("SET s3_use_ssl=" + ssl);
    }
    return statements;
  }

  public String setSql(String name, String value) {
    return "SET " + name + "=" + literal(value);
  }

  public String createTableSql(String tableName, List<ResultColumn> columns) {
    StringBuilder sb = new StringBuilder("CREATE OR REPLACE TABLE ")
        .append(tableName).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(quoteIdentifier(columns.get(i).getName())).append(' ')
          .append(sqlType(columns.get(i).getType()));
    }
    return sb.append(')').toString();
  }

  public String insertSql(String tableName, int columnCount) {
    StringBuilder sb = new StringBuilder("INSERT INTO ").append(tableName).append(" VALUES (");
    for (int i = 0; i < columnCount; i++) {
      sb.append(i > 0 ? ", ?" : "?");
    }
    return sb.append(')').toString();
  }

  public String sqlType(ColumnType type) {
    switch (type) {
    case BOOLEAN:
      return "BOOLEAN";
    case INTEGER:
      return "INTEGER";
    case BIGINT:
      return "BIGINT";
    case FLOAT:
      return "REAL";
    case DOUBLE:
      return "DOUBLE";
    case DECIMAL:
      return "DECIMAL(38, 10)";
    case DATE:
      return "DATE";
    case TIMESTAMP:
      return "TIMESTAMP";
    case BINARY:
      return "BLOB";
    case VARCHAR:
    default:
      return "VARCHAR";
    }
  }

  public String quoteIdentifier(String name) {
    return "\"" + name.replace("\"", "\"\"") + "\"";
  }

  public String literal(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  public String getName() {
    return "DuckDB";
  }
}
