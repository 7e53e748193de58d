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

import org.finops.query.BillingFixtures;
import org.finops.query.DataNotFoundException;
import org.finops.query.QueryExecutionException;
import org.finops.query.config.DatasetConfig;
import org.finops.query.config.FileFormat;
import org.finops.query.result.ColumnType;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultTable;
import org.finops.query.sidetable.NamedTable;
import org.finops.query.sidetable.SideTables;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the DuckDB backend over Parquet files written to a temporary directory.
 */
@Tag("integration")
public class DuckDBQueryBackendTest {
  private static final String COST_BY_SERVICE =
      "SELECT line_item_product_code AS service, SUM(line_item_unblended_cost) AS cost"
      + " FROM CUR GROUP BY 1 ORDER BY 1";

  @TempDir
  static Path baseDir;

  @BeforeAll
  static void writeDataset() throws Exception {
    BillingFixtures.writeDataset(baseDir);
  }

  private static DuckDBQueryBackend backend(DatasetConfig config) {
    return new DuckDBQueryBackend(config);
  }

  private static double ec2Cost(QueryResult result) {
    List<Map<String, Object>> rows = ((QueryResult.Records) result).getRows();
    assertEquals("AmazonEC2", rows.get(0).get("service"));
    return ((Number) rows.get(0).get("cost")).doubleValue();
  }

  @Test
  void testRemoteRangeIsPruned() {
    DatasetConfig config = BillingFixtures.config(baseDir)
        .dateRange("2025-02", "2025-03")
        .preferLocalData(false)
        .build();
    try (DuckDBQueryBackend backend = backend(config)) {
      assertEquals(50.0, ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS)));
    }
  }

  @Test
  void testLocalMirrorPreferred() {
    DatasetConfig config = BillingFixtures.config(baseDir).dateRange("2025-03", "2025-03").build();
    try (DuckDBQueryBackend backend = backend(config)) {
      assertTrue(backend.hasLocalData());
      assertEquals(999.0, ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS)));
      assertEquals(30.0,
          ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS, true)));
    }
  }

  @Test
  void testFallsBackToRemoteWhenMirrorLacksRange() {
    DatasetConfig config = BillingFixtures.config(baseDir).dateRange("2025-01", "2025-01").build();
    try (DuckDBQueryBackend backend = backend(config)) {
      assertFalse(backend.hasLocalData());
      assertEquals(10.0, ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS)));
    }
  }

  @Test
  void testNoDataInRange() {
    DatasetConfig config = BillingFixtures.config(baseDir).dateRange("2026-01", null).build();
    try (DuckDBQueryBackend backend = backend(config)) {
      DataNotFoundException e = assertThrows(DataNotFoundException.class,
          () -> backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS));
      assertTrue(e.getMessage().contains("2026-01"));
    }
  }

  @Test
  void testSqlErrorIsWrapped() {
    try (DuckDBQueryBackend backend = backend(BillingFixtures.config(baseDir).build())) {
      QueryExecutionException e = assertThrows(QueryExecutionException.class,
          () -> backend.execute("SELECT no_such_column FROM CUR", OutputFormat.RECORDS));
      assertEquals("DuckDB", e.getEngine());
    }
  }

  @Test
  void testTableKeepsTypes() {
    DatasetConfig config = BillingFixtures.config(baseDir)
        .dateRange("2025-04", "2025-04")
        .preferLocalData(false)
        .build();
    try (DuckDBQueryBackend backend = backend(config)) {
      ResultTable table = ((QueryResult.Table) backend.execute(
          "SELECT * FROM CUR ORDER BY line_item_product_code", OutputFormat.TABLE)).getTable();
      assertEquals(2, table.getRowCount());
      assertEquals(ColumnType.DECIMAL, table.getColumns().get(2).getType());
      assertEquals(0, new BigDecimal("4.25")
          .compareTo((BigDecimal) table.getValue(0, "line_item_usage_amount")));
      assertEquals(Timestamp.valueOf("2025-04-01 10:00:00"),
          table.getValue(0, "line_item_usage_start_date"));
    }
  }

  @Test
  void testSchemaIsCached() {
    try (DuckDBQueryBackend backend = backend(BillingFixtures.config(baseDir).build())) {
      List<ResultColumn> schema = backend.schema();
      assertEquals(6, schema.size());
      assertEquals("line_item_product_code", schema.get(0).getName());
      assertEquals(ColumnType.VARCHAR, schema.get(0).getType());
      assertEquals(ColumnType.DOUBLE, schema.get(1).getType());
      assertEquals(ColumnType.TIMESTAMP, schema.get(3).getType());
      assertEquals(ColumnType.DATE, schema.get(4).getType());
      assertSame(schema, backend.schema());

      Map<String, Object> catalog = backend.catalog();
      assertEquals("duckdb", catalog.get("engine"));
      assertEquals("CUR", catalog.get("table"));
      assertEquals("BILLING_PERIOD", catalog.get("partitionKey"));
      assertSame(schema, catalog.get("schema"));
    }
  }

  @Test
  void testSideTablesJoin() {
    ResultTable accounts = new ResultTable(
        Arrays.asList(new ResultColumn("account_id", ColumnType.VARCHAR),
            new ResultColumn("team", ColumnType.VARCHAR)),
        Arrays.asList(new Object[] {"111111111111", "compute"},
            new Object[] {"222222222222", "storage"}));
    SideTables sideTables = new SideTables(
        Collections.singletonList(new NamedTable("accounts", accounts)),
        Collections.singletonList("budgets table unavailable"));
    DatasetConfig config = BillingFixtures.config(baseDir)
        .dateRange("2025-02", "2025-02")
        .build();

    try (DuckDBQueryBackend backend = new DuckDBQueryBackend(config, () -> sideTables)) {
      QueryResult result = backend.execute("SELECT a.team, SUM(c.line_item_unblended_cost) AS cost"
          + " FROM CUR c JOIN accounts a ON c.line_item_usage_account_id = a.account_id"
          + " GROUP BY a.team ORDER BY a.team", OutputFormat.RECORDS);
      List<Map<String, Object>> rows = ((QueryResult.Records) result).getRows();
      assertEquals(2, rows.size());
      assertEquals("compute", rows.get(0).get("team"));
      assertEquals(20.0, ((Number) rows.get(0).get("cost")).doubleValue());
    }
  }

  @Test
  void testFailingSideTableProviderIsSkipped() {
    DatasetConfig config = BillingFixtures.config(baseDir).dateRange("2025-02", "2025-02").build();
    try (DuckDBQueryBackend backend = new DuckDBQueryBackend(config, () -> {
      throw new IllegalStateException("tag service down");
    })) {
      assertEquals(20.0, ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS)));
    }
  }

  @Test
  void testCsvAndColumnar() {
    DatasetConfig config = BillingFixtures.config(baseDir)
        .dateRange("2025-01", "2025-01")
        .build();
    try (DuckDBQueryBackend backend = backend(config)) {
      String csv = ((QueryResult.Csv) backend.execute(COST_BY_SERVICE, OutputFormat.CSV))
          .getText();
      assertEquals("service,cost\nAmazonEC2,10.0\nAmazonS3,1.0\n", csv);

      try (QueryResult result = backend.execute(COST_BY_SERVICE, OutputFormat.COLUMNAR)) {
        VectorSchemaRoot root = ((QueryResult.Columnar) result).getRoot();
        assertEquals(2, root.getRowCount());
        assertEquals(Arrays.asList("service", "cost"),
            Arrays.asList(root.getSchema().getFields().get(0).getName(),
                root.getSchema().getFields().get(1).getName()));
      }
    }
  }

  @Test
  void testWideIntegers() {
    DatasetConfig config = BillingFixtures.config(baseDir)
        .dateRange("2025-04", "2025-04")
        .preferLocalData(false)
        .build();
    try (DuckDBQueryBackend backend = backend(config)) {
      ResultTable table = ((QueryResult.Table) backend.execute(
          "SELECT SUM(CAST(1 AS INTEGER)) AS n FROM CUR", OutputFormat.TABLE)).getTable();
      assertEquals(ColumnType.DECIMAL, table.getColumns().get(0).getType());
      assertEquals(0, new BigDecimal(2).compareTo((BigDecimal) table.getValue(0, "n")));

      try (QueryResult result = backend.execute(
          "SELECT CAST(COUNT(*) AS UHUGEINT) AS n, 'x' AS tag FROM CUR",
          OutputFormat.COLUMNAR)) {
        VectorSchemaRoot root = ((QueryResult.Columnar) result).getRoot();
        assertEquals(1, root.getRowCount());
        assertEquals("2", String.valueOf(root.getVector("n").getObject(0)));
        assertEquals("x", String.valueOf(root.getVector("tag").getObject(0)));
      }
    }
  }

  @Test
  void testGzipCsvDataset() throws Exception {
    Path csvBase = baseDir.resolve("csv");
    BillingFixtures.writeCsvGzip(
        BillingFixtures.partitionDir(csvBase, "2025-05").resolve("export-00001.csv.gz"),
        "line_item_product_code,line_item_unblended_cost\nAmazonEC2,1.5\nAmazonEC2,2.5\n");
    DatasetConfig config = BillingFixtures.config(baseDir)
        .remoteRoot(csvBase.toString())
        .formatHint(FileFormat.CSV_GZIP)
        .preferLocalData(false)
        .build();
    try (DuckDBQueryBackend backend = backend(config)) {
      assertEquals(4.0, ec2Cost(backend.execute(COST_BY_SERVICE, OutputFormat.RECORDS)));
    }
  }

  @Test
  void testSample() {
    DatasetConfig config = BillingFixtures.config(baseDir).preferLocalData(false).build();
    try (DuckDBQueryBackend backend = backend(config)) {
      List<Map<String, Object>> rows =
          ((QueryResult.Records) backend.sample(3, OutputFormat.RECORDS)).getRows();
      assertEquals(3, rows.size());
    }
  }
}
