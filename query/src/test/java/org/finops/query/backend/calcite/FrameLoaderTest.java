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

import org.finops.query.BillingFixtures;
import org.finops.query.config.FileFormat;
import org.finops.query.result.ColumnType;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultTable;
import org.finops.query.storage.LocalFileStorageProvider;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link FrameLoader}.
 */
@Tag("unit")
public class FrameLoaderTest {
  @TempDir
  Path tempDir;

  @Test
  void testWiden() {
    assertEquals(ColumnType.BIGINT, FrameLoader.widen(ColumnType.INTEGER, ColumnType.BIGINT));
    assertEquals(ColumnType.DOUBLE, FrameLoader.widen(ColumnType.BIGINT, ColumnType.FLOAT));
    assertEquals(ColumnType.VARCHAR, FrameLoader.widen(ColumnType.DOUBLE, ColumnType.DATE));
    assertEquals(ColumnType.DATE, FrameLoader.widen(ColumnType.DATE, ColumnType.DATE));
  }

  @Test
  void testUnionByName() {
    ResultTable first = new ResultTable(
        Arrays.asList(new ResultColumn("service", ColumnType.VARCHAR),
            new ResultColumn("cost", ColumnType.BIGINT)),
        Collections.singletonList(new Object[] {"AmazonEC2", 3L}));
    ResultTable second = new ResultTable(
        Arrays.asList(new ResultColumn("cost", ColumnType.DOUBLE),
            new ResultColumn("region", ColumnType.VARCHAR)),
        Collections.singletonList(new Object[] {1.5, "us-east-1"}));

    ResultTable union = FrameLoader.union(Arrays.asList(first, second));

    assertEquals(3, union.getColumnCount());
    assertEquals(2, union.columnIndex("region"));
    assertEquals(ColumnType.DOUBLE, union.getColumns().get(1).getType());
    assertArrayEquals(new Object[] {"AmazonEC2", 3.0, null}, union.getRows().get(0));
    assertArrayEquals(new Object[] {null, 1.5, "us-east-1"}, union.getRows().get(1));
  }

  @Test
  void testCsvTypesInferred() throws Exception {
    Path file = tempDir.resolve("export-00001.csv.gz");
    BillingFixtures.writeCsvGzip(file,
        "line_item_product_code,line_item_usage_amount,line_item_unblended_cost\n"
        + "AmazonEC2,2,1.5\n"
        + "AmazonS3,,2\n");

    ResultTable table = new FrameLoader(new LocalFileStorageProvider())
        .load(FileFormat.CSV_GZIP, Collections.singletonList(file.toString()));

    assertEquals(ColumnType.VARCHAR, table.getColumns().get(0).getType());
    assertEquals(ColumnType.BIGINT, table.getColumns().get(1).getType());
    assertEquals(ColumnType.DOUBLE, table.getColumns().get(2).getType());
    assertEquals(2L, table.getValue(0, "line_item_usage_amount"));
    assertNull(table.getValue(1, "line_item_usage_amount"));
    assertEquals(2.0, table.getValue(1, "line_item_unblended_cost"));
  }
}
