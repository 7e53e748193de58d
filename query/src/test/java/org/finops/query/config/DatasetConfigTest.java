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
package org.finops.query.config;

import org.finops.query.ConfigurationException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DatasetConfig}.
 */
@Tag("unit")
public class DatasetConfigTest {

  @Test
  void testExportTypeSuppliesPartitioning() {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("billing-bucket")
        .s3DataPrefix("/cur2/cur2/data/")
        .exportType(DataExportType.CUR_2_0)
        .build();

    DatasetLocation location = config.getLocation();
    assertEquals("BILLING_PERIOD", location.getPartitionKeyName());
    assertEquals(Granularity.MONTHLY, location.getGranularity());
    assertEquals("s3://billing-bucket/cur2/cur2/data/", location.getBasePath());
    assertEquals("s3://billing-bucket/cur2/cur2/data/BILLING_PERIOD=2025-03/",
        location.partitionPath("BILLING_PERIOD=2025-03"));
    assertTrue(location.isRemote());
    assertEquals("CUR", config.getTableName());
    assertTrue(config.isPreferLocalData());
    assertNull(config.getLocalLocation());
  }

  @Test
  void testCostOptimizationHubIsDaily() {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("b")
        .exportType(DataExportType.COH)
        .dateRange("2025-01-30", "2025-02-02")
        .build();
    assertEquals("date", config.getLocation().getPartitionKeyName());
    assertEquals(Granularity.DAILY, config.getLocation().getGranularity());
  }

  @Test
  void testLocalMirrorKeepsBucketInPath() {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("billing-bucket")
        .s3DataPrefix("focus/data")
        .exportType(DataExportType.FOCUS_1_0)
        .localDataPath("mirror")
        .build();

    String expectedRoot = new File(new File("mirror").getAbsolutePath(), "billing-bucket")
        .getPath();
    assertEquals(expectedRoot + "/focus/data/", config.getLocalLocation().getBasePath());
    assertFalse(config.getLocalLocation().isRemote());
    assertEquals("billing_period", config.getLocalLocation().getPartitionKeyName());
  }

  @Test
  void testExplicitPartitioningOverridesExportType() {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("b")
        .exportType(DataExportType.CUR_2_0)
        .partitionKey("period")
        .granularity(Granularity.DAILY)
        .build();
    assertEquals("period", config.getLocation().getPartitionKeyName());
    assertEquals(Granularity.DAILY, config.getLocation().getGranularity());
  }

  @Test
  void testMissingPartitioning() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DatasetConfig.builder().s3Bucket("b").build());
    assertEquals(ConfigurationException.Reason.INVALID_CONFIG, e.getReason());

    e = assertThrows(ConfigurationException.class,
        () -> DatasetConfig.builder().s3Bucket("b").partitionKey("p").build());
    assertEquals(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY, e.getReason());
  }

  @Test
  void testMissingBucket() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DatasetConfig.builder().exportType(DataExportType.CUR_2_0).build());
    assertEquals(ConfigurationException.Reason.INVALID_LOCATION, e.getReason());
  }

  @Test
  void testDateRangeIsValidatedAgainstGranularity() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DatasetConfig.builder()
            .s3Bucket("b")
            .exportType(DataExportType.CUR_2_0)
            .dateRange("2025-03-01", "2025-04-01")
            .build());
    assertEquals(ConfigurationException.Reason.INVALID_DATE_FORMAT, e.getReason());
  }

  @Test
  void testInvalidTableName() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DatasetConfig.builder()
            .s3Bucket("b")
            .exportType(DataExportType.CUR_2_0)
            .tableName("cur; DROP TABLE x")
            .build());
    assertEquals(ConfigurationException.Reason.INVALID_CONFIG, e.getReason());
  }

  @Test
  void testToBuilderCopiesEverything() {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("b")
        .exportType(DataExportType.CUR_2_0)
        .dateRange("2025-01", "2025-02")
        .tableName("costs")
        .preferLocalData(false)
        .build();
    DatasetConfig copy = config.toBuilder().build();
    assertEquals(config.getLocation(), copy.getLocation());
    assertEquals(config.getDateRange(), copy.getDateRange());
    assertEquals("costs", copy.getTableName());
    assertFalse(copy.isPreferLocalData());
  }
}
