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

import org.finops.query.ConfigurationException;
import org.finops.query.EngineInitializationException;
import org.finops.query.config.DataExportType;
import org.finops.query.config.DatasetConfig;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultColumn;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

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
 * Tests for {@link BackendRegistry} and the default methods of {@link QueryBackend}.
 */
@Tag("unit")
public class BackendRegistryTest {
  private static final DatasetConfig CONFIG = DatasetConfig.builder()
      .s3Bucket("billing")
      .exportType(DataExportType.CUR_2_0)
      .build();

  @Test
  void testDefaultNames() {
    BackendRegistry registry = BackendRegistry.withDefaults();
    assertEquals(Arrays.asList("athena", "calcite", "duckdb"), registry.names());
    assertTrue(registry.isRegistered("DuckDB"));
    assertTrue(registry.isRegistered(" athena "));
    assertFalse(registry.isRegistered("spark"));
  }

  @Test
  void testUnknownEngine() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> BackendRegistry.withDefaults().create("spark", CONFIG));
    assertEquals(ConfigurationException.Reason.UNKNOWN_BACKEND, e.getReason());
    assertEquals("Unknown query engine 'spark'. Available engines: athena, calcite, duckdb",
        e.getMessage());
  }

  @Test
  void testLookupIsCaseInsensitive() {
    RecordingBackend backend = new RecordingBackend();
    BackendRegistry registry = new BackendRegistry();
    registry.register("Fake", config -> backend);
    assertSame(backend, registry.create("FAKE", CONFIG));
    assertSame(backend, registry.create("fake", CONFIG));
  }

  @Test
  void testFactoryFailureIsWrapped() {
    BackendRegistry registry = new BackendRegistry();
    registry.register("broken", config -> {
      throw new IllegalStateException("native library missing");
    });
    EngineInitializationException e = assertThrows(EngineInitializationException.class,
        () -> registry.create("broken", CONFIG));
    assertEquals("Failed to initialize query engine 'broken': native library missing",
        e.getMessage());
    assertTrue(e.getCause() instanceof IllegalStateException);
  }

  @Test
  void testConfigurationErrorsPassThrough() {
    BackendRegistry registry = new BackendRegistry();
    registry.register("picky", config -> {
      throw new ConfigurationException(ConfigurationException.Reason.CREDENTIALS_EXPIRED,
          "expired");
    });
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> registry.create("picky", CONFIG));
    assertEquals(ConfigurationException.Reason.CREDENTIALS_EXPIRED, e.getReason());
  }

  @Test
  void testRegisterRejectsBlankName() {
    assertThrows(IllegalArgumentException.class,
        () -> new BackendRegistry().register(" ", config -> new RecordingBackend()));
  }

  @Test
  void testSampleBuildsLimitQuery() {
    RecordingBackend backend = new RecordingBackend();
    backend.sample(5, OutputFormat.RECORDS);
    assertEquals("SELECT * FROM CUR LIMIT 5", backend.lastRequest.getSql());
    assertEquals(OutputFormat.RECORDS, backend.lastRequest.getFormat());
    assertFalse(backend.lastRequest.isForceRemote());
    assertThrows(IllegalArgumentException.class, () -> backend.sample(-1, OutputFormat.TABLE));
  }

  /** Backend that records the last request instead of running it. */
  private static class RecordingBackend implements QueryBackend {
    QueryRequest lastRequest;

    @Override public String name() {
      return "fake";
    }

    @Override public boolean supportsRemoteDirect() {
      return true;
    }

    @Override public boolean supportsLocalCache() {
      return false;
    }

    @Override public DatasetConfig getConfig() {
      return CONFIG;
    }

    @Override public boolean hasLocalData() {
      return false;
    }

    @Override public List<ResultColumn> schema() {
      return Collections.emptyList();
    }

    @Override public Map<String, Object> catalog() {
      return Collections.emptyMap();
    }

    @Override public QueryResult execute(QueryRequest request) {
      lastRequest = request;
      return QueryResult.records(Collections.<Map<String, Object>>emptyList());
    }
  }
}
