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
import org.finops.query.backend.athena.AthenaQueryBackend;
import org.finops.query.backend.calcite.CalciteQueryBackend;
import org.finops.query.backend.duckdb.DuckDBQueryBackend;
import org.finops.query.config.DatasetConfig;
import org.finops.query.sidetable.SideTableProvider;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps engine names to {@link BackendFactory} instances.
 *
 * <p>Names are case-insensitive. Lookups are safe from any thread.
 *
 * <p>Example usage:
 * <pre>{@code
 * BackendRegistry registry = BackendRegistry.withDefaults();
 * try (QueryBackend backend = registry.create("duckdb", config)) {
 *   QueryResult result = backend.execute("SELECT COUNT(*) FROM CUR", OutputFormat.RECORDS);
 * }
 * }</pre>
 */
public class BackendRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(BackendRegistry.class);

  private final Map<String, BackendFactory> factories = new ConcurrentHashMap<>();

  /**
   * Creates a registry with the {@code duckdb}, {@code calcite} and
   * {@code athena} backends.
   */
  public static BackendRegistry withDefaults() {
    return withDefaults(null);
  }

  /**
   * Creates a registry with the default backends; the embedded ones attach
   * the given side tables to every query.
   */
  public static BackendRegistry withDefaults(@Nullable SideTableProvider sideTables) {
    BackendRegistry registry = new BackendRegistry();
    registry.register(DuckDBQueryBackend.NAME,
        config -> new DuckDBQueryBackend(config, sideTables));
    registry.register(CalciteQueryBackend.NAME,
        config -> new CalciteQueryBackend(config, sideTables));
    registry.register(AthenaQueryBackend.NAME, AthenaQueryBackend::new);
    return registry;
  }

  /** Registers a factory, replacing any factory of the same name. */
  public void register(String name, BackendFactory factory) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Backend name cannot be null or empty");
    }
    BackendFactory previous = factories.put(normalize(name), factory);
    if (previous != null) {
      LOGGER.debug("Replaced backend factory '{}'", name);
    }
  }

  public boolean isRegistered(String name) {
    return name != null && factories.containsKey(normalize(name));
  }

  /** Registered names, sorted. */
  public List<String> names() {
    List<String> names = new ArrayList<>(factories.keySet());
    Collections.sort(names);
    return names;
  }

  /**
   * Creates the named backend.
   *
   * @throws ConfigurationException with reason {@code UNKNOWN_BACKEND} if no
   *     factory is registered under the name
   * @throws EngineInitializationException if the factory fails
   */
  public QueryBackend create(String name, DatasetConfig config) {
    BackendFactory factory = name == null ? null : factories.get(normalize(name));
    if (factory == null) {
      throw new ConfigurationException(ConfigurationException.Reason.UNKNOWN_BACKEND,
          "Unknown query engine '" + name + "'. Available engines: " + String.join(", ", names()));
    }
    try {
      QueryBackend backend = factory.create(config);
      LOGGER.info("Created {} backend", backend.name());
      return backend;
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException | LinkageError e) {
      throw new EngineInitializationException(
          "Failed to initialize query engine '" + name + "': " + e.getMessage(), e);
    }
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
