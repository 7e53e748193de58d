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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Reads a {@link DatasetConfig} from a YAML or JSON document, or from an
 * operand map.
 *
 * <p>YAML is loaded with SnakeYAML so that anchors and aliases are resolved,
 * then handed to Jackson as a {@link JsonNode}; JSON goes straight to Jackson.
 */
public final class DatasetConfigParser {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private DatasetConfigParser() {
  }

  /**
   * Parses a configuration document.
   *
   * @param stream document contents
   * @param resourceName name of the resource; {@code .yaml}/{@code .yml} selects YAML
   * @throws IOException if the document cannot be read
   */
  public static DatasetConfig parse(InputStream stream, String resourceName) throws IOException {
    JsonNode root;
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      DumperOptions dumperOptions = new DumperOptions();
      Yaml yaml = new Yaml(new Constructor(loaderOptions), new Representer(dumperOptions),
          dumperOptions, loaderOptions, new PlainDateResolver());
      Object parsed = yaml.load(stream);
      root = JSON_MAPPER.convertValue(parsed, JsonNode.class);
    } else {
      root = JSON_MAPPER.readTree(stream);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Configuration " + resourceName + " must be a mapping");
    }
    return fromJson(root);
  }

  /** Builds a configuration from an operand map, as passed by a model file. */
  public static DatasetConfig fromOperand(Map<String, Object> operand) {
    return fromJson(JSON_MAPPER.convertValue(operand, JsonNode.class));
  }

  static DatasetConfig fromJson(JsonNode node) {
    DatasetConfig.Builder builder = DatasetConfig.builder()
        .s3Bucket(text(node, "s3Bucket"))
        .s3DataPrefix(text(node, "s3DataPrefix"))
        .partitionKey(text(node, "partitionKey"))
        .formatHint(FileFormat.fromHint(text(node, "formatHint")))
        .remoteRoot(text(node, "remoteRoot"))
        .localDataPath(text(node, "localDataPath"))
        .dateRange(text(node, "dateStart"), text(node, "dateEnd"));

    String exportType = text(node, "dataExportType");
    if (exportType != null) {
      builder.exportType(DataExportType.fromValue(exportType));
    }
    String granularity = text(node, "granularity");
    if (granularity != null) {
      builder.granularity(Granularity.fromString(granularity));
    }
    String tableName = text(node, "tableName");
    if (tableName != null) {
      builder.tableName(tableName);
    }
    if (node.hasNonNull("preferLocalData")) {
      builder.preferLocalData(bool(node, "preferLocalData"));
    }
    if (node.hasNonNull("aws")) {
      builder.aws(parseAws(node.get("aws")));
    }
    if (node.hasNonNull("athena")) {
      builder.athena(parseAthena(node.get("athena")));
    }
    if (node.hasNonNull("duckdb")) {
      builder.duckdb(parseDuckDB(node.get("duckdb")));
    }
    return builder.build();
  }

  private static AwsSettings parseAws(JsonNode node) {
    Instant expiration = null;
    String expirationText = text(node, "expiration");
    if (expirationText != null) {
      try {
        expiration = Instant.parse(expirationText);
      } catch (DateTimeParseException e) {
        throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
            "Invalid aws.expiration '" + expirationText + "'", e);
      }
    }
    return new AwsSettings(text(node, "region"), text(node, "accessKeyId"),
        text(node, "secretAccessKey"), text(node, "sessionToken"), expiration,
        text(node, "endpoint"));
  }

  private static AthenaSettings parseAthena(JsonNode node) {
    AthenaSettings d = AthenaSettings.DEFAULT;
    String database = text(node, "database");
    String workgroup = text(node, "workgroup");
    return new AthenaSettings(
        database != null ? database : d.getDatabase(),
        workgroup != null ? workgroup : d.getWorkgroup(),
        text(node, "outputBucket"),
        text(node, "crawlerRole"),
        duration(node, "pollInterval", d.getPollInterval()),
        duration(node, "queryTimeout", d.getQueryTimeout()),
        duration(node, "crawlerPollInterval", d.getCrawlerPollInterval()),
        duration(node, "crawlerTimeout", d.getCrawlerTimeout()));
  }

  private static DuckDBSettings parseDuckDB(JsonNode node) {
    Integer threads = null;
    if (node.hasNonNull("threads")) {
      JsonNode t = node.get("threads");
      if (!t.canConvertToInt() || t.asInt() <= 0) {
        throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
            "duckdb.threads must be a positive integer, got " + t);
      }
      threads = t.asInt();
    }
    return new DuckDBSettings(text(node, "memoryLimit"), threads);
  }

  private static Duration duration(JsonNode node, String field, Duration defaultValue) {
    String value = text(node, field);
    if (value == null) {
      return defaultValue;
    }
    Duration parsed = IntervalParser.parse(value);
    if (parsed == null || parsed.isZero() || parsed.isNegative()) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Invalid duration for " + field + ": '" + value + "'");
    }
    return parsed;
  }

  private static boolean bool(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    String text = value.asText().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
        field + " must be true or false, got '" + text + "'");
  }

  private static @Nullable String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.trim().isEmpty() ? null : text.trim();
  }

  /**
   * Standard implicit resolvers minus timestamps, so that {@code 2025-03-01}
   * stays a string instead of becoming a {@link java.util.Date}.
   */
  private static final class PlainDateResolver extends Resolver {
    @Override protected void addImplicitResolvers() {
      addImplicitResolver(Tag.BOOL, BOOL, "yYnNtTfFoO");
      addImplicitResolver(Tag.INT, INT, "-+0123456789");
      addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
      addImplicitResolver(Tag.MERGE, MERGE, "<");
      addImplicitResolver(Tag.NULL, NULL, "~nN\0");
      addImplicitResolver(Tag.NULL, EMPTY, null);
    }
  }
}
