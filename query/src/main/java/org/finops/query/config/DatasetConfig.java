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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.File;
import java.util.regex.Pattern;

/**
 * Configuration of one billing dataset: where the export lives, how it is
 * partitioned, which dates to read, the optional local mirror and the engine
 * settings.
 *
 * <p>Instances are immutable; build them with {@link #builder()} or parse them
 * with {@link DatasetConfigParser}.
 */
public final class DatasetConfig {
  public static final String DEFAULT_TABLE_NAME = "CUR";

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final @Nullable String s3Bucket;
  private final String s3DataPrefix;
  private final @Nullable DataExportType exportType;
  private final DatasetLocation location;
  private final @Nullable DatasetLocation localLocation;
  private final boolean preferLocalData;
  private final String tableName;
  private final DateRange dateRange;
  private final AwsSettings aws;
  private final AthenaSettings athena;
  private final DuckDBSettings duckdb;

  private DatasetConfig(Builder builder) {
    this.s3Bucket = builder.s3Bucket;
    this.s3DataPrefix = builder.s3DataPrefix == null ? "" : builder.s3DataPrefix;
    this.exportType = builder.exportType;

    String partitionKey = builder.partitionKey;
    Granularity granularity = builder.granularity;
    if (exportType != null) {
      if (partitionKey == null) {
        partitionKey = exportType.getPartitionKey();
      }
      if (granularity == null) {
        granularity = exportType.getGranularity();
      }
    }
    if (partitionKey == null) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Either dataExportType or partitionKey must be configured");
    }
    if (granularity == null) {
      throw new ConfigurationException(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY,
          "Either dataExportType or granularity must be configured");
    }

    String root = builder.remoteRoot;
    if (root == null) {
      if (s3Bucket == null || s3Bucket.trim().isEmpty()) {
        throw new ConfigurationException(ConfigurationException.Reason.INVALID_LOCATION,
            "s3Bucket must be configured");
      }
      root = "s3://" + s3Bucket;
    }
    this.location = new DatasetLocation(root, s3DataPrefix, partitionKey, granularity,
        builder.formatHint);

    if (builder.localDataPath != null) {
      String mirrorRoot = new File(builder.localDataPath).getAbsolutePath();
      if (s3Bucket != null) {
        mirrorRoot = new File(mirrorRoot, s3Bucket).getPath();
      }
      this.localLocation = location.withRoot(mirrorRoot);
    } else {
      this.localLocation = null;
    }

    this.preferLocalData = builder.preferLocalData;
    this.tableName = builder.tableName;
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Invalid table name '" + tableName + "'");
    }
    this.dateRange = builder.dateRange;
    this.dateRange.validate(granularity);
    this.aws = builder.aws;
    this.athena = builder.athena;
    this.duckdb = builder.duckdb;
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable String getS3Bucket() {
    return s3Bucket;
  }

  public String getS3DataPrefix() {
    return s3DataPrefix;
  }

  public @Nullable DataExportType getExportType() {
    return exportType;
  }

  /** The remote (authoritative) dataset location. */
  public DatasetLocation getLocation() {
    return location;
  }

  /** The local mirror, laid out like the remote store, or null if not configured. */
  public @Nullable DatasetLocation getLocalLocation() {
    return localLocation;
  }

  public boolean isPreferLocalData() {
    return preferLocalData;
  }

  public String getTableName() {
    return tableName;
  }

  public DateRange getDateRange() {
    return dateRange;
  }

  public AwsSettings getAws() {
    return aws;
  }

  public AthenaSettings getAthena() {
    return athena;
  }

  public DuckDBSettings getDuckdb() {
    return duckdb;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.s3Bucket = s3Bucket;
    b.s3DataPrefix = s3DataPrefix;
    b.exportType = exportType;
    b.partitionKey = location.getPartitionKeyName();
    b.granularity = location.getGranularity();
    b.formatHint = location.getFormatHint();
    b.remoteRoot = location.getRoot().equals("s3://" + s3Bucket) ? null : location.getRoot();
    b.tableName = tableName;
    b.dateRange = dateRange;
    b.preferLocalData = preferLocalData;
    b.aws = aws;
    b.athena = athena;
    b.duckdb = duckdb;
    if (localLocation != null) {
      File mirror = new File(localLocation.getRoot());
      b.localDataPath = s3Bucket != null ? mirror.getParent() : mirror.getPath();
    }
    return b;
  }

  /** Builder for {@link DatasetConfig}. */
  public static final class Builder {
    private @Nullable String s3Bucket;
    private @Nullable String s3DataPrefix;
    private @Nullable DataExportType exportType;
    private @Nullable String partitionKey;
    private @Nullable Granularity granularity;
    private @Nullable FileFormat formatHint;
    private @Nullable String remoteRoot;
    private String tableName = DEFAULT_TABLE_NAME;
    private DateRange dateRange = DateRange.empty();
    private @Nullable String localDataPath;
    private boolean preferLocalData = true;
    private AwsSettings aws = AwsSettings.DEFAULT;
    private AthenaSettings athena = AthenaSettings.DEFAULT;
    private DuckDBSettings duckdb = DuckDBSettings.DEFAULT;

    private Builder() {
    }

    public Builder s3Bucket(@Nullable String s3Bucket) {
      this.s3Bucket = s3Bucket;
      return this;
    }

    public Builder s3DataPrefix(@Nullable String s3DataPrefix) {
      this.s3DataPrefix = s3DataPrefix;
      return this;
    }

    public Builder exportType(@Nullable DataExportType exportType) {
      this.exportType = exportType;
      return this;
    }

    public Builder partitionKey(@Nullable String partitionKey) {
      this.partitionKey = partitionKey;
      return this;
    }

    public Builder granularity(@Nullable Granularity granularity) {
      this.granularity = granularity;
      return this;
    }

    public Builder formatHint(@Nullable FileFormat formatHint) {
      this.formatHint = formatHint;
      return this;
    }

    /**
     * Overrides the {@code s3://bucket} root of the remote store, e.g. with a
     * directory exposed through a mounted file system.
     */
    public Builder remoteRoot(@Nullable String remoteRoot) {
      this.remoteRoot = remoteRoot;
      return this;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder dateRange(DateRange dateRange) {
      this.dateRange = dateRange == null ? DateRange.empty() : dateRange;
      return this;
    }

    public Builder dateRange(@Nullable String start, @Nullable String end) {
      return dateRange(DateRange.of(start, end));
    }

    public Builder localDataPath(@Nullable String localDataPath) {
      this.localDataPath = localDataPath;
      return this;
    }

    public Builder preferLocalData(boolean preferLocalData) {
      this.preferLocalData = preferLocalData;
      return this;
    }

    public Builder aws(AwsSettings aws) {
      this.aws = aws;
      return this;
    }

    public Builder athena(AthenaSettings athena) {
      this.athena = athena;
      return this;
    }

    public Builder duckdb(DuckDBSettings duckdb) {
      this.duckdb = duckdb;
      return this;
    }

    public DatasetConfig build() {
      return new DatasetConfig(this);
    }
  }
}
