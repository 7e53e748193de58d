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

import org.finops.query.DataNotFoundException;
import org.finops.query.QueryException;
import org.finops.query.config.DatasetConfig;
import org.finops.query.config.DatasetLocation;
import org.finops.query.config.FileFormat;
import org.finops.query.credentials.AwsSessionCredentials;
import org.finops.query.credentials.CredentialProvider;
import org.finops.query.credentials.ResolvingCredentialsProvider;
import org.finops.query.partition.PartitionCatalog;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultColumn;
import org.finops.query.sidetable.NamedTable;
import org.finops.query.sidetable.SideTableProvider;
import org.finops.query.sidetable.SideTables;
import org.finops.query.source.DataSourceSelector;
import org.finops.query.source.SourceSelection;
import org.finops.query.storage.S3StorageProvider;
import org.finops.query.storage.StorageProvider;
import org.finops.query.storage.StorageProviderFactory;

import com.amazonaws.services.s3.AmazonS3;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of the backends that run the query in-process.
 *
 * <p>{@link #execute(QueryRequest)} picks the local mirror or the remote
 * store, discovers the data files in the configured date range and hands
 * them to {@link #executeOver}, which materializes the dataset relation in a
 * fresh engine context, runs the SQL and converts the result.
 */
public abstract class AbstractEmbeddedBackend implements QueryBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractEmbeddedBackend.class);

  protected final DatasetConfig config;
  private final @Nullable SideTableProvider sideTableProvider;
  private final CredentialProvider credentialProvider;
  private final Clock clock;
  private final PartitionCatalog remoteCatalog;
  private final @Nullable PartitionCatalog localCatalog;

  private volatile @Nullable List<ResultColumn> cachedSchema;

  protected AbstractEmbeddedBackend(DatasetConfig config,
      @Nullable SideTableProvider sideTableProvider) {
    this(config, sideTableProvider, CredentialProvider.fromSettings(config.getAws()),
        Clock.systemUTC());
  }

  protected AbstractEmbeddedBackend(DatasetConfig config,
      @Nullable SideTableProvider sideTableProvider, CredentialProvider credentialProvider,
      Clock clock) {
    this(config, sideTableProvider, credentialProvider, clock,
        s3Client(config, credentialProvider, clock));
  }

  private AbstractEmbeddedBackend(DatasetConfig config,
      @Nullable SideTableProvider sideTableProvider, CredentialProvider credentialProvider,
      Clock clock, Supplier<AmazonS3> s3Client) {
    this(config, sideTableProvider, credentialProvider, clock,
        StorageProviderFactory.forLocation(config.getLocation(), s3Client),
        config.getLocalLocation() == null ? null
            : StorageProviderFactory.forLocation(config.getLocalLocation(), s3Client));
  }

  /**
   * Creates a backend reading the remote location and the local mirror
   * through the given storage providers.
   *
   * @param localStorage storage of the local mirror; ignored when no mirror
   *     is configured
   */
  protected AbstractEmbeddedBackend(DatasetConfig config,
      @Nullable SideTableProvider sideTableProvider, CredentialProvider credentialProvider,
      Clock clock, StorageProvider remoteStorage, @Nullable StorageProvider localStorage) {
    this.config = config;
    this.sideTableProvider = sideTableProvider;
    this.credentialProvider = credentialProvider;
    this.clock = clock;
    this.remoteCatalog = new PartitionCatalog(remoteStorage);
    this.localCatalog = config.getLocalLocation() == null || localStorage == null ? null
        : new PartitionCatalog(localStorage);
  }

  /**
   * S3 client created on first use. It resolves and checks the credentials
   * on every request.
   */
  private static Supplier<AmazonS3> s3Client(DatasetConfig config,
      CredentialProvider credentialProvider, Clock clock) {
    return Suppliers.memoize(() -> S3StorageProvider.createClient(
        new ResolvingCredentialsProvider(credentialProvider, clock),
        credentialProvider.resolve().getRegion(), config.getAws().getEndpoint()));
  }

  /**
   * Runs the request over the discovered files.
   *
   * @param request the query
   * @param location the location the files were discovered under
   * @param format format of every file in {@code files}
   * @param files data files; never empty
   */
  protected abstract QueryResult executeOver(QueryRequest request, DatasetLocation location,
      FileFormat format, List<String> files);

  @Override public DatasetConfig getConfig() {
    return config;
  }

  @Override public boolean supportsRemoteDirect() {
    return true;
  }

  @Override public boolean supportsLocalCache() {
    return true;
  }

  @Override public QueryResult execute(QueryRequest request) {
    boolean preferLocal = config.isPreferLocalData();
    List<String> localFiles = !request.isForceRemote() && preferLocal
        ? localFiles() : Collections.<String>emptyList();
    SourceSelection selection = DataSourceSelector.select(request.isForceRemote(), preferLocal,
        !localFiles.isEmpty());
    if (selection.shouldWarn()) {
      LOGGER.warn("Local data not available under {}, querying remote data at {}",
          config.getLocalLocation() == null ? "(no local path)"
              : config.getLocalLocation().getBasePath(),
          config.getLocation().getBasePath());
    } else {
      LOGGER.info("{}: using {} data ({})", name(), selection.getSource(),
          selection.getReason());
    }

    DatasetLocation location;
    List<String> files;
    if (selection.isLocal()) {
      location = config.getLocalLocation();
      files = localFiles;
    } else {
      location = config.getLocation();
      if (location.isRemote()) {
        credentials();
      }
      files = remoteCatalog.discover(location, config.getDateRange());
    }

    if (files.isEmpty()) {
      throw new DataNotFoundException("No data files found under " + location.getBasePath()
          + " for date range " + config.getDateRange());
    }
    FileFormat format = FileFormat.of(files.get(0));
    LOGGER.debug("{}: {} {} files under {}", name(), files.size(), format,
        location.getBasePath());
    return executeOver(request, location, format, files);
  }

  @Override public boolean hasLocalData() {
    return !localFiles().isEmpty();
  }

  /** Data files of the local mirror in the date range; empty when there are none. */
  private List<String> localFiles() {
    DatasetLocation local = config.getLocalLocation();
    if (local == null || localCatalog == null) {
      return Collections.emptyList();
    }
    try {
      return localCatalog.discover(local, config.getDateRange());
    } catch (QueryException e) {
      LOGGER.debug("Listing local data under {} failed: {}", local.getBasePath(), e.getMessage());
      return Collections.emptyList();
    }
  }

  @Override public List<ResultColumn> schema() {
    List<ResultColumn> schema = cachedSchema;
    if (schema == null) {
      QueryResult result =
          execute("SELECT * FROM " + config.getTableName() + " LIMIT 0", OutputFormat.TABLE);
      schema = ((QueryResult.Table) result).getTable().getColumns();
      cachedSchema = schema;
    }
    return schema;
  }

  @Override public Map<String, Object> catalog() {
    Map<String, Object> catalog = new LinkedHashMap<>();
    catalog.put("engine", name());
    catalog.put("table", config.getTableName());
    catalog.put("exportType",
        config.getExportType() == null ? null : config.getExportType().getValue());
    catalog.put("partitionKey", config.getLocation().getPartitionKeyName());
    catalog.put("granularity", config.getLocation().getGranularity());
    catalog.put("remoteLocation", config.getLocation().getBasePath());
    catalog.put("localLocation",
        config.getLocalLocation() == null ? null : config.getLocalLocation().getBasePath());
    catalog.put("preferLocalData", config.isPreferLocalData());
    catalog.put("hasLocalData", hasLocalData());
    catalog.put("dateRange", config.getDateRange().toString());
    catalog.put("supportsRemoteDirect", supportsRemoteDirect());
    catalog.put("supportsLocalCache", supportsLocalCache());
    catalog.put("schema", schema());
    return catalog;
  }

  /** One-line description of the backend and its dataset. */
  public String describe() {
    return name() + " over " + config.getLocation().getBasePath()
        + (config.getLocalLocation() == null ? ""
            : " (local mirror " + config.getLocalLocation().getBasePath() + ")")
        + " as " + config.getTableName() + ", range " + config.getDateRange();
  }

  /**
   * Resolves the credentials for a remote read.
   *
   * @throws org.finops.query.ConfigurationException with reason
   *     {@code CREDENTIALS_EXPIRED} when they have expired
   */
  protected AwsSessionCredentials credentials() {
    return credentialProvider.resolve().checkNotExpired(clock);
  }

  /** Storage provider able to read files under the given location. */
  protected StorageProvider storageFor(DatasetLocation location) {
    if (location.equals(config.getLocalLocation()) && localCatalog != null) {
      return localCatalog.getStorage();
    }
    return remoteCatalog.getStorage();
  }

  /**
   * Side tables to attach, or none. Provider warnings are logged; a provider
   * that throws is logged and skipped.
   */
  protected List<NamedTable> sideTables() {
    if (sideTableProvider == null) {
      return SideTables.empty().getTables();
    }
    SideTables sideTables;
    try {
      sideTables = sideTableProvider.get();
    } catch (RuntimeException e) {
      LOGGER.warn("Side table provider failed, continuing without side tables: {}",
          e.getMessage(), e);
      return SideTables.empty().getTables();
    }
    for (String warning : sideTables.getWarnings()) {
      LOGGER.warn("Side table warning: {}", warning);
    }
    return sideTables.getTables();
  }
}
