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
package org.finops.query.backend.athena;

import org.finops.query.QueryExecutionException;
import org.finops.query.QueryTimeoutException;
import org.finops.query.backend.QueryBackend;
import org.finops.query.backend.QueryRequest;
import org.finops.query.config.AthenaSettings;
import org.finops.query.config.DatasetConfig;
import org.finops.query.credentials.CredentialProvider;
import org.finops.query.result.ColumnType;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultNormalizer;
import org.finops.query.result.ResultTable;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.athena.AmazonAthena;
import com.amazonaws.services.athena.model.EncryptionConfiguration;
import com.amazonaws.services.athena.model.EncryptionOption;
import com.amazonaws.services.athena.model.GetQueryExecutionRequest;
import com.amazonaws.services.athena.model.QueryExecution;
import com.amazonaws.services.athena.model.QueryExecutionContext;
import com.amazonaws.services.athena.model.QueryExecutionState;
import com.amazonaws.services.athena.model.QueryExecutionStatus;
import com.amazonaws.services.athena.model.ResultConfiguration;
import com.amazonaws.services.athena.model.StartQueryExecutionRequest;
import com.amazonaws.services.athena.model.StopQueryExecutionRequest;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;

/**
 * Backend that runs queries on Amazon Athena against the dataset in S3.
 *
 * <p>Every query first makes sure the dataset table is in the Glue catalog
 * (running a crawler, or registering a minimal manual table, if it is not),
 * then submits the SQL, polls the execution until it finishes and fetches
 * the result in the requested shape. Athena always reads the remote store;
 * the local mirror is never used.
 *
 * <p>Interrupting the thread that waits for a query stops the query in
 * Athena. {@link #executeAsync} runs queries on a pool of daemon threads and
 * returns futures whose {@code cancel(true)} does the same.
 */
public class AthenaQueryBackend implements QueryBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(AthenaQueryBackend.class);

  public static final String NAME = "athena";

  private static final String ENGINE = "Athena";

  private final DatasetConfig config;
  private final AthenaSettings settings;
  private final AthenaClients clients;
  private final CredentialProvider credentialProvider;
  private final Clock clock;
  private final GlueCatalogManager catalogManager;
  private final AthenaResultFetcher fetcher;
  private final JobPoller queryPoller;
  private final String s3Location;
  private final String outputLocation;

  private volatile @Nullable List<ResultColumn> cachedSchema;
  private volatile @Nullable ListeningExecutorService executor;

  public AthenaQueryBackend(DatasetConfig config) {
    this(config, CredentialProvider.fromSettings(config.getAws()), Clock.systemUTC());
  }

  public AthenaQueryBackend(DatasetConfig config, CredentialProvider credentialProvider,
      Clock clock) {
    this(config, AthenaClients.create(credentialProvider, clock), Sleeper.SYSTEM,
        credentialProvider, clock);
  }

  /**
   * Creates a backend on the given clients.
   *
   * @param credentialProvider checked for expiry before every query
   */
  public AthenaQueryBackend(DatasetConfig config, AthenaClients clients, Sleeper sleeper,
      CredentialProvider credentialProvider, Clock clock) {
    if (!config.getLocation().isRemote()) {
      throw new IllegalArgumentException(
          "Athena reads data from S3, not from " + config.getLocation().getRoot());
    }
    this.config = config;
    this.settings = config.getAthena();
    this.clients = clients;
    this.credentialProvider = credentialProvider;
    this.clock = clock;
    this.catalogManager = new GlueCatalogManager(clients.glue(), clients.sts(),
        new JobPoller(sleeper, settings.getCrawlerPollInterval(), settings.getCrawlerTimeout()),
        settings.getCrawlerRole());
    this.fetcher = new AthenaResultFetcher(clients.athena(), clients.s3());
    this.queryPoller = new JobPoller(sleeper, settings.getPollInterval(),
        settings.getQueryTimeout());
    this.s3Location = config.getLocation().getBasePath();
    String outputBucket = settings.getOutputBucket() != null
        ? settings.getOutputBucket() : config.getS3Bucket();
    this.outputLocation = "s3://" + outputBucket + "/athena-results/";
    LOGGER.info("Initialized {}", describe());
  }

  @Override public String name() {
    return NAME;
  }

  @Override public boolean supportsRemoteDirect() {
    return true;
  }

  @Override public boolean supportsLocalCache() {
    return false;
  }

  @Override public DatasetConfig getConfig() {
    return config;
  }

  @Override public boolean hasLocalData() {
    return false;
  }

  /** Glue table name; the catalog stores names in lower case. */
  private String tableName() {
    return config.getTableName().toLowerCase(Locale.ROOT);
  }

  @Override public QueryResult execute(QueryRequest request) {
    if (!request.isForceRemote()) {
      LOGGER.debug("Athena always reads remote data; ignoring forceRemote=false");
    }
    credentialProvider.resolve().checkNotExpired(clock);
    try {
      ensureTable();
      String executionId = submit(request.getSql());
      QueryExecution execution = awaitCompletion(executionId);
      return fetch(execution, request.getFormat());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryExecutionException(ENGINE, "Interrupted while waiting for Athena", e);
    } catch (SdkClientException e) {
      throw new QueryExecutionException(ENGINE, e.getMessage(), e);
    } catch (IOException e) {
      throw new QueryExecutionException(ENGINE,
          "Failed to read Athena result: " + e.getMessage(), e);
    }
  }

  /**
   * Runs the query on a background thread. Cancelling the future with
   * {@code mayInterruptIfRunning} stops the query in Athena.
   */
  public ListenableFuture<QueryResult> executeAsync(String sql, OutputFormat format) {
    QueryRequest request = new QueryRequest(sql, format, true);
    return executor().submit(() -> execute(request));
  }

  private ListeningExecutorService executor() {
    ListeningExecutorService current = executor;
    if (current == null) {
      synchronized (this) {
        current = executor;
        if (current == null) {
          current = MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(
              new ThreadFactoryBuilder()
                  .setDaemon(true)
                  .setNameFormat("athena-query-%d")
                  .build()));
          executor = current;
        }
      }
    }
    return current;
  }

  private void ensureTable() throws InterruptedException {
    GlueCatalogManager.CatalogState state =
        catalogManager.ensureTable(settings.getDatabase(), tableName(), s3Location);
    if (state == GlueCatalogManager.CatalogState.MANUAL_SCHEMA_REQUIRED) {
      LOGGER.warn("Registering a minimal manual schema for {}; only a few columns will be"
          + " queryable", tableName());
      String executionId = submit(GlueCatalogManager.manualTableDdl(tableName(), s3Location));
      awaitCompletion(executionId);
    }
  }

  private String submit(String sql) {
    String executionId = clients.athena().startQueryExecution(new StartQueryExecutionRequest()
        .withQueryString(sql)
        .withQueryExecutionContext(new QueryExecutionContext()
            .withDatabase(settings.getDatabase()))
        .withResultConfiguration(new ResultConfiguration()
            .withOutputLocation(outputLocation)
            .withEncryptionConfiguration(new EncryptionConfiguration()
                .withEncryptionOption(EncryptionOption.SSE_S3)))
        .withWorkGroup(settings.getWorkgroup()))
        .getQueryExecutionId();
    LOGGER.debug("Submitted Athena query {}", executionId);
    return executionId;
  }

  private QueryExecution awaitCompletion(String executionId) throws InterruptedException {
    AmazonAthena athena = clients.athena();
    try {
      return queryPoller.await("Athena query " + executionId, () -> {
        QueryExecution execution = athena.getQueryExecution(
            new GetQueryExecutionRequest().withQueryExecutionId(executionId))
            .getQueryExecution();
        QueryExecutionStatus status = execution.getStatus();
        QueryExecutionState state = QueryExecutionState.fromValue(status.getState());
        switch (state) {
        case SUCCEEDED:
          return execution;
        case FAILED:
        case CANCELLED:
          String reason = status.getStateChangeReason();
          throw new QueryExecutionException(ENGINE,
              reason != null ? reason : "Query " + executionId + " " + state);
        default:
          return null;
        }
      });
    } catch (InterruptedException | QueryTimeoutException e) {
      stopQuietly(executionId);
      throw e;
    }
  }

  private void stopQuietly(String executionId) {
    try {
      clients.athena().stopQueryExecution(
          new StopQueryExecutionRequest().withQueryExecutionId(executionId));
      LOGGER.info("Requested stop of Athena query {}", executionId);
    } catch (SdkClientException e) {
      LOGGER.warn("Could not stop Athena query {}: {}", executionId, e.getMessage());
    }
  }

  private QueryResult fetch(QueryExecution execution, OutputFormat format) throws IOException {
    String executionId = execution.getQueryExecutionId();
    String resultLocation = execution.getResultConfiguration() != null
        && execution.getResultConfiguration().getOutputLocation() != null
        ? execution.getResultConfiguration().getOutputLocation()
        : outputLocation + executionId + ".csv";
    switch (format) {
    case RECORDS:
      return QueryResult.records(fetcher.records(executionId));
    case CSV:
      return QueryResult.csv(fetcher.csv(resultLocation));
    case NATIVE:
      return QueryResult.nativeResult(new AthenaQueryHandle(executionId, resultLocation));
    case TABLE:
    case COLUMNAR:
      ResultTable table = fetcher.table(executionId, resultLocation);
      return ResultNormalizer.normalize(table, format, null);
    default:
      throw new AssertionError("unknown format " + format);
    }
  }

  @Override public List<ResultColumn> schema() {
    List<ResultColumn> schema = cachedSchema;
    if (schema == null) {
      String sql = "SELECT column_name, data_type FROM information_schema.columns"
          + " WHERE table_schema = '" + settings.getDatabase() + "'"
          + " AND table_name = '" + tableName() + "'";
      QueryResult result = execute(sql, OutputFormat.RECORDS, true);
      schema = new ArrayList<>();
      for (Map<String, Object> row : ((QueryResult.Records) result).getRows()) {
        schema.add(new ResultColumn(String.valueOf(row.get("column_name")),
            ColumnType.fromAthenaType(String.valueOf(row.get("data_type")))));
      }
      cachedSchema = schema;
    }
    return schema;
  }

  @Override public Map<String, Object> catalog() {
    Map<String, Object> catalog = new LinkedHashMap<>();
    catalog.put("engine", NAME);
    catalog.put("table", config.getTableName());
    catalog.put("database", settings.getDatabase());
    catalog.put("workgroup", settings.getWorkgroup());
    catalog.put("exportType",
        config.getExportType() == null ? null : config.getExportType().getValue());
    catalog.put("partitionKey", config.getLocation().getPartitionKeyName());
    catalog.put("granularity", config.getLocation().getGranularity());
    catalog.put("remoteLocation", s3Location);
    catalog.put("outputLocation", outputLocation);
    catalog.put("hasLocalData", false);
    catalog.put("dateRange", config.getDateRange().toString());
    catalog.put("supportsRemoteDirect", supportsRemoteDirect());
    catalog.put("supportsLocalCache", supportsLocalCache());
    catalog.put("schema", schema());
    return catalog;
  }

  public String describe() {
    return NAME + " over " + s3Location + " as " + settings.getDatabase() + "."
        + tableName() + " (workgroup " + settings.getWorkgroup() + ", results in "
        + outputLocation + ")";
  }

  @Override public void close() {
    ListeningExecutorService current = executor;
    if (current != null) {
      current.shutdownNow();
    }
    clients.shutdown();
  }
}
