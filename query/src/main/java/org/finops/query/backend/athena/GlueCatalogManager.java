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

import org.finops.query.QueryTimeoutException;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.glue.AWSGlue;
import com.amazonaws.services.glue.model.Crawler;
import com.amazonaws.services.glue.model.CrawlerTargets;
import com.amazonaws.services.glue.model.CreateCrawlerRequest;
import com.amazonaws.services.glue.model.DeleteBehavior;
import com.amazonaws.services.glue.model.DeleteCrawlerRequest;
import com.amazonaws.services.glue.model.EntityNotFoundException;
import com.amazonaws.services.glue.model.GetCrawlerRequest;
import com.amazonaws.services.glue.model.GetTableRequest;
import com.amazonaws.services.glue.model.LastCrawlInfo;
import com.amazonaws.services.glue.model.LineageConfiguration;
import com.amazonaws.services.glue.model.RecrawlPolicy;
import com.amazonaws.services.glue.model.S3Target;
import com.amazonaws.services.glue.model.SchemaChangePolicy;
import com.amazonaws.services.glue.model.StartCrawlerRequest;
import com.amazonaws.services.glue.model.UpdateBehavior;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.model.GetCallerIdentityRequest;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.Locale;

/**
 * Makes sure the dataset table exists in the Glue Data Catalog.
 *
 * <p>A missing table is discovered with a Glue crawler over the dataset
 * location: any stale crawler of the same name is deleted, a new one is
 * created, started and polled until it is ready again. When the crawler
 * cannot be created, when its crawl does not succeed, or when it finishes
 * without producing the table, the caller registers a minimal manual schema
 * ({@link #manualTableDdl}) and continues in degraded mode.
 */
public class GlueCatalogManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(GlueCatalogManager.class);

  static final String CRAWLER_READY = "READY";
  static final String CRAWL_SUCCEEDED = "SUCCEEDED";

  /** Result of {@link #ensureTable}. */
  public enum CatalogState {
    /** The table was already in the catalog. */
    PRESENT,
    /** A crawler created the table. */
    CRAWLED,
    /** Schema discovery failed; a manual table definition is needed. */
    MANUAL_SCHEMA_REQUIRED
  }

  private final AWSGlue glue;
  private final AWSSecurityTokenService sts;
  private final JobPoller crawlerPoller;
  private final @Nullable String crawlerRole;

  public GlueCatalogManager(AWSGlue glue, AWSSecurityTokenService sts, JobPoller crawlerPoller,
      @Nullable String crawlerRole) {
    this.glue = glue;
    this.sts = sts;
    this.crawlerPoller = crawlerPoller;
    this.crawlerRole = crawlerRole;
  }

  public boolean tableExists(String database, String table) {
    try {
      glue.getTable(new GetTableRequest()
          .withDatabaseName(database)
          .withName(table.toLowerCase(Locale.ROOT)));
      return true;
    } catch (EntityNotFoundException e) {
      return false;
    }
  }

  /**
   * Checks the catalog and runs schema discovery if the table is missing.
   *
   * @param s3Path dataset location, {@code s3://bucket/prefix/}
   * @throws InterruptedException if interrupted while waiting for the crawler
   */
  public CatalogState ensureTable(String database, String table, String s3Path)
      throws InterruptedException {
    if (tableExists(database, table)) {
      LOGGER.debug("Table {}.{} found in the Glue catalog", database, table);
      return CatalogState.PRESENT;
    }
    LOGGER.info("Table {}.{} not found, running a Glue crawler over {}", database, table,
        s3Path);

    String crawlerName = crawlerName(table);
    try {
      createCrawler(crawlerName, database, table, s3Path);
    } catch (SdkClientException e) {
      LOGGER.warn("Could not create Glue crawler {}: {}", crawlerName, e.getMessage());
      return CatalogState.MANUAL_SCHEMA_REQUIRED;
    }

    LastCrawlInfo lastCrawl;
    try {
      lastCrawl = runCrawler(crawlerName);
    } catch (QueryTimeoutException e) {
      LOGGER.warn("Glue crawler {} did not finish: {}", crawlerName, e.getMessage());
      return CatalogState.MANUAL_SCHEMA_REQUIRED;
    } catch (SdkClientException e) {
      LOGGER.warn("Glue crawler {} could not be run: {}", crawlerName, e.getMessage());
      return CatalogState.MANUAL_SCHEMA_REQUIRED;
    }

    if (!CRAWL_SUCCEEDED.equals(lastCrawl.getStatus())) {
      LOGGER.warn("Glue crawler {} ended with status {}: {}", crawlerName, lastCrawl.getStatus(),
          lastCrawl.getErrorMessage());
      return CatalogState.MANUAL_SCHEMA_REQUIRED;
    }
    if (!tableExists(database, table)) {
      LOGGER.warn("Glue crawler {} succeeded but did not create table {}.{}", crawlerName,
          database, table);
      return CatalogState.MANUAL_SCHEMA_REQUIRED;
    }
    LOGGER.info("Glue crawler {} created table {}.{}", crawlerName, database, table);
    return CatalogState.CRAWLED;
  }

  /**
   * Minimal external table over the dataset location, used when schema
   * discovery fails.
   */
  public static String manualTableDdl(String table, String s3Path) {
    return "CREATE EXTERNAL TABLE IF NOT EXISTS " + table + " (\n"
        + "  line_item_unblended_cost double,\n"
        + "  product_servicecode string,\n"
        + "  line_item_usage_start_date string,\n"
        + "  line_item_resource_id string\n"
        + ")\n"
        + "STORED AS PARQUET\n"
        + "LOCATION '" + s3Path + "'";
  }

  static String crawlerName(String table) {
    return table + "_crawler";
  }

  private void createCrawler(String crawlerName, String database, String table, String s3Path) {
    try {
      glue.deleteCrawler(new DeleteCrawlerRequest().withName(crawlerName));
      LOGGER.info("Deleted stale Glue crawler {}", crawlerName);
    } catch (EntityNotFoundException e) {
      LOGGER.debug("No stale Glue crawler {}", crawlerName);
    }

    glue.createCrawler(new CreateCrawlerRequest()
        .withName(crawlerName)
        .withRole(resolveRole())
        .withDatabaseName(database)
        .withDescription("Schema discovery for the " + table + " billing dataset")
        .withTargets(new CrawlerTargets().withS3Targets(new S3Target().withPath(s3Path)))
        .withTablePrefix("")
        .withSchemaChangePolicy(new SchemaChangePolicy()
            .withUpdateBehavior(UpdateBehavior.UPDATE_IN_DATABASE)
            .withDeleteBehavior(DeleteBehavior.LOG))
        .withRecrawlPolicy(new RecrawlPolicy().withRecrawlBehavior("CRAWL_EVERYTHING"))
        .withLineageConfiguration(
            new LineageConfiguration().withCrawlerLineageSettings("DISABLE")));
    LOGGER.info("Created Glue crawler {}", crawlerName);
  }

  private LastCrawlInfo runCrawler(String crawlerName) throws InterruptedException {
    Date startRequested = new Date();
    glue.startCrawler(new StartCrawlerRequest().withName(crawlerName));
    LOGGER.info("Started Glue crawler {}", crawlerName);

    boolean[] seenRunning = {false};
    return crawlerPoller.await("Glue crawler " + crawlerName, () -> {
      Crawler crawler = glue.getCrawler(new GetCrawlerRequest().withName(crawlerName))
          .getCrawler();
      String state = crawler.getState();
      if (!CRAWLER_READY.equals(state)) {
        seenRunning[0] = true;
        LOGGER.debug("Glue crawler {} is {}", crawlerName, state);
        return null;
      }
      LastCrawlInfo lastCrawl = crawler.getLastCrawl();
      if (lastCrawl == null) {
        return null;
      }
      boolean thisCrawl = seenRunning[0]
          || lastCrawl.getStartTime() == null
          || !lastCrawl.getStartTime().before(new Date(startRequested.getTime() - 1000));
      return thisCrawl ? lastCrawl : null;
    });
  }

  private String resolveRole() {
    if (crawlerRole != null) {
      return crawlerRole;
    }
    String account = sts.getCallerIdentity(new GetCallerIdentityRequest()).getAccount();
    return "arn:aws:iam::" + account + ":role/service-role/AWSGlueServiceRole-DefaultRole";
  }
}
