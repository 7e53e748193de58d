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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;

/**
 * Athena and Glue settings for the distributed backend.
 */
public final class AthenaSettings {
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_CRAWLER_POLL_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_CRAWLER_TIMEOUT = Duration.ofMinutes(5);

  public static final AthenaSettings DEFAULT =
      new AthenaSettings("default", "primary", null, null,
          DEFAULT_POLL_INTERVAL, DEFAULT_QUERY_TIMEOUT,
          DEFAULT_CRAWLER_POLL_INTERVAL, DEFAULT_CRAWLER_TIMEOUT);

  private final String database;
  private final String workgroup;
  private final @Nullable String outputBucket;
  private final @Nullable String crawlerRole;
  private final Duration pollInterval;
  private final Duration queryTimeout;
  private final Duration crawlerPollInterval;
  private final Duration crawlerTimeout;

  public AthenaSettings(String database, String workgroup, @Nullable String outputBucket,
      @Nullable String crawlerRole, Duration pollInterval, Duration queryTimeout,
      Duration crawlerPollInterval, Duration crawlerTimeout) {
    this.database = database;
    this.workgroup = workgroup;
    this.outputBucket = outputBucket;
    this.crawlerRole = crawlerRole;
    this.pollInterval = pollInterval;
    this.queryTimeout = queryTimeout;
    this.crawlerPollInterval = crawlerPollInterval;
    this.crawlerTimeout = crawlerTimeout;
  }

  public String getDatabase() {
    return database;
  }

  public String getWorkgroup() {
    return workgroup;
  }

  /** Bucket for query output; null means the dataset bucket. */
  public @Nullable String getOutputBucket() {
    return outputBucket;
  }

  /** IAM role ARN for the Glue crawler; null derives the default service role. */
  public @Nullable String getCrawlerRole() {
    return crawlerRole;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public Duration getCrawlerPollInterval() {
    return crawlerPollInterval;
  }

  public Duration getCrawlerTimeout() {
    return crawlerTimeout;
  }
}
