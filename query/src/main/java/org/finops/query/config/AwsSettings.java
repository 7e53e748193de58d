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

import java.time.Instant;

/**
 * AWS connection settings from the dataset configuration. Any field may be
 * null; missing keys fall back to the SDK's default provider chains.
 */
public final class AwsSettings {
  public static final AwsSettings DEFAULT =
      new AwsSettings(null, null, null, null, null, null);

  private final @Nullable String region;
  private final @Nullable String accessKeyId;
  private final @Nullable String secretAccessKey;
  private final @Nullable String sessionToken;
  private final @Nullable Instant expiration;
  private final @Nullable String endpoint;

  public AwsSettings(@Nullable String region, @Nullable String accessKeyId,
      @Nullable String secretAccessKey, @Nullable String sessionToken,
      @Nullable Instant expiration, @Nullable String endpoint) {
    this.region = region;
    this.accessKeyId = accessKeyId;
    this.secretAccessKey = secretAccessKey;
    this.sessionToken = sessionToken;
    this.expiration = expiration;
    this.endpoint = endpoint;
  }

  public @Nullable String getRegion() {
    return region;
  }

  public @Nullable String getAccessKeyId() {
    return accessKeyId;
  }

  public @Nullable String getSecretAccessKey() {
    return secretAccessKey;
  }

  public @Nullable String getSessionToken() {
    return sessionToken;
  }

  public @Nullable Instant getExpiration() {
    return expiration;
  }

  /** Custom S3 endpoint (MinIO and other S3-compatible stores). */
  public @Nullable String getEndpoint() {
    return endpoint;
  }

  public boolean hasStaticKeys() {
    return accessKeyId != null && secretAccessKey != null;
  }
}
