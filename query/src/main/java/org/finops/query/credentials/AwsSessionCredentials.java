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
package org.finops.query.credentials;

import org.finops.query.ConfigurationException;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A resolved AWS credential set, optionally temporary.
 */
public final class AwsSessionCredentials {
  private static final Logger LOGGER = LoggerFactory.getLogger(AwsSessionCredentials.class);

  /** Remaining lifetime below which a warning is logged. */
  public static final Duration EXPIRY_WARNING = Duration.ofMinutes(15);

  public static final String DEFAULT_REGION = "us-east-1";

  private final String accessKeyId;
  private final String secretAccessKey;
  private final @Nullable String sessionToken;
  private final String region;
  private final @Nullable Instant expiration;

  public AwsSessionCredentials(String accessKeyId, String secretAccessKey,
      @Nullable String sessionToken, @Nullable String region, @Nullable Instant expiration) {
    this.accessKeyId = accessKeyId;
    this.secretAccessKey = secretAccessKey;
    this.sessionToken = sessionToken;
    this.region = region == null ? DEFAULT_REGION : region;
    this.expiration = expiration;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public String getSecretAccessKey() {
    return secretAccessKey;
  }

  public @Nullable String getSessionToken() {
    return sessionToken;
  }

  public String getRegion() {
    return region;
  }

  public @Nullable Instant getExpiration() {
    return expiration;
  }

  /**
   * Fails if the credentials have expired; logs a warning when they expire
   * within {@link #EXPIRY_WARNING}. Credentials without an expiration never
   * expire.
   *
   * @throws ConfigurationException with reason {@code CREDENTIALS_EXPIRED}
   */
  public AwsSessionCredentials checkNotExpired(Clock clock) {
    if (expiration == null) {
      return this;
    }
    Duration remaining = Duration.between(clock.instant(), expiration);
    if (remaining.isNegative() || remaining.isZero()) {
      throw new ConfigurationException(ConfigurationException.Reason.CREDENTIALS_EXPIRED,
          "AWS credentials expired at " + expiration);
    }
    if (remaining.compareTo(EXPIRY_WARNING) <= 0) {
      LOGGER.warn("AWS credentials expire in {} minutes (at {})",
          remaining.toMinutes(), expiration);
    }
    return this;
  }

  /** Converts these credentials to the AWS SDK type; session credentials keep their token. */
  public AWSCredentials toAwsCredentials() {
    return sessionToken != null
        ? new BasicSessionCredentials(accessKeyId, secretAccessKey, sessionToken)
        : new BasicAWSCredentials(accessKeyId, secretAccessKey);
  }

  @Override public String toString() {
    return "AwsSessionCredentials{accessKeyId=" + accessKeyId
        + ", region=" + region
        + ", temporary=" + (sessionToken != null)
        + ", expiration=" + expiration + "}";
  }
}
