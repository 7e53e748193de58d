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

import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves credentials through the AWS default provider chain (environment,
 * system properties, profile, container and instance roles).
 */
public class DefaultChainCredentialProvider implements CredentialProvider {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DefaultChainCredentialProvider.class);

  private final @Nullable String region;

  public DefaultChainCredentialProvider(@Nullable String region) {
    this.region = region;
  }

  @Override public AwsSessionCredentials resolve() {
    AWSCredentials credentials;
    try {
      credentials = DefaultAWSCredentialsProviderChain.getInstance().getCredentials();
    } catch (SdkClientException e) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "No AWS credentials found in the default provider chain", e);
    }
    String sessionToken = credentials instanceof AWSSessionCredentials
        ? ((AWSSessionCredentials) credentials).getSessionToken()
        : null;
    return new AwsSessionCredentials(credentials.getAWSAccessKeyId(),
        credentials.getAWSSecretKey(), sessionToken, resolveRegion(), null);
  }

  private String resolveRegion() {
    if (region != null) {
      return region;
    }
    try {
      return new DefaultAwsRegionProviderChain().getRegion();
    } catch (SdkClientException e) {
      LOGGER.debug("No region in the default region chain, using {}",
          AwsSessionCredentials.DEFAULT_REGION);
      return AwsSessionCredentials.DEFAULT_REGION;
    }
  }
}
