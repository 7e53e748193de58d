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

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;

import java.time.Clock;

/**
 * SDK credentials provider that asks a {@link CredentialProvider} for the
 * current credential set on every request, so rotated credentials are used
 * as soon as the provider hands them out and expired ones are refused with
 * {@code CREDENTIALS_EXPIRED} instead of being sent to AWS.
 */
public class ResolvingCredentialsProvider implements AWSCredentialsProvider {
  private final CredentialProvider provider;
  private final Clock clock;

  public ResolvingCredentialsProvider(CredentialProvider provider, Clock clock) {
    this.provider = provider;
    this.clock = clock;
  }

  @Override public AWSCredentials getCredentials() {
    return provider.resolve().checkNotExpired(clock).toAwsCredentials();
  }

  @Override public void refresh() {
    // nothing is cached here
  }
}
