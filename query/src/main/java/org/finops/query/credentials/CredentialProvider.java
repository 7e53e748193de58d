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

import org.finops.query.config.AwsSettings;

/**
 * Source of AWS credentials for the remote store and the Athena backend.
 *
 * <p>Issuing and refreshing credentials is not done here; a provider only
 * hands out the credential set that is currently valid.
 */
public interface CredentialProvider {

  /**
   * Resolves the current credential set.
   *
   * @throws org.finops.query.ConfigurationException if no credentials can be found
   */
  AwsSessionCredentials resolve();

  /**
   * Returns a provider for the given settings: the static keys when both are
   * present, the AWS default provider chain otherwise.
   */
  static CredentialProvider fromSettings(AwsSettings settings) {
    if (settings.hasStaticKeys()) {
      return new StaticCredentialProvider(settings);
    }
    return new DefaultChainCredentialProvider(settings.getRegion());
  }
}
