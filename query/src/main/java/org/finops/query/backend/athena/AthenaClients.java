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

import org.finops.query.credentials.CredentialProvider;
import org.finops.query.credentials.ResolvingCredentialsProvider;
import org.finops.query.storage.S3StorageProvider;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.services.athena.AmazonAthena;
import com.amazonaws.services.athena.AmazonAthenaClientBuilder;
import com.amazonaws.services.glue.AWSGlue;
import com.amazonaws.services.glue.AWSGlueClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.AWSSecurityTokenServiceClientBuilder;

import java.time.Clock;

/**
 * The AWS service clients used by the Athena backend.
 */
public final class AthenaClients {
  private final AmazonAthena athena;
  private final AWSGlue glue;
  private final AmazonS3 s3;
  private final AWSSecurityTokenService sts;

  public AthenaClients(AmazonAthena athena, AWSGlue glue, AmazonS3 s3,
      AWSSecurityTokenService sts) {
    this.athena = athena;
    this.glue = glue;
    this.s3 = s3;
    this.sts = sts;
  }

  /**
   * Builds clients for the credentials' region. The clients resolve the
   * credentials again on every request.
   *
   * @throws org.finops.query.ConfigurationException if the credentials have
   *     already expired
   */
  public static AthenaClients create(CredentialProvider provider, Clock clock) {
    String region = provider.resolve().checkNotExpired(clock).getRegion();
    AWSCredentialsProvider credentials = new ResolvingCredentialsProvider(provider, clock);
    return new AthenaClients(
        AmazonAthenaClientBuilder.standard()
            .withCredentials(credentials)
            .withRegion(region)
            .build(),
        AWSGlueClientBuilder.standard()
            .withCredentials(credentials)
            .withRegion(region)
            .build(),
        S3StorageProvider.createClient(credentials, region, null),
        AWSSecurityTokenServiceClientBuilder.standard()
            .withCredentials(credentials)
            .withRegion(region)
            .build());
  }

  public AmazonAthena athena() {
    return athena;
  }

  public AWSGlue glue() {
    return glue;
  }

  public AmazonS3 s3() {
    return s3;
  }

  public AWSSecurityTokenService sts() {
    return sts;
  }

  public void shutdown() {
    athena.shutdown();
    glue.shutdown();
    s3.shutdown();
    sts.shutdown();
  }
}
