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
import org.finops.query.config.AwsSettings;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSSessionCredentials;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AwsSessionCredentials} and the credential providers.
 */
@Tag("unit")
public class AwsSessionCredentialsTest {
  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static AwsSessionCredentials expiringAt(Instant expiration) {
    return new AwsSessionCredentials("AKIATEST", "secret", "token", "eu-west-1", expiration);
  }

  @Test
  void testExpiredCredentialsFailFast() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> expiringAt(NOW.minusSeconds(1)).checkNotExpired(CLOCK));
    assertEquals(ConfigurationException.Reason.CREDENTIALS_EXPIRED, e.getReason());

    assertThrows(ConfigurationException.class, () -> expiringAt(NOW).checkNotExpired(CLOCK));
  }

  @Test
  void testSoonExpiringCredentialsStillUsable() {
    AwsSessionCredentials credentials = expiringAt(NOW.plus(Duration.ofMinutes(5)));
    assertSame(credentials, credentials.checkNotExpired(CLOCK));
  }

  @Test
  void testCredentialsWithoutExpiration() {
    AwsSessionCredentials credentials =
        new AwsSessionCredentials("AKIATEST", "secret", null, null, null);
    assertSame(credentials, credentials.checkNotExpired(CLOCK));
    assertEquals(AwsSessionCredentials.DEFAULT_REGION, credentials.getRegion());
  }

  @Test
  void testSdkAdapter() {
    AWSCredentials session = expiringAt(null).toAwsCredentials();
    assertTrue(session instanceof AWSSessionCredentials);
    assertEquals("token", ((AWSSessionCredentials) session).getSessionToken());

    AWSCredentials basic = new AwsSessionCredentials("AKIATEST", "secret", null, null, null)
        .toAwsCredentials();
    assertFalse(basic instanceof AWSSessionCredentials);
    assertEquals("AKIATEST", basic.getAWSAccessKeyId());
  }

  @Test
  void testToStringHidesSecret() {
    String text = expiringAt(null).toString();
    assertTrue(text.contains("AKIATEST"));
    assertFalse(text.contains("secret"));
    assertFalse(text.contains("token"));
  }

  @Test
  void testProviderSelection() {
    AwsSettings keys = new AwsSettings("eu-west-1", "AKIATEST", "secret", null,
        NOW.plusSeconds(3600), null);
    CredentialProvider provider = CredentialProvider.fromSettings(keys);
    assertTrue(provider instanceof StaticCredentialProvider);
    assertEquals("eu-west-1", provider.resolve().getRegion());
    assertEquals(NOW.plusSeconds(3600), provider.resolve().getExpiration());

    assertTrue(CredentialProvider.fromSettings(AwsSettings.DEFAULT)
        instanceof DefaultChainCredentialProvider);
  }

  @Test
  void testStaticProviderNeedsBothKeys() {
    AwsSettings halfKeys = new AwsSettings(null, "AKIATEST", null, null, null, null);
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> new StaticCredentialProvider(halfKeys));
    assertEquals(ConfigurationException.Reason.INVALID_CONFIG, e.getReason());
  }
}
