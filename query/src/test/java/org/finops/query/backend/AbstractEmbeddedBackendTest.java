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
package org.finops.query.backend;

import org.finops.query.ConfigurationException;
import org.finops.query.config.DataExportType;
import org.finops.query.config.DatasetConfig;
import org.finops.query.config.DatasetLocation;
import org.finops.query.config.FileFormat;
import org.finops.query.credentials.AwsSessionCredentials;
import org.finops.query.credentials.CredentialProvider;
import org.finops.query.credentials.MutableClock;
import org.finops.query.credentials.StaticCredentialProvider;
import org.finops.query.result.OutputFormat;
import org.finops.query.result.QueryResult;
import org.finops.query.storage.InMemoryStorageProvider;
import org.finops.query.storage.StorageProvider;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AbstractEmbeddedBackend}.
 */
@Tag("unit")
public class AbstractEmbeddedBackendTest {
  private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

  private static final String SQL = "SELECT * FROM CUR";

  private final MutableClock clock = new MutableClock(T0);
  private final CredentialProvider credentials = new StaticCredentialProvider(
      new AwsSessionCredentials("ASIATEST", "secret", "token", "eu-west-1",
          T0.plus(Duration.ofMinutes(30))));
  private final InMemoryStorageProvider remote = new InMemoryStorageProvider();
  private final InMemoryStorageProvider local = new InMemoryStorageProvider();

  /** Backend that records the files it is handed instead of running SQL. */
  private static class FilesBackend extends AbstractEmbeddedBackend {
    DatasetLocation lastLocation;
    List<String> lastFiles;

    FilesBackend(DatasetConfig config, CredentialProvider credentialProvider, Clock clock,
        StorageProvider remoteStorage, StorageProvider localStorage) {
      super(config, null, credentialProvider, clock, remoteStorage, localStorage);
    }

    @Override public String name() {
      return "files";
    }

    @Override protected QueryResult executeOver(QueryRequest request, DatasetLocation location,
        FileFormat format, List<String> files) {
      lastLocation = location;
      lastFiles = files;
      return QueryResult.records(Collections.emptyList());
    }
  }

  private FilesBackend backend(boolean preferLocal) {
    DatasetConfig config = DatasetConfig.builder()
        .s3Bucket("billing")
        .s3DataPrefix("cur2/data")
        .exportType(DataExportType.CUR_2_0)
        .localDataPath("/mirror")
        .preferLocalData(preferLocal)
        .build();
    remote.add(config.getLocation().partitionPath("BILLING_PERIOD=2025-03") + "a.parquet", 10);
    local.add(config.getLocalLocation().partitionPath("BILLING_PERIOD=2025-03") + "b.parquet",
        10);
    return new FilesBackend(config, credentials, clock, remote, local);
  }

  @Test
  void testRemoteQueryFailsOnceCredentialsExpire() {
    FilesBackend backend = backend(false);
    backend.execute(SQL, OutputFormat.RECORDS);
    assertEquals(1, backend.lastFiles.size());
    assertEquals(1, remote.getListings().size());

    clock.advance(Duration.ofHours(2));
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> backend.execute(SQL, OutputFormat.RECORDS));
    assertEquals(ConfigurationException.Reason.CREDENTIALS_EXPIRED, e.getReason());
    // refused before the store is listed again
    assertEquals(1, remote.getListings().size());
  }

  @Test
  void testLocalQueryDoesNotNeedCredentials() {
    FilesBackend backend = backend(true);
    clock.advance(Duration.ofHours(2));

    backend.execute(SQL, OutputFormat.RECORDS);

    assertEquals(backend.getConfig().getLocalLocation(), backend.lastLocation);
    assertTrue(remote.getListings().isEmpty());
  }

  @Test
  void testLocalFilesDiscoveredOnce() {
    FilesBackend backend = backend(true);

    backend.execute(SQL, OutputFormat.RECORDS);

    assertEquals(1, backend.lastFiles.size());
    assertTrue(backend.lastFiles.get(0).endsWith("b.parquet"));
    assertEquals(1, local.getListings().size());
  }

  @Test
  void testForcedRemoteSkipsLocalListing() {
    FilesBackend backend = backend(true);

    backend.execute(SQL, OutputFormat.RECORDS, true);

    assertTrue(local.getListings().isEmpty());
    assertTrue(backend.lastFiles.get(0).endsWith("a.parquet"));
  }
}
