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
package org.finops.query.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LocalFileStorageProvider}.
 */
@Tag("unit")
public class LocalFileStorageProviderTest {

  @TempDir
  Path tempDir;

  private final LocalFileStorageProvider storage = new LocalFileStorageProvider();

  private void write(String relative, String content) throws IOException {
    Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void testNonRecursiveListingShowsDirectories() throws IOException {
    write("BILLING_PERIOD=2025-03/part-0.parquet", "abc");
    write("manifest.json", "{}");

    List<StorageProvider.FileEntry> entries = storage.listFiles(tempDir.toString(), false);

    assertEquals(2, entries.size());
    StorageProvider.FileEntry directory = entries.stream()
        .filter(StorageProvider.FileEntry::isDirectory).findFirst().get();
    assertEquals("BILLING_PERIOD=2025-03", directory.getName());
    assertTrue(directory.getPath().endsWith("BILLING_PERIOD=2025-03/"));
  }

  @Test
  void testRecursiveListingReturnsFilesOnly() throws IOException {
    write("BILLING_PERIOD=2025-03/part-0.parquet", "abc");
    write("BILLING_PERIOD=2025-03/nested/part-1.parquet", "abcdef");

    List<String> names = new ArrayList<>();
    for (StorageProvider.FileEntry entry : storage.listFiles(tempDir.toString(), true)) {
      assertFalse(entry.isDirectory());
      names.add(entry.getName());
    }
    Collections.sort(names);
    assertEquals(2, names.size());
    assertEquals("part-0.parquet", names.get(0));
  }

  @Test
  void testMissingDirectoryIsEmpty() throws IOException {
    assertTrue(storage.listFiles(new File(tempDir.toFile(), "absent").getPath(), true).isEmpty());
  }

  @Test
  void testMetadataAndContent() throws IOException {
    write("data.csv.gz", "hello");
    String path = tempDir.resolve("data.csv.gz").toString();

    assertTrue(storage.exists(path));
    assertEquals(5, storage.getMetadata(path).getSize());
    try (InputStream in = storage.openInputStream(path)) {
      assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
    assertThrows(IOException.class,
        () -> storage.getMetadata(tempDir.resolve("missing").toString()));
    assertEquals("local", storage.getStorageType());
  }
}
