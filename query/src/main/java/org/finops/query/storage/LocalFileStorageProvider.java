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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Storage provider over the local file system, used for the on-disk mirror
 * of the remote dataset.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    Path dir = Paths.get(path);
    List<FileEntry> entries = new ArrayList<>();
    if (!Files.isDirectory(dir)) {
      LOGGER.debug("Local directory {} does not exist", dir);
      return entries;
    }

    try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
      stream.filter(p -> !p.equals(dir))
          .forEach(p -> {
            boolean directory = Files.isDirectory(p);
            if (recursive && directory) {
              return;
            }
            entries.add(toEntry(p, directory));
          });
    } catch (java.io.UncheckedIOException e) {
      throw e.getCause();
    }
    LOGGER.debug("Listed {} entries under {} (recursive={})", entries.size(), path, recursive);
    return entries;
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    Path file = Paths.get(path);
    try {
      BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
      return new FileMetadata(path, attributes.size(),
          attributes.lastModifiedTime().toMillis(), null);
    } catch (NoSuchFileException e) {
      throw new IOException("File not found: " + path, e);
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    return Files.newInputStream(Paths.get(path));
  }

  @Override public boolean exists(String path) {
    return Files.exists(Paths.get(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  private static FileEntry toEntry(Path path, boolean directory) {
    long size = 0;
    long lastModified = 0;
    if (!directory) {
      try {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        size = attributes.size();
        lastModified = attributes.lastModifiedTime().toMillis();
      } catch (IOException e) {
        throw new java.io.UncheckedIOException(e);
      }
    }
    String absolute = path.toAbsolutePath().toString();
    return new FileEntry(directory ? absolute + "/" : absolute,
        path.getFileName().toString(), directory, size, lastModified);
  }
}
