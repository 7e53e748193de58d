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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Storage provider over an in-memory map of object path to size, listing
 * the way an object store does: directories exist only as key prefixes.
 */
public class InMemoryStorageProvider implements StorageProvider {
  private final Map<String, Long> objects = new TreeMap<>();
  private final List<String> listings = new ArrayList<>();

  public InMemoryStorageProvider add(String path, long size) {
    objects.put(path, size);
    return this;
  }

  /** Paths passed to {@link #listFiles}, with {@code (r)} appended for recursive calls. */
  public List<String> getListings() {
    return listings;
  }

  @Override public List<FileEntry> listFiles(String path, boolean recursive) {
    listings.add(recursive ? path + " (r)" : path);
    String prefix = path.endsWith("/") ? path : path + "/";
    List<FileEntry> entries = new ArrayList<>();
    TreeSet<String> directories = new TreeSet<>();
    for (Map.Entry<String, Long> object : objects.entrySet()) {
      String key = object.getKey();
      if (!key.startsWith(prefix)) {
        continue;
      }
      String rest = key.substring(prefix.length());
      int slash = rest.indexOf('/');
      if (recursive || slash < 0) {
        String name = key.substring(key.lastIndexOf('/') + 1);
        entries.add(new FileEntry(key, name, false, object.getValue(), 0));
      } else {
        directories.add(rest.substring(0, slash));
      }
    }
    for (String directory : directories) {
      entries.add(new FileEntry(prefix + directory + "/", directory, true, 0, 0));
    }
    return entries;
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    Long size = objects.get(path);
    if (size == null) {
      throw new IOException("File not found: " + path);
    }
    return new FileMetadata(path, size, 0, null);
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    Long size = objects.get(path);
    if (size == null) {
      throw new IOException("File not found: " + path);
    }
    return new ByteArrayInputStream(new byte[size.intValue()]);
  }

  @Override public boolean exists(String path) {
    return objects.containsKey(path);
  }

  @Override public String getStorageType() {
    return "memory";
  }
}
