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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Storage provider interface for abstracting file access across the remote
 * object store and the local mirror.
 */
public interface StorageProvider {

  /**
   * Lists files in a directory or under a key prefix.
   *
   * <p>A non-recursive listing also returns the immediate subdirectories
   * (common prefixes for object stores). A missing directory yields an empty
   * list.
   *
   * @param path The directory path, ending with a slash
   * @param recursive Whether to include files in subdirectories
   * @return List of file entries
   * @throws IOException If an I/O error occurs
   */
  List<FileEntry> listFiles(String path, boolean recursive) throws IOException;

  /**
   * Gets metadata for a single file.
   *
   * @throws IOException If the file does not exist or cannot be read
   */
  FileMetadata getMetadata(String path) throws IOException;

  /**
   * Opens a file for reading. The caller closes the stream.
   */
  InputStream openInputStream(String path) throws IOException;

  boolean exists(String path) throws IOException;

  /** Short name of the storage system, e.g. "s3" or "local". */
  String getStorageType();

  /**
   * File entry representing a file in a directory listing.
   */
  class FileEntry {
    private final String path;
    private final String name;
    private final boolean isDirectory;
    private final long size;
    private final long lastModified;

    public FileEntry(String path, String name, boolean isDirectory,
                     long size, long lastModified) {
      this.path = path;
      this.name = name;
      this.isDirectory = isDirectory;
      this.size = size;
      this.lastModified = lastModified;
    }

    public String getPath() {
      return path;
    }

    public String getName() {
      return name;
    }

    public boolean isDirectory() {
      return isDirectory;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    @Override public String toString() {
      return path + (isDirectory ? " (dir)" : " (" + size + " bytes)");
    }
  }

  /**
   * File metadata containing detailed information about a file.
   */
  class FileMetadata {
    private final String path;
    private final long size;
    private final long lastModified;
    private final @Nullable String etag;

    public FileMetadata(String path, long size, long lastModified, @Nullable String etag) {
      this.path = path;
      this.size = size;
      this.lastModified = lastModified;
      this.etag = etag;
    }

    public String getPath() {
      return path;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    public @Nullable String getEtag() {
      return etag;
    }
  }
}
