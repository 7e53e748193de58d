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
package org.finops.query.partition;

import org.finops.query.QueryExecutionException;
import org.finops.query.config.DatasetLocation;
import org.finops.query.config.DateRange;
import org.finops.query.config.FileFormat;
import org.finops.query.config.Granularity;
import org.finops.query.storage.StorageProvider;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Discovers the data files of a date-partitioned dataset.
 *
 * <p>With an empty date range every object under the dataset prefix is
 * listed in one recursive pass. With a range, partition directories are
 * listed first (non-recursively), filtered by date, and only the surviving
 * partitions are listed recursively.
 *
 * <p>Zero-byte objects and files that are neither Parquet nor gzip CSV are
 * ignored. When both formats are present the minority format is discarded
 * (ties keep Parquet) unless the location carries a format hint. Results are
 * recomputed on every call and returned sorted.
 */
public class PartitionCatalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionCatalog.class);

  private final StorageProvider storage;

  public PartitionCatalog(StorageProvider storage) {
    this.storage = storage;
  }

  public StorageProvider getStorage() {
    return storage;
  }

  /**
   * Returns the data files of the dataset within the date range.
   *
   * @return sorted file paths; empty if nothing matches
   * @throws QueryExecutionException if the store cannot be listed
   */
  public List<String> discover(DatasetLocation location, DateRange range) {
    List<StorageProvider.FileEntry> entries;
    if (range.isEmpty()) {
      entries = dataFiles(list(location.getBasePath(), true));
    } else {
      entries = new ArrayList<>();
      for (Partition partition : partitionEntries(location, range)) {
        entries.addAll(dataFiles(list(location.partitionPath(partition.getName()), true)));
      }
    }
    FileFormat format = chooseFormat(location, entries);
    List<String> files = new ArrayList<>();
    for (StorageProvider.FileEntry entry : entries) {
      if (format != null && format.matches(entry.getPath())) {
        files.add(entry.getPath());
      }
    }
    Collections.sort(files);
    LOGGER.debug("Discovered {} {} files under {} for range {}", files.size(), format,
        location.getBasePath(), range);
    return files;
  }

  /**
   * Returns the names of all partition directories whose name is
   * {@code <partitionKey>=<valid date>}, sorted.
   */
  public List<String> listPartitions(DatasetLocation location) {
    List<String> names = new ArrayList<>();
    for (Partition partition : partitionEntries(location, DateRange.empty())) {
      names.add(partition.getName());
    }
    return names;
  }

  /**
   * Returns the partitions within the date range together with their data
   * files. Partitions left without files after format filtering are omitted.
   */
  public List<Partition> partitions(DatasetLocation location, DateRange range) {
    List<Partition> candidates = partitionEntries(location, range);
    List<List<StorageProvider.FileEntry>> filesPerPartition = new ArrayList<>();
    List<StorageProvider.FileEntry> all = new ArrayList<>();
    for (Partition candidate : candidates) {
      List<StorageProvider.FileEntry> files =
          dataFiles(list(location.partitionPath(candidate.getName()), true));
      filesPerPartition.add(files);
      all.addAll(files);
    }

    FileFormat format = chooseFormat(location, all);
    List<Partition> result = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      List<String> paths = new ArrayList<>();
      for (StorageProvider.FileEntry entry : filesPerPartition.get(i)) {
        if (format != null && format.matches(entry.getPath())) {
          paths.add(entry.getPath());
        }
      }
      if (!paths.isEmpty()) {
        Collections.sort(paths);
        Partition candidate = candidates.get(i);
        result.add(new Partition(candidate.getName(), candidate.getDateString(), paths));
      }
    }
    return result;
  }

  /** Partition directories in range, without files; sorted by name. */
  private List<Partition> partitionEntries(DatasetLocation location, DateRange range) {
    Granularity granularity = location.getGranularity();
    PartitionDateFilter filter = new PartitionDateFilter(range, granularity);
    List<Partition> partitions = new ArrayList<>();
    for (StorageProvider.FileEntry entry : list(location.getBasePath(), false)) {
      if (!entry.isDirectory()) {
        continue;
      }
      String name = entry.getName();
      String date = PartitionDateFilter.parseDate(name, location.getPartitionKeyName(),
          granularity);
      if (date == null) {
        LOGGER.warn("Skipping directory '{}' under {}: expected {}={}", name,
            location.getBasePath(), location.getPartitionKeyName(), granularity.getFormat());
        continue;
      }
      if (filter.test(date)) {
        partitions.add(new Partition(name, date, Collections.<String>emptyList()));
      }
    }
    partitions.sort((a, b) -> a.getName().compareTo(b.getName()));
    LOGGER.debug("{} partitions under {} match range {}", partitions.size(),
        location.getBasePath(), range);
    return partitions;
  }

  private List<StorageProvider.FileEntry> list(String path, boolean recursive) {
    try {
      return storage.listFiles(path, recursive);
    } catch (IOException e) {
      throw new QueryExecutionException(storage.getStorageType(),
          "Failed to list " + path + ": " + e.getMessage(), e);
    }
  }

  private static List<StorageProvider.FileEntry> dataFiles(
      List<StorageProvider.FileEntry> entries) {
    List<StorageProvider.FileEntry> files = new ArrayList<>();
    for (StorageProvider.FileEntry entry : entries) {
      if (!entry.isDirectory() && entry.getSize() > 0 && FileFormat.of(entry.getPath()) != null) {
        files.add(entry);
      }
    }
    return files;
  }

  /**
   * The format hint if one is set, otherwise the majority format of the
   * files; null when there are no files at all.
   */
  static @Nullable FileFormat chooseFormat(DatasetLocation location,
      List<StorageProvider.FileEntry> files) {
    if (location.getFormatHint() != null) {
      return location.getFormatHint();
    }
    int parquet = 0;
    int gzip = 0;
    for (StorageProvider.FileEntry file : files) {
      FileFormat format = FileFormat.of(file.getPath());
      if (format == FileFormat.PARQUET) {
        parquet++;
      } else if (format == FileFormat.CSV_GZIP) {
        gzip++;
      }
    }
    if (parquet == 0 && gzip == 0) {
      return null;
    }
    if (parquet > 0 && gzip > 0) {
      LOGGER.warn("Mixed formats under {}: {} parquet, {} gzip; keeping the majority",
          location.getBasePath(), parquet, gzip);
    }
    return gzip > parquet ? FileFormat.CSV_GZIP : FileFormat.PARQUET;
  }
}
