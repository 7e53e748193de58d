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
package org.finops.query.config;

import org.finops.query.ConfigurationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Where a partitioned dataset lives and how its partitions are named.
 *
 * <p>{@code root} is either an {@code s3://bucket} URI or a local directory;
 * partitions are the directories directly under {@code root/prefix/} named
 * {@code <partitionKeyName>=<date>}.
 */
public final class DatasetLocation {
  private final String root;
  private final String prefix;
  private final String partitionKeyName;
  private final Granularity granularity;
  private final @Nullable FileFormat formatHint;

  public DatasetLocation(String root, String prefix, String partitionKeyName,
      Granularity granularity, @Nullable FileFormat formatHint) {
    if (root == null || root.trim().isEmpty()) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_LOCATION,
          "Dataset root must not be empty");
    }
    if (partitionKeyName == null || partitionKeyName.trim().isEmpty()
        || partitionKeyName.contains("=") || partitionKeyName.contains("/")) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_LOCATION,
          "Invalid partition key name '" + partitionKeyName + "'");
    }
    if (granularity == null) {
      throw new ConfigurationException(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY,
          "Granularity must be specified for " + root);
    }
    this.root = stripTrailingSlashes(root.trim());
    this.prefix = stripSlashes(prefix == null ? "" : prefix.trim());
    this.partitionKeyName = partitionKeyName;
    this.granularity = granularity;
    this.formatHint = formatHint;
  }

  public String getRoot() {
    return root;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getPartitionKeyName() {
    return partitionKeyName;
  }

  public Granularity getGranularity() {
    return granularity;
  }

  /** Forced file format, or null to decide by majority of the files found. */
  public @Nullable FileFormat getFormatHint() {
    return formatHint;
  }

  public boolean isRemote() {
    return root.startsWith("s3://");
  }

  /** Dataset base directory, always ending with a slash. */
  public String getBasePath() {
    return prefix.isEmpty() ? root + "/" : root + "/" + prefix + "/";
  }

  /** Directory of one partition, ending with a slash. */
  public String partitionPath(String partitionName) {
    return getBasePath() + partitionName + "/";
  }

  /** Same layout and partitioning under a different root. */
  public DatasetLocation withRoot(String newRoot) {
    return new DatasetLocation(newRoot, prefix, partitionKeyName, granularity, formatHint);
  }

  private static String stripTrailingSlashes(String value) {
    String result = value;
    while (result.endsWith("/") && !result.endsWith("://") && result.length() > 1) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static String stripSlashes(String value) {
    String result = value;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetLocation)) {
      return false;
    }
    DatasetLocation that = (DatasetLocation) o;
    return root.equals(that.root)
        && prefix.equals(that.prefix)
        && partitionKeyName.equals(that.partitionKeyName)
        && granularity == that.granularity
        && formatHint == that.formatHint;
  }

  @Override public int hashCode() {
    return Objects.hash(root, prefix, partitionKeyName, granularity, formatHint);
  }

  @Override public String toString() {
    return getBasePath() + " (" + partitionKeyName + "=" + granularity.getFormat() + ")";
  }
}
