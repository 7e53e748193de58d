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

import java.util.Locale;

/**
 * Data file formats found in billing exports.
 */
public enum FileFormat {
  PARQUET(".parquet"),
  CSV_GZIP(".gz");

  private final String extension;

  FileFormat(String extension) {
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }

  public boolean matches(String path) {
    return path.toLowerCase(Locale.ROOT).endsWith(extension);
  }

  /**
   * Returns the format a path belongs to, or null if it is not a data file.
   */
  public static @Nullable FileFormat of(String path) {
    for (FileFormat format : values()) {
      if (format.matches(path)) {
        return format;
      }
    }
    return null;
  }

  /**
   * Parses a format hint. {@code auto} (or null) returns null, meaning the
   * format is decided from the files found.
   */
  public static @Nullable FileFormat fromHint(@Nullable String hint) {
    if (hint == null) {
      return null;
    }
    switch (hint.trim().toLowerCase(Locale.ROOT)) {
    case "":
    case "auto":
      return null;
    case "parquet":
      return PARQUET;
    case "csv_gzip":
    case "gzip":
    case "csv.gz":
      return CSV_GZIP;
    default:
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Unknown formatHint '" + hint + "'. Supported: auto, parquet, csv_gzip");
    }
  }
}
