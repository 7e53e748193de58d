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
package org.finops.query.result;

import org.finops.query.ConfigurationException;

import java.util.Locale;

/** Shape in which a query result is returned to the caller. */
public enum OutputFormat {
  /** A list of rows, each a column-name to value map. */
  RECORDS,
  /** A typed in-memory table. */
  TABLE,
  /** CSV text with a header row. */
  CSV,
  /** An Arrow {@code VectorSchemaRoot}. */
  COLUMNAR,
  /** The backend's own result object. */
  NATIVE;

  /**
   * Parses a format name, case-insensitively. The legacy names
   * {@code dataframe} and {@code arrow} and {@code raw} map to TABLE,
   * COLUMNAR and NATIVE.
   */
  public static OutputFormat fromString(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
    case "records":
      return RECORDS;
    case "table":
    case "dataframe":
      return TABLE;
    case "csv":
      return CSV;
    case "columnar":
    case "arrow":
      return COLUMNAR;
    case "native":
    case "raw":
      return NATIVE;
    default:
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Unknown output format '" + name + "'. Supported: records, table, csv, columnar, native");
    }
  }
}
