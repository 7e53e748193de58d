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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Types;

/**
 * Column types of a {@link ResultTable} and the Java class of their values.
 */
public enum ColumnType {
  BOOLEAN(Boolean.class),
  INTEGER(Integer.class),
  BIGINT(Long.class),
  FLOAT(Float.class),
  DOUBLE(Double.class),
  DECIMAL(java.math.BigDecimal.class),
  VARCHAR(String.class),
  DATE(java.sql.Date.class),
  TIMESTAMP(java.sql.Timestamp.class),
  BINARY(byte[].class);

  private final Class<?> javaClass;

  ColumnType(Class<?> javaClass) {
    this.javaClass = javaClass;
  }

  public Class<?> getJavaClass() {
    return javaClass;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT || this == DOUBLE;
  }

  /**
   * Maps a JDBC type code to a column type.
   *
   * @return the column type, or null for types without a flat representation
   *     (structs, lists, maps, intervals, engine-specific objects), which are
   *     read as text
   */
  public static @Nullable ColumnType fromJdbcType(int sqlType) {
    switch (sqlType) {
    case Types.BOOLEAN:
    case Types.BIT:
      return BOOLEAN;
    case Types.TINYINT:
    case Types.SMALLINT:
    case Types.INTEGER:
      return INTEGER;
    case Types.BIGINT:
      return BIGINT;
    case Types.REAL:
      return FLOAT;
    case Types.FLOAT:
    case Types.DOUBLE:
      return DOUBLE;
    case Types.DECIMAL:
    case Types.NUMERIC:
      return DECIMAL;
    case Types.CHAR:
    case Types.VARCHAR:
    case Types.LONGVARCHAR:
    case Types.NCHAR:
    case Types.NVARCHAR:
    case Types.LONGNVARCHAR:
      return VARCHAR;
    case Types.DATE:
      return DATE;
    case Types.TIMESTAMP:
    case Types.TIMESTAMP_WITH_TIMEZONE:
      return TIMESTAMP;
    case Types.BINARY:
    case Types.VARBINARY:
    case Types.LONGVARBINARY:
    case Types.BLOB:
      return BINARY;
    default:
      return null;
    }
  }

  /**
   * Maps an Athena result-metadata type name ({@code varchar}, {@code bigint},
   * {@code decimal(18,2)} ...) to a column type; unknown names become VARCHAR.
   */
  public static ColumnType fromAthenaType(String typeName) {
    String type = typeName.toLowerCase(java.util.Locale.ROOT);
    int paren = type.indexOf('(');
    if (paren >= 0) {
      type = type.substring(0, paren);
    }
    switch (type.trim()) {
    case "boolean":
      return BOOLEAN;
    case "tinyint":
    case "smallint":
    case "integer":
    case "int":
      return INTEGER;
    case "bigint":
      return BIGINT;
    case "float":
    case "real":
      return FLOAT;
    case "double":
      return DOUBLE;
    case "decimal":
      return DECIMAL;
    case "date":
      return DATE;
    case "timestamp":
      return TIMESTAMP;
    case "varbinary":
      return BINARY;
    default:
      return VARCHAR;
    }
  }
}
