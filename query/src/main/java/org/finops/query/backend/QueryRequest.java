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

import org.finops.query.result.OutputFormat;

import java.util.Objects;

/**
 * One query submission: SQL text, requested result shape and whether the
 * local mirror must be bypassed.
 */
public final class QueryRequest {
  private final String sql;
  private final OutputFormat format;
  private final boolean forceRemote;

  public QueryRequest(String sql, OutputFormat format, boolean forceRemote) {
    this.sql = Objects.requireNonNull(sql, "sql");
    this.format = Objects.requireNonNull(format, "format");
    this.forceRemote = forceRemote;
  }

  public String getSql() {
    return sql;
  }

  public OutputFormat getFormat() {
    return format;
  }

  public boolean isForceRemote() {
    return forceRemote;
  }

  @Override public String toString() {
    return "QueryRequest{format=" + format + ", forceRemote=" + forceRemote + ", sql=" + sql + "}";
  }
}
