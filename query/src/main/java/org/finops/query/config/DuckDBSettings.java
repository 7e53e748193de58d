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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Optional DuckDB pragmas applied to every execution context.
 */
public final class DuckDBSettings {
  public static final DuckDBSettings DEFAULT = new DuckDBSettings(null, null);

  private final @Nullable String memoryLimit;
  private final @Nullable Integer threads;

  public DuckDBSettings(@Nullable String memoryLimit, @Nullable Integer threads) {
    this.memoryLimit = memoryLimit;
    this.threads = threads;
  }

  /** Value for {@code SET memory_limit}, e.g. "4GB". */
  public @Nullable String getMemoryLimit() {
    return memoryLimit;
  }

  public @Nullable Integer getThreads() {
    return threads;
  }
}
