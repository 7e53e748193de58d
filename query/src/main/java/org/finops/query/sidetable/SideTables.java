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
package org.finops.query.sidetable;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Tables supplied by a {@link SideTableProvider} together with the warnings
 * raised while producing them.
 */
public final class SideTables {
  private static final SideTables EMPTY =
      new SideTables(ImmutableList.<NamedTable>of(), ImmutableList.<String>of());

  private final List<NamedTable> tables;
  private final List<String> warnings;

  public SideTables(List<NamedTable> tables, List<String> warnings) {
    this.tables = ImmutableList.copyOf(tables);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public static SideTables empty() {
    return EMPTY;
  }

  public List<NamedTable> getTables() {
    return tables;
  }

  public List<String> getWarnings() {
    return warnings;
  }
}
