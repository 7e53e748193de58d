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

import org.finops.query.config.DateRange;
import org.finops.query.config.Granularity;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.function.Predicate;

/**
 * Decides whether a partition date falls inside a {@link DateRange}.
 *
 * <p>Monthly dates compare lexically; daily dates compare as calendar dates,
 * so ranges crossing month and year boundaries behave as expected.
 */
public final class PartitionDateFilter implements Predicate<String> {
  private final DateRange range;
  private final Granularity granularity;

  public PartitionDateFilter(DateRange range, Granularity granularity) {
    range.validate(granularity);
    this.range = range;
    this.granularity = granularity;
  }

  /**
   * Extracts the date from a partition directory name.
   *
   * @return the date string, or null if the name is not
   *     {@code <key>=<valid date>}
   */
  public static @Nullable String parseDate(String directoryName, String partitionKey,
      Granularity granularity) {
    String prefix = partitionKey + "=";
    if (!directoryName.startsWith(prefix)) {
      return null;
    }
    String date = directoryName.substring(prefix.length());
    return granularity.isValid(date) ? date : null;
  }

  @Override public boolean test(String date) {
    return range.contains(date, granularity);
  }
}
