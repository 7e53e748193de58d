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
 * Optional inclusive date window used to prune partitions.
 *
 * <p>Either bound may be absent. A range with neither bound is empty and
 * selects every partition.
 */
public final class DateRange {
  private static final DateRange EMPTY = new DateRange(null, null);

  private final @Nullable String start;
  private final @Nullable String end;

  private DateRange(@Nullable String start, @Nullable String end) {
    this.start = start;
    this.end = end;
  }

  public static DateRange empty() {
    return EMPTY;
  }

  public static DateRange of(@Nullable String start, @Nullable String end) {
    String s = blankToNull(start);
    String e = blankToNull(end);
    if (s == null && e == null) {
      return EMPTY;
    }
    return new DateRange(s, e);
  }

  public @Nullable String getStart() {
    return start;
  }

  public @Nullable String getEnd() {
    return end;
  }

  public boolean isEmpty() {
    return start == null && end == null;
  }

  /**
   * Checks that both bounds use the date format of the given granularity and
   * that the range is not reversed.
   *
   * @throws ConfigurationException if a bound is malformed or start is after end
   */
  public void validate(Granularity granularity) {
    checkBound("start", start, granularity);
    checkBound("end", end, granularity);
    if (start != null && end != null && granularity.compare(start, end) > 0) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
          "Date range start " + start + " is after end " + end);
    }
  }

  /**
   * Whether a partition date falls inside the range, inclusive at both ends.
   * The date must already be valid for the granularity.
   */
  public boolean contains(String date, Granularity granularity) {
    if (start != null && granularity.compare(date, start) < 0) {
      return false;
    }
    return end == null || granularity.compare(date, end) <= 0;
  }

  private static void checkBound(String which, @Nullable String value, Granularity granularity) {
    if (value != null && !granularity.isValid(value)) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_DATE_FORMAT,
          "Invalid " + which + " date '" + value + "'. Expected format: "
          + granularity.getFormat());
    }
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    return value.trim();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DateRange)) {
      return false;
    }
    DateRange that = (DateRange) o;
    return Objects.equals(start, that.start) && Objects.equals(end, that.end);
  }

  @Override public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override public String toString() {
    return isEmpty() ? "[all]" : "[" + (start == null ? "" : start) + ", "
        + (end == null ? "" : end) + "]";
  }
}
