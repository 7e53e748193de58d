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

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Date resolution of partition keys.
 *
 * <p>Monthly keys ({@code YYYY-MM}) are zero-padded and compare correctly as
 * strings. Daily keys ({@code YYYY-MM-DD}) are compared as calendar dates.
 */
public enum Granularity {
  MONTHLY("YYYY-MM", Pattern.compile("\\d{4}-\\d{2}")) {
    @Override public boolean isValid(String date) {
      if (!matchesFormat(date)) {
        return false;
      }
      try {
        YearMonth.parse(date);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }

    @Override public int compare(String left, String right) {
      return left.compareTo(right);
    }
  },

  DAILY("YYYY-MM-DD", Pattern.compile("\\d{4}-\\d{2}-\\d{2}")) {
    @Override public boolean isValid(String date) {
      if (!matchesFormat(date)) {
        return false;
      }
      try {
        LocalDate.parse(date);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }

    @Override public int compare(String left, String right) {
      return LocalDate.parse(left).compareTo(LocalDate.parse(right));
    }
  };

  private final String format;
  private final Pattern pattern;

  Granularity(String format, Pattern pattern) {
    this.format = format;
    this.pattern = pattern;
  }

  /** Human-readable date format, e.g. {@code YYYY-MM}. */
  public String getFormat() {
    return format;
  }

  /** Whether the string has the shape of this granularity's date format. */
  public boolean matchesFormat(String date) {
    return date != null && pattern.matcher(date).matches();
  }

  /** Whether the string has the right shape and names a real month or day. */
  public abstract boolean isValid(String date);

  /**
   * Compares two date strings that are both {@link #isValid(String) valid}
   * for this granularity.
   */
  public abstract int compare(String left, String right);

  /**
   * Parses a granularity name ({@code monthly} or {@code daily}, any case).
   *
   * @throws ConfigurationException for any other partition scheme
   */
  public static Granularity fromString(String name) {
    if (name == null) {
      throw new ConfigurationException(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY,
          "Granularity must be specified (monthly or daily)");
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
    case "monthly":
      return MONTHLY;
    case "daily":
      return DAILY;
    default:
      throw new ConfigurationException(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY,
          "Unsupported partition granularity '" + name + "'. Supported: monthly, daily");
    }
  }
}
