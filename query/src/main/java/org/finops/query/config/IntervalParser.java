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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses polling intervals and timeouts.
 *
 * <p>Accepts ISO-8601 durations ({@code PT2S}) and text made of one or more
 * amount/unit pairs: {@code "2 seconds"}, {@code "500ms"},
 * {@code "1 minute 30 seconds"}.
 */
public final class IntervalParser {
  private static final Pattern PART =
      Pattern.compile("\\s*(\\d+)\\s*([a-z]+)\\s*,?", Pattern.CASE_INSENSITIVE);

  private static final Map<String, ChronoUnit> UNITS = ImmutableMap.<String, ChronoUnit>builder()
      .put("ms", ChronoUnit.MILLIS)
      .put("millisecond", ChronoUnit.MILLIS)
      .put("s", ChronoUnit.SECONDS)
      .put("sec", ChronoUnit.SECONDS)
      .put("second", ChronoUnit.SECONDS)
      .put("m", ChronoUnit.MINUTES)
      .put("min", ChronoUnit.MINUTES)
      .put("minute", ChronoUnit.MINUTES)
      .put("h", ChronoUnit.HOURS)
      .put("hour", ChronoUnit.HOURS)
      .build();

  private IntervalParser() {
  }

  /**
   * Returns the duration, or null when the text is blank or not understood.
   */
  public static @Nullable Duration parse(@Nullable String text) {
    if (text == null || text.trim().isEmpty()) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
      try {
        return Duration.parse(trimmed);
      } catch (DateTimeParseException e) {
        return null;
      }
    }

    Duration total = Duration.ZERO;
    Matcher matcher = PART.matcher(trimmed);
    int end = 0;
    while (matcher.find() && matcher.start() == end) {
      ChronoUnit unit = unit(matcher.group(2));
      if (unit == null) {
        return null;
      }
      total = total.plus(Long.parseLong(matcher.group(1)), unit);
      end = matcher.end();
    }
    return end == trimmed.length() ? total : null;
  }

  private static @Nullable ChronoUnit unit(String word) {
    String lower = word.toLowerCase(Locale.ROOT);
    ChronoUnit unit = UNITS.get(lower);
    if (unit == null && lower.length() > 1 && lower.endsWith("s")) {
      unit = UNITS.get(lower.substring(0, lower.length() - 1));
    }
    return unit;
  }
}
