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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DateRange}.
 */
@Tag("unit")
public class DateRangeTest {

  @Test
  void testBlankBoundsAreEmpty() {
    assertSame(DateRange.empty(), DateRange.of(null, " "));
    assertTrue(DateRange.of("", null).isEmpty());
    assertEquals("[all]", DateRange.empty().toString());
  }

  @Test
  void testOpenEndedRange() {
    DateRange range = DateRange.of("2025-03", null);
    assertFalse(range.isEmpty());
    assertNull(range.getEnd());
    assertFalse(range.contains("2025-02", Granularity.MONTHLY));
    assertTrue(range.contains("2025-03", Granularity.MONTHLY));
    assertTrue(range.contains("2030-01", Granularity.MONTHLY));
  }

  @Test
  void testInclusiveBounds() {
    DateRange range = DateRange.of("2024-12-30", "2025-01-02");
    range.validate(Granularity.DAILY);
    assertFalse(range.contains("2024-12-29", Granularity.DAILY));
    assertTrue(range.contains("2024-12-30", Granularity.DAILY));
    assertTrue(range.contains("2025-01-01", Granularity.DAILY));
    assertTrue(range.contains("2025-01-02", Granularity.DAILY));
    assertFalse(range.contains("2025-01-03", Granularity.DAILY));
  }

  @Test
  void testMalformedBound() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DateRange.of("2025-03-01", null).validate(Granularity.MONTHLY));
    assertEquals(ConfigurationException.Reason.INVALID_DATE_FORMAT, e.getReason());
    assertTrue(e.getMessage().contains("YYYY-MM"));

    e = assertThrows(ConfigurationException.class,
        () -> DateRange.of(null, "2025-02-30").validate(Granularity.DAILY));
    assertEquals(ConfigurationException.Reason.INVALID_DATE_FORMAT, e.getReason());
  }

  @Test
  void testReversedRange() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> DateRange.of("2025-05", "2025-03").validate(Granularity.MONTHLY));
    assertEquals(ConfigurationException.Reason.INVALID_CONFIG, e.getReason());
  }
}
