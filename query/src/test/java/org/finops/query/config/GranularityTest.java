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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Granularity}.
 */
@Tag("unit")
public class GranularityTest {

  @Test
  void testMonthlyValidation() {
    assertTrue(Granularity.MONTHLY.isValid("2025-03"));
    assertFalse(Granularity.MONTHLY.isValid("2025-3"));
    assertFalse(Granularity.MONTHLY.isValid("2025-13"));
    assertFalse(Granularity.MONTHLY.isValid("2025-03-01"));
    assertFalse(Granularity.MONTHLY.isValid(null));
  }

  @Test
  void testDailyValidation() {
    assertTrue(Granularity.DAILY.isValid("2024-02-29"));
    assertFalse(Granularity.DAILY.isValid("2025-02-29"));
    assertFalse(Granularity.DAILY.isValid("2025-03"));
    assertFalse(Granularity.DAILY.isValid("20250301"));
  }

  @Test
  void testCompare() {
    assertTrue(Granularity.MONTHLY.compare("2024-12", "2025-01") < 0);
    assertEquals(0, Granularity.MONTHLY.compare("2025-01", "2025-01"));
    assertTrue(Granularity.DAILY.compare("2025-01-31", "2025-02-01") < 0);
    assertTrue(Granularity.DAILY.compare("2025-01-01", "2024-12-31") > 0);
  }

  @Test
  void testFromString() {
    assertEquals(Granularity.MONTHLY, Granularity.fromString("monthly"));
    assertEquals(Granularity.DAILY, Granularity.fromString(" DAILY "));

    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> Granularity.fromString("hourly"));
    assertEquals(ConfigurationException.Reason.UNSUPPORTED_GRANULARITY, e.getReason());
    assertTrue(e.getMessage().contains("hourly"));
  }
}
