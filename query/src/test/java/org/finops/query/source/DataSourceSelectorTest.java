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
package org.finops.query.source;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DataSourceSelector}.
 */
@Tag("unit")
public class DataSourceSelectorTest {

  @Test
  void testForceRemoteWins() {
    SourceSelection selection = DataSourceSelector.select(true, true, true);
    assertEquals(DataSource.REMOTE, selection.getSource());
    assertEquals(SourceSelection.Reason.FORCED_REMOTE, selection.getReason());
    assertFalse(selection.shouldWarn());
  }

  @Test
  void testLocalNotPreferred() {
    SourceSelection selection = DataSourceSelector.select(false, false, true);
    assertEquals(DataSource.REMOTE, selection.getSource());
    assertEquals(SourceSelection.Reason.LOCAL_NOT_PREFERRED, selection.getReason());
    assertFalse(selection.shouldWarn());
  }

  @Test
  void testLocalUnavailableFallsBackWithWarning() {
    SourceSelection selection = DataSourceSelector.select(false, true, false);
    assertEquals(DataSource.REMOTE, selection.getSource());
    assertEquals(SourceSelection.Reason.LOCAL_UNAVAILABLE, selection.getReason());
    assertTrue(selection.shouldWarn());
  }

  @Test
  void testLocalPreferredAndAvailable() {
    SourceSelection selection = DataSourceSelector.select(false, true, true);
    assertTrue(selection.isLocal());
    assertEquals(SourceSelection.Reason.LOCAL_PREFERRED, selection.getReason());
    assertEquals(new SourceSelection(DataSource.LOCAL, SourceSelection.Reason.LOCAL_PREFERRED),
        selection);
  }
}
