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

import java.util.Objects;

/**
 * Outcome of {@link DataSourceSelector#select}: the chosen source and why.
 */
public final class SourceSelection {

  /** Reason for a selection. */
  public enum Reason {
    FORCED_REMOTE,
    LOCAL_NOT_PREFERRED,
    LOCAL_UNAVAILABLE,
    LOCAL_PREFERRED
  }

  private final DataSource source;
  private final Reason reason;

  public SourceSelection(DataSource source, Reason reason) {
    this.source = source;
    this.reason = reason;
  }

  public DataSource getSource() {
    return source;
  }

  public Reason getReason() {
    return reason;
  }

  public boolean isLocal() {
    return source == DataSource.LOCAL;
  }

  /**
   * Whether the caller should warn: local data was preferred but not
   * available, so the query falls back to the remote store.
   */
  public boolean shouldWarn() {
    return reason == Reason.LOCAL_UNAVAILABLE;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SourceSelection)) {
      return false;
    }
    SourceSelection that = (SourceSelection) o;
    return source == that.source && reason == that.reason;
  }

  @Override public int hashCode() {
    return Objects.hash(source, reason);
  }

  @Override public String toString() {
    return source + " (" + reason + ")";
  }
}
