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
package org.finops.query.backend;

/** Name and capabilities of a backend. */
public final class BackendDescriptor {
  private final String name;
  private final boolean supportsRemoteDirect;
  private final boolean supportsLocalCache;

  public BackendDescriptor(String name, boolean supportsRemoteDirect,
      boolean supportsLocalCache) {
    this.name = name;
    this.supportsRemoteDirect = supportsRemoteDirect;
    this.supportsLocalCache = supportsLocalCache;
  }

  public String getName() {
    return name;
  }

  /** Whether the backend can read the remote store without a local copy. */
  public boolean isSupportsRemoteDirect() {
    return supportsRemoteDirect;
  }

  /**
   * Whether the backend can read the local mirror. A backend without local
   * support always runs against the remote store.
   */
  public boolean isSupportsLocalCache() {
    return supportsLocalCache;
  }

  @Override public String toString() {
    return name + "{remoteDirect=" + supportsRemoteDirect
        + ", localCache=" + supportsLocalCache + "}";
  }
}
