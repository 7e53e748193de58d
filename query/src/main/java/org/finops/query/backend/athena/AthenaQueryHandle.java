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
package org.finops.query.backend.athena;

import java.util.Objects;

/**
 * Reference to a finished Athena query: its execution id and the S3
 * location of the result file.
 */
public final class AthenaQueryHandle {
  private final String executionId;
  private final String outputLocation;

  public AthenaQueryHandle(String executionId, String outputLocation) {
    this.executionId = executionId;
    this.outputLocation = outputLocation;
  }

  public String getExecutionId() {
    return executionId;
  }

  public String getOutputLocation() {
    return outputLocation;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AthenaQueryHandle)) {
      return false;
    }
    AthenaQueryHandle that = (AthenaQueryHandle) o;
    return executionId.equals(that.executionId) && outputLocation.equals(that.outputLocation);
  }

  @Override public int hashCode() {
    return Objects.hash(executionId, outputLocation);
  }

  @Override public String toString() {
    return executionId + " -> " + outputLocation;
  }
}
