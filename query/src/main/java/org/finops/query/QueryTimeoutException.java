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
package org.finops.query;

import java.time.Duration;

/**
 * Raised when a polling loop exhausts its wait budget before the remote job
 * reached a terminal state.
 */
public class QueryTimeoutException extends QueryException {

  private final Duration budget;

  public QueryTimeoutException(String message, Duration budget) {
    super(message);
    this.budget = budget;
  }

  public Duration getBudget() {
    return budget;
  }
}
