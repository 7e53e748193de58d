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

/**
 * Base class for all failures raised by the billing query layer.
 *
 * <p>Subclasses classify the failure so callers can decide whether to retry,
 * widen the date range, or fix their configuration.
 */
public class QueryException extends RuntimeException {

  /**
   * Creates a new QueryException with the specified message.
   */
  public QueryException(String message) {
    super(message);
  }

  /**
   * Creates a new QueryException with the specified message and cause.
   */
  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
