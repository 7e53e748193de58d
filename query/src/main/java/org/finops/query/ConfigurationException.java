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
 * Raised when a backend name, dataset location, date range or credential set
 * is not usable. Not retriable without a configuration change.
 */
public class ConfigurationException extends QueryException {

  /** Classification of a configuration failure. */
  public enum Reason {
    UNKNOWN_BACKEND,
    INVALID_LOCATION,
    INVALID_DATE_FORMAT,
    UNSUPPORTED_GRANULARITY,
    INVALID_CONFIG,
    CREDENTIALS_EXPIRED
  }

  private final Reason reason;

  public ConfigurationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ConfigurationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
