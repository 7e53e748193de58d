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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * AWS Data Export flavours and the partition layout each one writes.
 */
public enum DataExportType {
  FOCUS_1_0("FOCUS1.0", "billing_period", Granularity.MONTHLY),
  CUR_2_0("CUR2.0", "BILLING_PERIOD", Granularity.MONTHLY),
  /** Cost Optimization Hub recommendations, exported daily. */
  COH("COH", "date", Granularity.DAILY),
  CARBON_EMISSION("CARBON_EMISSION", "BILLING_PERIOD", Granularity.MONTHLY);

  private final String value;
  private final String partitionKey;
  private final Granularity granularity;

  DataExportType(String value, String partitionKey, Granularity granularity) {
    this.value = value;
    this.partitionKey = partitionKey;
    this.granularity = granularity;
  }

  public String getValue() {
    return value;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public Granularity getGranularity() {
    return granularity;
  }

  public static DataExportType fromValue(String value) {
    for (DataExportType type : values()) {
      if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new ConfigurationException(ConfigurationException.Reason.INVALID_CONFIG,
        "Invalid dataExportType '" + value + "'. Must be one of: "
        + Arrays.stream(values()).map(DataExportType::getValue)
            .collect(Collectors.joining(", ")));
  }
}
