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
package org.finops.query.partition;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One date partition of a dataset: a directory named
 * {@code <partitionKey>=<date>} and the data files found under it.
 */
public final class Partition {
  private final String name;
  private final String dateString;
  private final List<String> files;

  public Partition(String name, String dateString, List<String> files) {
    this.name = name;
    this.dateString = dateString;
    this.files = Collections.unmodifiableList(files);
  }

  /** Directory name, e.g. {@code BILLING_PERIOD=2025-03}. */
  public String getName() {
    return name;
  }

  public String getDateString() {
    return dateString;
  }

  public List<String> getFiles() {
    return files;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Partition)) {
      return false;
    }
    Partition that = (Partition) o;
    return name.equals(that.name) && files.equals(that.files);
  }

  @Override public int hashCode() {
    return Objects.hash(name, files);
  }

  @Override public String toString() {
    return name + " (" + files.size() + " files)";
  }
}
