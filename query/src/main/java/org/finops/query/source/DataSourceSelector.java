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

/**
 * Arbitrates between the local mirror and the remote store.
 *
 * <table>
 *   <caption>Selection rules</caption>
 *   <tr><th>forceRemote</th><th>preferLocal</th><th>localAvailable</th><th>result</th></tr>
 *   <tr><td>true</td><td>any</td><td>any</td><td>REMOTE, FORCED_REMOTE</td></tr>
 *   <tr><td>false</td><td>false</td><td>any</td><td>REMOTE, LOCAL_NOT_PREFERRED</td></tr>
 *   <tr><td>false</td><td>true</td><td>false</td><td>REMOTE, LOCAL_UNAVAILABLE</td></tr>
 *   <tr><td>false</td><td>true</td><td>true</td><td>LOCAL, LOCAL_PREFERRED</td></tr>
 * </table>
 *
 * <p>Pure; performs no I/O and does not log.
 */
public final class DataSourceSelector {

  private DataSourceSelector() {
  }

  public static SourceSelection select(boolean forceRemote, boolean preferLocal,
      boolean localAvailable) {
    if (forceRemote) {
      return new SourceSelection(DataSource.REMOTE, SourceSelection.Reason.FORCED_REMOTE);
    }
    if (!preferLocal) {
      return new SourceSelection(DataSource.REMOTE, SourceSelection.Reason.LOCAL_NOT_PREFERRED);
    }
    if (!localAvailable) {
      return new SourceSelection(DataSource.REMOTE, SourceSelection.Reason.LOCAL_UNAVAILABLE);
    }
    return new SourceSelection(DataSource.LOCAL, SourceSelection.Reason.LOCAL_PREFERRED);
  }
}
