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

import com.amazonaws.services.athena.AbstractAmazonAthena;
import com.amazonaws.services.athena.model.ColumnInfo;
import com.amazonaws.services.athena.model.Datum;
import com.amazonaws.services.athena.model.GetQueryExecutionRequest;
import com.amazonaws.services.athena.model.GetQueryExecutionResult;
import com.amazonaws.services.athena.model.GetQueryResultsRequest;
import com.amazonaws.services.athena.model.GetQueryResultsResult;
import com.amazonaws.services.athena.model.QueryExecution;
import com.amazonaws.services.athena.model.QueryExecutionStatus;
import com.amazonaws.services.athena.model.ResultConfiguration;
import com.amazonaws.services.athena.model.ResultSet;
import com.amazonaws.services.athena.model.ResultSetMetadata;
import com.amazonaws.services.athena.model.Row;
import com.amazonaws.services.athena.model.StartQueryExecutionRequest;
import com.amazonaws.services.athena.model.StartQueryExecutionResult;
import com.amazonaws.services.athena.model.StopQueryExecutionRequest;
import com.amazonaws.services.athena.model.StopQueryExecutionResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Athena client that walks every query through a scripted list of states
 * and serves a fixed result set.
 */
class FakeAthena extends AbstractAmazonAthena {
  final List<StartQueryExecutionRequest> started = new CopyOnWriteArrayList<>();
  final List<String> stopped = new CopyOnWriteArrayList<>();
  final List<GetQueryResultsRequest> resultRequests = new ArrayList<>();
  boolean shutdown;

  private List<String> states = Arrays.asList("QUEUED", "RUNNING", "SUCCEEDED");
  private String stateChangeReason;
  private final Map<String, Integer> polls = new HashMap<>();
  private final List<ColumnInfo> columns = new ArrayList<>();
  private final List<List<String>> rows = new ArrayList<>();
  private int pageSize = 1000;

  /** States reported by successive status checks; the last one repeats. */
  FakeAthena states(String... sequence) {
    this.states = Arrays.asList(sequence);
    return this;
  }

  FakeAthena stateChangeReason(String reason) {
    this.stateChangeReason = reason;
    return this;
  }

  FakeAthena column(String name, String type) {
    columns.add(new ColumnInfo().withName(name).withType(type));
    return this;
  }

  FakeAthena row(String... values) {
    rows.add(Arrays.asList(values));
    return this;
  }

  /** Data rows per page; the header row counts against the first page. */
  FakeAthena pageSize(int pageSize) {
    this.pageSize = pageSize;
    return this;
  }

  static String outputLocation(String executionId) {
    return "s3://results/athena-results/" + executionId + ".csv";
  }

  String lastSql() {
    return started.get(started.size() - 1).getQueryString();
  }

  @Override public StartQueryExecutionResult startQueryExecution(
      StartQueryExecutionRequest request) {
    started.add(request);
    return new StartQueryExecutionResult().withQueryExecutionId("q-" + started.size());
  }

  @Override public GetQueryExecutionResult getQueryExecution(GetQueryExecutionRequest request) {
    String id = request.getQueryExecutionId();
    int poll = polls.merge(id, 1, Integer::sum) - 1;
    String state = states.get(Math.min(poll, states.size() - 1));
    return new GetQueryExecutionResult().withQueryExecution(new QueryExecution()
        .withQueryExecutionId(id)
        .withStatus(new QueryExecutionStatus()
            .withState(state)
            .withStateChangeReason(stateChangeReason))
        .withResultConfiguration(new ResultConfiguration()
            .withOutputLocation(outputLocation(id))));
  }

  @Override public GetQueryResultsResult getQueryResults(GetQueryResultsRequest request) {
    resultRequests.add(request);
    List<Row> all = new ArrayList<>();
    List<Datum> header = new ArrayList<>();
    for (ColumnInfo column : columns) {
      header.add(new Datum().withVarCharValue(column.getName()));
    }
    all.add(new Row().withData(header));
    for (List<String> values : rows) {
      List<Datum> data = new ArrayList<>();
      for (String value : values) {
        data.add(value == null ? new Datum() : new Datum().withVarCharValue(value));
      }
      all.add(new Row().withData(data));
    }

    int from = request.getNextToken() == null ? 0 : Integer.parseInt(request.getNextToken());
    int size = request.getMaxResults() != null ? request.getMaxResults() : pageSize;
    int to = Math.min(all.size(), from + size);
    GetQueryResultsResult result = new GetQueryResultsResult().withResultSet(new ResultSet()
        .withRows(new ArrayList<>(all.subList(from, to)))
        .withResultSetMetadata(new ResultSetMetadata().withColumnInfo(columns)));
    if (to < all.size() && request.getMaxResults() == null) {
      result.setNextToken(String.valueOf(to));
    }
    return result;
  }

  @Override public StopQueryExecutionResult stopQueryExecution(StopQueryExecutionRequest request) {
    stopped.add(request.getQueryExecutionId());
    return new StopQueryExecutionResult();
  }

  @Override public void shutdown() {
    shutdown = true;
  }
}
