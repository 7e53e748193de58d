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

import org.finops.query.result.ColumnType;
import org.finops.query.result.ResultColumn;
import org.finops.query.result.ResultTable;

import com.amazonaws.services.athena.AmazonAthena;
import com.amazonaws.services.athena.model.ColumnInfo;
import com.amazonaws.services.athena.model.Datum;
import com.amazonaws.services.athena.model.GetQueryResultsRequest;
import com.amazonaws.services.athena.model.GetQueryResultsResult;
import com.amazonaws.services.athena.model.Row;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3URI;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.util.IOUtils;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the result of a finished Athena query.
 *
 * <p>Records are paged through the GetQueryResults API; tables and CSV text
 * come from the result file Athena writes to S3.
 */
public class AthenaResultFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(AthenaResultFetcher.class);

  private static final Pattern INTEGRAL = Pattern.compile("-?\\d+");
  private static final Pattern FRACTIONAL =
      Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

  private final AmazonAthena athena;
  private final AmazonS3 s3;

  public AthenaResultFetcher(AmazonAthena athena, AmazonS3 s3) {
    this.athena = athena;
    this.s3 = s3;
  }

  /**
   * Pages through the query results. The header row is dropped; values that
   * look like integers become {@link Long}, other numbers {@link Double},
   * everything else stays text. Missing values are null.
   */
  public List<Map<String, Object>> records(String executionId) {
    List<Map<String, Object>> records = new ArrayList<>();
    List<String> headers = null;
    String nextToken = null;
    do {
      GetQueryResultsResult page = athena.getQueryResults(new GetQueryResultsRequest()
          .withQueryExecutionId(executionId)
          .withNextToken(nextToken));
      List<Row> rows = page.getResultSet().getRows();
      int start = 0;
      if (headers == null) {
        headers = new ArrayList<>();
        if (!rows.isEmpty()) {
          for (Datum datum : rows.get(0).getData()) {
            headers.add(datum.getVarCharValue());
          }
          start = 1;
        }
      }
      for (int r = start; r < rows.size(); r++) {
        List<Datum> data = rows.get(r).getData();
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
          String value = i < data.size() ? data.get(i).getVarCharValue() : null;
          record.put(headers.get(i), coerceNumber(value));
        }
        records.add(record);
      }
      nextToken = page.getNextToken();
    } while (nextToken != null);
    LOGGER.debug("Fetched {} records for query {}", records.size(), executionId);
    return records;
  }

  /** Column names and types from the result metadata. */
  public List<ResultColumn> columns(String executionId) {
    GetQueryResultsResult page = athena.getQueryResults(new GetQueryResultsRequest()
        .withQueryExecutionId(executionId)
        .withMaxResults(1));
    List<ResultColumn> columns = new ArrayList<>();
    for (ColumnInfo info : page.getResultSet().getResultSetMetadata().getColumnInfo()) {
      columns.add(new ResultColumn(info.getName(), ColumnType.fromAthenaType(info.getType())));
    }
    return columns;
  }

  /** Text of the result file at {@code s3://bucket/key}. */
  public String csv(String outputLocation) throws IOException {
    AmazonS3URI uri = new AmazonS3URI(outputLocation);
    try (S3Object object = s3.getObject(uri.getBucket(), uri.getKey())) {
      return IOUtils.toString(object.getObjectContent());
    }
  }

  /**
   * Parses the result file with the column types of the result metadata.
   * A column whose values do not parse as its declared type is returned as
   * text.
   */
  public ResultTable table(String executionId, String outputLocation) throws IOException {
    List<ResultColumn> declared = columns(executionId);
    List<String[]> lines = new ArrayList<>();
    try (CSVReader reader = new CSVReader(new StringReader(csv(outputLocation)))) {
      String[] header = reader.readNext();
      if (header != null) {
        String[] line;
        while ((line = reader.readNext()) != null) {
          lines.add(line);
        }
      }
    } catch (CsvValidationException e) {
      throw new IOException("Malformed Athena result " + outputLocation + ": " + e.getMessage(),
          e);
    }

    int columnCount = declared.size();
    List<Object[]> rows = new ArrayList<>(lines.size());
    for (int r = 0; r < lines.size(); r++) {
      rows.add(new Object[columnCount]);
    }
    List<ResultColumn> columns = new ArrayList<>(columnCount);
    for (int c = 0; c < columnCount; c++) {
      ResultColumn column = declared.get(c);
      ColumnType type = column.getType();
      try {
        for (int r = 0; r < lines.size(); r++) {
          rows.get(r)[c] = parse(cell(lines.get(r), c), type);
        }
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Column {} does not parse as {}, returning text: {}", column.getName(), type,
            e.getMessage());
        type = ColumnType.VARCHAR;
        for (int r = 0; r < lines.size(); r++) {
          rows.get(r)[c] = cell(lines.get(r), c);
        }
      }
      columns.add(new ResultColumn(column.getName(), type));
    }
    return new ResultTable(columns, rows);
  }

  static @Nullable Object coerceNumber(@Nullable String value) {
    if (value == null) {
      return null;
    }
    if (INTEGRAL.matcher(value).matches()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        return new BigDecimal(value);
      }
    }
    if (FRACTIONAL.matcher(value).matches()) {
      return Double.parseDouble(value);
    }
    return value;
  }

  private static @Nullable String cell(String[] line, int column) {
    if (column >= line.length || line[column].isEmpty()) {
      return null;
    }
    return line[column];
  }

  private static @Nullable Object parse(@Nullable String text, ColumnType type) {
    if (text == null) {
      return null;
    }
    switch (type) {
    case BOOLEAN:
      if (!"true".equalsIgnoreCase(text) && !"false".equalsIgnoreCase(text)) {
        throw new IllegalArgumentException("not a boolean: " + text);
      }
      return Boolean.parseBoolean(text);
    case INTEGER:
      return Integer.parseInt(text);
    case BIGINT:
      return Long.parseLong(text);
    case FLOAT:
      return Float.parseFloat(text);
    case DOUBLE:
      return Double.parseDouble(text);
    case DECIMAL:
      return new BigDecimal(text);
    case DATE:
      return Date.valueOf(text);
    case TIMESTAMP:
      return Timestamp.valueOf(text);
    case BINARY:
      return text.getBytes(StandardCharsets.UTF_8);
    case VARCHAR:
    default:
      return text;
    }
  }
}
