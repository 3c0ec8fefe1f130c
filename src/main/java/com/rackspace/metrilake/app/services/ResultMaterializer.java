/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.metrilake.app.services;

import static com.rackspace.metrilake.app.utils.DateTimeUtils.formatIso;

import com.rackspace.metrilake.app.clients.ObjectStore;
import com.rackspace.metrilake.app.clients.QueryEngine;
import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.exceptions.StorageException;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.MaterializedResult;
import com.rackspace.metrilake.app.model.QueryExecution;
import com.rackspace.metrilake.app.model.QueryResultSet;
import com.rackspace.metrilake.app.model.ResultColumn;
import com.rackspace.metrilake.app.model.ResultPage;
import com.rackspace.metrilake.app.utils.CsvUtils;
import com.rackspace.metrilake.app.utils.DateTimeUtils;
import com.rackspace.metrilake.app.utils.Retries;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads the complete result of a succeeded execution, replaces the canonical
 * <code>latest.csv</code> object with it and cuts the inline preview.
 */
@Component
@Slf4j
public class ResultMaterializer {

  static final String LATEST_OBJECT = "latest.csv";

  private final QueryEngine queryEngine;
  private final ObjectStore objectStore;
  private final QueryProperties properties;

  @Autowired
  public ResultMaterializer(QueryEngine queryEngine, ObjectStore objectStore,
                            QueryProperties properties) {
    this.queryEngine = queryEngine;
    this.objectStore = objectStore;
    this.properties = properties;
  }

  /**
   * @throws StorageException if the canonical object could not be written, in which case no
   * locator is produced
   */
  public MaterializedResult materialize(QueryExecution execution) {
    if (execution.getState() != ExecutionState.SUCCEEDED) {
      throw new IllegalStateException(
          "Execution " + execution.getId() + " has not succeeded: " + execution.getState());
    }

    final String key = resultKey();
    final QueryResultSet resultSet = fetchResultSet(execution.getId(), key);
    final byte[] csv = encode(resultSet);

    Retries.run(() -> objectStore.put(key, csv),
        properties.getRetryStore(),
        e -> e instanceof StorageException,
        "write of " + key);
    log.info("Materialized {} rows of execution {} to {}",
        resultSet.getRows().size(), execution.getId(), key);

    return new MaterializedResult(preview(resultSet, properties.getPreviewRows()), key,
        objectStore.locate(key), resultSet.getRows().size());
  }

  String resultKey() {
    return properties.getResultPrefix() + "/" + LATEST_OBJECT;
  }

  /**
   * Reads every page in order. The column list of the first page applies to all pages.
   */
  QueryResultSet fetchResultSet(String executionId, String resultLocation) {
    List<ResultColumn> columns = null;
    final List<List<Object>> rows = new ArrayList<>();
    String nextToken = null;
    int pages = 0;

    do {
      final String token = nextToken;
      final ResultPage page = Retries.call(
          () -> queryEngine.getResults(executionId, token),
          properties.getRetryEngine(),
          UpstreamException::isTransientFailure,
          "result read of " + executionId
      );
      pages++;
      if (columns == null) {
        columns = page.getColumns();
      } else if (page.getColumns().size() != columns.size()) {
        throw new UpstreamException(String.format(
            "Result page %d of %s has %d columns, expected %d",
            pages, executionId, page.getColumns().size(), columns.size()), false);
      }
      for (List<String> raw : page.getRows()) {
        rows.add(decodeRow(columns, raw));
      }
      if (page.getNextToken() != null && Objects.equals(page.getNextToken(), token)) {
        throw new UpstreamException("Result paging of " + executionId + " did not advance", false);
      }
      nextToken = page.getNextToken();
    } while (nextToken != null);

    log.debug("Read {} rows in {} pages for execution {}", rows.size(), pages, executionId);
    return new QueryResultSet(columns, rows, resultLocation);
  }

  private static List<Object> decodeRow(List<ResultColumn> columns, List<String> raw) {
    if (raw.size() > columns.size()) {
      throw new UpstreamException(String.format(
          "Result row has %d values for %d columns", raw.size(), columns.size()), false);
    }
    final List<Object> row = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      // engines omit trailing nulls
      final String value = i < raw.size() ? raw.get(i) : null;
      row.add(decode(columns.get(i), value));
    }
    return row;
  }

  static Object decode(ResultColumn column, String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      switch (column.getType()) {
        case BIGINT:
          return Long.parseLong(value.trim());
        case DOUBLE:
          return Double.parseDouble(value.trim());
        case BOOLEAN:
          if ("true".equalsIgnoreCase(value.trim()) || "false".equalsIgnoreCase(value.trim())) {
            return Boolean.parseBoolean(value.trim());
          }
          throw new IllegalArgumentException("not a boolean");
        case TIMESTAMP:
          return DateTimeUtils.parseEngineTimestamp(value.trim());
        case DATE:
          return LocalDate.parse(value.trim());
        default:
          return value;
      }
    } catch (IllegalArgumentException | DateTimeParseException e) {
      throw new UpstreamException(String.format(
          "Column %s holds a value that is not a valid %s: %s",
          column.getName(), column.getType(), value), false, e);
    }
  }

  static byte[] encode(QueryResultSet resultSet) {
    final List<List<String>> lines = resultSet.getRows().stream()
        .map(row -> row.stream().map(ResultMaterializer::toText).collect(Collectors.toList()))
        .collect(Collectors.toList());
    return CsvUtils.write(resultSet.getColumnNames(), lines);
  }

  private static String toText(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant) {
      return formatIso((Instant) value);
    }
    if (value instanceof Double) {
      final double d = (Double) value;
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return value.toString();
      }
      return BigDecimal.valueOf(d).toPlainString();
    }
    return value.toString();
  }

  static List<Map<String, Object>> preview(QueryResultSet resultSet, int limit) {
    final List<String> names = resultSet.getColumnNames();
    return resultSet.getRows().stream()
        .limit(limit)
        .map(row -> {
          final Map<String, Object> entry = new LinkedHashMap<>();
          for (int i = 0; i < names.size(); i++) {
            entry.put(names.get(i), row.get(i));
          }
          return entry;
        })
        .collect(Collectors.toList());
  }
}
