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

package com.rackspace.metrilake.app.clients;

import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ColumnType;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.ExecutionStatus;
import com.rackspace.metrilake.app.model.ResultColumn;
import com.rackspace.metrilake.app.model.ResultPage;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Query engine reached over HTTP under <code>/executions</code>.
 */
public class HttpQueryEngine implements QueryEngine {

  private final WebClient webClient;
  private final Duration requestTimeout;

  public HttpQueryEngine(WebClient webClient, Duration requestTimeout) {
    this.webClient = webClient;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public String submit(String sql, String database, String outputLocation) {
    final SubmitRequest request = new SubmitRequest()
        .setQuery(sql)
        .setDatabase(database)
        .setOutputLocation(outputLocation);
    final SubmitResponse response = webClient.post()
        .uri("/executions")
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(request))
        .retrieve()
        .bodyToMono(SubmitResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(e -> WebClientErrors.toUpstream(e, "Submitting query"))
        .block();
    if (response == null || response.getExecutionId() == null) {
      throw new UpstreamException("Query engine accepted the query without an execution id", false);
    }
    return response.getExecutionId();
  }

  @Override
  public ExecutionStatus getStatus(String executionId) {
    final StatusResponse response = webClient.get()
        .uri("/executions/{id}", executionId)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(StatusResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(e -> WebClientErrors.toUpstream(e, "Checking query " + executionId))
        .block();
    if (response == null || response.getState() == null) {
      throw new UpstreamException("Query engine returned no state for " + executionId, true);
    }
    final ExecutionState state;
    try {
      state = ExecutionState.fromEngineState(response.getState());
    } catch (IllegalArgumentException e) {
      throw new UpstreamException("Query engine reported unknown state " + response.getState(), false, e);
    }
    return new ExecutionStatus(state, response.getStateChangeReason());
  }

  @Override
  public ResultPage getResults(String executionId, String nextToken) {
    final ResultsResponse response = webClient.get()
        .uri(uriBuilder -> {
          uriBuilder.path("/executions/{id}/results");
          if (nextToken != null) {
            uriBuilder.queryParam("nextToken", nextToken);
          }
          return uriBuilder.build(executionId);
        })
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(ResultsResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(e -> WebClientErrors.toUpstream(e, "Reading results of " + executionId))
        .block();
    if (response == null || response.getColumns() == null) {
      throw new UpstreamException("Query engine returned no result schema for " + executionId, false);
    }
    final List<ResultColumn> columns = response.getColumns().stream()
        .map(column -> new ResultColumn(column.getName(), ColumnType.fromEngineType(column.getType())))
        .collect(Collectors.toList());
    return new ResultPage(columns,
        response.getRows() == null ? List.of() : response.getRows(),
        response.getNextToken());
  }

  @Data
  static class SubmitRequest {
    String query;
    String database;
    String outputLocation;
  }

  @Data
  static class SubmitResponse {
    String executionId;
  }

  @Data
  static class StatusResponse {
    String state;
    String stateChangeReason;
  }

  @Data
  static class ResultsResponse {
    List<ColumnInfo> columns;
    List<List<String>> rows;
    String nextToken;
  }

  @Data
  static class ColumnInfo {
    String name;
    String type;
  }
}
