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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ColumnType;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.ExecutionStatus;
import com.rackspace.metrilake.app.model.ResultColumn;
import com.rackspace.metrilake.app.model.ResultPage;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

class HttpQueryEngineTest {

  final StubExchange exchange = new StubExchange();
  final HttpQueryEngine engine = new HttpQueryEngine(exchange.webClient(), Duration.ofSeconds(5));

  @Test
  void submit() {
    exchange.respond(HttpStatus.OK, "{\"executionId\":\"abc-123\"}");

    assertThat(engine.submit("SELECT 1", "cpu_metrics", "s3://metrics/out/")).isEqualTo("abc-123");
    assertThat(exchange.getRequests()).hasSize(1);
    assertThat(exchange.getRequests().get(0).method()).isEqualTo(HttpMethod.POST);
    assertThat(exchange.getRequests().get(0).url().getPath()).isEqualTo("/executions");
  }

  @Test
  void submitRejected() {
    exchange.respond(HttpStatus.BAD_REQUEST, "{\"message\":\"bad\"}");

    assertThatThrownBy(() -> engine.submit("SELECT 1", "cpu_metrics", "s3://metrics/out/"))
        .isInstanceOfSatisfying(UpstreamException.class, e -> assertThat(e.isTransient()).isFalse())
        .hasMessageContaining("400");
  }

  @Test
  void throttledStatusIsTransient() {
    exchange.respond(HttpStatus.TOO_MANY_REQUESTS, "{}");

    assertThatThrownBy(() -> engine.getStatus("abc-123"))
        .isInstanceOfSatisfying(UpstreamException.class, e -> assertThat(e.isTransient()).isTrue());
  }

  @Test
  void statusMapsEngineStates() {
    exchange.respond(HttpStatus.OK, "{\"state\":\"QUEUED\"}")
        .respond(HttpStatus.OK, "{\"state\":\"FAILED\",\"stateChangeReason\":\"Table not found\"}");

    assertThat(engine.getStatus("abc-123").getState()).isEqualTo(ExecutionState.SUBMITTED);
    final ExecutionStatus failed = engine.getStatus("abc-123");
    assertThat(failed.getState()).isEqualTo(ExecutionState.FAILED);
    assertThat(failed.getStateChangeReason()).isEqualTo("Table not found");
    assertThat(exchange.getRequests().get(0).url().getPath()).isEqualTo("/executions/abc-123");
  }

  @Test
  void unknownStateIsPermanent() {
    exchange.respond(HttpStatus.OK, "{\"state\":\"EXPLODED\"}");

    assertThatThrownBy(() -> engine.getStatus("abc-123"))
        .isInstanceOfSatisfying(UpstreamException.class, e -> assertThat(e.isTransient()).isFalse());
  }

  @Test
  void resultsPage() {
    exchange.respond(HttpStatus.OK, "{\"columns\":[{\"name\":\"ts\",\"type\":\"timestamp(3)\"},"
        + "{\"name\":\"cpu\",\"type\":\"double\"}],"
        + "\"rows\":[[\"2024-03-01 00:00:00.000\",\"1.5\"],[\"2024-03-01 00:05:00.000\",null]],"
        + "\"nextToken\":\"t2\"}");

    final ResultPage page = engine.getResults("abc-123", "t1");

    assertThat(page.getColumns()).containsExactly(
        new ResultColumn("ts", ColumnType.TIMESTAMP), new ResultColumn("cpu", ColumnType.DOUBLE));
    assertThat(page.getRows()).containsExactly(
        List.of("2024-03-01 00:00:00.000", "1.5"), Arrays.asList("2024-03-01 00:05:00.000", null));
    assertThat(page.getNextToken()).isEqualTo("t2");
    assertThat(exchange.getRequests().get(0).url().getPath()).isEqualTo("/executions/abc-123/results");
    assertThat(exchange.getRequests().get(0).url().getQuery()).isEqualTo("nextToken=t1");
  }
}
