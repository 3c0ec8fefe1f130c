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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.metrilake.app.clients.InMemoryObjectStore;
import com.rackspace.metrilake.app.clients.ScriptedQueryEngine;
import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.exceptions.StorageException;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ColumnType;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.MaterializedResult;
import com.rackspace.metrilake.app.model.QueryExecution;
import com.rackspace.metrilake.app.model.ResultColumn;
import com.rackspace.metrilake.app.model.ResultPage;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultMaterializerTest {

  static final List<ResultColumn> COLUMNS = List.of(
      new ResultColumn("timestamp", ColumnType.TIMESTAMP),
      new ResultColumn("cpu_percent", ColumnType.DOUBLE),
      new ResultColumn("network_in_bytes", ColumnType.BIGINT),
      new ResultColumn("instance_id", ColumnType.VARCHAR));

  final ScriptedQueryEngine engine = new ScriptedQueryEngine();
  final InMemoryObjectStore objectStore = new InMemoryObjectStore();
  final QueryProperties properties = new QueryProperties();
  final ResultMaterializer materializer = new ResultMaterializer(engine, objectStore, properties);

  {
    properties.getRetryEngine().setMinBackoff(Duration.ofMillis(1));
    properties.getRetryStore().setMinBackoff(Duration.ofMillis(1));
  }

  static QueryExecution succeeded() {
    return new QueryExecution().setId("exec-1").setState(ExecutionState.SUCCEEDED);
  }

  @Test
  void readsEveryPageInOrder() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(
            List.of("2024-03-01 00:00:00.000", "12.5", "1024", "i-1"),
            List.of("2024-03-01 00:05:00.000", "3.25", "2048", "i-1")), "t1"))
        .withPage("t1", new ResultPage(COLUMNS, List.of(
            Arrays.asList("2024-03-01 00:10:00.000", null, "", "i-1")), null));

    final MaterializedResult result = materializer.materialize(succeeded());

    assertThat(engine.getRequestedTokens()).containsExactly(null, "t1");
    assertThat(result.getRowCount()).isEqualTo(3);
    assertThat(result.getResultLocation()).isEqualTo("athena-query-results/latest.csv");
    assertThat(result.getLocator()).isEqualTo("s3://metrics-test/athena-query-results/latest.csv");
    assertThat(objectStore.getText("athena-query-results/latest.csv")).isEqualTo(
        "timestamp,cpu_percent,network_in_bytes,instance_id\n"
            + "2024-03-01T00:00:00Z,12.5,1024,i-1\n"
            + "2024-03-01T00:05:00Z,3.25,2048,i-1\n"
            + "2024-03-01T00:10:00Z,,,i-1\n");
  }

  @Test
  void previewIsKeyedByColumnName() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(
        List.of("2024-03-01 00:00:00", "12.5", "1024", "i-1")), null));

    final MaterializedResult result = materializer.materialize(succeeded());

    assertThat(result.getPreview()).hasSize(1);
    final Map<String, Object> row = result.getPreview().get(0);
    assertThat(row.keySet()).containsExactly("timestamp", "cpu_percent", "network_in_bytes", "instance_id");
    assertThat(row).containsEntry("timestamp", Instant.parse("2024-03-01T00:00:00Z"))
        .containsEntry("cpu_percent", 12.5)
        .containsEntry("network_in_bytes", 1024L)
        .containsEntry("instance_id", "i-1");
  }

  @Test
  void previewIsLimited() {
    final List<List<String>> rows = new ArrayList<>();
    for (int i = 0; i < 25; i++) {
      rows.add(List.of("2024-03-01 00:00:00", Integer.toString(i), "1", "i-1"));
    }
    engine.withPage(null, new ResultPage(COLUMNS, rows, null));

    final MaterializedResult result = materializer.materialize(succeeded());

    assertThat(result.getPreview()).hasSize(10);
    assertThat(result.getRowCount()).isEqualTo(25);
  }

  @Test
  void emptyResultWritesHeader() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(), null));

    final MaterializedResult result = materializer.materialize(succeeded());

    assertThat(result.getPreview()).isEmpty();
    assertThat(objectStore.getText("athena-query-results/latest.csv"))
        .isEqualTo("timestamp,cpu_percent,network_in_bytes,instance_id\n");
  }

  @Test
  void quotesValuesThatNeedIt() {
    final List<ResultColumn> columns = List.of(new ResultColumn("note", ColumnType.VARCHAR));
    engine.withPage(null, new ResultPage(columns, List.of(
        List.of("a,b"), List.of("say \"hi\"")), null));

    materializer.materialize(succeeded());

    assertThat(objectStore.getText("athena-query-results/latest.csv"))
        .isEqualTo("note\n\"a,b\"\n\"say \"\"hi\"\"\"\n");
  }

  @Test
  void decodesTypes() {
    assertThat(ResultMaterializer.decode(new ResultColumn("b", ColumnType.BOOLEAN), "TRUE")).isEqualTo(true);
    assertThat(ResultMaterializer.decode(new ResultColumn("d", ColumnType.DATE), "2024-03-01"))
        .isEqualTo(LocalDate.of(2024, 3, 1));
    assertThat(ResultMaterializer.decode(new ResultColumn("t", ColumnType.TIMESTAMP), "2024-03-01T10:00:00Z"))
        .isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    assertThat(ResultMaterializer.decode(new ResultColumn("n", ColumnType.BIGINT), "")).isNull();
  }

  @Test
  void undecodableValue() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(
        List.of("2024-03-01 00:00:00", "lots", "1", "i-1")), null));

    assertThatThrownBy(() -> materializer.materialize(succeeded()))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("cpu_percent");
    assertThat(objectStore.getPutCount()).isZero();
  }

  @Test
  void columnCountMismatchBetweenPages() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(), "t1"))
        .withPage("t1", new ResultPage(COLUMNS.subList(0, 2), List.of(), null));

    assertThatThrownBy(() -> materializer.materialize(succeeded()))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("columns");
  }

  @Test
  void repeatedTokenIsRejected() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(), "t1"))
        .withPage("t1", new ResultPage(COLUMNS, List.of(), "t1"));

    assertThatThrownBy(() -> materializer.materialize(succeeded()))
        .isInstanceOf(UpstreamException.class);
  }

  @Test
  void storageFailureProducesNoLocator() {
    engine.withPage(null, new ResultPage(COLUMNS, List.of(), null));
    objectStore.failNextPuts(2);

    assertThatThrownBy(() -> materializer.materialize(succeeded()))
        .isInstanceOf(StorageException.class);
    assertThat(objectStore.getPutCount()).isEqualTo(2);
  }

  @Test
  void requiresSucceededExecution() {
    assertThatThrownBy(() -> materializer.materialize(
        new QueryExecution().setId("exec-1").setState(ExecutionState.RUNNING)))
        .isInstanceOf(IllegalStateException.class);
  }
}
