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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.metrilake.app.clients.FakeMonitoringSource;
import com.rackspace.metrilake.app.clients.MonitoringSource;
import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.AlignedSeriesRow;
import com.rackspace.metrilake.app.model.FetchResult;
import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.MetricSample;
import com.rackspace.metrilake.app.model.MetricWindow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MetricsFetcherTest {

  static final String INSTANCE = "i-0123456789abcdef0";
  static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

  final MetricWindow window = new MetricWindow(T0, T0.plus(Duration.ofMinutes(20)), Duration.ofMinutes(5));
  final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  final CollectionProperties properties = new CollectionProperties();

  {
    properties.getRetryFetch().setMinBackoff(Duration.ofMillis(1)).setMaxBackoff(Duration.ofMillis(5));
  }

  @Test
  void alignsMetricsIntoOneRowPerBucket() {
    final FakeMonitoringSource source = new FakeMonitoringSource()
        .withSample(MetricKind.CPU_UTILIZATION, T0, 10.0)
        .withSample(MetricKind.CPU_UTILIZATION, T0.plusSeconds(300), 20.5)
        .withSample(MetricKind.NETWORK_IN, T0.plusSeconds(600), 1000.0)
        .withSample(MetricKind.NETWORK_OUT, T0.plusSeconds(900), 42.0);

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    final List<AlignedSeriesRow> rows = result.getRows();
    assertThat(rows).extracting(AlignedSeriesRow::getTimestamp).containsExactly(
        T0, T0.plusSeconds(300), T0.plusSeconds(600), T0.plusSeconds(900));
    assertThat(rows).allSatisfy(row -> assertThat(row.getInstanceId()).isEqualTo(INSTANCE));

    assertThat(rows.get(0).getValue(MetricKind.CPU_UTILIZATION)).isEqualTo(10.0);
    assertThat(rows.get(0).getValue(MetricKind.NETWORK_IN)).isNull();
    assertThat(rows.get(1).getValue(MetricKind.CPU_UTILIZATION)).isEqualTo(20.5);
    assertThat(rows.get(2).getValue(MetricKind.NETWORK_IN)).isEqualTo(1000.0);
    assertThat(rows.get(3).getValue(MetricKind.NETWORK_OUT)).isEqualTo(42.0);
    assertThat(result.getFailedMetrics()).isEmpty();
    assertThat(result.getDatapoints()).containsEntry(MetricKind.CPU_UTILIZATION, 2);
  }

  @Test
  void emptySeriesStillProducesEveryBucket() {
    final FetchResult result = new MetricsFetcher(new FakeMonitoringSource(), properties, meterRegistry)
        .fetch(window, INSTANCE);

    assertThat(result.getRows()).hasSize(4);
    assertThat(result.getRows()).allSatisfy(row ->
        assertThat(row.getValues().values()).containsOnlyNulls());
  }

  @Test
  void ignoresSamplesOutsideWindow() {
    final FakeMonitoringSource source = new FakeMonitoringSource()
        .withSample(MetricKind.CPU_UTILIZATION, T0.minusSeconds(300), 1.0)
        .withSample(MetricKind.CPU_UTILIZATION, window.getEnd(), 2.0)
        .withSample(MetricKind.CPU_UTILIZATION, T0.plusSeconds(300), 3.0);

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    assertThat(result.getRows()).hasSize(4);
    assertThat(result.getRows().stream()
        .map(row -> row.getValue(MetricKind.CPU_UTILIZATION))
        .collect(Collectors.toList()))
        .containsExactly(null, 3.0, null, null);
    assertThat(result.getDatapoints()).containsEntry(MetricKind.CPU_UTILIZATION, 1);
  }

  @Test
  void dropsSamplesWithoutTimestamp() {
    final FakeMonitoringSource source = new FakeMonitoringSource()
        .withSample(MetricKind.NETWORK_OUT, null, 7.0)
        .withSample(MetricKind.NETWORK_OUT, T0.plusSeconds(600), 8.0);

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    assertThat(result.getFailedMetrics()).isEmpty();
    assertThat(result.getRows().stream()
        .map(row -> row.getValue(MetricKind.NETWORK_OUT))
        .collect(Collectors.toList()))
        .containsExactly(null, null, 8.0, null);
    assertThat(result.getDatapoints()).containsEntry(MetricKind.NETWORK_OUT, 1);
  }

  @Test
  void laterSampleWinsWithinBucket() {
    final FakeMonitoringSource source = new FakeMonitoringSource()
        .withSample(MetricKind.CPU_UTILIZATION, T0.plusSeconds(300), 1.0)
        .withSample(MetricKind.CPU_UTILIZATION, T0.plusSeconds(420), 2.0);

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    assertThat(result.getRows().get(1).getValue(MetricKind.CPU_UTILIZATION)).isEqualTo(2.0);
  }

  @Test
  void failedMetricLeavesColumnEmpty() {
    final FakeMonitoringSource source = new FakeMonitoringSource()
        .withSample(MetricKind.CPU_UTILIZATION, T0, 10.0)
        .withSample(MetricKind.NETWORK_IN, T0, 5.0)
        .failing(MetricKind.NETWORK_OUT, new UpstreamException("Access denied", false));

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    assertThat(result.getFailedMetrics()).containsExactly(MetricKind.NETWORK_OUT);
    assertThat(result.getRows()).hasSize(4);
    assertThat(result.getRows()).allSatisfy(row ->
        assertThat(row.getValue(MetricKind.NETWORK_OUT)).isNull());
    assertThat(result.getRows().get(0).getValue(MetricKind.CPU_UTILIZATION)).isEqualTo(10.0);
    assertThat(meterRegistry.get("metrilake.metric.fetch.failures")
        .tag("metric", "NetworkOut").counter().count()).isEqualTo(1.0);
  }

  @Test
  void allMetricsFailing() {
    final FakeMonitoringSource source = new FakeMonitoringSource().failingAll();

    assertThatThrownBy(() -> new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining(INSTANCE);
  }

  @Test
  void retriesTransientFailure() {
    final MonitoringSource source = mock(MonitoringSource.class);
    when(source.getSeries(eq(INSTANCE), any(), eq(window))).thenReturn(List.of());
    when(source.getSeries(INSTANCE, MetricKind.CPU_UTILIZATION, window))
        .thenThrow(new UpstreamException("Throttled", true))
        .thenReturn(List.of(new MetricSample(T0, "CPUUtilization", 7.5)));

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    verify(source, times(2)).getSeries(INSTANCE, MetricKind.CPU_UTILIZATION, window);
    assertThat(result.getFailedMetrics()).isEmpty();
    assertThat(result.getRows().get(0).getValue(MetricKind.CPU_UTILIZATION)).isEqualTo(7.5);
  }

  @Test
  void doesNotRetryPermanentFailure() {
    final MonitoringSource source = mock(MonitoringSource.class);
    when(source.getSeries(eq(INSTANCE), any(), eq(window))).thenReturn(List.of());
    when(source.getSeries(INSTANCE, MetricKind.NETWORK_IN, window))
        .thenThrow(new UpstreamException("Access denied", false));

    final FetchResult result = new MetricsFetcher(source, properties, meterRegistry).fetch(window, INSTANCE);

    verify(source, times(1)).getSeries(INSTANCE, MetricKind.NETWORK_IN, window);
    assertThat(result.getFailedMetrics()).containsExactly(MetricKind.NETWORK_IN);
  }
}
