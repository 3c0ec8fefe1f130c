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

import static com.rackspace.metrilake.app.utils.DateTimeUtils.floorToPeriod;

import com.rackspace.metrilake.app.clients.MonitoringSource;
import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.AlignedSeriesRow;
import com.rackspace.metrilake.app.model.FetchResult;
import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.MetricSample;
import com.rackspace.metrilake.app.model.MetricWindow;
import com.rackspace.metrilake.app.utils.Retries;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MetricsFetcher {

  private final MonitoringSource monitoringSource;
  private final CollectionProperties properties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public MetricsFetcher(MonitoringSource monitoringSource,
                        CollectionProperties properties,
                        MeterRegistry meterRegistry) {
    this.monitoringSource = monitoringSource;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Fetches every {@link MetricKind} over the window and outer joins them into one row per
   * bucket. Samples without a timestamp are dropped. A metric that cannot be fetched leaves its
   * column null in every row; only when no metric can be fetched does the whole fetch fail.
   *
   * @throws UpstreamException if every metric fetch failed
   */
  public FetchResult fetch(MetricWindow window, String instanceId) {
    final Map<MetricKind, Map<Instant, Double>> bucketed = new EnumMap<>(MetricKind.class);
    final Map<MetricKind, Integer> datapoints = new EnumMap<>(MetricKind.class);
    final List<MetricKind> failed = new ArrayList<>();

    for (MetricKind metric : MetricKind.values()) {
      try {
        final List<MetricSample> samples = Retries.call(
            () -> monitoringSource.getSeries(instanceId, metric, window),
            properties.getRetryFetch(),
            UpstreamException::isTransientFailure,
            "fetch of " + metric.getMetricName()
        );
        final List<MetricSample> inWindow = samples.stream()
            .filter(sample -> sample.getTimestamp() != null)
            .filter(sample -> window.contains(sample.getTimestamp()))
            .sorted(Comparator.comparing(MetricSample::getTimestamp))
            .collect(Collectors.toList());
        bucketed.put(metric, toBuckets(inWindow, window));
        datapoints.put(metric, inWindow.size());
      } catch (UpstreamException e) {
        log.warn("Fetching {} for instance {} failed, column will be empty: {}",
            metric.getMetricName(), instanceId, e.getMessage());
        meterRegistry.counter("metrilake.metric.fetch.failures", "metric", metric.getMetricName())
            .increment();
        bucketed.put(metric, Map.of());
        datapoints.put(metric, 0);
        failed.add(metric);
      }
    }

    if (failed.size() == MetricKind.values().length) {
      throw new UpstreamException(
          "Monitoring source failed for every metric of instance " + instanceId, false);
    }

    final List<AlignedSeriesRow> rows = new ArrayList<>(window.getBucketCount());
    for (Instant bucket : window.bucketStarts()) {
      final Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
      for (MetricKind metric : MetricKind.values()) {
        values.put(metric, bucketed.get(metric).get(bucket));
      }
      rows.add(new AlignedSeriesRow(bucket, instanceId, values));
    }

    log.debug("Aligned {} buckets for instance {} over [{}, {})",
        rows.size(), instanceId, window.getStart(), window.getEnd());
    return new FetchResult(rows, datapoints, failed);
  }

  /**
   * Samples must be in the window and sorted, so a later sample in the same bucket wins.
   */
  private static Map<Instant, Double> toBuckets(List<MetricSample> samples, MetricWindow window) {
    final Map<Instant, Double> buckets = new HashMap<>();
    for (MetricSample sample : samples) {
      buckets.put(floorToPeriod(sample.getTimestamp(), window.getPeriod()), sample.getValue());
    }
    return buckets;
  }
}
