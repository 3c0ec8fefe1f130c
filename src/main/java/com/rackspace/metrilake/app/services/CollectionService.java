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

import com.rackspace.metrilake.app.clients.MonitoringSource;
import com.rackspace.metrilake.app.config.AppProperties;
import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.CollectionReport;
import com.rackspace.metrilake.app.model.FetchResult;
import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.MetricWindow;
import com.rackspace.metrilake.app.model.PartitionKey;
import com.rackspace.metrilake.app.utils.Retries;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one collection for the configured instance. Every UTC day missing since the watermark is
 * fetched, aligned and written as its own partition, and the watermark follows each complete
 * day. Without a watermark the run covers everything since launch, split into daily partitions.
 */
@Service
@Slf4j
public class CollectionService {

  private final AppProperties appProperties;
  private final CollectionProperties properties;
  private final MonitoringSource monitoringSource;
  private final WatermarkService watermarkService;
  private final TimeWindowResolver timeWindowResolver;
  private final MetricsFetcher metricsFetcher;
  private final PartitionWriter partitionWriter;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public CollectionService(AppProperties appProperties,
                           CollectionProperties properties,
                           MonitoringSource monitoringSource,
                           WatermarkService watermarkService,
                           TimeWindowResolver timeWindowResolver,
                           MetricsFetcher metricsFetcher,
                           PartitionWriter partitionWriter,
                           MeterRegistry meterRegistry,
                           Clock clock) {
    this.appProperties = appProperties;
    this.properties = properties;
    this.monitoringSource = monitoringSource;
    this.watermarkService = watermarkService;
    this.timeWindowResolver = timeWindowResolver;
    this.metricsFetcher = metricsFetcher;
    this.partitionWriter = partitionWriter;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public CollectionReport collect() {
    final String instanceId = appProperties.getInstanceId();
    try {
      final CollectionReport report = collect(instanceId, clock.instant());
      meterRegistry.counter("metrilake.collection.runs", "outcome", "success").increment();
      return report;
    } catch (RuntimeException e) {
      meterRegistry.counter("metrilake.collection.runs", "outcome", "failure").increment();
      throw e;
    }
  }

  private CollectionReport collect(String instanceId, Instant now) {
    final Optional<LocalDate> watermark = watermarkService.lastCollectedDay();
    final List<MetricWindow> windows;
    if (watermark.isPresent()) {
      windows = timeWindowResolver.pendingDays(now, watermark.get());
    } else {
      final Instant launchTime = Retries.call(
          () -> monitoringSource.findLaunchTime(instanceId),
          properties.getRetryFetch(),
          UpstreamException::isTransientFailure,
          "launch time lookup"
      ).orElse(null);
      windows = TimeWindowResolver.splitByDay(timeWindowResolver.resolve(now, launchTime));
    }

    final CollectionReport report = new CollectionReport()
        .setInstanceId(instanceId)
        .setPeriodSeconds(properties.getPeriod().getSeconds())
        .setObjectKeys(new ArrayList<>())
        .setDatapoints(new EnumMap<>(MetricKind.class))
        .setFailedMetrics(new ArrayList<>());
    if (windows.isEmpty()) {
      log.info("Instance {} is collected up to {}, nothing to do",
          instanceId, watermark.map(LocalDate::toString).orElse("none"));
      return report;
    }
    report
        .setWindowStart(windows.get(0).getStart())
        .setWindowEnd(windows.get(windows.size() - 1).getEnd());

    // oldest first; a failure leaves the watermark on the last written day
    for (MetricWindow window : windows) {
      log.info("Collecting instance {} over [{}, {}) at {}s",
          instanceId, window.getStart(), window.getEnd(), window.getPeriod().getSeconds());

      final FetchResult fetched = metricsFetcher.fetch(window, instanceId);
      final PartitionKey partitionKey = PartitionKey.of(instanceId, window);
      report.getObjectKeys().add(partitionWriter.write(fetched.getRows(), partitionKey));
      if (TimeWindowResolver.endsDay(window)) {
        watermarkService.advance(partitionKey.getDate());
      }

      report.setRowCount(report.getRowCount() + fetched.getRows().size());
      fetched.getDatapoints().forEach(
          (metric, count) -> report.getDatapoints().merge(metric, count, Integer::sum));
      for (MetricKind metric : fetched.getFailedMetrics()) {
        if (!report.getFailedMetrics().contains(metric)) {
          report.getFailedMetrics().add(metric);
        }
      }
    }
    return report;
  }
}
