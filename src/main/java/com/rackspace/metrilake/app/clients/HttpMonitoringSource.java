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

import static com.rackspace.metrilake.app.utils.DateTimeUtils.formatIso;

import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.MetricSample;
import com.rackspace.metrilake.app.model.MetricWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Monitoring source reached over HTTP. Series are served from <code>/series</code> and instance
 * descriptions from <code>/instances/{id}</code>.
 */
@Slf4j
public class HttpMonitoringSource implements MonitoringSource {

  private final WebClient webClient;
  private final Duration requestTimeout;

  public HttpMonitoringSource(WebClient webClient, Duration requestTimeout) {
    this.webClient = webClient;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public List<MetricSample> getSeries(String instanceId, MetricKind metric, MetricWindow window) {
    final String operation = "Fetching " + metric.getMetricName() + " for " + instanceId;
    return webClient.get()
        .uri(uriBuilder -> uriBuilder.path("/series")
            .queryParam("instanceId", instanceId)
            .queryParam("metric", metric.getMetricName())
            .queryParam("statistic", metric.getStatistic())
            .queryParam("unit", metric.getUnit())
            .queryParam("start", formatIso(window.getStart()))
            .queryParam("end", formatIso(window.getEnd()))
            .queryParam("period", window.getPeriod().getSeconds())
            .build())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToFlux(SeriesPoint.class)
        .map(point -> new MetricSample(point.getTimestamp(), metric.getMetricName(), point.getValue()))
        .collectList()
        .timeout(requestTimeout)
        .onErrorMap(e -> WebClientErrors.toUpstream(e, operation))
        .block();
  }

  @Override
  public Optional<Instant> findLaunchTime(String instanceId) {
    return webClient.get()
        .uri("/instances/{id}", instanceId)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(InstanceDescription.class)
        .onErrorResume(WebClientResponseException.NotFound.class, e -> {
          log.debug("Monitoring source does not know instance {}", instanceId);
          return Mono.empty();
        })
        .timeout(requestTimeout)
        .onErrorMap(e -> WebClientErrors.toUpstream(e, "Describing instance " + instanceId))
        .blockOptional()
        .map(InstanceDescription::getLaunchTime);
  }

  @Data
  static class SeriesPoint {
    Instant timestamp;
    Double value;
  }

  @Data
  static class InstanceDescription {
    String instanceId;
    Instant launchTime;
  }
}
