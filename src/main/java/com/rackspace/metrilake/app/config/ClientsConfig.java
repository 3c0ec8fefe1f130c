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

package com.rackspace.metrilake.app.config;

import com.rackspace.metrilake.app.clients.FileSystemObjectStore;
import com.rackspace.metrilake.app.clients.HttpMonitoringSource;
import com.rackspace.metrilake.app.clients.HttpQueryEngine;
import com.rackspace.metrilake.app.clients.MonitoringSource;
import com.rackspace.metrilake.app.clients.ObjectStore;
import com.rackspace.metrilake.app.clients.QueryEngine;
import com.rackspace.metrilake.app.utils.Sleeper;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the external collaborators. Each one is an interface so tests and alternative
 * deployments can supply their own beans.
 */
@Configuration
public class ClientsConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.THREAD;
  }

  @Bean
  @ConditionalOnMissingBean
  public MonitoringSource monitoringSource(WebClient.Builder webClientBuilder,
                                           AppProperties appProperties) {
    final AppProperties.Endpoint endpoint = appProperties.getMonitoring();
    return new HttpMonitoringSource(
        webClientBuilder.clone().baseUrl(endpoint.getBaseUrl()).build(),
        endpoint.getRequestTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public QueryEngine queryEngine(WebClient.Builder webClientBuilder, AppProperties appProperties) {
    final AppProperties.Endpoint endpoint = appProperties.getEngine();
    return new HttpQueryEngine(
        webClientBuilder.clone().baseUrl(endpoint.getBaseUrl()).build(),
        endpoint.getRequestTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectStore objectStore(AppProperties appProperties) {
    return new FileSystemObjectStore(
        appProperties.getStorage().getRoot(),
        appProperties.getBucket(),
        appProperties.getStorage().getLocatorScheme());
  }
}
