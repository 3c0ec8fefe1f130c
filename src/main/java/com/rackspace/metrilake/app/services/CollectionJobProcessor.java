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

import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.model.CollectionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
@Profile("collect")
public class CollectionJobProcessor {
  private final CollectionProperties properties;
  private final CollectionService collectionService;
  private final ScheduledExecutorService executor;

  @Autowired
  public CollectionJobProcessor(CollectionProperties properties,
                                CollectionService collectionService,
                                ScheduledExecutorService executor) {
    this.properties = properties;
    this.collectionService = collectionService;
    this.executor = executor;
  }

  @PostConstruct
  public void setupSchedulers() {
    log.info("Scheduling collection every {} after {}",
        properties.getScheduleInterval(), properties.getInitialDelay());
    executor.scheduleWithFixedDelay(this::runCollection,
        properties.getInitialDelay().toMillis(),
        properties.getScheduleInterval().toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @PreDestroy
  public void stop() {
    executor.shutdown();
  }

  void runCollection() {
    try {
      final CollectionReport report = collectionService.collect();
      log.info("Scheduled collection stored {} rows at {}", report.getRowCount(), report.getObjectKeys());
    } catch (RuntimeException e) {
      // an exception escaping here would cancel all later runs
      log.error("Scheduled collection failed", e);
    }
  }
}
