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

package com.rackspace.metrilake.app.web;

import com.rackspace.metrilake.app.model.ApiResponse;
import com.rackspace.metrilake.app.services.CollectionService;
import com.rackspace.metrilake.app.services.ResponseFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Triggers a collection run outside the schedule.
 */
@RestController
@RequestMapping("/collect")
@Profile("collect")
public class CollectController {

  private final CollectionService collectionService;
  private final ResponseFormatter responseFormatter;

  @Autowired
  public CollectController(CollectionService collectionService,
                           ResponseFormatter responseFormatter) {
    this.collectionService = collectionService;
    this.responseFormatter = responseFormatter;
  }

  @PostMapping
  public Mono<ResponseEntity<ApiResponse>> collect() {
    return Mono.fromCallable(collectionService::collect)
        .subscribeOn(Schedulers.boundedElastic())
        .map(report -> ResponseEntity.ok(ApiResponse.success(report, null)))
        .onErrorResume(RuntimeException.class, e -> {
          final ApiResponse response = responseFormatter.failure(e);
          final HttpStatus status = responseFormatter.statusOf(response);
          return Mono.just(ResponseEntity.status(status).body(response));
        });
  }
}
