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
import com.rackspace.metrilake.app.model.QueryRequest;
import com.rackspace.metrilake.app.services.QueryService;
import com.rackspace.metrilake.app.services.ResponseFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs a SQL query against the metric table and returns a preview plus the location of the full
 * result. A request without a query runs the configured default query.
 */
@RestController
@RequestMapping("/query")
@Profile("query")
public class QueryController {

  private final QueryService queryService;
  private final ResponseFormatter responseFormatter;

  @Autowired
  public QueryController(QueryService queryService, ResponseFormatter responseFormatter) {
    this.queryService = queryService;
    this.responseFormatter = responseFormatter;
  }

  @PostMapping
  public Mono<ResponseEntity<ApiResponse>> query(@RequestBody(required = false) QueryRequest request) {
    return execute(request);
  }

  @GetMapping
  public Mono<ResponseEntity<ApiResponse>> queryByParam(
      @RequestParam(name = "query", required = false) String query) {
    return execute(query == null ? null : new QueryRequest().setSql(query));
  }

  private Mono<ResponseEntity<ApiResponse>> execute(QueryRequest request) {
    // polling blocks, so keep it off the event loop
    return Mono.fromCallable(() -> queryService.execute(request))
        .subscribeOn(Schedulers.boundedElastic())
        .map(response -> ResponseEntity.status(responseFormatter.statusOf(response)).body(response));
  }
}
