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

import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.exceptions.ErrorKind;
import com.rackspace.metrilake.app.exceptions.MetrilakePipelineException;
import com.rackspace.metrilake.app.model.ApiResponse;
import com.rackspace.metrilake.app.model.MaterializedResult;
import com.rackspace.metrilake.app.model.QueryExecution;
import com.rackspace.metrilake.app.model.QueryRequest;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Serves one query request from submission to formatted response. Failures of any stage become
 * an error response; nothing is thrown to the caller.
 */
@Service
@Slf4j
public class QueryService {

  private final QueryProperties properties;
  private final QuerySubmitter querySubmitter;
  private final QueryPoller queryPoller;
  private final ResultMaterializer resultMaterializer;
  private final ResponseFormatter responseFormatter;
  private final MeterRegistry meterRegistry;

  @Autowired
  public QueryService(QueryProperties properties,
                      QuerySubmitter querySubmitter,
                      QueryPoller queryPoller,
                      ResultMaterializer resultMaterializer,
                      ResponseFormatter responseFormatter,
                      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.querySubmitter = querySubmitter;
    this.queryPoller = queryPoller;
    this.resultMaterializer = resultMaterializer;
    this.responseFormatter = responseFormatter;
    this.meterRegistry = meterRegistry;
  }

  /**
   * @param request the request; a request without any query runs the configured default query
   */
  public ApiResponse execute(QueryRequest request) {
    final QueryRequest effective = request == null || request.getSql() == null
        ? new QueryRequest().setSql(properties.getDefaultQuery())
        : request;
    try {
      final QueryExecution submitted = querySubmitter.submit(effective);
      final QueryExecution completed = queryPoller.awaitCompletion(submitted);
      final MaterializedResult result = resultMaterializer.materialize(completed);
      meterRegistry.counter("metrilake.query", "outcome", "success").increment();
      return responseFormatter.success(result);
    } catch (RuntimeException e) {
      final ErrorKind kind = e instanceof MetrilakePipelineException
          ? ((MetrilakePipelineException) e).getKind() : ErrorKind.INTERNAL;
      meterRegistry.counter("metrilake.query", "outcome", kind.label()).increment();
      return responseFormatter.failure(e);
    }
  }
}
