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

import com.rackspace.metrilake.app.clients.QueryEngine;
import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.exceptions.QueryValidationException;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.QueryExecution;
import com.rackspace.metrilake.app.model.QueryRequest;
import com.rackspace.metrilake.app.utils.Retries;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class QuerySubmitter {

  private final QueryEngine queryEngine;
  private final QueryProperties properties;
  private final Clock clock;

  @Autowired
  public QuerySubmitter(QueryEngine queryEngine, QueryProperties properties, Clock clock) {
    this.queryEngine = queryEngine;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Validates and submits the query. Syntax errors are not detected here; the engine reports
   * them asynchronously as a failed execution.
   *
   * @throws QueryValidationException if the query is blank or too long, without contacting the
   * engine
   * @throws UpstreamException if the engine rejects the submission
   */
  public QueryExecution submit(QueryRequest request) {
    final String sql = request == null ? null : request.getSql();
    validate(sql);

    final String executionId = Retries.call(
        () -> queryEngine.submit(sql, properties.getDatabase(), properties.getOutputLocation()),
        properties.getRetryEngine(),
        UpstreamException::isTransientFailure,
        "query submission"
    );
    log.info("Submitted query as execution {}", executionId);

    return new QueryExecution()
        .setId(executionId)
        .setState(ExecutionState.SUBMITTED)
        .setSubmittedAt(clock.instant());
  }

  private void validate(String sql) {
    if (StringUtils.isBlank(sql)) {
      throw new QueryValidationException("Query must not be empty");
    }
    if (sql.length() > properties.getMaxQueryLength()) {
      throw new QueryValidationException(String.format(
          "Query is %d characters long, the limit is %d", sql.length(), properties.getMaxQueryLength()));
    }
  }
}
