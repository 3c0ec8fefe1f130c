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

import com.rackspace.metrilake.app.config.configValidator.PollBudgetValidator;
import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("metrilake.query")
@Component
@Data
@Validated
@PollBudgetValidator
public class QueryProperties {

  /**
   * Namespace the engine resolves unqualified table names against.
   */
  @NotBlank
  String database = "cpu_metrics";

  @NotBlank
  String table = "ec2_metrics_typed";

  /**
   * Where the engine stages its own output for each execution.
   */
  @NotBlank
  String outputLocation = "s3://metrics/athena-query-results/";

  /**
   * Prefix of the canonical result object, written as <code>&lt;prefix&gt;/latest.csv</code>.
   */
  @NotBlank
  String resultPrefix = "athena-query-results";

  /**
   * Query used when a request carries no query at all. Defaults to a small sample of the
   * configured table.
   */
  String defaultQuery;

  @Min(1)
  int maxQueryLength = 262144;

  @Min(0)
  int previewRows = 10;

  /**
   * Wall clock limit of a single query request. The poll budget has to leave room below it for
   * materializing and formatting the result.
   */
  @NotNull
  Duration executionDeadline = Duration.ofSeconds(60);

  @Valid
  @NotNull
  Poll poll = new Poll();

  /**
   * Applied to submission and result reads. Status checks are never retried, the poll loop
   * simply checks again.
   */
  @Valid
  @NotNull
  RetrySpec retryEngine = new RetrySpec()
      .setMaxAttempts(2)
      .setMinBackoff(Duration.ofMillis(200));

  @Valid
  @NotNull
  RetrySpec retryStore = new RetrySpec()
      .setMaxAttempts(1)
      .setMinBackoff(Duration.ofMillis(100));

  public String getDefaultQuery() {
    if (defaultQuery != null) {
      return defaultQuery;
    }
    return String.format("SELECT * FROM %s.%s LIMIT 20;", database, table);
  }

  @Data
  public static class Poll {

    @NotNull
    Duration initialInterval = Duration.ofSeconds(1);

    /**
     * Growth factor applied to the interval after each status check. 1.0 polls at a fixed rate.
     */
    @DecimalMin("1.0")
    double multiplier = 1.5;

    @NotNull
    Duration maxInterval = Duration.ofSeconds(5);

    @Min(1)
    int maxAttempts = 40;

    /**
     * Maximum total time spent waiting for an execution to reach a terminal state.
     */
    @NotNull
    Duration budget = Duration.ofSeconds(50);
  }
}
