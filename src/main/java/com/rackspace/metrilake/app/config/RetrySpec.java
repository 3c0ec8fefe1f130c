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

import java.time.Duration;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

@Data
public class RetrySpec {

  /**
   * Number of retries after the initial attempt. Zero disables retrying.
   */
  @Min(0)
  long maxAttempts = 3;

  @NotNull
  Duration minBackoff = Duration.ofMillis(100);

  @NotNull
  Duration maxBackoff = Duration.ofSeconds(5);

  public RetryBackoffSpec build() {
    // retried calls block, so the backoff delay must not land on the parallel scheduler
    return Retry.backoff(maxAttempts, minBackoff)
        .maxBackoff(maxBackoff)
        .scheduler(Schedulers.boundedElastic());
  }
}
