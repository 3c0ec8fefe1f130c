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

package com.rackspace.metrilake.app.utils;

import com.rackspace.metrilake.app.config.RetrySpec;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Runs blocking calls under a {@link RetrySpec}. Failures rejected by the filter propagate
 * immediately and the last failure is rethrown once the retries are exhausted.
 */
@Slf4j
public class Retries {

  private Retries() {
  }

  public static <T> T call(Callable<T> callable, RetrySpec retrySpec,
                           Predicate<Throwable> retryable, String operation) {
    return Mono.fromCallable(callable)
        .retryWhen(retrySpec.build()
            .filter(retryable)
            .doBeforeRetry(signal -> log.warn("Retrying {} after failed attempt {}: {}",
                operation, signal.totalRetries() + 1, signal.failure().getMessage()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .block();
  }

  public static void run(Runnable runnable, RetrySpec retrySpec,
                         Predicate<Throwable> retryable, String operation) {
    call(() -> {
      runnable.run();
      return Boolean.TRUE;
    }, retrySpec, retryable, operation);
  }
}
