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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.metrilake.app.config.RetrySpec;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetriesTest {

  final RetrySpec retrySpec = new RetrySpec()
      .setMaxAttempts(2)
      .setMinBackoff(Duration.ofMillis(1))
      .setMaxBackoff(Duration.ofMillis(5));

  @Test
  void retriesUntilSuccess() {
    final AtomicInteger calls = new AtomicInteger();

    final String result = Retries.call(() -> {
      if (calls.incrementAndGet() < 3) {
        throw new UpstreamException("Throttled", true);
      }
      return "ok";
    }, retrySpec, UpstreamException::isTransientFailure, "test call");

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
  }

  @Test
  void rethrowsLastFailureWhenExhausted() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> Retries.call(() -> {
      throw new UpstreamException("Throttled " + calls.incrementAndGet(), true);
    }, retrySpec, UpstreamException::isTransientFailure, "test call"))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Throttled 3");
  }

  @Test
  void permanentFailureIsNotRetried() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> Retries.run(() -> {
      calls.incrementAndGet();
      throw new UpstreamException("Denied", false);
    }, retrySpec, UpstreamException::isTransientFailure, "test call"))
        .isInstanceOf(UpstreamException.class);
    assertThat(calls).hasValue(1);
  }
}
