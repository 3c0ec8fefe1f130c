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
import java.time.temporal.ChronoUnit;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("metrilake.collection")
@Component
@Data
@Validated
public class CollectionProperties {

  /**
   * Width of one time bucket. Must be a multiple of <code>min-resolution</code> and divide a
   * day evenly; violations are reported when a window is resolved.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration period = Duration.ofMinutes(5);

  /**
   * The finest period the monitoring source can aggregate to.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration minResolution = Duration.ofMinutes(1);

  /**
   * How far back the monitoring source retains data at the configured period. A first run never
   * asks for older data than this.
   */
  @NotNull
  Duration maxRetention = Duration.ofDays(15);

  @NotBlank
  String partitionPrefix = "ec2-metrics";

  /**
   * Delay between scheduled collection runs, only used with the <code>collect</code> profile.
   */
  @NotNull
  Duration scheduleInterval = Duration.ofDays(1);

  @NotNull
  Duration initialDelay = Duration.ofSeconds(5);

  @Valid
  @NotNull
  RetrySpec retryFetch = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(200));

  @Valid
  @NotNull
  RetrySpec retryStore = new RetrySpec()
      .setMaxAttempts(1)
      .setMinBackoff(Duration.ofMillis(100));
}
