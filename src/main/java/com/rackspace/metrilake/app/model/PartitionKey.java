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

package com.rackspace.metrilake.app.model;

import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.Value;

/**
 * Identifies the single storage object holding one instance's metrics for one UTC day.
 */
@Value
public class PartitionKey {
  String instanceId;
  int year;
  int month;
  int day;

  public static PartitionKey of(String instanceId, MetricWindow window) {
    final LocalDate date = window.getStart().atOffset(ZoneOffset.UTC).toLocalDate();
    return new PartitionKey(instanceId, date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  public LocalDate getDate() {
    return LocalDate.of(year, month, day);
  }

  public String toObjectKey(String prefix) {
    return String.format("%s/%04d/%02d/%02d/instance-%s.csv", prefix, year, month, day, instanceId);
  }
}
