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

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/**
 * One time bucket of an instance with a value, or null, for every collected metric.
 */
@Value
public class AlignedSeriesRow {
  Instant timestamp;
  String instanceId;
  Map<MetricKind, Double> values;

  public AlignedSeriesRow(Instant timestamp, String instanceId, Map<MetricKind, Double> values) {
    this.timestamp = timestamp;
    this.instanceId = instanceId;
    final EnumMap<MetricKind, Double> copy = new EnumMap<>(MetricKind.class);
    for (MetricKind kind : MetricKind.values()) {
      copy.put(kind, values.get(kind));
    }
    this.values = Collections.unmodifiableMap(copy);
  }

  public Double getValue(MetricKind kind) {
    return values.get(kind);
  }
}
