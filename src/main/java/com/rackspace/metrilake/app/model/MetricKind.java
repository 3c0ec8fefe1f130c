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

/**
 * The fixed set of metrics collected for an instance. Declaration order is the column order of
 * the partition layout and must not change.
 */
public enum MetricKind {
  CPU_UTILIZATION("CPUUtilization", "Average", "Percent", "cpu_percent"),
  NETWORK_IN("NetworkIn", "Sum", "Bytes", "network_in_bytes"),
  NETWORK_OUT("NetworkOut", "Sum", "Bytes", "network_out_bytes");

  private final String metricName;
  private final String statistic;
  private final String unit;
  private final String column;

  MetricKind(String metricName, String statistic, String unit, String column) {
    this.metricName = metricName;
    this.statistic = statistic;
    this.unit = unit;
    this.column = column;
  }

  public String getMetricName() {
    return metricName;
  }

  public String getStatistic() {
    return statistic;
  }

  public String getUnit() {
    return unit;
  }

  public String getColumn() {
    return column;
  }
}
