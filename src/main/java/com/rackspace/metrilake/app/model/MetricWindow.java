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

import com.rackspace.metrilake.app.exceptions.ConfigurationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * A <code>[start, end)</code> collection range split into buckets of <code>period</code>.
 */
@Value
public class MetricWindow {
  Instant start;
  Instant end;
  Duration period;

  public MetricWindow(Instant start, Instant end, Duration period) {
    if (period == null || period.isZero() || period.isNegative()) {
      throw new ConfigurationException("Collection period must be positive: " + period);
    }
    if (!start.isBefore(end)) {
      throw new ConfigurationException(
          String.format("Window start %s is not before end %s", start, end));
    }
    final Duration length = Duration.between(start, end);
    if (period.compareTo(length) > 0) {
      throw new ConfigurationException(
          String.format("Collection period %s exceeds the window length %s", period, length));
    }
    if (length.getSeconds() % period.getSeconds() != 0) {
      throw new ConfigurationException(
          String.format("Collection period %s does not divide the window length %s", period, length));
    }
    this.start = start;
    this.end = end;
    this.period = period;
  }

  public Duration getLength() {
    return Duration.between(start, end);
  }

  public int getBucketCount() {
    return (int) (getLength().getSeconds() / period.getSeconds());
  }

  /**
   * @return the start of every bucket in ascending order
   */
  public List<Instant> bucketStarts() {
    final List<Instant> buckets = new ArrayList<>(getBucketCount());
    for (Instant next = start; next.isBefore(end); next = next.plus(period)) {
      buckets.add(next);
    }
    return buckets;
  }

  public boolean contains(Instant timestamp) {
    return !timestamp.isBefore(start) && timestamp.isBefore(end);
  }
}
