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

package com.rackspace.metrilake.app.clients;

import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.MetricSample;
import com.rackspace.metrilake.app.model.MetricWindow;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the time-series store that monitors compute instances.
 */
public interface MonitoringSource {

  /**
   * Retrieves the aggregated samples of one metric over the window at the window's period.
   * Samples may be sparse and are not guaranteed to be ordered.
   *
   * @throws com.rackspace.metrilake.app.exceptions.UpstreamException if the source fails
   */
  List<MetricSample> getSeries(String instanceId, MetricKind metric, MetricWindow window);

  /**
   * @return the instance launch time, or empty when the source does not know the instance
   */
  Optional<Instant> findLaunchTime(String instanceId);
}
