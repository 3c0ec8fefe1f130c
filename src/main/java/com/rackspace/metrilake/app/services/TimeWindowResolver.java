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

package com.rackspace.metrilake.app.services;

import static com.rackspace.metrilake.app.utils.DateTimeUtils.ceilToPeriod;
import static com.rackspace.metrilake.app.utils.DateTimeUtils.floorToPeriod;
import static com.rackspace.metrilake.app.utils.DateTimeUtils.startOfDayUtc;
import static com.rackspace.metrilake.app.utils.DateTimeUtils.utcDate;

import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.ConfigurationException;
import com.rackspace.metrilake.app.model.MetricWindow;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides which interval a collection run covers. The result depends only on the arguments and
 * the configured period, so every run within the same UTC day resolves the same window.
 */
@Component
@Slf4j
public class TimeWindowResolver {

  private static final Duration DAY = Duration.ofDays(1);

  private final CollectionProperties properties;

  @Autowired
  public TimeWindowResolver(CollectionProperties properties) {
    this.properties = properties;
  }

  /**
   * @param now the current time
   * @param launchTime the instance launch time when this is the first run for the instance,
   *                   otherwise null
   * @return the previous full UTC day, or on a first run everything since launch that is still
   * retained by the monitoring source
   */
  public MetricWindow resolve(Instant now, Instant launchTime) {
    final Duration period = validatedPeriod();

    if (launchTime == null) {
      final Instant end = startOfDayUtc(now);
      return new MetricWindow(end.minus(DAY), end, period);
    }

    final Instant end = floorToPeriod(now, period);
    final Instant earliest = ceilToPeriod(end.minus(properties.getMaxRetention()), period);
    Instant start = ceilToPeriod(launchTime, period);
    if (start.isBefore(earliest)) {
      start = earliest;
    }
    if (!start.isBefore(end)) {
      throw new ConfigurationException(String.format(
          "No complete %ds period between launch at %s and %s",
          period.getSeconds(), launchTime, now));
    }
    return new MetricWindow(start, end, period);
  }

  /**
   * Lists the full UTC days after the watermark that are still missing, oldest first, up to and
   * including yesterday. Days that have already aged out of the source's retention are skipped.
   *
   * @return an empty list when the watermark already covers yesterday
   */
  public List<MetricWindow> pendingDays(Instant now, LocalDate watermark) {
    final Duration period = validatedPeriod();
    final LocalDate today = utcDate(now);

    final Instant retainedFrom = now.minus(properties.getMaxRetention());
    LocalDate earliest = utcDate(retainedFrom);
    if (dayStart(earliest).isBefore(retainedFrom)) {
      earliest = earliest.plusDays(1);
    }

    LocalDate day = watermark.plusDays(1);
    if (day.isBefore(earliest)) {
      log.warn("Days {} to {} are past the source retention and cannot be collected",
          day, earliest.minusDays(1));
      day = earliest;
    }

    final List<MetricWindow> windows = new ArrayList<>();
    for (; day.isBefore(today); day = day.plusDays(1)) {
      windows.add(new MetricWindow(dayStart(day), dayStart(day.plusDays(1)), period));
    }
    return windows;
  }

  /**
   * Cuts a window at every UTC midnight so each piece belongs to exactly one partition.
   */
  public static List<MetricWindow> splitByDay(MetricWindow window) {
    final List<MetricWindow> pieces = new ArrayList<>();
    Instant start = window.getStart();
    while (start.isBefore(window.getEnd())) {
      final Instant midnight = startOfDayUtc(start).plus(DAY);
      final Instant end = midnight.isBefore(window.getEnd()) ? midnight : window.getEnd();
      pieces.add(new MetricWindow(start, end, window.getPeriod()));
      start = end;
    }
    return pieces;
  }

  /**
   * @return true when the window runs up to the end of its UTC day
   */
  public static boolean endsDay(MetricWindow window) {
    return window.getEnd().equals(startOfDayUtc(window.getStart()).plus(DAY));
  }

  private static Instant dayStart(LocalDate day) {
    return day.atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  private Duration validatedPeriod() {
    final Duration period = properties.getPeriod();
    if (period == null || period.getSeconds() <= 0) {
      throw new ConfigurationException("Collection period must be positive: " + period);
    }
    final long resolution = properties.getMinResolution().getSeconds();
    if (resolution > 0 && period.getSeconds() % resolution != 0) {
      throw new ConfigurationException(String.format(
          "Collection period %ds is not a multiple of the source resolution %ds",
          period.getSeconds(), resolution));
    }
    if (period.compareTo(DAY) > 0) {
      throw new ConfigurationException(String.format(
          "Collection period %ds exceeds the window length %ds", period.getSeconds(), DAY.getSeconds()));
    }
    if (DAY.getSeconds() % period.getSeconds() != 0) {
      throw new ConfigurationException(String.format(
          "Collection period %ds does not divide a day", period.getSeconds()));
    }
    return period;
  }
}
