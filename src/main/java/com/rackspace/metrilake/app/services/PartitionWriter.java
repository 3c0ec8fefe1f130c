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

import static com.rackspace.metrilake.app.utils.DateTimeUtils.formatIso;

import com.rackspace.metrilake.app.clients.ObjectStore;
import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.StorageException;
import com.rackspace.metrilake.app.model.AlignedSeriesRow;
import com.rackspace.metrilake.app.model.MetricKind;
import com.rackspace.metrilake.app.model.PartitionKey;
import com.rackspace.metrilake.app.utils.CsvUtils;
import com.rackspace.metrilake.app.utils.Retries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores aligned rows as one CSV object per instance and day. The object is replaced as a whole
 * and identical rows always encode to identical bytes, which makes re-running a day harmless.
 */
@Component
@Slf4j
public class PartitionWriter {

  /**
   * Bump when the column layout changes.
   */
  public static final int LAYOUT_VERSION = 1;

  public static final String TIMESTAMP_COLUMN = "timestamp";

  private final ObjectStore objectStore;
  private final CollectionProperties properties;

  @Autowired
  public PartitionWriter(ObjectStore objectStore, CollectionProperties properties) {
    this.objectStore = objectStore;
    this.properties = properties;
  }

  /**
   * @return the key of the written object
   * @throws StorageException if the object could not be written after one retry
   */
  public String write(List<AlignedSeriesRow> rows, PartitionKey partitionKey) {
    final byte[] content = encode(rows);
    final String key = partitionKey.toObjectKey(properties.getPartitionPrefix());

    Retries.run(() -> objectStore.put(key, content),
        properties.getRetryStore(),
        e -> e instanceof StorageException,
        "write of " + key);

    log.info("Wrote {} rows ({} bytes, layout v{}) to {}", rows.size(), content.length, LAYOUT_VERSION, key);
    return key;
  }

  public static List<String> header() {
    final List<String> header = new ArrayList<>();
    header.add(TIMESTAMP_COLUMN);
    for (MetricKind metric : MetricKind.values()) {
      header.add(metric.getColumn());
    }
    return header;
  }

  static byte[] encode(List<AlignedSeriesRow> rows) {
    final List<List<String>> lines = new ArrayList<>(rows.size());
    Instant previous = null;
    for (AlignedSeriesRow row : rows) {
      if (previous != null && !row.getTimestamp().isAfter(previous)) {
        throw new IllegalArgumentException(
            "Rows must be strictly ascending, got " + row.getTimestamp() + " after " + previous);
      }
      previous = row.getTimestamp();

      final List<String> line = new ArrayList<>(MetricKind.values().length + 1);
      line.add(formatIso(row.getTimestamp()));
      for (MetricKind metric : MetricKind.values()) {
        line.add(formatValue(row.getValue(metric)));
      }
      lines.add(line);
    }
    return CsvUtils.write(header(), lines);
  }

  /**
   * Whole numbers are written without a fraction and everything else with three decimals.
   * Missing and non-finite readings become empty cells.
   */
  static String formatValue(Double value) {
    if (value == null || value.isNaN() || value.isInfinite()) {
      return null;
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString(value.longValue());
    }
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
