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

import com.rackspace.metrilake.app.clients.ObjectStore;
import com.rackspace.metrilake.app.config.CollectionProperties;
import com.rackspace.metrilake.app.exceptions.StorageException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Remembers the most recent day whose partition was written successfully. Only a successful run
 * advances it, so a failed day is simply collected again by the next run.
 */
@Service
@Slf4j
public class WatermarkService {

  static final String WATERMARK_OBJECT = "_watermark";

  private final ObjectStore objectStore;
  private final CollectionProperties properties;

  @Autowired
  public WatermarkService(ObjectStore objectStore, CollectionProperties properties) {
    this.objectStore = objectStore;
    this.properties = properties;
  }

  public Optional<LocalDate> lastCollectedDay() {
    return objectStore.get(key())
        .map(content -> {
          final String text = new String(content, StandardCharsets.UTF_8).trim();
          try {
            return LocalDate.parse(text);
          } catch (DateTimeParseException e) {
            throw new StorageException("Unreadable collection watermark: " + text, e);
          }
        });
  }

  /**
   * Moves the watermark forward to the given day. Older days leave it where it is.
   */
  public void advance(LocalDate day) {
    final Optional<LocalDate> current = lastCollectedDay();
    if (current.isPresent() && !day.isAfter(current.get())) {
      log.debug("Watermark {} already covers {}", current.get(), day);
      return;
    }
    objectStore.put(key(), day.toString().getBytes(StandardCharsets.UTF_8));
    log.debug("Advanced watermark to {}", day);
  }

  String key() {
    return properties.getPartitionPrefix() + "/" + WATERMARK_OBJECT;
  }
}
