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

import java.util.Optional;

/**
 * Key addressed blob storage. Writes replace the whole object and are never partially visible.
 */
public interface ObjectStore {

  /**
   * @throws com.rackspace.metrilake.app.exceptions.StorageException if the object could not be
   * written, in which case any previous content under the key is left untouched
   */
  void put(String key, byte[] content);

  Optional<byte[]> get(String key);

  /**
   * @return a locator callers can use to fetch the object from outside this service
   */
  String locate(String key);
}
