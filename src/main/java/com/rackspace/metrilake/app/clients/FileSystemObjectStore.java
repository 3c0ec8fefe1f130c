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

import com.rackspace.metrilake.app.exceptions.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Object store laid out as files below a root directory, one file per key. Each put writes a
 * sibling temporary file and atomically moves it over the target.
 */
@Slf4j
public class FileSystemObjectStore implements ObjectStore {

  private final Path root;
  private final String bucket;
  private final String locatorScheme;

  public FileSystemObjectStore(Path root, String bucket, String locatorScheme) {
    this.root = root.toAbsolutePath().normalize();
    this.bucket = bucket;
    this.locatorScheme = locatorScheme;
  }

  @Override
  public void put(String key, byte[] content) {
    final Path target = resolve(key);
    Path tmp = null;
    try {
      Files.createDirectories(target.getParent());
      tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
      Files.write(tmp, content);
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Stored {} bytes at {}", content.length, target);
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new StorageException("Failed to store " + key, e);
    }
  }

  @Override
  public Optional<byte[]> get(String key) {
    try {
      return Optional.of(Files.readAllBytes(resolve(key)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key, e);
    }
  }

  @Override
  public String locate(String key) {
    if ("file".equals(locatorScheme)) {
      return resolve(key).toUri().toString();
    }
    return String.format("%s://%s/%s", locatorScheme, bucket, key);
  }

  private Path resolve(String key) {
    final Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new StorageException("Object key escapes the store: " + key);
    }
    return path;
  }

  private void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Failed to remove temporary file {}", tmp, e);
    }
  }
}
