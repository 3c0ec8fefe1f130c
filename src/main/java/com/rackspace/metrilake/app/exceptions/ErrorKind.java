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

package com.rackspace.metrilake.app.exceptions;

/**
 * Error categories reported to callers. The {@link #label()} is what appears as
 * <code>error.kind</code> in API responses.
 */
public enum ErrorKind {
  CONFIGURATION("ConfigurationError"),
  VALIDATION("ValidationError"),
  UPSTREAM("UpstreamError"),
  TIMEOUT("TimeoutError"),
  STORAGE("StorageError"),
  INTERNAL("InternalError");

  private final String label;

  ErrorKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
