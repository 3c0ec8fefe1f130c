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

import java.util.Locale;

public enum ExecutionState {
  SUBMITTED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELLED;
  }

  /**
   * Maps an engine state name, accepting the engine's <code>QUEUED</code> as submitted.
   *
   * @throws IllegalArgumentException for names the engine is not known to report
   */
  public static ExecutionState fromEngineState(String name) {
    if ("QUEUED".equalsIgnoreCase(name)) {
      return SUBMITTED;
    }
    return valueOf(name.toUpperCase(Locale.ROOT));
  }
}
