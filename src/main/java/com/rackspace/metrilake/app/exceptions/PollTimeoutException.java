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

import java.time.Duration;

public class PollTimeoutException extends MetrilakePipelineException {

  public PollTimeoutException(String executionId, int attempts, Duration elapsed) {
    super(ErrorKind.TIMEOUT, String.format(
        "Query %s did not complete after %d status checks in %ds",
        executionId, attempts, elapsed.getSeconds()));
  }
}
