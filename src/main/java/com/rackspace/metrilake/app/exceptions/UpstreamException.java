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
 * Raised when the monitoring source or the query engine fails. Only transient failures are
 * eligible for retry.
 */
public class UpstreamException extends MetrilakePipelineException {

  private final boolean transientFailure;

  public UpstreamException(String message, boolean transientFailure) {
    super(ErrorKind.UPSTREAM, message);
    this.transientFailure = transientFailure;
  }

  public UpstreamException(String message, boolean transientFailure, Throwable cause) {
    super(ErrorKind.UPSTREAM, message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public static boolean isTransientFailure(Throwable throwable) {
    return throwable instanceof UpstreamException && ((UpstreamException) throwable).isTransient();
  }
}
