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

import com.rackspace.metrilake.app.exceptions.UpstreamException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Classifies WebClient failures. Server errors, throttling, timeouts and connection failures are
 * transient; other client errors are not.
 */
public class WebClientErrors {

  private WebClientErrors() {
  }

  public static Throwable toUpstream(Throwable e, String operation) {
    if (e instanceof UpstreamException) {
      return e;
    }
    if (e instanceof WebClientResponseException) {
      final WebClientResponseException responseException = (WebClientResponseException) e;
      final int status = responseException.getRawStatusCode();
      return new UpstreamException(
          String.format("%s failed with status %d", operation, status),
          status >= 500 || status == 429, e);
    }
    if (e instanceof WebClientRequestException || e instanceof TimeoutException) {
      return new UpstreamException(operation + " could not be completed: " + e.getMessage(), true, e);
    }
    return new UpstreamException(operation + " failed: " + e.getMessage(), false, e);
  }
}
