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

import com.rackspace.metrilake.app.exceptions.ErrorKind;
import com.rackspace.metrilake.app.exceptions.MetrilakePipelineException;
import com.rackspace.metrilake.app.model.ApiError;
import com.rackspace.metrilake.app.model.ApiResponse;
import com.rackspace.metrilake.app.model.MaterializedResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Shapes pipeline outcomes into {@link ApiResponse}s. Error messages are reduced to a single
 * short line so engine diagnostics and stack traces never reach the caller.
 */
@Component
@Slf4j
public class ResponseFormatter {

  static final int MAX_MESSAGE_LENGTH = 300;

  static final String UNEXPECTED_MESSAGE = "The request could not be completed";

  public ApiResponse success(MaterializedResult result) {
    return ApiResponse.success(result.getPreview(), result.getLocator());
  }

  public ApiResponse failure(Throwable error) {
    if (error instanceof MetrilakePipelineException) {
      final MetrilakePipelineException pipelineException = (MetrilakePipelineException) error;
      log.warn("Request failed with {}: {}", pipelineException.getKind().label(), error.getMessage());
      return failure(pipelineException.getKind(), error.getMessage());
    }
    log.error("Request failed unexpectedly", error);
    return failure(ErrorKind.INTERNAL, UNEXPECTED_MESSAGE);
  }

  public ApiResponse failure(ErrorKind kind, String message) {
    return ApiResponse.failure(new ApiError(kind, sanitize(kind, message)));
  }

  public HttpStatus statusOf(ApiResponse response) {
    if (response.isSuccess()) {
      return HttpStatus.OK;
    }
    switch (response.getError().getErrorKind()) {
      case VALIDATION:
        return HttpStatus.BAD_REQUEST;
      case TIMEOUT:
        return HttpStatus.GATEWAY_TIMEOUT;
      case UPSTREAM:
        return HttpStatus.BAD_GATEWAY;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  static String sanitize(ErrorKind kind, String message) {
    if (StringUtils.isBlank(message)) {
      return kind.label();
    }
    final String firstLine = message.strip().lines().findFirst().orElse("");
    return StringUtils.abbreviate(StringUtils.normalizeSpace(firstLine), MAX_MESSAGE_LENGTH);
  }
}
