/*
 * Copyright 2020 Rackspace US, Inc.
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

package com.rackspace.metrilake.app.web;

import com.rackspace.metrilake.app.exceptions.ErrorKind;
import com.rackspace.metrilake.app.model.ApiResponse;
import com.rackspace.metrilake.app.services.ResponseFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Renders errors that escape the controllers, such as unreadable request bodies, in the same
 * envelope as pipeline failures.
 */
@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends
    AbstractErrorWebExceptionHandler {

  private final ResponseFormatter responseFormatter;

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer,
      ResponseFormatter responseFormatter) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
    this.responseFormatter = responseFormatter;
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(
      ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    final Throwable error = getError(serverRequest);
    final ApiResponse body;
    final HttpStatus status;

    if (error instanceof ServerWebInputException) {
      // avoid logs cluttering for bad requests
      log.trace("Web request for uri {} was rejected", serverRequest.uri(), error);
      body = responseFormatter.failure(ErrorKind.VALIDATION, ((ServerWebInputException) error).getReason());
      status = HttpStatus.BAD_REQUEST;
    } else if (error instanceof ResponseStatusException
        && ((ResponseStatusException) error).getStatus().is4xxClientError()) {
      log.debug("Web request for uri {} failed with {}", serverRequest.uri(), error.getMessage());
      body = responseFormatter.failure(ErrorKind.VALIDATION, ((ResponseStatusException) error).getReason());
      status = ((ResponseStatusException) error).getStatus();
    } else {
      log.warn("Web request for uri {} failed with exception", serverRequest.uri(), error);
      body = responseFormatter.failure(ErrorKind.INTERNAL, "Service encountered an unexpected "
          + "condition which prevented it from fulfilling the request.");
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }

    return ServerResponse.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(body));
  }
}
