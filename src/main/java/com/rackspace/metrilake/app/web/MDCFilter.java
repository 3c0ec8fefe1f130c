/*
 * Copyright 2021 Rackspace US, Inc.
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
 *
 */

package com.rackspace.metrilake.app.web;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Tags each request with a trace id, taken from the caller when present, and echoes it back.
 */
@Component
@Slf4j
public class MDCFilter implements WebFilter {

  static final String X_B3_TRACE_ID = "X-B3-TraceId";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    String traceId = exchange.getRequest().getHeaders().getFirst(X_B3_TRACE_ID);
    if (StringUtils.isBlank(traceId)) {
      traceId = UUID.randomUUID().toString().replace("-", "");
    }
    exchange.getResponse().getHeaders().set(X_B3_TRACE_ID, traceId);
    MDC.put(X_B3_TRACE_ID, traceId);
    log.trace("Handling {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath());
    return chain.filter(exchange)
        .doFinally(signal -> MDC.remove(X_B3_TRACE_ID));
  }
}
