package com.rackspace.metrilake.app.clients;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Answers WebClient requests with queued canned responses and records the requests.
 */
public class StubExchange implements ExchangeFunction {

  private final Deque<ClientResponse> responses = new ArrayDeque<>();
  private final List<ClientRequest> requests = new ArrayList<>();

  public StubExchange respond(HttpStatus status, String json) {
    responses.add(ClientResponse.create(status)
        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .body(json)
        .build());
    return this;
  }

  public WebClient webClient() {
    return WebClient.builder()
        .baseUrl("http://engine.test")
        .exchangeFunction(this)
        .build();
  }

  @Override
  public Mono<ClientResponse> exchange(ClientRequest request) {
    requests.add(request);
    final ClientResponse response = responses.poll();
    if (response == null) {
      return Mono.error(new IllegalStateException("No response queued for " + request.url()));
    }
    return Mono.just(response);
  }

  public List<ClientRequest> getRequests() {
    return requests;
  }
}
