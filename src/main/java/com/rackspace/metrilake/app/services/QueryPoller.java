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

import com.rackspace.metrilake.app.clients.QueryEngine;
import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.config.QueryProperties.Poll;
import com.rackspace.metrilake.app.exceptions.ConfigurationException;
import com.rackspace.metrilake.app.exceptions.PollTimeoutException;
import com.rackspace.metrilake.app.exceptions.UpstreamException;
import com.rackspace.metrilake.app.model.ExecutionState;
import com.rackspace.metrilake.app.model.ExecutionStatus;
import com.rackspace.metrilake.app.model.QueryExecution;
import com.rackspace.metrilake.app.utils.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Waits for a submitted execution to reach a terminal state.
 * <p>
 * The first status check is immediate. Later checks are spaced by an interval that starts at
 * <code>poll.initial-interval</code> and grows by <code>poll.multiplier</code> up to
 * <code>poll.max-interval</code>. Waiting stops after <code>poll.max-attempts</code> checks or
 * when the next wait would exceed <code>poll.budget</code>. Giving up does not cancel the remote
 * execution.
 * </p>
 */
@Component
@Slf4j
public class QueryPoller {

  private final QueryEngine queryEngine;
  private final QueryProperties properties;
  private final Clock clock;
  private final Sleeper sleeper;

  @Autowired
  public QueryPoller(QueryEngine queryEngine, QueryProperties properties, Clock clock, Sleeper sleeper) {
    if (properties.getPoll().getBudget().compareTo(properties.getExecutionDeadline()) >= 0) {
      throw new ConfigurationException(String.format(
          "Poll budget %s must be shorter than the execution deadline %s",
          properties.getPoll().getBudget(), properties.getExecutionDeadline()));
    }
    this.queryEngine = queryEngine;
    this.properties = properties;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * @return the execution, updated to {@link ExecutionState#SUCCEEDED}
   * @throws UpstreamException if the execution failed or was cancelled
   * @throws PollTimeoutException if no terminal state was observed within the budget
   */
  public QueryExecution awaitCompletion(QueryExecution execution) {
    final Poll poll = properties.getPoll();
    final Instant started = clock.instant();
    Duration interval = poll.getInitialInterval();
    int attempts = 0;

    while (true) {
      attempts++;
      final ExecutionStatus status = checkStatus(execution.getId());
      if (status != null) {
        transition(execution, status);
        if (execution.getState().isTerminal()) {
          execution.setCompletedAt(clock.instant());
          return finish(execution, attempts);
        }
      }

      final Duration elapsed = Duration.between(started, clock.instant());
      if (attempts >= poll.getMaxAttempts() || elapsed.plus(interval).compareTo(poll.getBudget()) > 0) {
        log.warn("Abandoning execution {} in state {} after {} checks",
            execution.getId(), execution.getState(), attempts);
        throw new PollTimeoutException(execution.getId(), attempts, elapsed);
      }

      try {
        sleeper.sleep(interval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PollTimeoutException(execution.getId(), attempts,
            Duration.between(started, clock.instant()));
      }
      interval = nextInterval(interval, poll);
    }
  }

  /**
   * @return the status, or null when this check failed transiently and only used up an attempt
   */
  private ExecutionStatus checkStatus(String executionId) {
    try {
      return queryEngine.getStatus(executionId);
    } catch (UpstreamException e) {
      if (!e.isTransient()) {
        throw e;
      }
      log.debug("Status check of {} failed transiently: {}", executionId, e.getMessage());
      return null;
    }
  }

  private void transition(QueryExecution execution, ExecutionStatus status) {
    final ExecutionState from = execution.getState();
    final ExecutionState to = status.getState();
    if (from == to) {
      return;
    }
    if (from.isTerminal() || to == ExecutionState.SUBMITTED) {
      log.warn("Ignoring transition of {} from {} to {}", execution.getId(), from, to);
      return;
    }
    log.debug("Execution {} moved from {} to {}", execution.getId(), from, to);
    execution.setState(to);
    execution.setStateChangeReason(status.getStateChangeReason());
  }

  private QueryExecution finish(QueryExecution execution, int attempts) {
    switch (execution.getState()) {
      case SUCCEEDED:
        log.info("Execution {} succeeded after {} checks", execution.getId(), attempts);
        return execution;
      case CANCELLED:
        throw new UpstreamException("Query was cancelled"
            + reasonSuffix(execution.getStateChangeReason()), false);
      default:
        throw new UpstreamException("Query failed"
            + reasonSuffix(execution.getStateChangeReason()), false);
    }
  }

  private static String reasonSuffix(String reason) {
    return reason == null || reason.isBlank() ? "" : ": " + reason;
  }

  static Duration nextInterval(Duration current, Poll poll) {
    final long nextMillis = (long) Math.ceil(current.toMillis() * poll.getMultiplier());
    final Duration next = Duration.ofMillis(nextMillis);
    return next.compareTo(poll.getMaxInterval()) > 0 ? poll.getMaxInterval() : next;
  }
}
