/*
 * Copyright 2021-2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.fhir.ehrclient;

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Bounded retry control for one logical request.
 *
 * <pre>
 *   ATTEMPTING --success--------------------------> SUCCEEDED
 *   ATTEMPTING --non-retryable failure------------> FAILED_TERMINAL
 *   ATTEMPTING --retryable failure, last attempt--> FAILED_TERMINAL
 *   ATTEMPTING --retryable failure----------------> BACKOFF
 *   BACKOFF    --resume---------------------------> ATTEMPTING (attempt number + 1)
 * </pre>
 *
 * Attempt numbers start at 0 and the backoff before attempt {@code n + 1} is {@code unit * 2^n}.
 * This class does no waiting itself.
 */
final class RetryStateMachine {

  enum State {
    ATTEMPTING,
    BACKOFF,
    SUCCEEDED,
    FAILED_TERMINAL
  }

  private final int maxAttempts;
  private State state = State.ATTEMPTING;
  private int attemptNumber = 0;
  private RequestOutcome lastOutcome;

  RetryStateMachine(int maxAttempts) {
    Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
    this.maxAttempts = maxAttempts;
  }

  State getState() {
    return state;
  }

  int getAttemptNumber() {
    return attemptNumber;
  }

  RequestOutcome getLastOutcome() {
    return lastOutcome;
  }

  void recordOutcome(RequestOutcome outcome) {
    Preconditions.checkState(state == State.ATTEMPTING, "No attempt in progress; state %s", state);
    lastOutcome = outcome;
    if (outcome == RequestOutcome.SUCCESS) {
      state = State.SUCCEEDED;
    } else if (!outcome.isRetryable() || attemptNumber + 1 >= maxAttempts) {
      state = State.FAILED_TERMINAL;
    } else {
      state = State.BACKOFF;
    }
  }

  Duration backoffDelay(Duration unit) {
    Preconditions.checkState(state == State.BACKOFF, "Not backing off; state %s", state);
    return unit.multipliedBy(1L << attemptNumber);
  }

  void resume() {
    Preconditions.checkState(state == State.BACKOFF, "Not backing off; state %s", state);
    attemptNumber++;
    state = State.ATTEMPTING;
  }
}
