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

import java.time.Clock;
import java.time.Instant;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/** Running request counters of one {@link FhirProtocolClient}. Thread-safe. */
final class ClientStatistics {

  private final Clock clock;

  @GuardedBy("this")
  private long totalRequests = 0;

  @GuardedBy("this")
  private long errorCount = 0;

  @GuardedBy("this")
  @Nullable
  private Instant lastRequestTime;

  ClientStatistics(Clock clock) {
    this.clock = clock;
  }

  synchronized void record(RequestAttempt attempt) {
    totalRequests++;
    if (!attempt.isSuccess()) {
      errorCount++;
    }
    lastRequestTime = clock.instant();
  }

  synchronized StatisticsReport snapshot(boolean tokenValid, @Nullable Instant tokenExpiry) {
    return new StatisticsReport(
        totalRequests, errorCount, lastRequestTime, tokenValid, tokenExpiry);
  }
}
