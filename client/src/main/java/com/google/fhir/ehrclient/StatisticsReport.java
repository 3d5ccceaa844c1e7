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

import com.google.gson.JsonObject;
import java.time.Instant;
import javax.annotation.Nullable;
import lombok.Getter;

/**
 * Point-in-time view of a client's request statistics and token state, intended for health and
 * diagnostics reporting.
 */
@Getter
public final class StatisticsReport {

  private final long totalRequests;
  private final long errorCount;
  @Nullable private final Instant lastRequestTime;
  private final boolean tokenValid;
  @Nullable private final Instant tokenExpiry;

  StatisticsReport(
      long totalRequests,
      long errorCount,
      @Nullable Instant lastRequestTime,
      boolean tokenValid,
      @Nullable Instant tokenExpiry) {
    this.totalRequests = totalRequests;
    this.errorCount = errorCount;
    this.lastRequestTime = lastRequestTime;
    this.tokenValid = tokenValid;
    this.tokenExpiry = tokenExpiry;
  }

  /** Returns {@code errorCount / totalRequests}, or 0 when nothing has been sent yet. */
  public double getErrorRate() {
    if (totalRequests == 0) {
      return 0;
    }
    return (double) errorCount / totalRequests;
  }

  public String toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("total_requests", totalRequests);
    json.addProperty("total_errors", errorCount);
    json.addProperty("error_rate", getErrorRate());
    json.addProperty(
        "last_request", lastRequestTime == null ? null : lastRequestTime.toString());
    json.addProperty("token_valid", tokenValid);
    json.addProperty("token_expiry", tokenExpiry == null ? null : tokenExpiry.toString());
    return json.toString();
  }
}
