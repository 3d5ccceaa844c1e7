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

import org.apache.http.HttpStatus;

/** Classification of a single HTTP attempt against the FHIR server. */
public enum RequestOutcome {
  SUCCESS(false),
  RATE_LIMITED(true),
  SERVER_ERROR(true),
  CLIENT_ERROR(false),
  NETWORK_ERROR(true);

  private final boolean retryable;

  RequestOutcome(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public static RequestOutcome fromStatusCode(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) {
      return SUCCESS;
    }
    if (statusCode == HttpStatus.SC_TOO_MANY_REQUESTS) {
      return RATE_LIMITED;
    }
    if (statusCode >= 500) {
      return SERVER_ERROR;
    }
    // Everything else, including unexpected 1xx/3xx answers, is a permanent failure.
    return CLIENT_ERROR;
  }
}
