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

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;

/** A bearer token together with the window in which it may be used. Never leaves this package. */
@Getter
final class AccessToken {

  private final String tokenValue;
  private final Instant acquiredAt;
  private final Instant expiresAt;

  AccessToken(String tokenValue, Instant acquiredAt, Instant expiresAt) {
    this.tokenValue = tokenValue;
    this.acquiredAt = acquiredAt;
    this.expiresAt = expiresAt;
  }

  /** Returns true iff the token stays valid for more than {@code margin} after {@code now}. */
  boolean isUsableAt(Instant now, Duration margin) {
    return now.isBefore(expiresAt.minus(margin));
  }

  @Override
  public String toString() {
    return String.format("AccessToken{acquiredAt=%s, expiresAt=%s}", acquiredAt, expiresAt);
  }
}
