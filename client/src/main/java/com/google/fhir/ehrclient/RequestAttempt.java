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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;

/** One iteration of the retry loop; recorded into {@link ClientStatistics} and then dropped. */
@Getter
final class RequestAttempt {

  private final String method;
  private final String path;
  private final ImmutableMap<String, String> params;
  private final int attemptNumber;
  private final RequestOutcome outcome;

  RequestAttempt(
      String method,
      String path,
      Map<String, String> params,
      int attemptNumber,
      RequestOutcome outcome) {
    this.method = method;
    this.path = path;
    this.params = ImmutableMap.copyOf(params);
    this.attemptNumber = attemptNumber;
    this.outcome = outcome;
  }

  boolean isSuccess() {
    return outcome == RequestOutcome.SUCCESS;
  }
}
