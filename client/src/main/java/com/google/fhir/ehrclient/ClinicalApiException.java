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

/**
 * Base of all failures surfaced by the EHR client. These are unchecked so that callers of the
 * facade can decide where to handle them; each subclass maps to one failure category.
 */
public class ClinicalApiException extends RuntimeException {

  public ClinicalApiException(String message) {
    super(message);
  }

  public ClinicalApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
