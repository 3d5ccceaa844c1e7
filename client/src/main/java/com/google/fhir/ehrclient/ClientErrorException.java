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

/**
 * The FHIR server rejected the request with a 4xx status other than 429. These are never retried.
 */
public class ClientErrorException extends ClinicalApiException {

  private final int statusCode;

  public ClientErrorException(String message) {
    this(message, HttpStatus.SC_BAD_REQUEST);
  }

  public ClientErrorException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return statusCode == HttpStatus.SC_NOT_FOUND;
  }
}
