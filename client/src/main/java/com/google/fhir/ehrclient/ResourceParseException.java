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
 * A payload could not be read as a FHIR resource at all. Missing optional fields never cause this;
 * the parsers fill in defaults instead.
 */
public class ResourceParseException extends ClinicalApiException {

  public ResourceParseException(String message) {
    super(message);
  }

  public ResourceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
