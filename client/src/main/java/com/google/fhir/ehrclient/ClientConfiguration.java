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

import com.google.common.base.Strings;
import java.time.Duration;
import lombok.Getter;

/**
 * Connection settings for one remote FHIR API. Instances are immutable and are owned by exactly
 * one {@link FhirProtocolClient}; separate targets (e.g. sandbox and production) get separate
 * configurations and therefore separate token caches.
 */
@Getter
public final class ClientConfiguration {

  static final String DEFAULT_SCOPE =
      "Patient.Read Condition.Read MedicationRequest.Read DocumentReference.Write";
  static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);
  static final int DEFAULT_MAX_ATTEMPTS = 3;
  // Keeps the exponential backoff delay within range.
  static final int MAX_ATTEMPTS_LIMIT = 10;
  static final String DEFAULT_MRN_IDENTIFIER_SYSTEM = "mrn";

  private final String baseUrl;
  private final String tokenUrl;
  private final String clientId;
  private final String clientSecret;
  private final String scope;
  private final Duration requestTimeout;
  private final Duration backoffUnit;
  private final int maxAttempts;
  private final String mrnIdentifierSystem;

  private ClientConfiguration(ClientConfigurationBuilder builder) {
    // Remove trailing '/'s so resource paths can be appended with a single separator.
    this.baseUrl = builder.baseUrl.replaceAll("/+$", "");
    this.tokenUrl = builder.tokenUrl;
    this.clientId = builder.clientId;
    this.clientSecret = builder.clientSecret;
    this.scope = builder.scope;
    this.requestTimeout = builder.requestTimeout;
    this.backoffUnit = builder.backoffUnit;
    this.maxAttempts = builder.maxAttempts;
    this.mrnIdentifierSystem = builder.mrnIdentifierSystem;
  }

  @Override
  public String toString() {
    // Never includes the client secret.
    return String.format(
        "ClientConfiguration{baseUrl=%s, tokenUrl=%s, clientId=%s, scope=%s, requestTimeout=%s,"
            + " maxAttempts=%d}",
        baseUrl, tokenUrl, clientId, scope, requestTimeout, maxAttempts);
  }

  public static class ClientConfigurationBuilder {
    private String baseUrl;
    private String tokenUrl;
    private String clientId;
    private String clientSecret;
    private String scope = DEFAULT_SCOPE;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private Duration backoffUnit = DEFAULT_BACKOFF_UNIT;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private String mrnIdentifierSystem = DEFAULT_MRN_IDENTIFIER_SYSTEM;

    public ClientConfigurationBuilder setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public ClientConfigurationBuilder setTokenUrl(String tokenUrl) {
      this.tokenUrl = tokenUrl;
      return this;
    }

    public ClientConfigurationBuilder setClientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public ClientConfigurationBuilder setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public ClientConfigurationBuilder setScope(String scope) {
      this.scope = scope;
      return this;
    }

    public ClientConfigurationBuilder setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public ClientConfigurationBuilder setBackoffUnit(Duration backoffUnit) {
      this.backoffUnit = backoffUnit;
      return this;
    }

    public ClientConfigurationBuilder setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public ClientConfigurationBuilder setMrnIdentifierSystem(String mrnIdentifierSystem) {
      this.mrnIdentifierSystem = mrnIdentifierSystem;
      return this;
    }

    public ClientConfiguration build() {
      checkSet(baseUrl, "Base URL");
      checkSet(tokenUrl, "Token URL");
      checkSet(clientId, "Client ID");
      checkSet(clientSecret, "Client secret");
      if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
        throw new IllegalArgumentException("Request timeout must be positive!");
      }
      if (backoffUnit == null || backoffUnit.isNegative()) {
        throw new IllegalArgumentException("Backoff unit must not be negative!");
      }
      if (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS_LIMIT) {
        throw new IllegalArgumentException(
            String.format("Max attempts must be between 1 and %d!", MAX_ATTEMPTS_LIMIT));
      }
      if (Strings.isNullOrEmpty(scope)) {
        scope = DEFAULT_SCOPE;
      }
      if (Strings.isNullOrEmpty(mrnIdentifierSystem)) {
        mrnIdentifierSystem = DEFAULT_MRN_IDENTIFIER_SYSTEM;
      }
      return new ClientConfiguration(this);
    }

    private static void checkSet(String value, String name) {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException(String.format("%s not set!", name));
      }
    }
  }
}
