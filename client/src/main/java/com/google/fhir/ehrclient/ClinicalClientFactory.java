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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.fhir.ehrclient.ClientConfiguration.ClientConfigurationBuilder;
import java.time.Duration;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a helper class to create a {@link ClinicalDataFacade} that talks to the FHIR server
 * configured through environment variables.
 */
public class ClinicalClientFactory {

  private static final Logger logger = LoggerFactory.getLogger(ClinicalClientFactory.class);

  static final String FHIR_BASE_URL_ENV = "FHIR_BASE_URL";
  static final String FHIR_SANDBOX_MODE_ENV = "FHIR_SANDBOX_MODE";
  static final String FHIR_SANDBOX_URL_ENV = "FHIR_SANDBOX_URL";
  static final String OAUTH_TOKEN_URL_ENV = "OAUTH_TOKEN_URL";
  static final String OAUTH_CLIENT_ID_ENV = "OAUTH_CLIENT_ID";
  static final String OAUTH_CLIENT_SECRET_ENV = "OAUTH_CLIENT_SECRET";
  static final String OAUTH_SCOPE_ENV = "OAUTH_SCOPE";
  static final String REQUEST_TIMEOUT_ENV = "FHIR_REQUEST_TIMEOUT_SECONDS";
  static final String MRN_IDENTIFIER_SYSTEM_ENV = "MRN_IDENTIFIER_SYSTEM";

  static final String DEFAULT_SANDBOX_URL =
      "https://fhir.epic.com/interconnect-fhir-oauth/api/FHIR/R4/";

  public static ClinicalDataFacade createFacadeFromEnvVars() {
    ClientConfiguration configuration = createConfigurationFromEnv(System::getenv);
    return new ClinicalDataFacade(FhirProtocolClient.create(configuration));
  }

  @VisibleForTesting
  static ClientConfiguration createConfigurationFromEnv(Function<String, String> env) {
    String baseUrl;
    if (Boolean.parseBoolean(env.apply(FHIR_SANDBOX_MODE_ENV))) {
      String sandboxUrl = env.apply(FHIR_SANDBOX_URL_ENV);
      baseUrl = Strings.isNullOrEmpty(sandboxUrl) ? DEFAULT_SANDBOX_URL : sandboxUrl;
      logger.info("Sandbox mode is on; using FHIR server {}", baseUrl);
    } else {
      baseUrl = requireEnv(env, FHIR_BASE_URL_ENV);
    }
    ClientConfigurationBuilder builder =
        new ClientConfigurationBuilder()
            .setBaseUrl(baseUrl)
            .setTokenUrl(requireEnv(env, OAUTH_TOKEN_URL_ENV))
            .setClientId(requireEnv(env, OAUTH_CLIENT_ID_ENV))
            .setClientSecret(requireEnv(env, OAUTH_CLIENT_SECRET_ENV))
            .setScope(env.apply(OAUTH_SCOPE_ENV))
            .setMrnIdentifierSystem(env.apply(MRN_IDENTIFIER_SYSTEM_ENV));
    String timeout = env.apply(REQUEST_TIMEOUT_ENV);
    if (!Strings.isNullOrEmpty(timeout)) {
      try {
        builder.setRequestTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format(
                "The environment variable %s is not a number: %s", REQUEST_TIMEOUT_ENV, timeout),
            e);
      }
    }
    ClientConfiguration configuration = builder.build();
    logger.info("Created EHR client configuration {}", configuration);
    return configuration;
  }

  private static String requireEnv(Function<String, String> env, String name) {
    String value = env.apply(name);
    if (Strings.isNullOrEmpty(value)) {
      throw new IllegalArgumentException(
          String.format("The environment variable %s is not set!", name));
    }
    return value;
  }
}
