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

import ca.uhn.fhir.context.FhirContext;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.fhir.ehrclient.RetryStateMachine.State;
import com.google.fhir.ehrclient.interfaces.Sleeper;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import javax.annotation.Nullable;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends authenticated requests to a FHIR server and retries transient failures.
 *
 * <p>Every attempt fetches a token from the {@link TokenManager}, so a token that expires between
 * attempts is renewed transparently. Rate limiting (429), server errors (5xx) and I/O failures are
 * retried with exponential backoff up to the configured number of attempts; every other non-2xx
 * status fails immediately. Each attempt is counted in the client statistics.
 *
 * <p>Instances are thread-safe and meant to be shared.
 */
public class FhirProtocolClient implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(FhirProtocolClient.class);

  static final String FHIR_JSON_CONTENT_TYPE = "application/fhir+json";

  private final ClientConfiguration configuration;
  private final TokenManager tokenManager;
  private final HttpClient httpClient;
  private final Sleeper sleeper;
  private final ClientStatistics statistics;
  private final FhirContext fhirContext = FhirUtil.createFhirContext();

  @VisibleForTesting
  FhirProtocolClient(
      ClientConfiguration configuration,
      TokenManager tokenManager,
      HttpClient httpClient,
      Sleeper sleeper,
      Clock clock) {
    this.configuration = Preconditions.checkNotNull(configuration);
    this.tokenManager = Preconditions.checkNotNull(tokenManager);
    this.httpClient = Preconditions.checkNotNull(httpClient);
    this.sleeper = Preconditions.checkNotNull(sleeper);
    this.statistics = new ClientStatistics(clock);
  }

  public static FhirProtocolClient create(ClientConfiguration configuration) {
    logger.info("Creating FHIR client with {}", configuration);
    HttpClient httpClient = HttpUtil.createHttpClient(configuration.getRequestTimeout());
    Clock clock = Clock.systemUTC();
    return new FhirProtocolClient(
        configuration,
        new TokenManager(configuration, httpClient, clock),
        httpClient,
        Sleeper.SYSTEM,
        clock);
  }

  public ClientConfiguration getConfiguration() {
    return configuration;
  }

  public FhirContext getFhirContext() {
    return fhirContext;
  }

  @Nullable
  public IBaseResource get(String path, Map<String, String> params) {
    return request("GET", path, params, null);
  }

  @Nullable
  public IBaseResource get(String path) {
    return get(path, ImmutableMap.of());
  }

  @Nullable
  public IBaseResource post(String path, IBaseResource resource) {
    Preconditions.checkNotNull(resource);
    return request("POST", path, ImmutableMap.of(), resource);
  }

  /**
   * Sends one logical request, retrying transient failures.
   *
   * @param method the HTTP method
   * @param path resource path relative to the base URL, e.g. {@code Patient/123}
   * @param params query parameters
   * @param body resource to send as the request body, if any
   * @return the parsed response resource, or null if the server answered with an empty body
   * @throws AuthenticationFailedException if no access token could be obtained
   * @throws RateLimitedException if the last attempt was rate limited
   * @throws ServerErrorException if the last attempt failed with a 5xx status
   * @throws NetworkErrorException if the last attempt failed with an I/O error
   * @throws ClientErrorException on any other non-2xx status; never retried
   * @throws ResourceParseException if a non-empty response body is not a FHIR resource
   */
  @Nullable
  public IBaseResource request(
      String method, String path, Map<String, String> params, @Nullable IBaseResource body) {
    Preconditions.checkNotNull(method);
    Preconditions.checkNotNull(path);
    Preconditions.checkNotNull(params);
    String payload =
        body == null ? null : fhirContext.newJsonParser().encodeResourceToString(body);
    URI uri = buildUri(path, params);
    RetryStateMachine retry = new RetryStateMachine(configuration.getMaxAttempts());

    while (true) {
      AccessToken token = tokenManager.getToken();
      HttpUriRequest httpRequest = buildRequest(method, uri, token, payload);
      int statusCode = -1;
      String responseBody = null;
      IOException ioException = null;
      RequestOutcome outcome;
      try {
        HttpResponse response = httpClient.execute(httpRequest);
        statusCode = response.getStatusLine().getStatusCode();
        responseBody = HttpUtil.readBody(response);
        outcome = RequestOutcome.fromStatusCode(statusCode);
      } catch (IOException e) {
        ioException = e;
        outcome = RequestOutcome.NETWORK_ERROR;
      }

      statistics.record(
          new RequestAttempt(method, path, params, retry.getAttemptNumber(), outcome));
      retry.recordOutcome(outcome);
      if (retry.getState() == State.SUCCEEDED) {
        logger.debug("{} {} succeeded with status {}", method, path, statusCode);
        return parseResponse(responseBody);
      }

      if (statusCode == HttpStatus.SC_UNAUTHORIZED) {
        tokenManager.invalidate();
      }
      ClinicalApiException error = createError(method, path, outcome, statusCode, ioException);
      if (retry.getState() == State.FAILED_TERMINAL) {
        logger.error(
            "{} {} failed after {} attempt(s): {}",
            method,
            path,
            retry.getAttemptNumber() + 1,
            error.getMessage());
        throw error;
      }

      Duration delay = retry.backoffDelay(configuration.getBackoffUnit());
      logger.warn(
          "{} {} attempt {} failed ({}); retrying in {} ms",
          method,
          path,
          retry.getAttemptNumber() + 1,
          outcome,
          delay.toMillis());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new NetworkErrorException(
            String.format("Interrupted while waiting to retry %s %s", method, path), e);
      }
      retry.resume();
    }
  }

  public StatisticsReport getStatistics() {
    return statistics.snapshot(tokenManager.isTokenValid(), tokenManager.getTokenExpiry());
  }

  @Override
  public void close() throws IOException {
    if (httpClient instanceof Closeable) {
      ((Closeable) httpClient).close();
    }
  }

  private URI buildUri(String path, Map<String, String> params) {
    try {
      URIBuilder uriBuilder =
          new URIBuilder(String.format("%s/%s", configuration.getBaseUrl(), path));
      for (Map.Entry<String, String> param : params.entrySet()) {
        uriBuilder.addParameter(param.getKey(), param.getValue());
      }
      return uriBuilder.build();
    } catch (URISyntaxException e) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger, "Error in building URI for resource " + path, e, IllegalArgumentException.class);
      return null; // Unreachable.
    }
  }

  private HttpUriRequest buildRequest(
      String method, URI uri, AccessToken token, @Nullable String payload) {
    RequestBuilder builder =
        RequestBuilder.create(method)
            .setUri(uri)
            .addHeader("Authorization", "Bearer " + token.getTokenValue())
            .addHeader("Accept", FHIR_JSON_CONTENT_TYPE);
    if (payload != null) {
      builder.setEntity(
          new StringEntity(payload, ContentType.create(FHIR_JSON_CONTENT_TYPE, "UTF-8")));
    }
    return builder.build();
  }

  @Nullable
  private IBaseResource parseResponse(@Nullable String responseBody) {
    if (responseBody == null || responseBody.trim().isEmpty()) {
      return null;
    }
    return FhirUtil.parseResource(fhirContext, responseBody);
  }

  private static ClinicalApiException createError(
      String method,
      String path,
      RequestOutcome outcome,
      int statusCode,
      @Nullable IOException ioException) {
    String message = String.format("%s %s failed with status %d", method, path, statusCode);
    switch (outcome) {
      case RATE_LIMITED:
        return new RateLimitedException(message);
      case SERVER_ERROR:
        return new ServerErrorException(message, statusCode);
      case NETWORK_ERROR:
        return new NetworkErrorException(
            String.format("%s %s failed: %s", method, path, ioException), ioException);
      default:
        return new ClientErrorException(message, statusCode);
    }
  }
}
