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
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.apache.http.HttpResponse;
import org.apache.http.NameValuePair;
import org.apache.http.client.HttpClient;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains bearer tokens through the OAuth2 client-credentials grant and caches the current one.
 *
 * <p>A cached token is handed out until it is within {@link #EXPIRY_MARGIN} of its expiry. When a
 * new token is needed, the first caller performs the exchange and every caller that arrives while
 * that exchange is in flight waits for it and receives the very same token, or the very same
 * failure. A failed exchange is never cached, so the next call starts a fresh one.
 */
class TokenManager {

  private static final Logger logger = LoggerFactory.getLogger(TokenManager.class);

  static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);
  static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  private final ClientConfiguration configuration;
  private final HttpClient httpClient;
  private final Clock clock;
  private final Gson gson = new Gson();

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  @Nullable
  private AccessToken cachedToken;

  // Non-null only while an exchange is running; completed before it is cleared.
  @GuardedBy("lock")
  @Nullable
  private CompletableFuture<AccessToken> inFlightRefresh;

  private final AtomicInteger callersAwaitingRefresh = new AtomicInteger();

  TokenManager(ClientConfiguration configuration, HttpClient httpClient, Clock clock) {
    this.configuration = configuration;
    this.httpClient = httpClient;
    this.clock = clock;
  }

  AccessToken getToken() {
    CompletableFuture<AccessToken> refresh;
    boolean ownsRefresh = false;
    lock.lock();
    try {
      if (cachedToken != null && cachedToken.isUsableAt(clock.instant(), EXPIRY_MARGIN)) {
        logger.debug("Using cached access token");
        return cachedToken;
      }
      if (inFlightRefresh == null) {
        inFlightRefresh = new CompletableFuture<>();
        ownsRefresh = true;
      }
      refresh = inFlightRefresh;
    } finally {
      lock.unlock();
    }

    if (ownsRefresh) {
      runRefresh(refresh);
      return awaitRefresh(refresh);
    }
    callersAwaitingRefresh.incrementAndGet();
    try {
      return awaitRefresh(refresh);
    } finally {
      callersAwaitingRefresh.decrementAndGet();
    }
  }

  /** Drops the cached token so that the next {@link #getToken()} performs a new exchange. */
  void invalidate() {
    lock.lock();
    try {
      if (cachedToken != null) {
        logger.info("Invalidating cached access token");
      }
      cachedToken = null;
    } finally {
      lock.unlock();
    }
  }

  boolean isTokenValid() {
    lock.lock();
    try {
      return cachedToken != null && cachedToken.isUsableAt(clock.instant(), EXPIRY_MARGIN);
    } finally {
      lock.unlock();
    }
  }

  @Nullable
  Instant getTokenExpiry() {
    lock.lock();
    try {
      return cachedToken == null ? null : cachedToken.getExpiresAt();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int getCallersAwaitingRefresh() {
    return callersAwaitingRefresh.get();
  }

  private void runRefresh(CompletableFuture<AccessToken> refresh) {
    AccessToken token = null;
    AuthenticationFailedException failure = null;
    try {
      token = exchangeClientCredentials();
    } catch (AuthenticationFailedException e) {
      failure = e;
    } catch (RuntimeException e) {
      logger.error("Unexpected error during token exchange", e);
      failure = new AuthenticationFailedException("Token exchange failed: " + e.getMessage(), e);
    }
    lock.lock();
    try {
      if (token != null) {
        cachedToken = token;
      }
      inFlightRefresh = null;
    } finally {
      lock.unlock();
    }
    if (token != null) {
      refresh.complete(token);
    } else {
      refresh.completeExceptionally(failure);
    }
  }

  private AccessToken awaitRefresh(CompletableFuture<AccessToken> refresh) {
    try {
      return refresh.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof AuthenticationFailedException) {
        throw (AuthenticationFailedException) e.getCause();
      }
      throw new AuthenticationFailedException("Token exchange failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthenticationFailedException("Interrupted while waiting for an access token", e);
    }
  }

  private AccessToken exchangeClientCredentials() {
    String tokenUrl = configuration.getTokenUrl();
    List<NameValuePair> form =
        Lists.newArrayList(
            new BasicNameValuePair("grant_type", "client_credentials"),
            new BasicNameValuePair("client_id", configuration.getClientId()),
            new BasicNameValuePair("client_secret", configuration.getClientSecret()),
            new BasicNameValuePair("scope", configuration.getScope()));
    HttpUriRequest request =
        RequestBuilder.post()
            .setUri(tokenUrl)
            .addHeader("Accept", "application/json")
            .setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8))
            .build();

    logger.info("Requesting new access token from {}", tokenUrl);
    Instant requestedAt = clock.instant();
    HttpResponse response = null;
    String body = null;
    try {
      response = httpClient.execute(request);
      body = HttpUtil.readBody(response);
    } catch (IOException e) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger,
          String.format("Token request to %s failed: %s", tokenUrl, e.getMessage()),
          e,
          AuthenticationFailedException.class);
    }
    if (!HttpUtil.isResponseValid(response)) {
      // The body is not logged; some servers echo the submitted credentials in error details.
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger,
          String.format(
              "Token request to %s failed; status %s", tokenUrl, response.getStatusLine()),
          AuthenticationFailedException.class);
    }

    TokenResponse tokenResponse = null;
    try {
      tokenResponse = gson.fromJson(body, TokenResponse.class);
    } catch (JsonParseException e) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger,
          "Malformed token response from " + tokenUrl,
          e,
          AuthenticationFailedException.class);
    }
    if (tokenResponse == null || Strings.isNullOrEmpty(tokenResponse.getAccessToken())) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger,
          "Token response from " + tokenUrl + " has no access_token",
          AuthenticationFailedException.class);
    }

    long expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
    if (tokenResponse.getExpiresIn() != null && tokenResponse.getExpiresIn() > 0) {
      expiresIn = tokenResponse.getExpiresIn();
    }
    logger.info("Obtained access token, expires in {} seconds", expiresIn);
    return new AccessToken(
        tokenResponse.getAccessToken(), requestedAt, requestedAt.plusSeconds(expiresIn));
  }
}
