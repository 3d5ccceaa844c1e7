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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import com.google.fhir.ehrclient.ClientConfiguration.ClientConfigurationBuilder;
import java.time.Duration;
import org.junit.Test;

public class ClientConfigurationTest {

  @Test
  public void build_trailingSlashes_areRemovedFromBaseUrl() {
    ClientConfiguration configuration =
        TestUtil.createConfigurationBuilder().setBaseUrl("https://fhir.example.org/R4//").build();

    assertThat(configuration.getBaseUrl(), equalTo("https://fhir.example.org/R4"));
  }

  @Test
  public void build_emptyScope_fallsBackToDefault() {
    ClientConfiguration configuration = TestUtil.createConfigurationBuilder().setScope("").build();

    assertThat(configuration.getScope(), equalTo(ClientConfiguration.DEFAULT_SCOPE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_missingBaseUrl_throws() {
    new ClientConfigurationBuilder()
        .setTokenUrl(TestUtil.TEST_TOKEN_URL)
        .setClientId(TestUtil.TEST_CLIENT_ID)
        .setClientSecret(TestUtil.TEST_CLIENT_SECRET)
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_zeroTimeout_throws() {
    TestUtil.createConfigurationBuilder().setRequestTimeout(Duration.ZERO).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_zeroAttempts_throws() {
    TestUtil.createConfigurationBuilder().setMaxAttempts(0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void build_attemptsAboveLimit_throws() {
    TestUtil.createConfigurationBuilder()
        .setMaxAttempts(ClientConfiguration.MAX_ATTEMPTS_LIMIT + 1)
        .build();
  }

  @Test
  public void build_attemptsAtLimit_accepted() {
    ClientConfiguration configuration =
        TestUtil.createConfigurationBuilder()
            .setMaxAttempts(ClientConfiguration.MAX_ATTEMPTS_LIMIT)
            .build();

    assertThat(configuration.getMaxAttempts(), equalTo(ClientConfiguration.MAX_ATTEMPTS_LIMIT));
  }
}
