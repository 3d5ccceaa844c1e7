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
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.google.fhir.ehrclient.TestUtil.FakeClock;
import com.google.fhir.ehrclient.TestUtil.RecordingSleeper;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.NameValuePair;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Patient;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class FhirProtocolClientTest {

  private static final Instant NOW = Instant.parse("2025-10-07T09:00:00Z");

  @Mock private HttpClient httpClientMock;

  @Mock private TokenManager tokenManagerMock;

  private final RecordingSleeper sleeper = new RecordingSleeper();

  private FhirProtocolClient client;

  private String patientJson;

  @Before
  public void setUp() throws Exception {
    client = createClient(TestUtil.createConfigurationBuilder().build());
    patientJson = TestUtil.loadFixture("patient_smith.json");
  }

  private FhirProtocolClient createClient(ClientConfiguration configuration) {
    return new FhirProtocolClient(
        configuration, tokenManagerMock, httpClientMock, sleeper, new FakeClock(NOW));
  }

  private void setUpToken() {
    when(tokenManagerMock.getToken())
        .thenReturn(new AccessToken("test-token", NOW, NOW.plusSeconds(3600)));
  }

  @Test
  public void get_ok_returnsParsedResource() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(200, patientJson));

    IBaseResource resource = client.get("Patient/eXYZ123");

    assertThat(resource, instanceOf(Patient.class));
    assertThat(((Patient) resource).getIdElement().getIdPart(), equalTo("eXYZ123"));
    assertThat(sleeper.getDelays(), empty());
  }

  @Test
  public void get_setsAuthorizationAndQueryParameters() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(200, TestUtil.loadFixture("bundle_empty.json")));
    ArgumentCaptor<HttpUriRequest> requestCaptor = ArgumentCaptor.forClass(HttpUriRequest.class);

    client.get("Patient", ImmutableMap.of("identifier", "mrn|12345678"));

    verify(httpClientMock).execute(requestCaptor.capture());
    HttpUriRequest request = requestCaptor.getValue();
    assertThat(request.getMethod(), equalTo("GET"));
    assertThat(request.getFirstHeader("Authorization").getValue(), equalTo("Bearer test-token"));
    assertThat(request.getFirstHeader("Accept").getValue(), equalTo("application/fhir+json"));
    assertThat(request.getURI().getPath(), equalTo("/api/FHIR/R4/Patient"));
    assertThat(
        URLEncodedUtils.parse(request.getURI(), StandardCharsets.UTF_8),
        contains((NameValuePair) new BasicNameValuePair("identifier", "mrn|12345678")));
  }

  @Test
  public void post_sendsResourceAsFhirJson() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(201, ""));
    ArgumentCaptor<HttpUriRequest> requestCaptor = ArgumentCaptor.forClass(HttpUriRequest.class);
    Patient patient = new Patient();
    patient.addName().setFamily("Doe");

    IBaseResource result = client.post("Patient", patient);

    assertThat(result, nullValue());
    verify(httpClientMock).execute(requestCaptor.capture());
    HttpEntityEnclosingRequest request = (HttpEntityEnclosingRequest) requestCaptor.getValue();
    assertThat(
        request.getEntity().getContentType().getValue(),
        equalTo("application/fhir+json; charset=UTF-8"));
    String body = EntityUtils.toString(request.getEntity());
    Patient sent = client.getFhirContext().newJsonParser().parseResource(Patient.class, body);
    assertThat(sent.getNameFirstRep().getFamily(), equalTo("Doe"));
  }

  @Test
  public void get_rateLimitedTwiceThenOk_succeedsWithIncreasingBackoff() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(
            TestUtil.createResponse(429, ""),
            TestUtil.createResponse(429, ""),
            TestUtil.createResponse(200, patientJson));

    IBaseResource resource = client.get("Patient/eXYZ123");

    assertThat(resource, instanceOf(Patient.class));
    assertThat(sleeper.getDelays(), contains(Duration.ofSeconds(1), Duration.ofSeconds(2)));
    assertThat(sleeper.getDelays().get(1), greaterThan(sleeper.getDelays().get(0)));
    verify(tokenManagerMock, times(3)).getToken();
    StatisticsReport statistics = client.getStatistics();
    assertThat(statistics.getTotalRequests(), equalTo(3L));
    assertThat(statistics.getErrorCount(), equalTo(2L));
  }

  @Test
  public void get_notFound_failsWithoutRetry() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(404, "{\"resourceType\":\"OperationOutcome\"}"));

    try {
      client.get("Patient/missing");
      fail("Expected ClientErrorException");
    } catch (ClientErrorException e) {
      assertThat(e.getStatusCode(), equalTo(404));
      assertThat(e.isNotFound(), equalTo(true));
    }

    verify(httpClientMock, times(1)).execute(any(HttpUriRequest.class));
    assertThat(sleeper.getDelays(), empty());
    verify(tokenManagerMock, never()).invalidate();
  }

  @Test
  public void get_serverErrorsExhausted_throwsServerError() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(503, ""));

    try {
      client.get("Condition", ImmutableMap.of("patient", "eXYZ123"));
      fail("Expected ServerErrorException");
    } catch (ServerErrorException e) {
      assertThat(e.getStatusCode(), equalTo(503));
    }

    verify(httpClientMock, times(3)).execute(any(HttpUriRequest.class));
    assertThat(sleeper.getDelays(), contains(Duration.ofSeconds(1), Duration.ofSeconds(2)));
    assertThat(client.getStatistics().getErrorCount(), equalTo(3L));
  }

  @Test
  public void get_timeoutThenOk_retries() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenThrow(new SocketTimeoutException("Read timed out"))
        .thenReturn(TestUtil.createResponse(200, patientJson));

    IBaseResource resource = client.get("Patient/eXYZ123");

    assertThat(resource, instanceOf(Patient.class));
    assertThat(sleeper.getDelays(), contains(Duration.ofSeconds(1)));
  }

  @Test(expected = NetworkErrorException.class)
  public void get_connectionFailuresExhausted_throwsNetworkError() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenThrow(new ConnectException("Connection refused"));

    client.get("Patient/eXYZ123");
  }

  @Test(expected = RateLimitedException.class)
  public void get_rateLimitedWithSingleAttempt_throwsWithoutBackoff() throws Exception {
    client = createClient(TestUtil.createConfigurationBuilder().setMaxAttempts(1).build());
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(429, ""));

    try {
      client.get("Patient/eXYZ123");
    } finally {
      assertThat(sleeper.getDelays(), empty());
    }
  }

  @Test
  public void get_unauthorized_invalidatesToken() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(401, ""));

    try {
      client.get("Patient/eXYZ123");
      fail("Expected ClientErrorException");
    } catch (ClientErrorException e) {
      assertThat(e.getStatusCode(), equalTo(401));
    }

    verify(tokenManagerMock).invalidate();
    verify(httpClientMock, times(1)).execute(any(HttpUriRequest.class));
  }

  @Test
  public void get_bodyIsNotFhir_throwsResourceParseException() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(200, "<html>maintenance</html>"));

    try {
      client.get("Patient/eXYZ123");
      fail("Expected ResourceParseException");
    } catch (ResourceParseException e) {
      // expected
    }

    verify(httpClientMock, times(1)).execute(any(HttpUriRequest.class));
  }

  @Test
  public void get_bundleWithStatusOutsideR4Codes_returnsBundle() throws Exception {
    setUpToken();
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(
            TestUtil.createResponse(200, TestUtil.loadFixture("medications_unknown_status.json")));

    IBaseResource resource =
        client.get("MedicationRequest", ImmutableMap.of("patient", "eUNK001"));

    List<MedicationRequest> requests =
        FhirUtil.resourcesOfType((Bundle) resource, MedicationRequest.class);
    assertThat(requests.size(), equalTo(1));
    assertThat(requests.get(0).getStatusElement().getValueAsString(), equalTo("Active"));
  }

  @Test(expected = AuthenticationFailedException.class)
  public void get_tokenUnavailable_propagatesWithoutSending() throws Exception {
    when(tokenManagerMock.getToken()).thenThrow(new AuthenticationFailedException("denied"));

    try {
      client.get("Patient/eXYZ123");
    } finally {
      verify(httpClientMock, never()).execute(any(HttpUriRequest.class));
    }
  }

  @Test
  public void getStatistics_noRequests_zeroErrorRate() {
    StatisticsReport statistics = client.getStatistics();

    assertThat(statistics.getTotalRequests(), equalTo(0L));
    assertThat(statistics.getErrorRate(), equalTo(0.0));
    assertThat(statistics.getLastRequestTime(), nullValue());
  }

  @Test
  public void getStatistics_afterRequests_reportsErrorRateAndToken() throws Exception {
    setUpToken();
    when(tokenManagerMock.isTokenValid()).thenReturn(true);
    when(tokenManagerMock.getTokenExpiry()).thenReturn(NOW.plusSeconds(3600));
    when(httpClientMock.execute(any(HttpUriRequest.class)))
        .thenReturn(TestUtil.createResponse(500, ""), TestUtil.createResponse(200, patientJson));

    client.get("Patient/eXYZ123");
    StatisticsReport statistics = client.getStatistics();

    assertThat(statistics.getTotalRequests(), equalTo(2L));
    assertThat(statistics.getErrorCount(), equalTo(1L));
    assertThat(statistics.getErrorRate(), closeTo(0.5, 1e-9));
    assertThat(statistics.getLastRequestTime(), equalTo(NOW));
    assertThat(statistics.isTokenValid(), equalTo(true));
    assertThat(statistics.getTokenExpiry(), equalTo(NOW.plusSeconds(3600)));
    String json = statistics.toJson();
    assertThat(json.contains("\"total_requests\":2"), equalTo(true));
    assertThat(json.contains("\"error_rate\":0.5"), equalTo(true));
    assertThat(json.contains("\"token_valid\":true"), equalTo(true));
  }

  @Test
  public void close_closesHttpClient() throws Exception {
    CloseableHttpClient closeableMock = mock(CloseableHttpClient.class);
    FhirProtocolClient closeableClient =
        new FhirProtocolClient(
            TestUtil.createConfigurationBuilder().build(),
            tokenManagerMock,
            closeableMock,
            sleeper,
            new FakeClock(NOW));

    closeableClient.close();

    verify(closeableMock).close();
  }
}
