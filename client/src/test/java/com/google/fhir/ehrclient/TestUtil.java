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
import com.google.common.io.Resources;
import com.google.fhir.ehrclient.interfaces.Sleeper;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;
import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.hl7.fhir.instance.model.api.IBaseResource;

public class TestUtil {

  public static final String TEST_BASE_URL = "https://fhir.example.org/api/FHIR/R4";
  public static final String TEST_TOKEN_URL = "https://fhir.example.org/oauth2/token";
  public static final String TEST_CLIENT_ID = "test-client";
  public static final String TEST_CLIENT_SECRET = "test-secret";

  public static String loadFixture(String name) throws IOException {
    URL url = Resources.getResource("fixtures/" + name);
    return Resources.toString(url, StandardCharsets.UTF_8);
  }

  public static <T extends IBaseResource> T loadResource(
      FhirContext fhirContext, String name, Class<T> type) throws IOException {
    return fhirContext.newJsonParser().parseResource(type, loadFixture(name));
  }

  public static HttpResponse createResponse(int statusCode, @Nullable String body) {
    BasicHttpResponse response =
        new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, statusCode, null));
    if (body != null) {
      response.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
    }
    return response;
  }

  public static ClientConfiguration.ClientConfigurationBuilder createConfigurationBuilder() {
    return new ClientConfiguration.ClientConfigurationBuilder()
        .setBaseUrl(TEST_BASE_URL)
        .setTokenUrl(TEST_TOKEN_URL)
        .setClientId(TEST_CLIENT_ID)
        .setClientSecret(TEST_CLIENT_SECRET);
  }

  /** A clock that only moves when told to. */
  public static class FakeClock extends Clock {

    private volatile Instant now;

    public FakeClock(Instant now) {
      this.now = now;
    }

    public void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  /** Records requested delays instead of sleeping. */
  public static class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
      delays.add(duration);
    }

    public List<Duration> getDelays() {
      return delays;
    }
  }
}
