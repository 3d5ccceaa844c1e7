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

import ca.uhn.fhir.rest.api.Constants;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Duration;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

public class HttpUtil {

  // The default pool only allows two connections per route which serialises concurrent lookups.
  private static final int MAX_CONNECTIONS_PER_ROUTE = 20;
  private static final int MAX_CONNECTIONS_TOTAL = 50;

  static boolean isResponseValid(HttpResponse response) {
    // All success codes are valid.
    return response.getStatusLine().getStatusCode() >= 200
        && response.getStatusLine().getStatusCode() < 300;
  }

  /**
   * Creates a client whose connect, connection-pool and socket waits are all bounded by {@code
   * timeout}.
   */
  static HttpClient createHttpClient(Duration timeout) {
    int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(timeoutMillis)
            .setConnectionRequestTimeout(timeoutMillis)
            .setSocketTimeout(timeoutMillis)
            .build();
    return HttpClients.custom()
        .setDefaultRequestConfig(requestConfig)
        .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
        .setMaxConnTotal(MAX_CONNECTIONS_TOTAL)
        .build();
  }

  /**
   * Reads the whole response entity, honouring its declared charset, and releases the connection.
   * Returns an empty string if there is no entity.
   */
  static String readBody(HttpResponse response) throws IOException {
    HttpEntity entity = response.getEntity();
    if (entity == null) {
      return "";
    }
    ContentType contentType = ContentType.getOrDefault(entity);
    Charset charset = Constants.CHARSET_UTF8;
    if (contentType.getCharset() != null) {
      charset = contentType.getCharset();
    }
    return EntityUtils.toString(entity, charset);
  }
}
