/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.daktela.extractor.client;

import io.daktela.extractor.ConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

/**
 * Creates the {@link HttpClient} shared by authentication and page requests.
 */
public final class DaktelaHttpClients {

  private static final Logger LOGGER = LoggerFactory.getLogger(DaktelaHttpClients.class);

  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
  static final String DISABLE_HOSTNAME_VERIFICATION =
      "jdk.internal.httpclient.disableHostnameVerification";

  private DaktelaHttpClients() {
  }

  /**
   * Turns off hostname verification for every {@link HttpClient} of this JVM.
   *
   * <p>The JDK reads the property once, when its HTTP client implementation is
   * first initialized, so this must run before the first client is created.
   */
  public static void disableHostnameVerification() {
    System.setProperty(DISABLE_HOSTNAME_VERIFICATION, "true");
  }

  /**
   * Creates a client.
   *
   * <p>With {@code verifySsl} false, server certificates are accepted without
   * validation; hostname checks are controlled process-wide by
   * {@link #disableHostnameVerification()}.
   *
   * @param verifySsl Whether server certificates are verified
   * @return HTTP client
   */
  public static HttpClient create(boolean verifySsl) {
    HttpClient.Builder builder = HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL);
    if (!verifySsl) {
      LOGGER.warn("SSL verification is disabled. This is insecure.");
      builder.sslContext(trustAllContext());
    }
    return builder.build();
  }

  private static SSLContext trustAllContext() {
    TrustManager[] trustAll = {
        new X509TrustManager() {
          @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {
          }

          @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {
          }

          @Override public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
          }
        }
    };
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, trustAll, new SecureRandom());
      return context;
    } catch (GeneralSecurityException e) {
      throw new ConfigurationException("Unable to disable SSL verification: " + e.getMessage(), e);
    }
  }
}
