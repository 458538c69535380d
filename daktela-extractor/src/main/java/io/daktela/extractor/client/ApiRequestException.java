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

import java.io.IOException;

/**
 * Non-success HTTP response from the Daktela API.
 *
 * <p>Carries the status code so callers can tell transient failures from
 * client errors. Instances are retried by {@link RetryExecutor}.
 */
public class ApiRequestException extends IOException {

  private final int statusCode;

  public ApiRequestException(int statusCode, String message) {
    super("HTTP " + statusCode + ": " + message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Whether the status is a 4xx that can be caused by the request's filter
   * parameters. Authentication, missing resource and throttling responses are
   * excluded.
   */
  public boolean isFilterRejection() {
    return statusCode >= 400 && statusCode < 500
        && statusCode != 401 && statusCode != 403 && statusCode != 404 && statusCode != 429;
  }
}
