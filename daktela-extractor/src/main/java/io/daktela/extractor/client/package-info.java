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

/**
 * HTTP access to the Daktela REST API.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link io.daktela.extractor.client.DaktelaAuthenticator} - Exchanges credentials for an access token</li>
 *   <li>{@link io.daktela.extractor.client.PageFetcher} - Paged list and dependent reads with retry and filter fallback</li>
 *   <li>{@link io.daktela.extractor.client.FilterEncoder} - Encodes date-range filters as query parameters</li>
 *   <li>{@link io.daktela.extractor.client.RetryExecutor} - Bounded retries with linear backoff</li>
 * </ul>
 */
package io.daktela.extractor.client;
