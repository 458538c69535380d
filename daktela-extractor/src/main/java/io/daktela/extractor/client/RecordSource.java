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
import java.util.List;
import java.util.Map;

/**
 * Source of raw Daktela records.
 *
 * <p>Implemented by {@link PageFetcher} against the live API; the extraction
 * layer depends only on this interface.
 */
public interface RecordSource {

  /**
   * Fetches one page of a collection.
   *
   * @param request Endpoint, window, filters and field selection
   * @return Page of raw records with the reported total
   * @throws IOException If the page cannot be fetched after retries
   */
  Page fetchPage(PageRequest request) throws IOException;

  /**
   * Fetches every record of a child collection scoped to one parent identifier.
   *
   * @param parentEndpoint Parent collection path
   * @param parentId Normalized parent identifier
   * @param childEndpoint Child collection path below the parent
   * @param fields Field selection, empty for all fields
   * @param limit Page size
   * @return All child records
   * @throws IOException If any page cannot be fetched after retries
   */
  List<Map<String, Object>> fetchDependent(String parentEndpoint, String parentId,
      String childEndpoint, List<String> fields, int limit) throws IOException;
}
