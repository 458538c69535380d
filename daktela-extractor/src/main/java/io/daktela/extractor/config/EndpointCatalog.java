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
package io.daktela.extractor.config;

import io.daktela.extractor.ConfigurationException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of known Daktela endpoints.
 *
 * <p>The catalog is loaded from the {@code daktela-endpoints.json} class path
 * resource. Besides one {@link EndpointSpec} per endpoint it names the
 * identity-source endpoint, whose invalid records gate the identifiers its
 * dependents are fetched for, and that endpoint's singular alias used as an
 * identifier prefix.
 */
public class EndpointCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(EndpointCatalog.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_RESOURCE = "/daktela-endpoints.json";

  private final Map<String, EndpointSpec> endpoints;
  private final String identitySource;
  private final String identitySourceAlias;

  public EndpointCatalog(Map<String, EndpointSpec> endpoints, String identitySource,
      String identitySourceAlias) {
    this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<String, EndpointSpec>(endpoints));
    this.identitySource = identitySource;
    this.identitySourceAlias = identitySourceAlias;
  }

  /**
   * Loads the catalog bundled with the extractor.
   */
  public static EndpointCatalog loadDefault() {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * Loads a catalog from a class path resource.
   *
   * @param resource Absolute resource name
   * @return Parsed catalog
   * @throws ConfigurationException If the resource is missing or malformed
   */
  @SuppressWarnings("unchecked")
  public static EndpointCatalog load(String resource) {
    try (InputStream in = EndpointCatalog.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigurationException(resource + " not found in resources");
      }
      Map<String, Object> root = MAPPER.readValue(in, new TypeReference<Map<String, Object>>() { });
      Object endpointsObj = root.get("endpoints");
      if (!(endpointsObj instanceof Map)) {
        throw new ConfigurationException("Invalid " + resource + ": missing 'endpoints' object");
      }
      Map<String, EndpointSpec> specs = new LinkedHashMap<String, EndpointSpec>();
      for (Map.Entry<String, Object> e : ((Map<String, Object>) endpointsObj).entrySet()) {
        Map<String, Object> specMap = e.getValue() instanceof Map
            ? (Map<String, Object>) e.getValue()
            : null;
        specs.put(e.getKey(), EndpointSpec.fromMap(e.getKey(), specMap));
      }
      String identity = root.get("identitySource") != null
          ? String.valueOf(root.get("identitySource")) : "activities";
      String alias = root.get("identitySourceAlias") != null
          ? String.valueOf(root.get("identitySourceAlias")) : "activity";
      LOGGER.debug("Loaded {} endpoint definitions from {}", specs.size(), resource);
      return new EndpointCatalog(specs, identity, alias);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load " + resource + ": " + e.getMessage(), e);
    }
  }

  public Map<String, EndpointSpec> getEndpoints() {
    return endpoints;
  }

  public @Nullable EndpointSpec get(String name) {
    return endpoints.get(name);
  }

  public String getIdentitySource() {
    return identitySource;
  }

  public String getIdentitySourceAlias() {
    return identitySourceAlias;
  }

  /**
   * Resolves requested endpoint names into specs.
   *
   * <p>Unknown names are logged and skipped. Explicit field lists replace the
   * catalog's. Parents of requested dependent endpoints are added when absent.
   *
   * @param requested Requested endpoint names, in request order
   * @param fieldsByEndpoint Explicit field selections keyed by endpoint name
   * @return Resolved specs keyed by name, parents appended after the requested ones
   * @throws ConfigurationException If no requested endpoint is known
   */
  public Map<String, EndpointSpec> resolve(List<String> requested,
      Map<String, List<String>> fieldsByEndpoint) {
    Map<String, EndpointSpec> resolved = new LinkedHashMap<String, EndpointSpec>();
    for (String name : requested) {
      EndpointSpec spec = endpoints.get(name);
      if (spec == null) {
        LOGGER.warn("Endpoint '{}' not found in configuration. Skipping.", name);
        continue;
      }
      List<String> fields = fieldsByEndpoint.get(name);
      resolved.put(name, fields != null ? spec.withFields(fields) : spec);
    }
    if (resolved.isEmpty()) {
      throw new ConfigurationException("No valid endpoints to extract");
    }

    List<String> pending = new ArrayList<String>(resolved.keySet());
    while (!pending.isEmpty()) {
      EndpointSpec spec = resolved.get(pending.remove(0));
      if (!spec.isDependent() || resolved.containsKey(spec.getParentEndpoint())) {
        continue;
      }
      EndpointSpec parent = endpoints.get(spec.getParentEndpoint());
      if (parent == null) {
        LOGGER.warn("Parent endpoint '{}' required by '{}' is not configured",
            spec.getParentEndpoint(), spec.getName());
        continue;
      }
      LOGGER.info("Auto-including parent endpoint '{}' required by dependent endpoint '{}'",
          parent.getName(), spec.getName());
      resolved.put(parent.getName(), parent);
      pending.add(parent.getName());
    }
    return resolved;
  }
}
