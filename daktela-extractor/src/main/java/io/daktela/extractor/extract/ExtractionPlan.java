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
package io.daktela.extractor.extract;

import io.daktela.extractor.config.EndpointSpec;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions endpoints into two sequential phases.
 *
 * <p>Phase 1 holds independent endpoints outside the identity-source family.
 * Phase 2 holds the identity source and every dependent endpoint, ordered so
 * that a parent always precedes its children.
 */
public class ExtractionPlan {

  private final ImmutableList<EndpointSpec> phaseOne;
  private final ImmutableList<EndpointSpec> phaseTwo;

  private ExtractionPlan(List<EndpointSpec> phaseOne, List<EndpointSpec> phaseTwo) {
    this.phaseOne = ImmutableList.copyOf(phaseOne);
    this.phaseTwo = ImmutableList.copyOf(phaseTwo);
  }

  public static ExtractionPlan of(Map<String, EndpointSpec> endpoints, String identitySource) {
    List<EndpointSpec> first = new ArrayList<EndpointSpec>();
    List<EndpointSpec> second = new ArrayList<EndpointSpec>();
    for (EndpointSpec spec : endpoints.values()) {
      if (!spec.isDependent() && !spec.getName().equals(identitySource)) {
        first.add(spec);
      }
    }

    EndpointSpec source = endpoints.get(identitySource);
    if (source != null && !source.isDependent()) {
      second.add(source);
    }
    Set<String> placed = new HashSet<String>();
    for (EndpointSpec spec : first) {
      placed.add(spec.getName());
    }
    for (EndpointSpec spec : second) {
      placed.add(spec.getName());
    }

    // Children after parents; a dependent whose parent is not scheduled still runs.
    List<EndpointSpec> pending = new ArrayList<EndpointSpec>();
    for (EndpointSpec spec : endpoints.values()) {
      if (spec.isDependent()) {
        pending.add(spec);
      }
    }
    while (!pending.isEmpty()) {
      boolean progressed = false;
      for (int i = 0; i < pending.size(); i++) {
        EndpointSpec spec = pending.get(i);
        if (placed.contains(spec.getParentEndpoint())
            || !endpoints.containsKey(spec.getParentEndpoint())) {
          second.add(spec);
          placed.add(spec.getName());
          pending.remove(i);
          progressed = true;
          break;
        }
      }
      if (!progressed) {
        second.addAll(pending);
        pending.clear();
      }
    }
    return new ExtractionPlan(first, second);
  }

  public List<EndpointSpec> getPhaseOne() {
    return phaseOne;
  }

  public List<EndpointSpec> getPhaseTwo() {
    return phaseTwo;
  }
}
