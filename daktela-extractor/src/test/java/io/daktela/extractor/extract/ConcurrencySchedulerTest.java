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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ConcurrencyScheduler}.
 */
@Tag("unit")
public class ConcurrencySchedulerTest {

  private static List<EndpointSpec> independent(int count) {
    List<EndpointSpec> specs = new ArrayList<EndpointSpec>();
    for (int i = 0; i < count; i++) {
      specs.add(EndpointSpec.builder().name("e" + i).build());
    }
    return specs;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  @Test void testEndpointLimit() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    try (ConcurrencyScheduler scheduler = new ConcurrencyScheduler(5, 2)) {
      Map<String, ExtractionOutcome> outcomes = scheduler.runPhase("test", independent(6),
          spec -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            sleep(30);
            running.decrementAndGet();
            return ExtractionOutcome.success(spec.getName(), spec.getName(), 1,
                new HashSet<String>());
          });

      assertEquals(6, outcomes.size());
      assertThat(peak.get(), lessThanOrEqualTo(2));
      assertEquals(0, running.get());
    }
  }

  @Test void testChildWaitsForParentInSamePhase() {
    Map<String, Long> finished = new ConcurrentHashMap<String, Long>();
    Map<String, Long> started = new ConcurrentHashMap<String, Long>();
    List<EndpointSpec> specs = new ArrayList<EndpointSpec>();
    specs.add(EndpointSpec.builder().name("activities").build());
    specs.add(EndpointSpec.builder().name("attachments").parentEndpoint("activities").build());

    try (ConcurrencyScheduler scheduler = new ConcurrencyScheduler(5, 5)) {
      scheduler.runPhase("test", specs, spec -> {
        started.put(spec.getName(), System.nanoTime());
        if (spec.getName().equals("activities")) {
          sleep(50);
        }
        finished.put(spec.getName(), System.nanoTime());
        return ExtractionOutcome.success(spec.getName(), spec.getName(), 0,
            new HashSet<String>());
      });
    }

    assertTrue(started.get("attachments") >= finished.get("activities"));
  }

  @Test void testTaskExceptionBecomesFailedOutcome() {
    try (ConcurrencyScheduler scheduler = new ConcurrencyScheduler(1, 1)) {
      Map<String, ExtractionOutcome> outcomes = scheduler.runPhase("test", independent(1),
          spec -> {
            throw new IllegalStateException("kaput");
          });

      assertFalse(outcomes.get("e0").isSuccessful());
      assertEquals("kaput", outcomes.get("e0").getFailureMessage());
    }
  }

  @Test void testInvalidLimits() {
    assertThrows(IllegalArgumentException.class, () -> new ConcurrencyScheduler(0, 1));
  }
}
