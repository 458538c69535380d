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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link DateRangeResolver}.
 */
@Tag("unit")
public class DateRangeResolverTest {

  private final DateRangeResolver resolver = new DateRangeResolver(
      Clock.fixed(Instant.parse("2024-05-15T12:34:56Z"), ZoneOffset.UTC));

  @Test void testKeywords() {
    assertEquals("2024-05-15 12:34:56", resolver.resolveTo("now"));
    assertEquals("2024-05-15 00:00:00", resolver.resolveTo("today"));
    assertEquals("2024-05-14 00:00:00", resolver.resolveTo("Yesterday"));
  }

  @Test void testRelativeExpressions() {
    assertEquals("2024-05-08 12:34:56", resolver.resolveTo("7 days ago"));
    assertEquals("2024-05-15 11:34:56", resolver.resolveTo("1 hour ago"));
    assertEquals("2024-03-15 12:34:56", resolver.resolveTo("2 months ago"));
    assertEquals("2024-05-01 12:34:56", resolver.resolveTo("2 weeks ago"));
  }

  @Test void testIsoInputs() {
    assertEquals("2024-01-31 00:00:00", resolver.resolveTo("2024-01-31"));
    assertEquals("2024-01-31 10:00:00", resolver.resolveTo("2024-01-31T10:00:00"));
    assertEquals("2024-01-31 10:00:00", resolver.resolveTo("2024-01-31 10:00:00"));
    assertEquals("2024-01-31 08:00:00", resolver.resolveTo("2024-01-31T10:00:00+02:00"));
  }

  @Test void testLastUsesPreviousRun() {
    assertEquals("2024-05-01 08:00:00",
        resolver.resolveFrom("last", "2024-05-01T10:00:00+02:00"));
  }

  @Test void testLastFallsBackOnColdStart() {
    assertEquals("2024-05-08 12:34:56", resolver.resolveFrom("last", null));
  }

  @Test void testUnrecognizedExpression() {
    assertThrows(ConfigurationException.class, () -> resolver.resolveTo("next tuesday"));
  }
}
