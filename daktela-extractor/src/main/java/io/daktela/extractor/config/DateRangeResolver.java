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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the human-friendly date expressions of {@code data_selection}
 * into the {@code yyyy-MM-dd HH:mm:ss} form the Daktela filters expect.
 *
 * <p>Supported expressions:
 * <ul>
 *   <li>{@code now}, {@code today} (midnight), {@code yesterday} (midnight)</li>
 *   <li>{@code N minutes|hours|days|weeks|months|years ago} (singular accepted)</li>
 *   <li>ISO dates ({@code 2024-01-31}) and date-times ({@code 2024-01-31T10:00:00},
 *       {@code 2024-01-31 10:00:00}, with or without offset)</li>
 *   <li>{@code last} - the last successful run, only meaningful for the lower bound</li>
 * </ul>
 */
public class DateRangeResolver {

  public static final DateTimeFormatter OUTPUT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  private static final DateTimeFormatter ISO_INPUT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd['T'HH:mm[:ss][.SSS]][XXX]", Locale.ROOT);

  private static final Pattern RELATIVE = Pattern.compile(
      "(\\d+)\\s*(minute|hour|day|week|month|year)s?\\s+ago");

  private static final String LAST_RUN_FALLBACK = "7 days ago";

  private final Clock clock;

  public DateRangeResolver() {
    this(Clock.systemDefaultZone());
  }

  public DateRangeResolver(Clock clock) {
    this.clock = clock;
  }

  /**
   * Resolves the lower bound of the range.
   *
   * @param expression Date expression from the configuration
   * @param lastRun Timestamp of the last successful run, or null on a cold start
   * @return Formatted timestamp
   */
  public String resolveFrom(String expression, @Nullable String lastRun) {
    if ("last".equalsIgnoreCase(expression.trim())) {
      return lastRun != null && !lastRun.isEmpty()
          ? format(parse(lastRun))
          : format(parse(LAST_RUN_FALLBACK));
    }
    return format(parse(expression));
  }

  /**
   * Resolves the upper bound of the range.
   */
  public String resolveTo(String expression) {
    return format(parse(expression));
  }

  /**
   * Parses one expression relative to the resolver's clock.
   *
   * @throws ConfigurationException If the expression is not recognized
   */
  public LocalDateTime parse(String expression) {
    String value = expression.trim().toLowerCase(Locale.ROOT);
    LocalDateTime now = LocalDateTime.now(clock);
    switch (value) {
      case "now":
        return now.withNano(0);
      case "today":
        return now.toLocalDate().atStartOfDay();
      case "yesterday":
        return now.toLocalDate().minusDays(1).atStartOfDay();
      default:
        break;
    }

    Matcher matcher = RELATIVE.matcher(value);
    if (matcher.matches()) {
      long amount = Long.parseLong(matcher.group(1));
      switch (matcher.group(2)) {
        case "minute":
          return now.minusMinutes(amount).withNano(0);
        case "hour":
          return now.minusHours(amount).withNano(0);
        case "day":
          return now.minusDays(amount).withNano(0);
        case "week":
          return now.minusWeeks(amount).withNano(0);
        case "month":
          return now.minusMonths(amount).withNano(0);
        default:
          return now.minusYears(amount).withNano(0);
      }
    }

    try {
      TemporalAccessor parsed = ISO_INPUT.parseBest(expression.trim().replace(' ', 'T'),
          OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime) {
        return ((OffsetDateTime) parsed).atZoneSameInstant(clock.getZone()).toLocalDateTime();
      }
      if (parsed instanceof LocalDateTime) {
        return (LocalDateTime) parsed;
      }
      return ((LocalDate) parsed).atStartOfDay();
    } catch (DateTimeParseException e) {
      throw new ConfigurationException("Unrecognized date expression: '" + expression + "'", e);
    }
  }

  public static String format(LocalDateTime value) {
    return OUTPUT_FORMAT.format(value);
  }
}
