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

import io.daktela.extractor.ExtractionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs a single request with bounded retries and linear backoff.
 *
 * <p>Attempts are 1-indexed. After a failed attempt {@code n} that is not the
 * last one, the executor waits {@code n * baseDelayMs} before the next
 * attempt. When every attempt failed an {@link ExtractionException} carrying
 * the last failure is thrown.
 *
 * <p>{@link FilterRejectedException} is not a transient failure and is
 * rethrown immediately so the caller can fall back to an unfiltered request.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RetryExecutor retry = new RetryExecutor(3, 1000);
 * String body = retry.execute("GET contacts", () -> send(request));
 * }</pre>
 */
public class RetryExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

  private final int maxAttempts;
  private final long baseDelayMs;
  private final Sleeper sleeper;

  public RetryExecutor(int maxAttempts, long baseDelayMs) {
    this(maxAttempts, baseDelayMs, Thread::sleep);
  }

  public RetryExecutor(int maxAttempts, long baseDelayMs, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = Math.max(0, baseDelayMs);
    this.sleeper = sleeper;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getBaseDelayMs() {
    return baseDelayMs;
  }

  /**
   * Executes the call, retrying transient failures.
   *
   * @param description Short request description for log and error messages
   * @param call Request to run
   * @param <T> Result type
   * @return Result of the first successful attempt
   * @throws FilterRejectedException If the endpoint rejected the request's filters
   * @throws ExtractionException If all attempts failed or the wait was interrupted
   */
  public <T> T execute(String description, Attempt<T> call) throws FilterRejectedException {
    IOException lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return call.run();
      } catch (FilterRejectedException e) {
        throw e;
      } catch (IOException e) {
        lastFailure = e;
        if (attempt == maxAttempts) {
          break;
        }
        long delay = attempt * baseDelayMs;
        LOGGER.warn("{} failed: {} - retrying in {} ms (attempt {}/{})",
            description, e.getMessage(), delay, attempt, maxAttempts);
        pause(description, delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ExtractionException(description + " interrupted", e);
      }
    }
    String reason = lastFailure != null ? lastFailure.getMessage() : "unknown error";
    throw new ExtractionException(
        description + " failed after " + maxAttempts + " attempts: " + reason, lastFailure);
  }

  private void pause(String description, long delay) {
    if (delay <= 0) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException(description + " interrupted during retry backoff", e);
    }
  }

  /**
   * One attempt of a request.
   *
   * @param <T> Result type
   */
  @FunctionalInterface
  public interface Attempt<T> {
    T run() throws IOException, InterruptedException;
  }

  /**
   * Waits between attempts.
   */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
