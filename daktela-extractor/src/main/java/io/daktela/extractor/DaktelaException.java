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
package io.daktela.extractor;

/**
 * Base exception for Daktela extraction failures.
 *
 * <p>All fatal conditions of a run are reported through a subclass of this
 * exception so the entry point can map them to a user-facing message and a
 * non-zero exit status.
 */
public class DaktelaException extends RuntimeException {

  /**
   * Creates a new DaktelaException with the specified message.
   */
  public DaktelaException(String message) {
    super(message);
  }

  /**
   * Creates a new DaktelaException with the specified message and cause.
   */
  public DaktelaException(String message, Throwable cause) {
    super(message, cause);
  }
}
