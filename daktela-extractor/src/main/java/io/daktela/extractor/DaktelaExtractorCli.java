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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} on configuration,
 * authentication or extraction errors, {@code 2} on unexpected errors.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * # run the configured action against /data
 * daktela-extractor
 *
 * # list fields using another data directory
 * daktela-extractor -d ./data listFields
 * }</pre>
 */
@Command(
    name = "daktela-extractor",
    mixinStandardHelpOptions = true,
    version = "daktela-extractor 1.0.0-SNAPSHOT",
    description = "Extracts Daktela CRM and contact-center data into CSV tables"
)
public class DaktelaExtractorCli implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(DaktelaExtractorCli.class);

  static final String DATA_DIR_ENV = "KBC_DATADIR";
  static final String DEFAULT_DATA_DIR = "/data";

  @Option(names = {"-d", "--data-dir"},
      description = "Data directory holding config.json (default: $KBC_DATADIR or /data)")
  private @Nullable Path dataDir;

  @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
  private boolean verbose;

  @Parameters(index = "0", arity = "0..1", paramLabel = "ACTION",
      description = "Action to run instead of the configured one: run, listFields")
  private @Nullable String action;

  @Override public Integer call() {
    if (verbose) {
      Configurator.setLevel("io.daktela", Level.DEBUG);
    }
    try {
      new ExtractorComponent(resolveDataDir()).execute(action);
      return 0;
    } catch (DaktelaException e) {
      LOGGER.error("{}", e.getMessage());
      return 1;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error: {}", e.getMessage(), e);
      return 2;
    }
  }

  Path resolveDataDir() {
    if (dataDir != null) {
      return dataDir;
    }
    String env = System.getenv(DATA_DIR_ENV);
    return Paths.get(env != null && !env.isEmpty() ? env : DEFAULT_DATA_DIR);
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new DaktelaExtractorCli()).execute(args);
    System.exit(exitCode);
  }
}
