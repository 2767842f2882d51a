/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.contextbudget.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Budget defaults loaded from the classpath.
 *
 * <p>An environment-specific file ({@code context-budget-<env>.properties}, selected by the {@code
 * env} environment variable) is tried first, then {@code context-budget.properties}. Recognized
 * keys:
 *
 * <ul>
 *   <li>{@code limit.default}: token limit for consumers without their own entry
 *   <li>{@code limit.<consumerId>}: token limit for one consumer
 *   <li>{@code threshold.ratio}, {@code target.ratio}, {@code reserved.minimum.ratio}
 *   <li>{@code chars.per.token}
 *   <li>{@code archive.write.timeout.ms}
 *   <li>{@code archive.directory}: root directory for file based archives
 * </ul>
 */
public class ContextBudgetProperties {

  private static final Logger logger = LoggerFactory.getLogger(ContextBudgetProperties.class);

  /** The default property file name. */
  private static final String DEFAULT_PROPERTY_FILE_NAME = "context-budget.properties";

  /** The template for the environment-specific property file name. */
  private static final String ENV_PROPERTY_FILE_TEMPLATE = "context-budget-%s.properties";

  private static final String LIMIT_PREFIX = "limit.";
  private static final String DEFAULT_LIMIT_KEY = "limit.default";
  private static final String THRESHOLD_RATIO_KEY = "threshold.ratio";
  private static final String TARGET_RATIO_KEY = "target.ratio";
  private static final String RESERVED_MINIMUM_RATIO_KEY = "reserved.minimum.ratio";
  private static final String CHARS_PER_TOKEN_KEY = "chars.per.token";
  private static final String ARCHIVE_WRITE_TIMEOUT_KEY = "archive.write.timeout.ms";
  private static final String ARCHIVE_DIRECTORY_KEY = "archive.directory";

  private static volatile ContextBudgetProperties instance;

  private final Properties properties;

  ContextBudgetProperties(Properties properties) {
    this.properties = properties;
  }

  private static Properties load() {
    Properties properties = new Properties();
    InputStream inputStream = null;

    String env = System.getenv("env");
    if (env != null && !env.trim().isEmpty()) {
      inputStream = loadResourceAsStream(String.format(ENV_PROPERTY_FILE_TEMPLATE, env));
    }

    if (inputStream == null) {
      inputStream = loadResourceAsStream(DEFAULT_PROPERTY_FILE_NAME);
    }

    if (inputStream == null) {
      logger.debug("No {} on the classpath, using built-in defaults", DEFAULT_PROPERTY_FILE_NAME);
      return properties;
    }

    try (InputStream in = inputStream) {
      properties.load(in);
    } catch (IOException e) {
      logger.error("Failed to load properties file.", e);
      throw new ContextBudgetConfigException("Failed to load properties file.", e);
    }
    return properties;
  }

  private static InputStream loadResourceAsStream(String resourceName) {
    return ContextBudgetProperties.class.getClassLoader().getResourceAsStream(resourceName);
  }

  /**
   * Reads a raw property.
   *
   * @param key the property key
   * @return the property value, or empty if not set
   */
  public Optional<String> getProperty(String key) {
    return Optional.ofNullable(properties.getProperty(key)).map(String::trim);
  }

  /**
   * Builds the configuration that applies to {@code consumerId}: the consumer's own limit if one is
   * set, else {@code limit.default}, together with the shared ratios.
   *
   * @throws ContextBudgetConfigException if a value cannot be parsed or is out of range
   */
  public ContextBudgetConfig configFor(String consumerId) {
    ContextBudgetConfig.Builder builder = ContextBudgetConfig.builder();
    Optional<Integer> limit =
        getInt(LIMIT_PREFIX + consumerId).or(() -> getInt(DEFAULT_LIMIT_KEY));
    limit.ifPresent(builder::limitTokens);
    getDouble(THRESHOLD_RATIO_KEY).ifPresent(builder::thresholdRatio);
    getDouble(TARGET_RATIO_KEY).ifPresent(builder::targetRatio);
    getDouble(RESERVED_MINIMUM_RATIO_KEY).ifPresent(builder::reservedMinimumRatio);
    getInt(CHARS_PER_TOKEN_KEY).ifPresent(builder::charsPerToken);
    getInt(ARCHIVE_WRITE_TIMEOUT_KEY)
        .map(Duration::ofMillis)
        .ifPresent(builder::archiveWriteTimeout);
    return builder.build();
  }

  /** Root directory for file based archives, if configured. */
  public Optional<String> getArchiveDirectory() {
    return getProperty(ARCHIVE_DIRECTORY_KEY);
  }

  private Optional<Integer> getInt(String key) {
    return getProperty(key).map(value -> parse(key, value, Integer::parseInt));
  }

  private Optional<Double> getDouble(String key) {
    return getProperty(key).map(value -> parse(key, value, Double::parseDouble));
  }

  private static <T> T parse(String key, String value, Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (NumberFormatException e) {
      throw new ContextBudgetConfigException(
          String.format("Property %s is not a number, got: %s", key, value), e);
    }
  }

  /**
   * Returns a singleton instance of ContextBudgetProperties.
   *
   * @return the ContextBudgetProperties instance
   */
  public static ContextBudgetProperties getInstance() {
    if (instance == null) {
      synchronized (ContextBudgetProperties.class) {
        if (instance == null) {
          instance = new ContextBudgetProperties(load());
        }
      }
    }
    return instance;
  }

  /** Resets the singleton instance. For testing purposes only. */
  public static void resetForTest() {
    instance = null;
  }
}
