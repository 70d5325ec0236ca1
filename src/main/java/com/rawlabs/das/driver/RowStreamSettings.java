/*
 * Copyright 2024 RAW Labs S.A.
 *
 * Use of this software is governed by the Business Source License
 * included in the file licenses/BSL.txt.
 *
 * As of the Change Date specified in that file, in accordance with
 * the Business Source License, use of this software will be governed
 * by the Apache License, Version 2.0, included in the file
 * licenses/APL.txt.
 */

package com.rawlabs.das.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Row stream settings, read from the {@code das.driver.rows} section of a Typesafe Config. Each
 * value is logged the first time it is read.
 */
public class RowStreamSettings {

  private static final Logger logger = LoggerFactory.getLogger(RowStreamSettings.class);

  static final String BACKPRESSURE_ENABLED = "das.driver.rows.backpressure.enabled";
  static final String PAUSE_COUNT = "das.driver.rows.backpressure.pause-count";
  static final String RESUME_COUNT = "das.driver.rows.backpressure.resume-count";

  private static final Object ALREADY_LOGGED_LOCK = new Object();
  private static final Set<String> ALREADY_LOGGED_KEYS = new HashSet<>();

  private final Config config;

  /** Exception representing a settings configuration problem. */
  public static class SettingsException extends DASException {
    public SettingsException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Loads the settings from the classpath (application.conf over reference.conf). */
  public RowStreamSettings() {
    this(ConfigFactory.load());
  }

  public RowStreamSettings(Config config) {
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  /** @return whether row streams should raise pause and resume events */
  public boolean isBackpressureEnabled() throws SettingsException {
    return withLogConfigException(
        BACKPRESSURE_ENABLED,
        () -> {
          boolean value = config.getBoolean(BACKPRESSURE_ENABLED);
          logOneTime(BACKPRESSURE_ENABLED, value);
          return value;
        });
  }

  /** @return the number of buffered rows at which a stream raises pause */
  public int getPauseCount() throws SettingsException {
    return withLogConfigException(
        PAUSE_COUNT,
        () -> {
          int value = config.getInt(PAUSE_COUNT);
          logOneTime(PAUSE_COUNT, value);
          return value;
        });
  }

  /**
   * @return the number of buffered rows at which a paused stream raises resume, if configured
   * @throws SettingsException if the value is set but is not an integer
   */
  public Optional<Integer> getResumeCount() throws SettingsException {
    return withLogConfigException(
        RESUME_COUNT,
        () -> {
          try {
            int value = config.getInt(RESUME_COUNT);
            logOneTime(RESUME_COUNT, value);
            return Optional.of(value);
          } catch (ConfigException.Missing e) {
            return Optional.empty();
          }
        });
  }

  /** Runs a config access block and wraps any ConfigException in a SettingsException. */
  private <T> T withLogConfigException(String propertyName, ConfigSupplier<T> supplier)
      throws SettingsException {
    try {
      return supplier.get();
    } catch (ConfigException ex) {
      throw new SettingsException("Error loading property: " + propertyName, ex);
    }
  }

  private void logOneTime(String key, Object value) {
    synchronized (ALREADY_LOGGED_LOCK) {
      if (ALREADY_LOGGED_KEYS.add(key)) {
        logger.info("Using {}: {}", key, value);
      }
    }
  }

  @FunctionalInterface
  private interface ConfigSupplier<T> {
    T get() throws ConfigException;
  }
}
