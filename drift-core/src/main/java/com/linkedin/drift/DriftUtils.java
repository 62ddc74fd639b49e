/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;
import org.apache.kafka.common.config.ConfigException;

/**
 * Utils class for Drift Monitor
 */
public final class DriftUtils {
  /**
   * Name of the logger that records every configuration change applied to a running monitor.
   */
  public static final String OPERATION_LOGGER = "operationLogger";
  /**
   * Prefix of the Dropwizard metrics reported by a drift monitor.
   */
  public static final String DRIFT_MONITOR_SENSOR = "DriftMonitor";
  public static final double BYTES_IN_MB = 1024.0 * 1024.0;

  private DriftUtils() {

  }

  /**
   * Ensure that the given metric name is non-blank and has no surrounding whitespace.
   *
   * @param metricName Metric name to check.
   * @return The given metric name.
   */
  public static String ensureValidMetricName(String metricName) {
    if (metricName == null || metricName.isBlank()) {
      throw new ConfigException("Metric name cannot be null or blank.");
    }
    if (!metricName.equals(metricName.trim())) {
      throw new ConfigException(String.format("Metric name '%s' cannot start or end with whitespace.", metricName));
    }
    return metricName;
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * @param bytes Number of bytes.
   * @return The given number of bytes in megabytes.
   */
  public static double toMegabytes(long bytes) {
    return bytes / BYTES_IN_MB;
  }
}
