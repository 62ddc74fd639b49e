/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.config.constants;

import com.linkedin.drift.collector.SystemMetricsCollector;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Drift Monitor check loop configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MonitorConfig {

  /**
   * <code>check.interval.ms</code>
   */
  public static final String CHECK_INTERVAL_MS_CONFIG = "check.interval.ms";
  public static final long DEFAULT_CHECK_INTERVAL_MS = TimeUnit.SECONDS.toMillis(5);
  public static final String CHECK_INTERVAL_MS_DOC = "The interval in milliseconds between the starts of two consecutive "
      + "checks of the monitor loop. A check that takes longer than the interval is followed immediately by the next one.";

  /**
   * <code>min.anomaly.duration</code>
   */
  public static final String MIN_ANOMALY_DURATION_CONFIG = "min.anomaly.duration";
  public static final int DEFAULT_MIN_ANOMALY_DURATION = 3;
  public static final String MIN_ANOMALY_DURATION_DOC = "The number of consecutive anomalous samples of a metric before "
      + "the metric is reported as an active anomaly.";

  /**
   * <code>history.capacity</code>
   */
  public static final String HISTORY_CAPACITY_CONFIG = "history.capacity";
  public static final int DEFAULT_HISTORY_CAPACITY = 100;
  public static final String HISTORY_CAPACITY_DOC = "The number of most recent check results kept in memory.";

  /**
   * <code>metrics.collector.class</code>
   */
  public static final String METRICS_COLLECTOR_CLASS_CONFIG = "metrics.collector.class";
  public static final String DEFAULT_METRICS_COLLECTOR_CLASS = SystemMetricsCollector.class.getName();
  public static final String METRICS_COLLECTOR_CLASS_DOC = "The class implementing MetricsCollector that takes the "
      + "metric snapshot of every check.";

  /**
   * <code>metric.</code>
   */
  public static final String METRIC_CONFIG_PREFIX = "metric.";

  private MonitorConfig() {
  }

  /**
   * Define configs for Drift Monitor check loop.
   *
   * @param configDef Config definition.
   * @return The given config definition updated with Drift Monitor check loop configs.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(CHECK_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_CHECK_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.HIGH,
                            CHECK_INTERVAL_MS_DOC)
                    .define(MIN_ANOMALY_DURATION_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MIN_ANOMALY_DURATION,
                            atLeast(1),
                            ConfigDef.Importance.HIGH,
                            MIN_ANOMALY_DURATION_DOC)
                    .define(HISTORY_CAPACITY_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_HISTORY_CAPACITY,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            HISTORY_CAPACITY_DOC)
                    .define(METRICS_COLLECTOR_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_METRICS_COLLECTOR_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            METRICS_COLLECTOR_CLASS_DOC);
  }
}
