/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.config.constants;

import com.linkedin.drift.notifier.NoopNotifier;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Drift Monitor notification configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class NotifierConfig {

  /**
   * <code>anomaly.notifier.class</code>
   */
  public static final String ANOMALY_NOTIFIER_CLASS_CONFIG = "anomaly.notifier.class";
  public static final String DEFAULT_ANOMALY_NOTIFIER_CLASS = NoopNotifier.class.getName();
  public static final String ANOMALY_NOTIFIER_CLASS_DOC = "The class implementing MetricNotifier that delivers drift "
      + "notifications to an external channel.";

  /**
   * <code>notification.cool.down.ms</code>
   */
  public static final String NOTIFICATION_COOL_DOWN_MS_CONFIG = "notification.cool.down.ms";
  public static final long DEFAULT_NOTIFICATION_COOL_DOWN_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String NOTIFICATION_COOL_DOWN_MS_DOC = "The minimum time in milliseconds between two anomaly or "
      + "escalation notifications of the same metric. Recovery notifications are not subject to the cool down.";

  /**
   * <code>notification.rate.limit.max.count</code>
   */
  public static final String NOTIFICATION_RATE_LIMIT_MAX_COUNT_CONFIG = "notification.rate.limit.max.count";
  public static final int DEFAULT_NOTIFICATION_RATE_LIMIT_MAX_COUNT = 10;
  public static final String NOTIFICATION_RATE_LIMIT_MAX_COUNT_DOC = "The maximum number of notifications of all "
      + "metrics sent within the rate limit window.";

  /**
   * <code>notification.rate.limit.window.ms</code>
   */
  public static final String NOTIFICATION_RATE_LIMIT_WINDOW_MS_CONFIG = "notification.rate.limit.window.ms";
  public static final long DEFAULT_NOTIFICATION_RATE_LIMIT_WINDOW_MS = TimeUnit.HOURS.toMillis(1);
  public static final String NOTIFICATION_RATE_LIMIT_WINDOW_MS_DOC = "The length in milliseconds of the rolling window "
      + "over which the notification rate limit applies.";

  /**
   * <code>recovery.notification.enabled</code>
   */
  public static final String RECOVERY_NOTIFICATION_ENABLED_CONFIG = "recovery.notification.enabled";
  public static final boolean DEFAULT_RECOVERY_NOTIFICATION_ENABLED = true;
  public static final String RECOVERY_NOTIFICATION_ENABLED_DOC = "True if a notification is sent when an active "
      + "anomaly ends, false otherwise.";

  /**
   * <code>notifier.shutdown.timeout.ms</code>
   */
  public static final String NOTIFIER_SHUTDOWN_TIMEOUT_MS_CONFIG = "notifier.shutdown.timeout.ms";
  public static final long DEFAULT_NOTIFIER_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);
  public static final String NOTIFIER_SHUTDOWN_TIMEOUT_MS_DOC = "The maximum time in milliseconds to wait for queued "
      + "notifications to be delivered when the monitor is closed.";

  private NotifierConfig() {
  }

  /**
   * Define configs for Drift Monitor notifications.
   *
   * @param configDef Config definition.
   * @return The given config definition updated with Drift Monitor notification configs.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ANOMALY_NOTIFIER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ANOMALY_NOTIFIER_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_NOTIFIER_CLASS_DOC)
                    .define(NOTIFICATION_COOL_DOWN_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_NOTIFICATION_COOL_DOWN_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            NOTIFICATION_COOL_DOWN_MS_DOC)
                    .define(NOTIFICATION_RATE_LIMIT_MAX_COUNT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_NOTIFICATION_RATE_LIMIT_MAX_COUNT,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            NOTIFICATION_RATE_LIMIT_MAX_COUNT_DOC)
                    .define(NOTIFICATION_RATE_LIMIT_WINDOW_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_NOTIFICATION_RATE_LIMIT_WINDOW_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            NOTIFICATION_RATE_LIMIT_WINDOW_MS_DOC)
                    .define(RECOVERY_NOTIFICATION_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_RECOVERY_NOTIFICATION_ENABLED,
                            ConfigDef.Importance.LOW,
                            RECOVERY_NOTIFICATION_ENABLED_DOC)
                    .define(NOTIFIER_SHUTDOWN_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_NOTIFIER_SHUTDOWN_TIMEOUT_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            NOTIFIER_SHUTDOWN_TIMEOUT_MS_DOC);
  }
}
