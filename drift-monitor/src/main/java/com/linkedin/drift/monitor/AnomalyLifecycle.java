/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Lifecycle of an anomaly of a metric.
 *
 * <ul>
 *   <li>{@link #NORMAL}: The last sample was not anomalous.</li>
 *   <li>{@link #PENDING}: Anomalous samples are observed, but fewer in a row than the minimum anomaly duration.</li>
 *   <li>{@link #ACTIVE}: At least the minimum anomaly duration of anomalous samples in a row.</li>
 *   <li>{@link #RECOVERING}: An active anomaly just ended. Transient; the metric is {@link #NORMAL} again within the
 *   same check.</li>
 * </ul>
 */
public enum AnomalyLifecycle {
  NORMAL, PENDING, ACTIVE, RECOVERING;

  private static final List<AnomalyLifecycle> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalyLifecycle> cachedValues() {
    return CACHED_VALUES;
  }
}
