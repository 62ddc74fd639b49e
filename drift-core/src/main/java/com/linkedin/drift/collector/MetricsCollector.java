/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.collector;

import com.linkedin.drift.common.DriftConfigurable;
import com.linkedin.drift.exception.MetricCollectionException;
import java.util.Map;


/**
 * The source of the periodic metric snapshots that a drift monitor evaluates. Implementations are instantiated by
 * reflection from the configured class name, and {@link #configure(Map)} receives the full monitor configuration.
 *
 * <p>A collector is only invoked by one thread at a time, and never while the monitor holds its state lock, so it
 * may block on I/O.
 */
public interface MetricsCollector extends DriftConfigurable, AutoCloseable {

  /**
   * Take a snapshot of the current metric values. Metrics that are unavailable on this platform or could not be read
   * are omitted from the snapshot.
   *
   * @return Metric name to its current value.
   * @throws MetricCollectionException If no snapshot can be taken at all.
   */
  Map<String, Double> collect() throws MetricCollectionException;

  /**
   * Release any resources held by this collector.
   */
  @Override
  default void close() {
  }
}
