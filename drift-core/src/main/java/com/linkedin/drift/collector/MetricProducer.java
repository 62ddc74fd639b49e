/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.collector;

import com.linkedin.drift.exception.MetricCollectionException;


/**
 * Supplies the current value of a single custom metric. A failing producer only excludes its own metric from the
 * current check.
 */
@FunctionalInterface
public interface MetricProducer {

  /**
   * @return The current value of the metric.
   * @throws MetricCollectionException If the value cannot be produced.
   */
  double produce() throws MetricCollectionException;
}
