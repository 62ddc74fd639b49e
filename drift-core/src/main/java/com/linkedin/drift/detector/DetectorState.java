/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

/**
 * The internal state a {@link MetricDetector} carries from one sample of a metric to the next. Implementations are
 * immutable; a detector returns a new state for every evaluated sample.
 */
public interface DetectorState {

  /**
   * @return The algorithm this state belongs to.
   */
  DetectionAlgorithm algorithm();
}
