/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import com.linkedin.drift.exception.DetectionException;


/**
 * A drift detection algorithm. Detectors are stateless: the per-metric state is passed in and returned explicitly,
 * so the same detector instance serves every metric and replaying a sequence of samples from the initial state always
 * yields the same sequence of scores.
 */
public interface MetricDetector {

  /**
   * @param config The config of the metric.
   * @return The state of a metric for which no sample has been observed yet.
   */
  DetectorState initialState(MetricConfig config);

  /**
   * Evaluate a new sample of a metric.
   *
   * @param value The sampled value.
   * @param state The detector state after the previous sample of the metric.
   * @param config The current config of the metric.
   * @return The drift score, anomaly flag and updated state.
   * @throws DetectionException If the value is not a finite number.
   */
  DetectionResult evaluate(double value, DetectorState state, MetricConfig config) throws DetectionException;
}
