/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import com.linkedin.drift.exception.DetectionException;

import static com.linkedin.drift.detector.DetectorUtils.ensureFinite;
import static com.linkedin.drift.detector.DetectorUtils.ensureState;


/**
 * Exponentially weighted moving average (EWMA) z-score detection.
 *
 * <p>The first sample initializes the mean and scores zero. Every later sample {@code x} updates
 * <pre>
 *   delta = x - mean
 *   mean = mean + alpha * delta
 *   variance = (1 - alpha) * (variance + alpha * delta^2)
 *   score = |x - mean| / sqrt(variance)
 * </pre>
 * and is anomalous if {@code score > thresholdSigma}. A metric whose variance is zero scores zero.
 */
public final class ExponentialDetector implements MetricDetector {
  static final ExponentialDetector INSTANCE = new ExponentialDetector();

  private ExponentialDetector() {
  }

  @Override
  public DetectorState initialState(MetricConfig config) {
    return ExponentialState.UNINITIALIZED;
  }

  @Override
  public DetectionResult evaluate(double value, DetectorState state, MetricConfig config) throws DetectionException {
    ensureFinite(value);
    ExponentialState current = ensureState(state, ExponentialState.class);
    if (!current.initialized()) {
      return new DetectionResult(0.0, false, new ExponentialState(value, 0.0, true));
    }

    double alpha = config.alpha();
    double delta = value - current.runningMean();
    double runningMean = current.runningMean() + alpha * delta;
    double runningVariance = (1 - alpha) * (current.runningVariance() + alpha * delta * delta);
    ExponentialState next = new ExponentialState(runningMean, runningVariance, true);

    double std = Math.sqrt(runningVariance);
    if (std == 0.0) {
      return new DetectionResult(0.0, false, next);
    }
    double score = Math.abs(value - runningMean) / std;
    return new DetectionResult(score, score > config.thresholdSigma(), next);
  }
}
