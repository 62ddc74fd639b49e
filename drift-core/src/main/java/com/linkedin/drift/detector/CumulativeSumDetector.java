/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import com.linkedin.drift.exception.DetectionException;

import static com.linkedin.drift.detector.DetectorUtils.ensureFinite;
import static com.linkedin.drift.detector.DetectorUtils.ensureState;


/**
 * Two-sided cumulative sum (CUSUM) change detection.
 *
 * <p>With baseline mean {@code mu}, each sample {@code x} updates
 * <pre>
 *   sPos = max(0, sPos + (x - mu - drift))
 *   sNeg = min(0, sNeg + (x - mu + drift))
 *   score = max(sPos, -sNeg)
 * </pre>
 * and is anomalous if {@code score > threshold}. Both sums restart from zero after an anomalous sample, so a
 * persisting shift triggers again once it has accumulated enough deviation.
 *
 * <p>The baseline is the reference mean of the config if set; otherwise the first observed sample.
 */
public final class CumulativeSumDetector implements MetricDetector {
  static final CumulativeSumDetector INSTANCE = new CumulativeSumDetector();

  private CumulativeSumDetector() {
  }

  @Override
  public DetectorState initialState(MetricConfig config) {
    return new CumulativeSumState(0.0, 0.0, config.referenceMean());
  }

  @Override
  public DetectionResult evaluate(double value, DetectorState state, MetricConfig config) throws DetectionException {
    ensureFinite(value);
    CumulativeSumState current = ensureState(state, CumulativeSumState.class);
    Double baseline = config.referenceMean() != null ? config.referenceMean() : current.baselineMean();
    if (baseline == null) {
      // First sample defines the baseline.
      baseline = value;
    }

    double deviation = value - baseline;
    double positiveSum = Math.max(0.0, current.positiveSum() + deviation - config.drift());
    double negativeSum = Math.min(0.0, current.negativeSum() + deviation + config.drift());
    double score = Math.max(positiveSum, -negativeSum);
    boolean isAnomaly = score > config.threshold();
    if (isAnomaly) {
      positiveSum = 0.0;
      negativeSum = 0.0;
    }
    return new DetectionResult(score, isAnomaly, new CumulativeSumState(positiveSum, negativeSum, baseline));
  }
}
