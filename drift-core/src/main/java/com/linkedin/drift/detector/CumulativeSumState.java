/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import java.util.Objects;


/**
 * State of {@link CumulativeSumDetector}: the positive and negative cumulative deviations, and the baseline mean
 * (null until the first sample is observed if the config has no reference mean).
 */
public final class CumulativeSumState implements DetectorState {
  private final double _positiveSum;
  private final double _negativeSum;
  private final Double _baselineMean;

  public CumulativeSumState(double positiveSum, double negativeSum, Double baselineMean) {
    _positiveSum = positiveSum;
    _negativeSum = negativeSum;
    _baselineMean = baselineMean;
  }

  @Override
  public DetectionAlgorithm algorithm() {
    return DetectionAlgorithm.CUMULATIVE;
  }

  /**
   * @return Cumulative sum of the upward deviations, always {@code >= 0}.
   */
  public double positiveSum() {
    return _positiveSum;
  }

  /**
   * @return Cumulative sum of the downward deviations, always {@code <= 0}.
   */
  public double negativeSum() {
    return _negativeSum;
  }

  public Double baselineMean() {
    return _baselineMean;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CumulativeSumState that = (CumulativeSumState) o;
    return Double.compare(that._positiveSum, _positiveSum) == 0
           && Double.compare(that._negativeSum, _negativeSum) == 0
           && Objects.equals(_baselineMean, that._baselineMean);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_positiveSum, _negativeSum, _baselineMean);
  }

  @Override
  public String toString() {
    return String.format("{sPos=%.4f,sNeg=%.4f,baseline=%s}", _positiveSum, _negativeSum, _baselineMean);
  }
}
