/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import java.util.Objects;


/**
 * State of {@link ExponentialDetector}: exponentially weighted moving mean and variance of a metric.
 */
public final class ExponentialState implements DetectorState {
  static final ExponentialState UNINITIALIZED = new ExponentialState(0.0, 0.0, false);
  private final double _runningMean;
  private final double _runningVariance;
  private final boolean _initialized;

  public ExponentialState(double runningMean, double runningVariance, boolean initialized) {
    _runningMean = runningMean;
    _runningVariance = runningVariance;
    _initialized = initialized;
  }

  @Override
  public DetectionAlgorithm algorithm() {
    return DetectionAlgorithm.EXPONENTIAL;
  }

  public double runningMean() {
    return _runningMean;
  }

  public double runningVariance() {
    return _runningVariance;
  }

  /**
   * @return {@code true} once the first sample has been observed, {@code false} otherwise.
   */
  public boolean initialized() {
    return _initialized;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ExponentialState that = (ExponentialState) o;
    return Double.compare(that._runningMean, _runningMean) == 0
           && Double.compare(that._runningVariance, _runningVariance) == 0
           && _initialized == that._initialized;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_runningMean, _runningVariance, _initialized);
  }

  @Override
  public String toString() {
    return _initialized ? String.format("{mean=%.4f,variance=%.4f}", _runningMean, _runningVariance) : "{uninitialized}";
  }
}
