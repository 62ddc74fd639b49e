/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

/**
 * The outcome of evaluating one sample: the drift score, whether the score crossed the threshold, and the detector
 * state to carry over to the next sample.
 */
public final class DetectionResult {
  private final double _score;
  private final boolean _isAnomaly;
  private final DetectorState _state;

  public DetectionResult(double score, boolean isAnomaly, DetectorState state) {
    _score = score;
    _isAnomaly = isAnomaly;
    _state = state;
  }

  public double score() {
    return _score;
  }

  public boolean isAnomaly() {
    return _isAnomaly;
  }

  /**
   * @return The updated detector state.
   */
  public DetectorState state() {
    return _state;
  }

  @Override
  public String toString() {
    return String.format("{score=%.4f,anomaly=%s,state=%s}", _score, _isAnomaly, _state);
  }
}
