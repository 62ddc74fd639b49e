/*
 * Copyright 2021 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

/**
 * Coarse classification of an active anomaly by how far its score exceeds the configured threshold.
 */
public enum AnomalySeverity {
  MEDIUM("medium"), HIGH("high");

  private static final double HIGH_SEVERITY_THRESHOLD_MULTIPLIER = 2.0;
  private final String _value;

  AnomalySeverity(String value) {
    _value = value;
  }

  /**
   * @param score Drift score of the sample.
   * @param config Config the score was computed with.
   * @return {@link #HIGH} if the score is more than twice the alert threshold of the config, {@link #MEDIUM} otherwise.
   */
  public static AnomalySeverity of(double score, MetricConfig config) {
    return score > HIGH_SEVERITY_THRESHOLD_MULTIPLIER * config.alertThreshold() ? HIGH : MEDIUM;
  }

  @Override
  public String toString() {
    return _value;
  }
}
