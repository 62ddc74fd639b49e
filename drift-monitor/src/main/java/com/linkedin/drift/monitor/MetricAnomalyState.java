/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.detector.AnomalySeverity;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.drift.DriftUtils.utcDateFor;


/**
 * A point in time view of the anomaly state of a metric.
 */
public final class MetricAnomalyState {
  private final AnomalyLifecycle _lifecycle;
  private final int _consecutiveCount;
  private final AnomalySeverity _severity;
  private final Long _lastNotifiedMs;

  public MetricAnomalyState(AnomalyLifecycle lifecycle, int consecutiveCount, AnomalySeverity severity, Long lastNotifiedMs) {
    _lifecycle = lifecycle;
    _consecutiveCount = consecutiveCount;
    _severity = severity;
    _lastNotifiedMs = lastNotifiedMs;
  }

  public AnomalyLifecycle lifecycle() {
    return _lifecycle;
  }

  public int consecutiveCount() {
    return _consecutiveCount;
  }

  /**
   * @return Severity of the current anomaly, or {@code null} if the metric is normal.
   */
  public AnomalySeverity severity() {
    return _severity;
  }

  /**
   * @return Time of the last admitted anomaly or escalation notification of the metric, or {@code null} if none.
   */
  public Long lastNotifiedMs() {
    return _lastNotifiedMs;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("lifecycle", _lifecycle.name());
    structure.put("consecutiveCount", _consecutiveCount);
    if (_severity != null) {
      structure.put("severity", _severity.toString());
    }
    if (_lastNotifiedMs != null) {
      structure.put("lastNotified", utcDateFor(_lastNotifiedMs));
    }
    return structure;
  }

  @Override
  public String toString() {
    return getJsonStructure().toString();
  }
}
