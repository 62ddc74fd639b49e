/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.detector.MetricConfig;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.drift.DriftUtils.utcDateFor;


/**
 * An active anomaly of a metric as observed in one check.
 */
public final class AnomalyRecord {
  private final String _metric;
  private final double _value;
  private final double _score;
  private final AnomalySeverity _severity;
  private final int _duration;
  private final long _timestampMs;
  private final MetricConfig _config;

  public AnomalyRecord(String metric,
                       double value,
                       double score,
                       AnomalySeverity severity,
                       int duration,
                       long timestampMs,
                       MetricConfig config) {
    _metric = metric;
    _value = value;
    _score = score;
    _severity = severity;
    _duration = duration;
    _timestampMs = timestampMs;
    _config = config;
  }

  public String metric() {
    return _metric;
  }

  public double value() {
    return _value;
  }

  public double score() {
    return _score;
  }

  public DetectionAlgorithm algorithm() {
    return _config.algorithm();
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  /**
   * @return Number of anomalous samples in a row, including this one.
   */
  public int duration() {
    return _duration;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return The config of the metric at the time of the check.
   */
  public MetricConfig config() {
    return _config;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("metric", _metric);
    structure.put("value", _value);
    structure.put("score", _score);
    structure.put("algorithm", algorithm().name());
    structure.put("severity", _severity.toString());
    structure.put("duration", _duration);
    structure.put("timestamp", utcDateFor(_timestampMs));
    structure.put("config", _config.getJsonStructure());
    return structure;
  }

  @Override
  public String toString() {
    return String.format("%s: %.2f (score: %.2f, severity: %s, duration: %d)", _metric, _value, _score, _severity, _duration);
  }
}
