/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.drift.DriftUtils.utcDateFor;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * A lifecycle transition of a metric that may be delivered to a {@link MetricNotifier}.
 */
public final class DriftEvent {
  public enum Type {
    /**
     * The metric entered the active anomaly state.
     */
    ANOMALY,
    /**
     * The severity of an active anomaly rose from medium to high.
     */
    ESCALATION,
    /**
     * An active anomaly ended and the metric is back to normal.
     */
    RECOVERY
  }

  private final Type _type;
  private final String _metric;
  private final double _value;
  private final double _score;
  private final DetectionAlgorithm _algorithm;
  private final AnomalySeverity _severity;
  private final int _duration;
  private final long _timestampMs;

  /**
   * @param type Type of the transition.
   * @param metric Name of the metric.
   * @param value Sample that caused the transition.
   * @param score Drift score of the sample.
   * @param algorithm Algorithm the score was computed with.
   * @param severity Severity of the anomaly. For {@link Type#RECOVERY}, the last severity of the ended anomaly.
   * @param duration Number of consecutive anomalous samples. For {@link Type#RECOVERY}, the length of the ended anomaly.
   * @param timestampMs Time of the check that caused the transition.
   */
  public DriftEvent(Type type,
                    String metric,
                    double value,
                    double score,
                    DetectionAlgorithm algorithm,
                    AnomalySeverity severity,
                    int duration,
                    long timestampMs) {
    _type = validateNotNull(type, "Event type cannot be null.");
    _metric = validateNotNull(metric, "Metric name cannot be null.");
    _value = value;
    _score = score;
    _algorithm = validateNotNull(algorithm, "Detection algorithm cannot be null.");
    _severity = validateNotNull(severity, "Severity cannot be null.");
    _duration = duration;
    _timestampMs = timestampMs;
  }

  public Type type() {
    return _type;
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
    return _algorithm;
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  public int duration() {
    return _duration;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("type", _type.name());
    structure.put("metric", _metric);
    structure.put("value", _value);
    structure.put("score", _score);
    structure.put("algorithm", _algorithm.name());
    structure.put("severity", _severity.toString());
    structure.put("duration", _duration);
    structure.put("timestamp", utcDateFor(_timestampMs));
    return structure;
  }

  @Override
  public String toString() {
    return String.format("%s of %s (value: %.2f, score: %.2f, severity: %s, duration: %d) at %s", _type, _metric, _value,
                         _score, _severity, _duration, utcDateFor(_timestampMs));
  }
}
