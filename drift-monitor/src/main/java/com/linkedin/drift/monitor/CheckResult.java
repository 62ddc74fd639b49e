/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.linkedin.drift.DriftUtils.utcDateFor;


/**
 * The immutable outcome of one check: the metric snapshot, the drift score of every evaluated metric, the active
 * anomalies, and the metrics that could not be evaluated.
 */
public final class CheckResult {
  private final long _timestampMs;
  private final List<AnomalyRecord> _anomalies;
  private final Map<String, Double> _metrics;
  private final Map<String, Double> _scores;
  private final Map<String, String> _errors;

  /**
   * @param timestampMs Time of the check.
   * @param anomalies Active anomalies, in metric registration order.
   * @param metrics The metric snapshot the check evaluated.
   * @param scores Drift score by evaluated metric.
   * @param errors Error message by metric that was excluded from the check.
   */
  public CheckResult(long timestampMs,
                     List<AnomalyRecord> anomalies,
                     Map<String, Double> metrics,
                     Map<String, Double> scores,
                     Map<String, String> errors) {
    _timestampMs = timestampMs;
    _anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    _metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    _scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    _errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public boolean hasAnomalies() {
    return !_anomalies.isEmpty();
  }

  public int anomalyCount() {
    return _anomalies.size();
  }

  public List<AnomalyRecord> anomalies() {
    return _anomalies;
  }

  public Map<String, Double> metrics() {
    return _metrics;
  }

  public Map<String, Double> scores() {
    return _scores;
  }

  public Map<String, String> errors() {
    return _errors;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("timestamp", utcDateFor(_timestampMs));
    structure.put("hasAnomalies", hasAnomalies());
    structure.put("anomalyCount", anomalyCount());
    structure.put("anomalies", _anomalies.stream().map(AnomalyRecord::getJsonStructure).collect(Collectors.toList()));
    structure.put("metrics", _metrics);
    structure.put("scores", _scores);
    if (!_errors.isEmpty()) {
      structure.put("errors", _errors);
    }
    return structure;
  }

  @Override
  public String toString() {
    return String.format("{%s: %d anomalies %s, scores %s, errors %s}", utcDateFor(_timestampMs), anomalyCount(), _anomalies,
                         _scores, _errors);
  }
}
