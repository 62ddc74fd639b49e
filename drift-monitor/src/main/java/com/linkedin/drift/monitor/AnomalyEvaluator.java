/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.common.utils.AutoCloseableLock;
import com.linkedin.drift.detector.DetectionResult;
import com.linkedin.drift.detector.DetectorState;
import com.linkedin.drift.detector.MetricConfig;
import com.linkedin.drift.exception.DetectionException;
import com.linkedin.drift.notifier.DriftEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.common.utils.Utils.validateNotNull;
import static com.linkedin.drift.config.constants.MonitorConfig.MIN_ANOMALY_DURATION_CONFIG;


/**
 * Runs the detector and the anomaly tracker of every enabled metric over a metric snapshot.
 *
 * <p>Each metric has a runtime slot holding its detector state and its anomaly tracker. A slot is bound to the
 * generation of the {@link MetricRegistration} it was created for, so a config change, a toggle of the enabled flag
 * or a re-registration starts the metric over on its next evaluation. Slots of removed or disabled metrics are
 * dropped. Guarded by the lock shared with the rest of the monitor.
 */
public class AnomalyEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyEvaluator.class);
  private final Lock _lock;
  private final MetricConfigStore _configStore;
  private final Map<String, MetricSlot> _slots;
  private volatile int _minAnomalyDuration;

  public AnomalyEvaluator(Lock lock, MetricConfigStore configStore, int minAnomalyDuration) {
    _lock = validateNotNull(lock, "Lock cannot be null.");
    _configStore = validateNotNull(configStore, "Metric config store cannot be null.");
    _slots = new LinkedHashMap<>();
    setMinAnomalyDuration(minAnomalyDuration);
  }

  /**
   * Evaluate the given snapshot against the current config of each enabled metric. Enabled metrics missing from the
   * snapshot keep their state, and snapshot entries of unknown or disabled metrics are ignored.
   *
   * @param snapshot Metric name to its sampled value.
   * @param collectionErrors Error message by metric that could not be sampled.
   * @param timestampMs Time of the check.
   * @return The check result and the lifecycle transitions of the check, in metric registration order.
   */
  public Evaluation evaluate(Map<String, Double> snapshot, Map<String, String> collectionErrors, long timestampMs) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      int minAnomalyDuration = _minAnomalyDuration;
      List<MetricRegistration> registrations = _configStore.enabledRegistrations();
      pruneSlots(registrations);

      List<AnomalyRecord> anomalies = new ArrayList<>();
      List<DriftEvent> transitions = new ArrayList<>();
      Map<String, Double> scores = new LinkedHashMap<>();
      Map<String, String> errors = new LinkedHashMap<>(collectionErrors);
      for (MetricRegistration registration : registrations) {
        String metric = registration.name();
        Double value = snapshot.get(metric);
        if (value == null) {
          continue;
        }
        MetricConfig config = registration.config();
        MetricSlot slot = slotFor(registration);
        DetectionResult result;
        try {
          result = config.detector().evaluate(value, slot._state, config);
        } catch (DetectionException e) {
          LOG.warn("Skipped sample {} of metric {}: {}", value, metric, e.getMessage());
          errors.put(metric, e.getMessage());
          continue;
        }
        slot._state = result.state();
        scores.put(metric, result.score());

        AnomalyTracker tracker = slot._tracker;
        DriftEvent.Type transition = tracker.update(result.isAnomaly(), result.score(), config, minAnomalyDuration);
        if (tracker.lifecycle() == AnomalyLifecycle.ACTIVE) {
          anomalies.add(new AnomalyRecord(metric, value, result.score(), tracker.severity(), tracker.consecutiveCount(),
                                          timestampMs, config));
        }
        if (transition != null) {
          transitions.add(new DriftEvent(transition, metric, value, result.score(), config.algorithm(), tracker.severity(),
                                         tracker.consecutiveCount(), timestampMs));
        }
        tracker.completeRecovery();
      }
      return new Evaluation(new CheckResult(timestampMs, anomalies, snapshot, scores, errors), transitions);
    }
  }

  private MetricSlot slotFor(MetricRegistration registration) {
    MetricSlot slot = _slots.get(registration.name());
    if (slot == null || slot._generation != registration.generation()) {
      if (slot != null) {
        LOG.debug("Restarting detection of metric {} after a config change.", registration.name());
      }
      slot = new MetricSlot(registration);
      _slots.put(registration.name(), slot);
    }
    return slot;
  }

  private void pruneSlots(List<MetricRegistration> registrations) {
    Set<String> enabled = new HashSet<>();
    registrations.forEach(r -> enabled.add(r.name()));
    if (_slots.keySet().retainAll(enabled)) {
      LOG.debug("Dropped detection state of metrics that are no longer enabled. Tracking {}.", _slots.keySet());
    }
  }

  /**
   * @param lastNotifiedMsByMetric Time of the last admitted notification by metric.
   * @return The anomaly state of every metric that has been evaluated since it was last configured.
   */
  public Map<String, MetricAnomalyState> anomalyStates(Map<String, Long> lastNotifiedMsByMetric) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      Map<String, MetricAnomalyState> states = new LinkedHashMap<>();
      _slots.forEach((metric, slot) -> states.put(metric, new MetricAnomalyState(slot._tracker.lifecycle(),
                                                                                 slot._tracker.consecutiveCount(),
                                                                                 slot._tracker.severity(),
                                                                                 lastNotifiedMsByMetric.get(metric))));
      return Collections.unmodifiableMap(states);
    }
  }

  /**
   * @return Number of metrics that currently have an active anomaly.
   */
  public int numActiveAnomalies() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      int numActive = 0;
      for (MetricSlot slot : _slots.values()) {
        if (slot._tracker.lifecycle() == AnomalyLifecycle.ACTIVE) {
          numActive++;
        }
      }
      return numActive;
    }
  }

  /**
   * Drop the detector and anomaly state of the given metric.
   *
   * @param metric Name of the metric.
   */
  public void forget(String metric) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _slots.remove(metric);
    }
  }

  /**
   * Drop the detector and anomaly state of every metric.
   */
  public void reset() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _slots.clear();
    }
  }

  public int minAnomalyDuration() {
    return _minAnomalyDuration;
  }

  /**
   * @param minAnomalyDuration Number of anomalous samples in a row that make an anomaly active.
   */
  public void setMinAnomalyDuration(int minAnomalyDuration) {
    if (minAnomalyDuration < 1) {
      throw new ConfigException(MIN_ANOMALY_DURATION_CONFIG, minAnomalyDuration, "Minimum anomaly duration must be positive.");
    }
    _minAnomalyDuration = minAnomalyDuration;
  }

  /**
   * The outcome of evaluating one snapshot.
   */
  public static final class Evaluation {
    private final CheckResult _result;
    private final List<DriftEvent> _transitions;

    Evaluation(CheckResult result, List<DriftEvent> transitions) {
      _result = result;
      _transitions = Collections.unmodifiableList(transitions);
    }

    public CheckResult result() {
      return _result;
    }

    public List<DriftEvent> transitions() {
      return _transitions;
    }
  }

  private static final class MetricSlot {
    private final long _generation;
    private final AnomalyTracker _tracker;
    private DetectorState _state;

    MetricSlot(MetricRegistration registration) {
      _generation = registration.generation();
      _tracker = new AnomalyTracker(registration.name());
      _state = registration.config().detector().initialState(registration.config());
    }
  }
}
