/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.drift.common.utils.AutoCloseableLock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.DRIFT_MONITOR_SENSOR;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;
import static com.linkedin.drift.config.constants.NotifierConfig.NOTIFICATION_COOL_DOWN_MS_CONFIG;


/**
 * Decides which {@link DriftEvent}s reach the notifier.
 *
 * <ul>
 *   <li>{@link DriftEvent.Type#ANOMALY} and {@link DriftEvent.Type#ESCALATION} events of a metric are suppressed
 *   within the cool down period since the last admitted notification of that metric.</li>
 *   <li>At most a fixed number of events of any type are admitted within a rolling window, across all metrics.</li>
 *   <li>{@link DriftEvent.Type#RECOVERY} events are exempt from the cool down, and can be disabled altogether.</li>
 * </ul>
 *
 * An admitted event counts against the cool down and the rate limit when it is admitted, whether or not its delivery
 * succeeds. Guarded by the lock shared with the rest of the monitor.
 */
public class NotificationPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationPolicy.class);
  private final Lock _lock;
  private final Time _time;
  private final int _rateLimitMaxCount;
  private final long _rateLimitWindowMs;
  private final boolean _recoveryNotificationEnabled;
  private volatile long _coolDownMs;
  private final Map<String, Long> _lastNotifiedMsByMetric;
  // Admission times within the rate limit window, oldest first.
  private final Deque<Long> _admissionTimesMs;
  private final Map<NotificationDecision.Reason, Meter> _suppressionRateByReason;

  public NotificationPolicy(Lock lock,
                            Time time,
                            long coolDownMs,
                            int rateLimitMaxCount,
                            long rateLimitWindowMs,
                            boolean recoveryNotificationEnabled,
                            MetricRegistry dropwizardMetricRegistry) {
    _lock = validateNotNull(lock, "Lock cannot be null.");
    _time = validateNotNull(time, "Time cannot be null.");
    if (rateLimitMaxCount < 1 || rateLimitWindowMs < 1) {
      throw new IllegalArgumentException(String.format("Invalid rate limit of %d notifications per %d ms.",
                                                       rateLimitMaxCount, rateLimitWindowMs));
    }
    setCoolDownMs(coolDownMs);
    _rateLimitMaxCount = rateLimitMaxCount;
    _rateLimitWindowMs = rateLimitWindowMs;
    _recoveryNotificationEnabled = recoveryNotificationEnabled;
    _lastNotifiedMsByMetric = new HashMap<>();
    _admissionTimesMs = new ArrayDeque<>(rateLimitMaxCount);
    _suppressionRateByReason = new EnumMap<>(NotificationDecision.Reason.class);
    for (NotificationDecision.Reason reason : NotificationDecision.Reason.values()) {
      String name = String.format("notification-suppressed-%s-rate", reason.name().toLowerCase().replace('_', '-'));
      _suppressionRateByReason.put(reason, dropwizardMetricRegistry == null
                                           ? new Meter() : dropwizardMetricRegistry.meter(MetricRegistry.name(DRIFT_MONITOR_SENSOR, name)));
    }
  }

  /**
   * Decide whether the given event should be delivered, and if so, record its admission.
   *
   * @param event A lifecycle transition of a metric.
   * @return The decision for the event.
   */
  public NotificationDecision onTransition(DriftEvent event) {
    NotificationDecision decision;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      decision = decide(event, _time.milliseconds());
    }
    if (decision.action() == NotificationDecision.Action.SUPPRESS) {
      LOG.info("Suppressed notification of {} due to {}.", event, decision.reason());
      _suppressionRateByReason.get(decision.reason()).mark();
    } else {
      LOG.debug("Admitted notification of {}.", event);
    }
    return decision;
  }

  private NotificationDecision decide(DriftEvent event, long nowMs) {
    boolean isRecovery = event.type() == DriftEvent.Type.RECOVERY;
    if (isRecovery && !_recoveryNotificationEnabled) {
      return NotificationDecision.suppress(NotificationDecision.Reason.RECOVERY_DISABLED, -1L);
    }
    if (!isRecovery) {
      Long lastNotifiedMs = _lastNotifiedMsByMetric.get(event.metric());
      if (lastNotifiedMs != null && nowMs - lastNotifiedMs < _coolDownMs) {
        return NotificationDecision.suppress(NotificationDecision.Reason.COOL_DOWN, lastNotifiedMs + _coolDownMs - nowMs);
      }
    }
    expireAdmissions(nowMs);
    if (_admissionTimesMs.size() >= _rateLimitMaxCount) {
      return NotificationDecision.suppress(NotificationDecision.Reason.RATE_LIMITED,
                                           _admissionTimesMs.peekFirst() + _rateLimitWindowMs - nowMs);
    }
    _admissionTimesMs.addLast(nowMs);
    if (!isRecovery) {
      _lastNotifiedMsByMetric.put(event.metric(), nowMs);
    }
    return NotificationDecision.send();
  }

  private void expireAdmissions(long nowMs) {
    while (!_admissionTimesMs.isEmpty() && nowMs - _admissionTimesMs.peekFirst() >= _rateLimitWindowMs) {
      _admissionTimesMs.pollFirst();
    }
  }

  /**
   * @param metric Name of the metric.
   * @return Time of the last admitted anomaly or escalation notification of the metric, or {@code null} if none.
   */
  public Long lastNotifiedMs(String metric) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _lastNotifiedMsByMetric.get(metric);
    }
  }

  /**
   * @return Last admitted anomaly or escalation notification time by metric.
   */
  public Map<String, Long> lastNotifiedMsByMetric() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return Collections.unmodifiableMap(new HashMap<>(_lastNotifiedMsByMetric));
    }
  }

  /**
   * @return Number of notifications admitted within the current rate limit window.
   */
  public int numAdmittedInWindow() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      expireAdmissions(_time.milliseconds());
      return _admissionTimesMs.size();
    }
  }

  /**
   * Forget the cool down of a metric, e.g. because the metric was removed.
   *
   * @param metric Name of the metric.
   */
  public void forget(String metric) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _lastNotifiedMsByMetric.remove(metric);
    }
  }

  /**
   * Clear all cool down and rate limit state.
   */
  public void reset() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _lastNotifiedMsByMetric.clear();
      _admissionTimesMs.clear();
    }
  }

  public long coolDownMs() {
    return _coolDownMs;
  }

  /**
   * @param coolDownMs Minimum time between two anomaly or escalation notifications of the same metric.
   */
  public void setCoolDownMs(long coolDownMs) {
    if (coolDownMs < 0) {
      throw new ConfigException(NOTIFICATION_COOL_DOWN_MS_CONFIG, coolDownMs, "Cool down cannot be negative.");
    }
    _coolDownMs = coolDownMs;
  }

  /**
   * @param reason Suppression reason.
   * @return Number of notifications suppressed for the given reason.
   */
  public long numSuppressed(NotificationDecision.Reason reason) {
    return _suppressionRateByReason.get(reason).getCount();
  }
}
