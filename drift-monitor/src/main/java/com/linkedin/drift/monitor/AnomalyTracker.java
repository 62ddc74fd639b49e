/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.MetricConfig;
import com.linkedin.drift.notifier.DriftEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Debounces the anomaly flags of one metric and tracks the lifecycle of its anomalies.
 *
 * <pre>
 *   current    | anomalous sample                            | normal sample
 *   -----------+---------------------------------------------+-------------------------------------
 *   NORMAL     | count = 1, PENDING (ACTIVE if min is 1)     | NORMAL
 *   PENDING    | count + 1, ACTIVE once count reaches min    | NORMAL, count = 0
 *   ACTIVE     | count + 1, ACTIVE                           | RECOVERING, then NORMAL, count = 0
 * </pre>
 *
 * Entering {@link AnomalyLifecycle#ACTIVE} yields an {@link DriftEvent.Type#ANOMALY} transition, a rise of the
 * severity from medium to high while active yields {@link DriftEvent.Type#ESCALATION}, and the end of an active
 * anomaly yields {@link DriftEvent.Type#RECOVERY}. Not thread safe; guarded by the lock of the monitor.
 */
public class AnomalyTracker {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyTracker.class);
  private final String _metric;
  private AnomalyLifecycle _lifecycle;
  private int _consecutiveCount;
  private AnomalySeverity _severity;

  public AnomalyTracker(String metric) {
    _metric = metric;
    _lifecycle = AnomalyLifecycle.NORMAL;
    _consecutiveCount = 0;
    _severity = null;
  }

  /**
   * Advance the lifecycle with the outcome of a new sample.
   *
   * @param isAnomaly Whether the detector flagged the sample.
   * @param score Drift score of the sample.
   * @param config Config the score was computed with.
   * @param minAnomalyDuration Number of anomalous samples in a row that make an anomaly active.
   * @return The transition caused by the sample, or {@code null} if none.
   */
  public DriftEvent.Type update(boolean isAnomaly, double score, MetricConfig config, int minAnomalyDuration) {
    AnomalyLifecycle previous = _lifecycle;
    DriftEvent.Type transition = null;
    if (isAnomaly) {
      _consecutiveCount++;
      AnomalySeverity severity = AnomalySeverity.of(score, config);
      if (_lifecycle == AnomalyLifecycle.ACTIVE) {
        if (_severity == AnomalySeverity.MEDIUM && severity == AnomalySeverity.HIGH) {
          transition = DriftEvent.Type.ESCALATION;
        }
      } else if (_consecutiveCount >= minAnomalyDuration) {
        _lifecycle = AnomalyLifecycle.ACTIVE;
        transition = DriftEvent.Type.ANOMALY;
      } else {
        _lifecycle = AnomalyLifecycle.PENDING;
      }
      _severity = severity;
    } else if (_lifecycle == AnomalyLifecycle.ACTIVE) {
      _lifecycle = AnomalyLifecycle.RECOVERING;
      transition = DriftEvent.Type.RECOVERY;
    } else {
      _lifecycle = AnomalyLifecycle.NORMAL;
      _consecutiveCount = 0;
      _severity = null;
    }

    if (previous != _lifecycle) {
      LOG.debug("Anomaly lifecycle of {} changed from {} to {} after {} anomalous samples.", _metric, previous, _lifecycle,
                _consecutiveCount);
    }
    return transition;
  }

  /**
   * Collapse {@link AnomalyLifecycle#RECOVERING} into {@link AnomalyLifecycle#NORMAL}. Called once the recovery of the
   * current check has been reported.
   */
  public void completeRecovery() {
    if (_lifecycle == AnomalyLifecycle.RECOVERING) {
      _lifecycle = AnomalyLifecycle.NORMAL;
      _consecutiveCount = 0;
      _severity = null;
    }
  }

  public String metric() {
    return _metric;
  }

  public AnomalyLifecycle lifecycle() {
    return _lifecycle;
  }

  /**
   * @return Number of anomalous samples in a row, including the last one. While recovering, the length of the
   * anomaly that just ended.
   */
  public int consecutiveCount() {
    return _consecutiveCount;
  }

  /**
   * @return Severity of the last anomalous sample of the current anomaly, or {@code null} if the metric is normal.
   */
  public AnomalySeverity severity() {
    return _severity;
  }
}
