/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.detector.MetricConfig;
import com.linkedin.drift.notifier.DriftEvent;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;


/**
 * Unit test for {@link AnomalyTracker}.
 */
public class AnomalyTrackerTest {
  private static final MetricConfig CONFIG = new MetricConfig.Builder().algorithm(DetectionAlgorithm.CUMULATIVE)
                                                                       .threshold(10.0).drift(1.0).build();
  private static final double MEDIUM_SCORE = 15.0;
  private static final double HIGH_SCORE = 25.0;

  @Test
  public void testDebounce() {
    AnomalyTracker tracker = new AnomalyTracker("cpu");
    assertNull(tracker.update(true, MEDIUM_SCORE, CONFIG, 3));
    assertEquals(AnomalyLifecycle.PENDING, tracker.lifecycle());
    assertEquals(1, tracker.consecutiveCount());
    assertNull(tracker.update(true, MEDIUM_SCORE, CONFIG, 3));
    assertEquals(AnomalyLifecycle.PENDING, tracker.lifecycle());
    assertEquals(DriftEvent.Type.ANOMALY, tracker.update(true, MEDIUM_SCORE, CONFIG, 3));
    assertEquals(AnomalyLifecycle.ACTIVE, tracker.lifecycle());
    assertEquals(3, tracker.consecutiveCount());
    assertEquals(AnomalySeverity.MEDIUM, tracker.severity());
    // Staying active yields no further transition.
    assertNull(tracker.update(true, MEDIUM_SCORE, CONFIG, 3));
    assertEquals(4, tracker.consecutiveCount());
  }

  @Test
  public void testInterruptedPendingReturnsToNormal() {
    AnomalyTracker tracker = new AnomalyTracker("cpu");
    tracker.update(true, MEDIUM_SCORE, CONFIG, 3);
    tracker.update(true, MEDIUM_SCORE, CONFIG, 3);
    assertNull(tracker.update(false, 0.0, CONFIG, 3));
    assertEquals(AnomalyLifecycle.NORMAL, tracker.lifecycle());
    assertEquals(0, tracker.consecutiveCount());
    assertNull(tracker.severity());
    assertNull(tracker.update(true, MEDIUM_SCORE, CONFIG, 3));
    assertEquals(1, tracker.consecutiveCount());
  }

  @Test
  public void testMinDurationOfOneActivatesImmediately() {
    AnomalyTracker tracker = new AnomalyTracker("cpu");
    assertEquals(DriftEvent.Type.ANOMALY, tracker.update(true, HIGH_SCORE, CONFIG, 1));
    assertEquals(AnomalyLifecycle.ACTIVE, tracker.lifecycle());
    assertEquals(AnomalySeverity.HIGH, tracker.severity());
  }

  @Test
  public void testEscalation() {
    AnomalyTracker tracker = new AnomalyTracker("cpu");
    assertEquals(DriftEvent.Type.ANOMALY, tracker.update(true, MEDIUM_SCORE, CONFIG, 1));
    assertEquals(DriftEvent.Type.ESCALATION, tracker.update(true, HIGH_SCORE, CONFIG, 1));
    assertEquals(AnomalySeverity.HIGH, tracker.severity());
    // Falling back to medium and rising again escalates again.
    assertNull(tracker.update(true, MEDIUM_SCORE, CONFIG, 1));
    assertEquals(AnomalySeverity.MEDIUM, tracker.severity());
    assertEquals(DriftEvent.Type.ESCALATION, tracker.update(true, HIGH_SCORE, CONFIG, 1));
    // Staying high does not.
    assertNull(tracker.update(true, HIGH_SCORE, CONFIG, 1));
  }

  @Test
  public void testRecoveryReportedOnce() {
    AnomalyTracker tracker = new AnomalyTracker("cpu");
    for (int i = 0; i < 4; i++) {
      tracker.update(true, HIGH_SCORE, CONFIG, 3);
    }
    assertEquals(DriftEvent.Type.RECOVERY, tracker.update(false, 0.0, CONFIG, 3));
    assertEquals(AnomalyLifecycle.RECOVERING, tracker.lifecycle());
    // The length and severity of the ended anomaly are kept until the recovery is complete.
    assertEquals(4, tracker.consecutiveCount());
    assertEquals(AnomalySeverity.HIGH, tracker.severity());

    tracker.completeRecovery();
    assertEquals(AnomalyLifecycle.NORMAL, tracker.lifecycle());
    assertEquals(0, tracker.consecutiveCount());
    assertNull(tracker.update(false, 0.0, CONFIG, 3));
    assertNull(tracker.update(false, 0.0, CONFIG, 3));
  }
}
