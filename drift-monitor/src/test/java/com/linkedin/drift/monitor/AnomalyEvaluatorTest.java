/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.detector.MetricConfig;
import com.linkedin.drift.notifier.DriftEvent;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


/**
 * Unit test for {@link AnomalyEvaluator}.
 */
public class AnomalyEvaluatorTest {
  private static final double DELTA = 1e-9;
  private static final String METRIC = "queue_depth";
  private static final MetricConfig CONFIG = new MetricConfig.Builder().algorithm(DetectionAlgorithm.CUMULATIVE)
                                                                       .threshold(10.0).drift(1.0).referenceMean(0.0).build();
  private MetricConfigStore _store;
  private AnomalyEvaluator _evaluator;

  @Before
  public void setUp() {
    Lock lock = new ReentrantLock();
    _store = new MetricConfigStore(lock, Collections.singletonMap(METRIC, CONFIG));
    _evaluator = new AnomalyEvaluator(lock, _store, 1);
  }

  private AnomalyEvaluator.Evaluation evaluate(double value, long timestampMs) {
    return _evaluator.evaluate(Collections.singletonMap(METRIC, value), Collections.emptyMap(), timestampMs);
  }

  @Test
  public void testStateCarriesAcrossEvaluations() {
    assertEquals(4.0, evaluate(5.0, 1L).result().scores().get(METRIC), DELTA);
    assertEquals(8.0, evaluate(5.0, 2L).result().scores().get(METRIC), DELTA);
    AnomalyEvaluator.Evaluation evaluation = evaluate(5.0, 3L);
    assertEquals(12.0, evaluation.result().scores().get(METRIC), DELTA);

    CheckResult result = evaluation.result();
    assertTrue(result.hasAnomalies());
    AnomalyRecord record = result.anomalies().get(0);
    assertEquals(METRIC, record.metric());
    assertEquals(1, record.duration());
    assertEquals(AnomalySeverity.MEDIUM, record.severity());
    assertEquals(DetectionAlgorithm.CUMULATIVE, record.algorithm());
    assertEquals(3L, record.timestampMs());

    assertEquals(1, evaluation.transitions().size());
    DriftEvent event = evaluation.transitions().get(0);
    assertEquals(DriftEvent.Type.ANOMALY, event.type());
    assertEquals(5.0, event.value(), DELTA);
    assertEquals(1, _evaluator.numActiveAnomalies());
  }

  @Test
  public void testRecoveryEvent() {
    for (int i = 0; i < 3; i++) {
      evaluate(5.0, i);
    }
    evaluate(12.0, 3L);
    AnomalyEvaluator.Evaluation evaluation = evaluate(0.0, 4L);
    assertFalse(evaluation.result().hasAnomalies());
    DriftEvent recovery = evaluation.transitions().get(0);
    assertEquals(DriftEvent.Type.RECOVERY, recovery.type());
    assertEquals(2, recovery.duration());
    assertEquals(0.0, recovery.value(), DELTA);
    assertEquals(AnomalyLifecycle.NORMAL, _evaluator.anomalyStates(Collections.emptyMap()).get(METRIC).lifecycle());
  }

  @Test
  public void testNonFiniteSamplePreservesState() {
    evaluate(5.0, 1L);
    evaluate(5.0, 2L);
    AnomalyEvaluator.Evaluation evaluation = evaluate(Double.NaN, 3L);
    assertTrue(evaluation.result().errors().containsKey(METRIC));
    assertFalse(evaluation.result().scores().containsKey(METRIC));
    assertEquals(12.0, evaluate(5.0, 4L).result().scores().get(METRIC), DELTA);
  }

  @Test
  public void testConfigChangeRestartsDetection() {
    evaluate(5.0, 1L);
    assertEquals(8.0, evaluate(5.0, 2L).result().scores().get(METRIC), DELTA);
    _store.set(METRIC, new MetricConfig.Builder(CONFIG).threshold(20.0).build());
    assertEquals(4.0, evaluate(5.0, 3L).result().scores().get(METRIC), DELTA);
  }

  @Test
  public void testDisabledAndMissingMetrics() {
    evaluate(5.0, 1L);
    // Missing from the snapshot: state is kept.
    CheckResult result = _evaluator.evaluate(Collections.singletonMap("other", 1.0), Collections.emptyMap(), 2L).result();
    assertTrue(result.scores().isEmpty());
    assertEquals(8.0, evaluate(5.0, 3L).result().scores().get(METRIC), DELTA);

    _store.setEnabled(METRIC, false);
    assertTrue(evaluate(5.0, 4L).result().scores().isEmpty());
    assertTrue(_evaluator.anomalyStates(Collections.emptyMap()).isEmpty());
  }

  @Test
  public void testCollectionErrorsAreReported() {
    CheckResult result = _evaluator.evaluate(Collections.emptyMap(), Collections.singletonMap(METRIC, "producer failed"), 1L)
                                   .result();
    assertEquals("producer failed", result.errors().get(METRIC));
    assertNull(_evaluator.anomalyStates(Collections.emptyMap()).get(METRIC));
  }

  @Test
  public void testAnomalyStatesAndReset() {
    _evaluator.setMinAnomalyDuration(3);
    evaluate(12.0, 1L);
    Map<String, MetricAnomalyState> states = _evaluator.anomalyStates(Collections.singletonMap(METRIC, 7L));
    MetricAnomalyState state = states.get(METRIC);
    assertEquals(AnomalyLifecycle.PENDING, state.lifecycle());
    assertEquals(1, state.consecutiveCount());
    assertEquals(7L, (long) state.lastNotifiedMs());

    _evaluator.reset();
    assertTrue(_evaluator.anomalyStates(Collections.emptyMap()).isEmpty());
  }

  @Test(expected = ConfigException.class)
  public void testInvalidMinAnomalyDuration() {
    _evaluator.setMinAnomalyDuration(0);
  }
}
