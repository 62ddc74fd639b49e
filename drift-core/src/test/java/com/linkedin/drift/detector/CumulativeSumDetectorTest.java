/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import com.linkedin.drift.exception.DetectionException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


/**
 * Unit test for {@link CumulativeSumDetector}.
 */
public class CumulativeSumDetectorTest {
  private static final double DELTA = 1e-9;
  private final MetricDetector _detector = DetectionAlgorithm.CUMULATIVE.detector();

  private static MetricConfig config(double threshold, double drift, Double referenceMean) {
    return new MetricConfig.Builder().algorithm(DetectionAlgorithm.CUMULATIVE).threshold(threshold).drift(drift)
                                     .referenceMean(referenceMean).build();
  }

  @Test
  public void testUpwardShiftDetectedWithinThreeSamples() throws DetectionException {
    MetricConfig config = config(10.0, 1.0, 0.0);
    DetectorState state = _detector.initialState(config);
    double[] expectedScores = {4.0, 8.0, 12.0};
    DetectionResult result = null;
    for (double expectedScore : expectedScores) {
      result = _detector.evaluate(5.0, state, config);
      assertEquals(expectedScore, result.score(), DELTA);
      state = result.state();
    }
    assertTrue(result.isAnomaly());
    // Both sums restart after an alarm.
    CumulativeSumState afterAlarm = (CumulativeSumState) state;
    assertEquals(0.0, afterAlarm.positiveSum(), DELTA);
    assertEquals(0.0, afterAlarm.negativeSum(), DELTA);
    assertEquals(0.0, afterAlarm.baselineMean(), DELTA);
  }

  @Test
  public void testDownwardShiftDetected() throws DetectionException {
    MetricConfig config = config(10.0, 1.0, 0.0);
    DetectorState state = _detector.initialState(config);
    DetectionResult result = _detector.evaluate(-5.0, state, config);
    assertEquals(-4.0, ((CumulativeSumState) result.state()).negativeSum(), DELTA);
    result = _detector.evaluate(-5.0, result.state(), config);
    assertFalse(result.isAnomaly());
    result = _detector.evaluate(-5.0, result.state(), config);
    assertEquals(12.0, result.score(), DELTA);
    assertTrue(result.isAnomaly());
  }

  @Test
  public void testStableMetricNeverDrifts() throws DetectionException {
    MetricConfig config = config(1.0, 0.5, null);
    DetectorState state = _detector.initialState(config);
    for (int i = 0; i < 1000; i++) {
      DetectionResult result = _detector.evaluate(42.0, state, config);
      assertEquals(0.0, result.score(), DELTA);
      assertFalse(result.isAnomaly());
      state = result.state();
    }
  }

  @Test
  public void testBaselineCapturedFromFirstSample() throws DetectionException {
    MetricConfig config = config(100.0, 0.5, null);
    DetectorState state = _detector.initialState(config);
    assertNull(((CumulativeSumState) state).baselineMean());

    DetectionResult first = _detector.evaluate(10.0, state, config);
    assertEquals(0.0, first.score(), DELTA);
    assertEquals(10.0, ((CumulativeSumState) first.state()).baselineMean(), DELTA);

    DetectionResult second = _detector.evaluate(20.0, first.state(), config);
    assertEquals(9.5, second.score(), DELTA);
    assertEquals(10.0, ((CumulativeSumState) second.state()).baselineMean(), DELTA);
  }

  @Test
  public void testScoreAtThresholdIsNotAnomalous() throws DetectionException {
    MetricConfig config = config(4.0, 1.0, 0.0);
    DetectionResult result = _detector.evaluate(5.0, _detector.initialState(config), config);
    assertEquals(4.0, result.score(), DELTA);
    assertFalse(result.isAnomaly());
  }

  @Test
  public void testReplayIsDeterministic() throws DetectionException {
    MetricConfig config = config(25.0, 5.0, 30.0);
    double[] samples = {30, 30, 30, 90, 90, 90, 90, 30, 12.5, 77, 31};
    assertEquals(scores(samples, config), scores(samples, config));
  }

  @Test
  public void testNonFiniteSampleRejected() throws DetectionException {
    MetricConfig config = config(10.0, 1.0, 0.0);
    DetectorState state = _detector.evaluate(5.0, _detector.initialState(config), config).state();
    for (double value : new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
      try {
        _detector.evaluate(value, state, config);
        fail("Should have rejected " + value);
      } catch (DetectionException e) {
        // Expected.
      }
    }
    // The caller keeps the prior state, which continues to accumulate.
    assertEquals(8.0, _detector.evaluate(5.0, state, config).score(), DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForeignStateRejected() throws DetectionException {
    MetricConfig config = config(10.0, 1.0, 0.0);
    _detector.evaluate(1.0, DetectionAlgorithm.EXPONENTIAL.detector().initialState(config), config);
  }

  @Test
  public void testSingleton() {
    assertSame(CumulativeSumDetector.INSTANCE, config(1.0, 0.0, null).detector());
  }

  private List<Double> scores(double[] samples, MetricConfig config) throws DetectionException {
    List<Double> scores = new ArrayList<>();
    DetectorState state = _detector.initialState(config);
    for (double sample : samples) {
      DetectionResult result = _detector.evaluate(sample, state, config);
      scores.add(result.score());
      state = result.state();
    }
    return scores;
  }
}
