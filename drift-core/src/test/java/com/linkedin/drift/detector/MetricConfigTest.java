/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class MetricConfigTest {

  @Test
  public void testDefaults() {
    MetricConfig config = new MetricConfig.Builder().build();
    assertEquals(DetectionAlgorithm.CUMULATIVE, config.algorithm());
    assertEquals(5.0, config.threshold(), 0.0);
    assertEquals(0.5, config.drift(), 0.0);
    assertNull(config.referenceMean());
    assertEquals(0.3, config.alpha(), 0.0);
    assertEquals(3.0, config.thresholdSigma(), 0.0);
    assertTrue(config.enabled());
    assertEquals("", config.description());
  }

  @Test
  public void testBuilderFromBaseKeepsUnchangedParameters() {
    MetricConfig base = new MetricConfig.Builder().threshold(25.0).drift(5.0).referenceMean(30.0)
                                                  .description("cpu").build();
    MetricConfig updated = new MetricConfig.Builder(base).threshold(40.0).build();
    assertEquals(40.0, updated.threshold(), 0.0);
    assertEquals(5.0, updated.drift(), 0.0);
    assertEquals(30.0, updated.referenceMean(), 0.0);
    assertEquals("cpu", updated.description());
    assertNotEquals(base, updated);
    assertEquals(base, new MetricConfig.Builder(base).build());
    assertEquals(base.hashCode(), new MetricConfig.Builder(base).build().hashCode());
  }

  @Test
  public void testAlertThresholdFollowsAlgorithm() {
    MetricConfig cumulative = new MetricConfig.Builder().threshold(7.0).thresholdSigma(2.0).build();
    assertEquals(7.0, cumulative.alertThreshold(), 0.0);
    MetricConfig exponential = new MetricConfig.Builder(cumulative).algorithm("ewma").build();
    assertEquals(DetectionAlgorithm.EXPONENTIAL, exponential.algorithm());
    assertEquals(2.0, exponential.alertThreshold(), 0.0);
  }

  @Test
  public void testSeverity() {
    MetricConfig config = new MetricConfig.Builder().threshold(25.0).build();
    assertEquals(AnomalySeverity.MEDIUM, AnomalySeverity.of(50.0, config));
    assertEquals(AnomalySeverity.HIGH, AnomalySeverity.of(50.1, config));
    assertEquals("high", AnomalySeverity.HIGH.toString());
  }

  @Test
  public void testAlphaBounds() {
    assertEquals(1.0, new MetricConfig.Builder().alpha(1.0).build().alpha(), 0.0);
    assertInvalid(new MetricConfig.Builder().alpha(0.0));
    assertInvalid(new MetricConfig.Builder().alpha(1.01));
    assertInvalid(new MetricConfig.Builder().alpha(Double.NaN));
  }

  @Test
  public void testInvalidParameters() {
    assertInvalid(new MetricConfig.Builder().threshold(0.0));
    assertInvalid(new MetricConfig.Builder().threshold(Double.POSITIVE_INFINITY));
    assertInvalid(new MetricConfig.Builder().thresholdSigma(-1.0));
    assertInvalid(new MetricConfig.Builder().drift(-0.1));
    assertInvalid(new MetricConfig.Builder().referenceMean(Double.NaN));
  }

  @Test
  public void testJsonStructureOnlyHasActiveParameters() {
    MetricConfig config = new MetricConfig.Builder().algorithm(DetectionAlgorithm.EXPONENTIAL).build();
    assertTrue(config.getJsonStructure().containsKey(MetricConfig.ALPHA));
    assertTrue(!config.getJsonStructure().containsKey(MetricConfig.THRESHOLD));
    assertEquals("EXPONENTIAL", config.getJsonStructure().get(MetricConfig.ALGORITHM));
  }

  private static void assertInvalid(MetricConfig.Builder builder) {
    try {
      builder.build();
      fail("Expected config to be rejected.");
    } catch (ConfigException e) {
      // Expected.
    }
  }
}
