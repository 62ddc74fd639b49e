/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.collector.MetricProducer;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.detector.MetricConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;


/**
 * Unit test for {@link MetricConfigStore}.
 */
public class MetricConfigStoreTest {
  private static final MetricConfig CUMULATIVE = new MetricConfig.Builder().algorithm(DetectionAlgorithm.CUMULATIVE).build();
  private static final MetricConfig EXPONENTIAL = new MetricConfig.Builder().algorithm(DetectionAlgorithm.EXPONENTIAL).build();
  private MetricConfigStore _store;

  @Before
  public void setUp() {
    Map<String, MetricConfig> initial = new LinkedHashMap<>();
    initial.put("cpu_percent", CUMULATIVE);
    initial.put("net_sent", EXPONENTIAL);
    _store = new MetricConfigStore(new ReentrantLock(), initial);
  }

  @Test
  public void testSetReplacesConfigAndBumpsGeneration() {
    long generation = _store.registration("cpu_percent").generation();
    _store.set("cpu_percent", EXPONENTIAL);
    assertSame(EXPONENTIAL, _store.get("cpu_percent"));
    assertNotEquals(generation, _store.registration("cpu_percent").generation());
    // Registration order is kept.
    assertEquals(new ArrayList<>(List.of("cpu_percent", "net_sent")), new ArrayList<>(_store.listAll().keySet()));
  }

  @Test
  public void testCustomMetricKeepsProducerOnConfigChange() {
    MetricProducer producer = () -> 42.0;
    _store.registerCustom("queue_depth", producer, CUMULATIVE);
    _store.set("queue_depth", EXPONENTIAL);
    MetricRegistration registration = _store.registration("queue_depth");
    assertTrue(registration.isCustom());
    assertSame(producer, registration.producer());
    assertSame(EXPONENTIAL, registration.config());
  }

  @Test
  public void testSetEnabled() {
    long generation = _store.registration("cpu_percent").generation();
    assertTrue(_store.setEnabled("cpu_percent", true).enabled());
    // Unchanged flag keeps the generation.
    assertEquals(generation, _store.registration("cpu_percent").generation());

    assertFalse(_store.setEnabled("cpu_percent", false).enabled());
    assertNotEquals(generation, _store.registration("cpu_percent").generation());
    assertEquals(1, _store.enabledRegistrations().size());
    assertEquals("net_sent", _store.enabledRegistrations().get(0).name());
  }

  @Test
  public void testRemove() {
    assertEquals("cpu_percent", _store.remove("cpu_percent").name());
    assertNull(_store.get("cpu_percent"));
    assertEquals(1, _store.listAll().size());
  }

  @Test(expected = ConfigException.class)
  public void testRemoveUnknownMetric() {
    _store.remove("unknown");
  }

  @Test(expected = ConfigException.class)
  public void testSetEnabledOnUnknownMetric() {
    _store.setEnabled("unknown", true);
  }

  @Test(expected = ConfigException.class)
  public void testBlankName() {
    _store.set(" ", CUMULATIVE);
  }

  @Test(expected = ConfigException.class)
  public void testNullConfig() {
    _store.set("cpu_percent", null);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testListAllIsUnmodifiable() {
    _store.listAll().put("ram_percent", CUMULATIVE);
  }
}
