/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.collector.MetricProducer;
import com.linkedin.drift.detector.MetricConfig;


/**
 * An immutable entry of the {@link MetricConfigStore}: the config of a metric, its producer if it is a custom metric,
 * and the generation of the entry. The generation changes whenever the entry changes, so that detector and anomaly
 * state built for an older generation can be recognized as stale.
 */
public final class MetricRegistration {
  private final String _name;
  private final MetricConfig _config;
  private final MetricProducer _producer;
  private final long _generation;

  MetricRegistration(String name, MetricConfig config, MetricProducer producer, long generation) {
    _name = name;
    _config = config;
    _producer = producer;
    _generation = generation;
  }

  public String name() {
    return _name;
  }

  public MetricConfig config() {
    return _config;
  }

  /**
   * @return The producer of a custom metric, or {@code null} if the metric comes from the collector.
   */
  public MetricProducer producer() {
    return _producer;
  }

  public boolean isCustom() {
    return _producer != null;
  }

  public long generation() {
    return _generation;
  }

  @Override
  public String toString() {
    return String.format("{%s%s,generation=%d,config=%s}", _name, isCustom() ? "(custom)" : "", _generation, _config);
  }
}
