/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.config;

import com.linkedin.drift.collector.SystemMetric;
import com.linkedin.drift.common.DriftConfigurable;
import com.linkedin.drift.config.constants.MonitorConfig;
import com.linkedin.drift.config.constants.NotifierConfig;
import com.linkedin.drift.detector.MetricConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;

/**
 * The configuration class of Drift Monitor.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.drift.config.constants}. Per-metric configs are given as
 * {@code metric.<name>.<parameter>} properties, see {@link MetricConfigProperties}.
 */
public class DriftMonitorConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = NotifierConfig.define(MonitorConfig.define(new ConfigDef()));
  }

  private final Map<String, MetricConfig> _metricConfigs;

  public DriftMonitorConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public DriftMonitorConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    _metricConfigs = sanityCheckMetricConfigs(originals);
  }

  /**
   * @return Merged config values.
   */
  public Map<String, Object> mergedConfigValues() {
    Map<String, Object> conf = originals();

    // Use parsed non-null value to overwrite originals.
    // This will keep default values and also keep values that are not defined under ConfigDef.
    values().forEach((k, v) -> {
      if (v != null) {
        conf.put(k, v);
      }
    });
    return conf;
  }

  @Override
  public <T> T getConfiguredInstance(String key, Class<T> t) {
    T o = super.getConfiguredInstance(key, t);
    if (o instanceof DriftConfigurable) {
      ((DriftConfigurable) o).configure(mergedConfigValues());
    }
    return o;
  }

  /**
   * @return The built-in metric configs, overridden and extended by the {@code metric.<name>.<parameter>} properties,
   * in registration order.
   */
  public Map<String, MetricConfig> metricConfigs() {
    return _metricConfigs;
  }

  /**
   * @return The configs of the metrics reported by the default collector.
   */
  public static Map<String, MetricConfig> builtInMetricConfigs() {
    Map<String, MetricConfig> builtIn = new LinkedHashMap<>();
    for (SystemMetric metric : SystemMetric.cachedValues()) {
      builtIn.put(metric.metricName(), metric.defaultConfig());
    }
    return builtIn;
  }

  /**
   * Parse and validate the per-metric configs, so that an invalid one fails the construction of this config.
   */
  private static Map<String, MetricConfig> sanityCheckMetricConfigs(Map<?, ?> originals) {
    Map<String, MetricConfig> metricConfigs = builtInMetricConfigs();
    metricConfigs.putAll(MetricConfigProperties.parse(originals, metricConfigs));
    return Collections.unmodifiableMap(metricConfigs);
  }
}
