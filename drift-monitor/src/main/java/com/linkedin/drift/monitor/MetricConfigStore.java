/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.collector.MetricProducer;
import com.linkedin.drift.common.utils.AutoCloseableLock;
import com.linkedin.drift.detector.MetricConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.OPERATION_LOGGER;
import static com.linkedin.drift.DriftUtils.ensureValidMetricName;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * The per-metric configs read by every check. Reads return immutable snapshots and every update replaces the entry of
 * a metric atomically, under the lock shared with the rest of the monitor. Registering a metric that already exists
 * replaces it.
 */
public class MetricConfigStore {
  private static final Logger LOG = LoggerFactory.getLogger(MetricConfigStore.class);
  private static final Logger OPERATION_LOG = LoggerFactory.getLogger(OPERATION_LOGGER);
  private final Lock _lock;
  private final Map<String, MetricRegistration> _registrations;
  private long _nextGeneration;

  /**
   * @param lock The lock shared with the rest of the monitor.
   * @param initialConfigs The configs to start with, by metric name.
   */
  public MetricConfigStore(Lock lock, Map<String, MetricConfig> initialConfigs) {
    _lock = validateNotNull(lock, "Lock cannot be null.");
    _registrations = new LinkedHashMap<>();
    _nextGeneration = 0L;
    validateNotNull(initialConfigs, "Initial metric configs cannot be null.").forEach(this::set);
    LOG.debug("Initialized metric config store with {}.", _registrations.keySet());
  }

  /**
   * @param name Name of the metric.
   * @return The config of the metric, or {@code null} if the metric is not registered.
   */
  public MetricConfig get(String name) {
    MetricRegistration registration = registration(name);
    return registration == null ? null : registration.config();
  }

  /**
   * @param name Name of the metric.
   * @return The registration of the metric, or {@code null} if the metric is not registered.
   */
  public MetricRegistration registration(String name) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _registrations.get(name);
    }
  }

  /**
   * Set the config of a metric. A custom metric keeps its producer.
   *
   * @param name Name of the metric.
   * @param config The new config of the metric.
   */
  public void set(String name, MetricConfig config) {
    ensureValidMetricName(name);
    if (config == null) {
      throw new ConfigException(String.format("Config of metric %s cannot be null.", name));
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      MetricRegistration existing = _registrations.get(name);
      put(name, config, existing == null ? null : existing.producer());
      OPERATION_LOG.info("{} metric {} with config {}.", existing == null ? "Registered" : "Updated", name, config);
    }
  }

  /**
   * Register a custom metric, replacing any metric of the same name.
   *
   * @param name Name of the metric.
   * @param producer Supplier of the metric value.
   * @param config Config of the metric.
   */
  public void registerCustom(String name, MetricProducer producer, MetricConfig config) {
    ensureValidMetricName(name);
    if (producer == null || config == null) {
      throw new ConfigException(String.format("Producer and config of custom metric %s cannot be null.", name));
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      MetricRegistration existing = put(name, config, producer);
      OPERATION_LOG.info("Registered custom metric {} with config {}{}.", name, config,
                         existing == null ? "" : ", replacing " + existing);
    }
  }

  /**
   * Enable or disable a metric. Changing the flag restarts the detection state of the metric.
   *
   * @param name Name of the metric.
   * @param enabled {@code true} to enable the metric, {@code false} to disable it.
   * @return The updated config of the metric.
   */
  public MetricConfig setEnabled(String name, boolean enabled) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      MetricRegistration existing = ensureRegistered(name);
      if (existing.config().enabled() == enabled) {
        return existing.config();
      }
      MetricConfig config = new MetricConfig.Builder(existing.config()).enabled(enabled).build();
      put(name, config, existing.producer());
      OPERATION_LOG.info("{} metric {}.", enabled ? "Enabled" : "Disabled", name);
      return config;
    }
  }

  /**
   * @param name Name of the metric.
   * @return The registration of the removed metric.
   */
  public MetricRegistration remove(String name) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      ensureRegistered(name);
      MetricRegistration removed = _registrations.remove(name);
      OPERATION_LOG.info("Removed metric {}.", name);
      return removed;
    }
  }

  /**
   * @return The config of every registered metric by name, in registration order.
   */
  public Map<String, MetricConfig> listAll() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      Map<String, MetricConfig> configs = new LinkedHashMap<>();
      _registrations.forEach((name, registration) -> configs.put(name, registration.config()));
      return Collections.unmodifiableMap(configs);
    }
  }

  /**
   * @return The registrations of the enabled metrics, in registration order.
   */
  public List<MetricRegistration> enabledRegistrations() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      List<MetricRegistration> enabled = new ArrayList<>();
      for (MetricRegistration registration : _registrations.values()) {
        if (registration.config().enabled()) {
          enabled.add(registration);
        }
      }
      return enabled;
    }
  }

  private MetricRegistration ensureRegistered(String name) {
    MetricRegistration registration = _registrations.get(name);
    if (registration == null) {
      throw new ConfigException(String.format("Unknown metric %s. Registered metrics are %s.", name, _registrations.keySet()));
    }
    return registration;
  }

  private MetricRegistration put(String name, MetricConfig config, MetricProducer producer) {
    return _registrations.put(name, new MetricRegistration(name, config, producer, _nextGeneration++));
  }
}
