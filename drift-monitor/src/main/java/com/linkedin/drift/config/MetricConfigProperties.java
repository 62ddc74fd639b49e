/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.config;

import com.linkedin.drift.detector.MetricConfig;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;

import static com.linkedin.drift.DriftUtils.ensureValidMetricName;
import static com.linkedin.drift.config.constants.MonitorConfig.METRIC_CONFIG_PREFIX;


/**
 * Parses per-metric configs given as properties of the form {@code metric.<name>.<parameter>}, e.g.
 * {@code metric.cpu_percent.threshold=30}. Parameters that are not given keep the value of the base config of the
 * metric, i.e. its built-in default if it has one.
 */
public final class MetricConfigProperties {
  // Longer names first, so that "threshold.sigma" is not taken for "threshold".
  private static final List<String> PARAMETERS = Arrays.asList(MetricConfig.THRESHOLD_SIGMA,
                                                               MetricConfig.REFERENCE_MEAN,
                                                               MetricConfig.DESCRIPTION,
                                                               MetricConfig.ALGORITHM,
                                                               MetricConfig.THRESHOLD,
                                                               MetricConfig.ENABLED,
                                                               MetricConfig.DRIFT,
                                                               MetricConfig.ALPHA);

  private MetricConfigProperties() {

  }

  /**
   * @param originals The original configs, which may contain configs of other components.
   * @param baseConfigs The configs to start from, by metric name.
   * @return The metric configs defined or overridden by the given originals, by metric name.
   */
  public static Map<String, MetricConfig> parse(Map<?, ?> originals, Map<String, MetricConfig> baseConfigs) {
    Map<String, Map<String, Object>> parametersByMetric = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      String key = String.valueOf(entry.getKey());
      if (!key.startsWith(METRIC_CONFIG_PREFIX)) {
        continue;
      }
      String metricAndParameter = key.substring(METRIC_CONFIG_PREFIX.length());
      String parameter = PARAMETERS.stream().filter(p -> metricAndParameter.endsWith("." + p)).findFirst()
                                   .orElseThrow(() -> new ConfigException(key, entry.getValue(),
                                                                          "Unknown metric parameter, supported are " + PARAMETERS));
      String metric = metricAndParameter.substring(0, metricAndParameter.length() - parameter.length() - 1);
      ensureValidMetricName(metric);
      parametersByMetric.computeIfAbsent(metric, m -> new LinkedHashMap<>()).put(parameter, entry.getValue());
    }

    Map<String, MetricConfig> metricConfigs = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Object>> entry : parametersByMetric.entrySet()) {
      String metric = entry.getKey();
      MetricConfig base = baseConfigs.get(metric);
      MetricConfig.Builder builder = base == null ? new MetricConfig.Builder() : new MetricConfig.Builder(base);
      entry.getValue().forEach((parameter, value) -> apply(builder, metric, parameter, value));
      try {
        metricConfigs.put(metric, builder.build());
      } catch (ConfigException e) {
        throw new ConfigException(String.format("Invalid config of metric %s: %s", metric, e.getMessage()));
      }
    }
    return Collections.unmodifiableMap(metricConfigs);
  }

  private static void apply(MetricConfig.Builder builder, String metric, String parameter, Object value) {
    String key = METRIC_CONFIG_PREFIX + metric + "." + parameter;
    String text = value == null ? null : value.toString().trim();
    switch (parameter) {
      case MetricConfig.ALGORITHM:
        try {
          builder.algorithm(text);
        } catch (ConfigException e) {
          throw new ConfigException(key, value, e.getMessage());
        }
        break;
      case MetricConfig.THRESHOLD:
        builder.threshold(parseDouble(key, text));
        break;
      case MetricConfig.DRIFT:
        builder.drift(parseDouble(key, text));
        break;
      case MetricConfig.REFERENCE_MEAN:
        builder.referenceMean(text == null || text.isEmpty() ? null : parseDouble(key, text));
        break;
      case MetricConfig.ALPHA:
        builder.alpha(parseDouble(key, text));
        break;
      case MetricConfig.THRESHOLD_SIGMA:
        builder.thresholdSigma(parseDouble(key, text));
        break;
      case MetricConfig.ENABLED:
        builder.enabled(parseBoolean(key, text));
        break;
      case MetricConfig.DESCRIPTION:
        builder.description(text);
        break;
      default:
        throw new IllegalStateException("Unsupported metric parameter " + parameter);
    }
  }

  private static double parseDouble(String key, String text) {
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException | NullPointerException e) {
      throw new ConfigException(key, text, "Expected a number.");
    }
  }

  private static boolean parseBoolean(String key, String text) {
    String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
    if (normalized.equals("true") || normalized.equals("false")) {
      return Boolean.parseBoolean(normalized);
    }
    throw new ConfigException(key, text, "Expected true or false.");
  }
}
