/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.apache.kafka.common.config.ConfigException;


/**
 * Drift detection algorithms supported for a metric.
 *
 * <ul>
 *  <li>{@link #CUMULATIVE}: Two-sided cumulative sum of the deviations from a reference mean. Good at catching small
 *  sustained shifts of a metric with a known or stable baseline.</li>
 *  <li>{@link #EXPONENTIAL}: Z-score of a sample against an exponentially weighted moving mean and variance. Adapts
 *  to slowly moving baselines such as throughput counters.</li>
 * </ul>
 */
public enum DetectionAlgorithm {
  CUMULATIVE("CUMSUM"),
  EXPONENTIAL("EWMA");

  private static final List<DetectionAlgorithm> CACHED_VALUES = List.of(values());
  private final String _alias;

  DetectionAlgorithm(String alias) {
    _alias = alias;
  }

  /**
   * @return The short name this algorithm is also known by.
   */
  public String alias() {
    return _alias;
  }

  /**
   * @return The stateless detector implementing this algorithm.
   */
  public MetricDetector detector() {
    switch (this) {
      case CUMULATIVE:
        return CumulativeSumDetector.INSTANCE;
      case EXPONENTIAL:
        return ExponentialDetector.INSTANCE;
      default:
        throw new IllegalStateException("Unsupported detection algorithm " + this);
    }
  }

  /**
   * Parse the given algorithm name. The name is case insensitive, and both {@link #name()} and {@link #alias()} are
   * accepted.
   *
   * @param name Name of the algorithm.
   * @return The algorithm with the given name.
   */
  public static DetectionAlgorithm forName(String name) {
    if (name != null) {
      String normalized = name.trim().toUpperCase(Locale.ROOT);
      for (DetectionAlgorithm algorithm : CACHED_VALUES) {
        if (algorithm.name().equals(normalized) || algorithm.alias().equals(normalized)) {
          return algorithm;
        }
      }
    }
    throw new ConfigException("algorithm", name, "Supported algorithms are " + CACHED_VALUES);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<DetectionAlgorithm> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }
}
