/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.collector;

import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.detector.MetricConfig;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Host metrics reported by the platform collector, with the detection config each metric starts with.
 * Utilization metrics have a well known baseline and use {@link DetectionAlgorithm#CUMULATIVE}; throughput counters
 * drift slowly and use {@link DetectionAlgorithm#EXPONENTIAL}.
 */
public enum SystemMetric {
  CPU_PERCENT("cpu_percent", cumulative(25.0, 5.0, 30.0, "CPU utilization of the host in percent")),
  RAM_PERCENT("ram_percent", cumulative(10.0, 2.0, 50.0, "Physical memory utilization of the host in percent")),
  LOAD_AVG("load_avg", cumulative(15.0, 1.0, 2.0, "System load average over the last minute")),
  NET_SENT("net_sent", exponential(0.1, 5.0, "Megabytes sent over all non-loopback interfaces")),
  NET_RECV("net_recv", exponential(0.1, 5.0, "Megabytes received over all non-loopback interfaces")),
  DISK_READ("disk_read", exponential(0.15, 4.5, "Megabytes read from all block devices")),
  DISK_WRITE("disk_write", exponential(0.15, 4.5, "Megabytes written to all block devices")),
  CONNECTIONS("connections", exponential(0.15, 5.0, "Number of TCP connections of the host"));

  private static final List<SystemMetric> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _metricName;
  private final MetricConfig _defaultConfig;

  SystemMetric(String metricName, MetricConfig defaultConfig) {
    _metricName = metricName;
    _defaultConfig = defaultConfig;
  }

  /**
   * @return The name the metric is reported under.
   */
  public String metricName() {
    return _metricName;
  }

  public MetricConfig defaultConfig() {
    return _defaultConfig;
  }

  private static MetricConfig cumulative(double threshold, double drift, double referenceMean, String description) {
    return new MetricConfig.Builder().algorithm(DetectionAlgorithm.CUMULATIVE).threshold(threshold).drift(drift)
                                     .referenceMean(referenceMean).description(description).build();
  }

  private static MetricConfig exponential(double alpha, double thresholdSigma, String description) {
    return new MetricConfig.Builder().algorithm(DetectionAlgorithm.EXPONENTIAL).alpha(alpha)
                                     .thresholdSigma(thresholdSigma).description(description).build();
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<SystemMetric> cachedValues() {
    return CACHED_VALUES;
  }
}
