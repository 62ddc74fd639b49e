/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.collector;

import com.linkedin.drift.exception.MetricCollectionException;
import com.sun.management.OperatingSystemMXBean;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.toMegabytes;
import static com.linkedin.drift.collector.SystemMetric.CONNECTIONS;
import static com.linkedin.drift.collector.SystemMetric.CPU_PERCENT;
import static com.linkedin.drift.collector.SystemMetric.DISK_READ;
import static com.linkedin.drift.collector.SystemMetric.DISK_WRITE;
import static com.linkedin.drift.collector.SystemMetric.LOAD_AVG;
import static com.linkedin.drift.collector.SystemMetric.NET_RECV;
import static com.linkedin.drift.collector.SystemMetric.NET_SENT;
import static com.linkedin.drift.collector.SystemMetric.RAM_PERCENT;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * The default {@link MetricsCollector}, which reports the {@link SystemMetric}s of the host.
 *
 * <ul>
 *   <li>CPU and memory utilization come from the JVM's {@link OperatingSystemMXBean}. On Linux, memory utilization
 *   is read from {@code /proc/meminfo} instead, so that reclaimable page cache counts as available.</li>
 *   <li>The load average is omitted on platforms that do not report one.</li>
 *   <li>Disk and network throughput (cumulative megabytes) and the TCP connection count are only reported on
 *   Linux.</li>
 * </ul>
 *
 * Each metric is read independently; a metric whose source is unavailable is left out of the snapshot.
 */
public class SystemMetricsCollector implements MetricsCollector {
  private static final Logger LOG = LoggerFactory.getLogger(SystemMetricsCollector.class);
  private static final double PERCENT = 100.0;
  private final OperatingSystemMXBean _osBean;
  private final Path _procRoot;
  private final Path _sysBlockRoot;

  public SystemMetricsCollector() {
    this((OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean(), Paths.get("/proc"), Paths.get("/sys", "block"));
  }

  /**
   * Package private for unit tests.
   */
  SystemMetricsCollector(OperatingSystemMXBean osBean, Path procRoot, Path sysBlockRoot) {
    _osBean = validateNotNull(osBean, "Operating system bean cannot be null.");
    _procRoot = validateNotNull(procRoot, "Proc root cannot be null.");
    _sysBlockRoot = validateNotNull(sysBlockRoot, "Block device root cannot be null.");
  }

  @Override
  public void configure(Map<String, ?> configs) {
  }

  @Override
  public Map<String, Double> collect() throws MetricCollectionException {
    Map<String, Double> snapshot = new HashMap<>();
    collectCpuAndLoad(snapshot);
    collectMemory(snapshot);
    if (_procRoot.toFile().isDirectory()) {
      collectDisk(snapshot);
      collectNetwork(snapshot);
      collectConnections(snapshot);
    }
    if (snapshot.isEmpty()) {
      throw new MetricCollectionException("None of the system metrics is available on this platform.");
    }
    return snapshot;
  }

  private void collectCpuAndLoad(Map<String, Double> snapshot) {
    double cpuLoad = _osBean.getCpuLoad();
    if (cpuLoad >= 0) {
      snapshot.put(CPU_PERCENT.metricName(), cpuLoad * PERCENT);
    } else {
      LOG.debug("Recent CPU usage of the system is not available.");
    }
    double loadAverage = _osBean.getSystemLoadAverage();
    if (loadAverage >= 0) {
      snapshot.put(LOAD_AVG.metricName(), loadAverage);
    }
  }

  private void collectMemory(Map<String, Double> snapshot) {
    if (_procRoot.resolve("meminfo").toFile().canRead()) {
      try {
        OptionalDouble usedPercent = ProcFsMetricUtils.memoryUsedPercent(_procRoot);
        if (usedPercent.isPresent()) {
          snapshot.put(RAM_PERCENT.metricName(), usedPercent.getAsDouble());
          return;
        }
      } catch (IOException | RuntimeException e) {
        LOG.debug("Failed to read memory info from {}, falling back to the JVM view of memory.", _procRoot, e);
      }
    }
    long total = _osBean.getTotalMemorySize();
    if (total > 0) {
      snapshot.put(RAM_PERCENT.metricName(), PERCENT * (total - _osBean.getFreeMemorySize()) / total);
    }
  }

  private void collectDisk(Map<String, Double> snapshot) {
    try {
      long[] readAndWritten = ProcFsMetricUtils.diskBytes(_procRoot, _sysBlockRoot);
      snapshot.put(DISK_READ.metricName(), toMegabytes(readAndWritten[0]));
      snapshot.put(DISK_WRITE.metricName(), toMegabytes(readAndWritten[1]));
    } catch (IOException | RuntimeException e) {
      LOG.debug("Failed to read disk statistics from {}.", _procRoot, e);
    }
  }

  private void collectNetwork(Map<String, Double> snapshot) {
    try {
      long[] receivedAndSent = ProcFsMetricUtils.networkBytes(_procRoot);
      snapshot.put(NET_RECV.metricName(), toMegabytes(receivedAndSent[0]));
      snapshot.put(NET_SENT.metricName(), toMegabytes(receivedAndSent[1]));
    } catch (IOException | RuntimeException e) {
      LOG.debug("Failed to read network statistics from {}.", _procRoot, e);
    }
  }

  private void collectConnections(Map<String, Double> snapshot) {
    try {
      snapshot.put(CONNECTIONS.metricName(), (double) ProcFsMetricUtils.tcpConnections(_procRoot));
    } catch (IOException | RuntimeException e) {
      LOG.debug("Failed to read TCP socket tables from {}.", _procRoot, e);
    }
  }
}
