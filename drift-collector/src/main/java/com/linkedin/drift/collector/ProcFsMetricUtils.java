/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.collector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;


/**
 * Readers for the Linux {@code /proc} and {@code /sys} pseudo file systems. Every reader takes the root of the file
 * system so that it can be pointed at a copy of the files.
 */
public final class ProcFsMetricUtils {
  static final String LOOPBACK_INTERFACE = "lo";
  static final long SECTOR_SIZE_BYTES = 512L;
  // Column positions in /proc/diskstats, after major, minor and device name.
  private static final int DISKSTATS_DEVICE_NAME = 2;
  private static final int DISKSTATS_SECTORS_READ = 5;
  private static final int DISKSTATS_SECTORS_WRITTEN = 9;
  // Column positions in /proc/net/dev, after the "iface:" prefix.
  private static final int NET_DEV_BYTES_RECEIVED = 0;
  private static final int NET_DEV_BYTES_TRANSMITTED = 8;

  private ProcFsMetricUtils() {

  }

  /**
   * Get the total number of bytes read from and written to the whole block devices of the host. Partitions, loop and
   * ram devices are skipped so that no I/O is counted twice.
   *
   * @param procRoot Root of the {@code /proc} file system.
   * @param sysBlockRoot The {@code /sys/block} directory, which lists the whole block devices.
   * @return A two element array with the bytes read and the bytes written.
   * @throws IOException If {@code diskstats} cannot be read.
   */
  public static long[] diskBytes(Path procRoot, Path sysBlockRoot) throws IOException {
    long[] readAndWritten = new long[2];
    for (String line : Files.readAllLines(procRoot.resolve("diskstats"), StandardCharsets.UTF_8)) {
      String[] columns = line.trim().split("\\s+");
      if (columns.length <= DISKSTATS_SECTORS_WRITTEN) {
        continue;
      }
      String device = columns[DISKSTATS_DEVICE_NAME];
      if (device.startsWith("loop") || device.startsWith("ram") || !Files.isDirectory(sysBlockRoot.resolve(device))) {
        continue;
      }
      readAndWritten[0] += Long.parseLong(columns[DISKSTATS_SECTORS_READ]) * SECTOR_SIZE_BYTES;
      readAndWritten[1] += Long.parseLong(columns[DISKSTATS_SECTORS_WRITTEN]) * SECTOR_SIZE_BYTES;
    }
    return readAndWritten;
  }

  /**
   * Get the total number of bytes received and sent over all network interfaces except loopback.
   *
   * @param procRoot Root of the {@code /proc} file system.
   * @return A two element array with the bytes received and the bytes sent.
   * @throws IOException If {@code net/dev} cannot be read.
   */
  public static long[] networkBytes(Path procRoot) throws IOException {
    long[] receivedAndSent = new long[2];
    for (String line : Files.readAllLines(procRoot.resolve("net").resolve("dev"), StandardCharsets.UTF_8)) {
      int separator = line.indexOf(':');
      if (separator < 0) {
        // Header lines
        continue;
      }
      String iface = line.substring(0, separator).trim();
      String[] columns = line.substring(separator + 1).trim().split("\\s+");
      if (iface.equals(LOOPBACK_INTERFACE) || columns.length <= NET_DEV_BYTES_TRANSMITTED) {
        continue;
      }
      receivedAndSent[0] += Long.parseLong(columns[NET_DEV_BYTES_RECEIVED]);
      receivedAndSent[1] += Long.parseLong(columns[NET_DEV_BYTES_TRANSMITTED]);
    }
    return receivedAndSent;
  }

  /**
   * Count the TCP sockets of the host over IPv4 and IPv6. A missing {@code tcp6} table counts as empty.
   *
   * @param procRoot Root of the {@code /proc} file system.
   * @return Number of TCP sockets.
   * @throws IOException If a socket table cannot be read.
   */
  public static long tcpConnections(Path procRoot) throws IOException {
    Path net = procRoot.resolve("net");
    long connections = countTableEntries(net.resolve("tcp"));
    Path ipv6 = net.resolve("tcp6");
    if (Files.exists(ipv6)) {
      connections += countTableEntries(ipv6);
    }
    return connections;
  }

  /**
   * Get the memory utilization of the host the way {@code free} reports it, i.e. counting reclaimable page cache as
   * available.
   *
   * @param procRoot Root of the {@code /proc} file system.
   * @return Used memory in percent, or empty if {@code meminfo} has no {@code MemAvailable} entry.
   * @throws IOException If {@code meminfo} cannot be read.
   */
  public static OptionalDouble memoryUsedPercent(Path procRoot) throws IOException {
    long totalKb = -1;
    long availableKb = -1;
    for (String line : Files.readAllLines(procRoot.resolve("meminfo"), StandardCharsets.UTF_8)) {
      if (line.startsWith("MemTotal:")) {
        totalKb = parseKb(line);
      } else if (line.startsWith("MemAvailable:")) {
        availableKb = parseKb(line);
      }
    }
    if (totalKb <= 0 || availableKb < 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(100.0 * (totalKb - availableKb) / totalKb);
  }

  private static long parseKb(String meminfoLine) {
    String[] columns = meminfoLine.trim().split("\\s+");
    return Long.parseLong(columns[1]);
  }

  private static long countTableEntries(Path table) throws IOException {
    List<String> lines = Files.readAllLines(table, StandardCharsets.US_ASCII);
    // The first line is the column header.
    return lines.stream().skip(1).filter(l -> !l.isBlank()).count();
  }
}
