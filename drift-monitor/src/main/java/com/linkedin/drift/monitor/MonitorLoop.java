/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.common.utils.Utils.validateNotNull;
import static com.linkedin.drift.config.constants.MonitorConfig.CHECK_INTERVAL_MS_CONFIG;


/**
 * The background loop of a drift monitor. Runs a check every check interval, measured from the start of one check to
 * the start of the next. A check that overruns the interval is followed immediately by the next one, without catching
 * up on missed checks. A failed check is logged and the loop carries on, except for an {@link IllegalStateException},
 * which ends the loop.
 *
 * <p>A loop instance runs once: after {@link #shutdown()} a new loop is needed to resume checking.
 */
public class MonitorLoop implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(MonitorLoop.class);
  private final Time _time;
  private final Runnable _check;
  private final CountDownLatch _shutdownLatch;
  private final AtomicLong _numChecks;
  private volatile long _checkIntervalMs;
  private volatile boolean _shutdown;
  private volatile boolean _exited;

  /**
   * @param time The time to measure the check interval with.
   * @param checkIntervalMs The interval between the starts of two consecutive checks.
   * @param check The check to run.
   */
  public MonitorLoop(Time time, long checkIntervalMs, Runnable check) {
    _time = validateNotNull(time, "Time cannot be null.");
    _check = validateNotNull(check, "Check cannot be null.");
    _shutdownLatch = new CountDownLatch(1);
    _numChecks = new AtomicLong(0L);
    _shutdown = false;
    _exited = false;
    setCheckIntervalMs(checkIntervalMs);
  }

  @Override
  public void run() {
    LOG.info("Starting drift monitor loop with a check interval of {} ms.", _checkIntervalMs);
    try {
      loop();
    } finally {
      _exited = true;
      LOG.info("Drift monitor loop stopped after {} checks.", _numChecks.get());
    }
  }

  private void loop() {
    while (!_shutdown) {
      long checkStartMs = _time.milliseconds();
      try {
        _check.run();
      } catch (IllegalStateException ise) {
        LOG.error("Drift monitor loop is in an illegal state, stopping the loop.", ise);
        break;
      } catch (Throwable t) {
        LOG.error("Uncaught exception in drift monitor check.", t);
      } finally {
        _numChecks.incrementAndGet();
      }

      long remainingMs = _checkIntervalMs - (_time.milliseconds() - checkStartMs);
      if (remainingMs <= 0) {
        LOG.debug("Check took longer than the check interval of {} ms, starting the next check immediately.", _checkIntervalMs);
        continue;
      }
      try {
        _shutdownLatch.await(remainingMs, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        LOG.warn("Drift monitor loop is interrupted, stopping the loop.");
        Thread.currentThread().interrupt();
        break;
      }
    }
  }

  /**
   * Ask the loop to stop. The check in progress, if any, completes first.
   */
  public void shutdown() {
    _shutdown = true;
    _shutdownLatch.countDown();
  }

  public boolean isShutdown() {
    return _shutdown;
  }

  /**
   * @return {@code true} once {@link #run()} has returned, whether shut down or ended by an illegal state.
   */
  public boolean hasExited() {
    return _exited;
  }

  /**
   * @return Number of checks run by this loop, including failed ones.
   */
  public long numChecks() {
    return _numChecks.get();
  }

  public long checkIntervalMs() {
    return _checkIntervalMs;
  }

  /**
   * @param checkIntervalMs The interval between the starts of two consecutive checks, effective after the current check.
   */
  public void setCheckIntervalMs(long checkIntervalMs) {
    if (checkIntervalMs < 1) {
      throw new ConfigException(CHECK_INTERVAL_MS_CONFIG, checkIntervalMs, "Check interval must be positive.");
    }
    _checkIntervalMs = checkIntervalMs;
  }
}
