/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * Creates the threads of a drift monitor. Each kind of thread has a fixed name prefix and daemon policy, and reports
 * uncaught exceptions to the logger of the component that owns it.
 */
public final class DriftThreadFactory implements ThreadFactory {
  public static final String MONITOR_LOOP_THREAD_PREFIX = "DriftMonitorLoop";
  public static final String NOTIFICATION_DISPATCHER_THREAD_PREFIX = "DriftNotificationDispatcher";
  private final String _prefix;
  private final boolean _daemon;
  private final Logger _ownerLogger;
  private final AtomicInteger _numThreads;

  private DriftThreadFactory(String prefix, boolean daemon, Logger ownerLogger) {
    _prefix = prefix;
    _daemon = daemon;
    _ownerLogger = validateNotNull(ownerLogger, "Owner logger cannot be null.");
    _numThreads = new AtomicInteger(0);
  }

  /**
   * The loop thread keeps the JVM alive while the monitor is running.
   *
   * @param ownerLogger Logger to report uncaught exceptions to.
   * @return A factory for the background check threads.
   */
  public static DriftThreadFactory forMonitorLoop(Logger ownerLogger) {
    return new DriftThreadFactory(MONITOR_LOOP_THREAD_PREFIX, false, ownerLogger);
  }

  /**
   * Dispatcher threads never hold up JVM exit; closing the monitor is what drains pending notifications.
   *
   * @param ownerLogger Logger to report uncaught exceptions to.
   * @return A factory for the notification delivery threads.
   */
  public static DriftThreadFactory forNotificationDispatcher(Logger ownerLogger) {
    return new DriftThreadFactory(NOTIFICATION_DISPATCHER_THREAD_PREFIX, true, ownerLogger);
  }

  public String prefix() {
    return _prefix;
  }

  public boolean isDaemon() {
    return _daemon;
  }

  public int numThreadsCreated() {
    return _numThreads.get();
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = new Thread(r, _prefix + "-" + _numThreads.getAndIncrement());
    thread.setDaemon(_daemon);
    thread.setUncaughtExceptionHandler(
        (t, e) -> _ownerLogger.error("Thread {} of drift monitor died with an uncaught exception.", t.getName(), e));
    return thread;
  }
}
