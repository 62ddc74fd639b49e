/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.common.utils;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * Holds the given lock from construction until {@link #close()}, so that a critical section can be written as a
 * try-with-resources block. The time the lock has been held is available for slow critical section reporting.
 */
public class AutoCloseableLock implements AutoCloseable {

  private final Lock _lock;
  private final AtomicBoolean _closed;
  private final long _acquiredNs;
  private volatile long _releasedNs;

  public AutoCloseableLock(Lock lock) {
    _lock = validateNotNull(lock, "Lock cannot be null");
    _closed = new AtomicBoolean(false);
    _lock.lock();
    _acquiredNs = System.nanoTime();
  }

  /**
   * @return Time in milliseconds this lock has been held, or was held until it got closed.
   */
  public long heldMs() {
    long endNs = _closed.get() ? _releasedNs : System.nanoTime();
    return TimeUnit.NANOSECONDS.toMillis(endNs - _acquiredNs);
  }

  /**
   * Release the lock. Calling it more than once is a no-op.
   *
   * @throws IllegalStateException If the underlying lock could not be released, i.e. it is not held by this thread.
   */
  @Override
  public void close() {
    if (_closed.compareAndSet(false, true)) {
      _releasedNs = System.nanoTime();
      try {
        _lock.unlock();
      } catch (Exception e) {
        throw new IllegalStateException("while invoking close action", e);
      }
    }
  }

  // Visible for testing purpose
  boolean isClosed() {
    return _closed.get();
  }
}
