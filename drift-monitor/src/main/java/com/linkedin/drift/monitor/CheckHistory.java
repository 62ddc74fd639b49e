/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

import com.linkedin.drift.common.utils.AutoCloseableLock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;

import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * The most recent check results, oldest first. Once full, adding a result evicts the oldest one.
 */
public class CheckHistory {
  private final Lock _lock;
  private final int _capacity;
  private final Deque<CheckResult> _results;

  public CheckHistory(Lock lock, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
    }
    _lock = validateNotNull(lock, "Lock cannot be null.");
    _capacity = capacity;
    _results = new ArrayDeque<>(capacity);
  }

  /**
   * @param result The result to append.
   * @return The evicted result, or {@code null} if nothing was evicted.
   */
  public CheckResult add(CheckResult result) {
    validateNotNull(result, "Check result cannot be null.");
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      CheckResult evicted = _results.size() == _capacity ? _results.pollFirst() : null;
      _results.addLast(result);
      return evicted;
    }
  }

  /**
   * @return A copy of the results, oldest first.
   */
  public List<CheckResult> results() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return Collections.unmodifiableList(new ArrayList<>(_results));
    }
  }

  /**
   * @return The most recent result, or {@code null} if the history is empty.
   */
  public CheckResult latest() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _results.peekLast();
    }
  }

  public int size() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _results.size();
    }
  }

  public int capacity() {
    return _capacity;
  }

  public void clear() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _results.clear();
    }
  }
}
