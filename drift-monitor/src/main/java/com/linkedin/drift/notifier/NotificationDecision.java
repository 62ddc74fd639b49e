/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

/**
 * The decision of the {@link NotificationPolicy} for a {@link DriftEvent}.
 */
public final class NotificationDecision {
  public enum Action {
    SEND, SUPPRESS
  }

  public enum Reason {
    /**
     * The metric was notified within the cool down period.
     */
    COOL_DOWN,
    /**
     * The global number of notifications within the rate limit window has been reached.
     */
    RATE_LIMITED,
    /**
     * Recovery notifications are disabled.
     */
    RECOVERY_DISABLED
  }

  private static final NotificationDecision SEND_DECISION = new NotificationDecision(Action.SEND, null, -1L);
  private final Action _action;
  private final Reason _reason;
  private final long _retryAfterMs;

  private NotificationDecision(Action action, Reason reason, long retryAfterMs) {
    if (action == Action.SEND && reason != null) {
      throw new IllegalArgumentException("The send action should not have a suppression reason.");
    }
    _action = action;
    _reason = reason;
    _retryAfterMs = retryAfterMs;
  }

  /**
   * @return A decision to indicate sending the notification.
   */
  public static NotificationDecision send() {
    return SEND_DECISION;
  }

  /**
   * @param reason Why the notification is suppressed.
   * @param retryAfterMs Time in milliseconds until a notification of the same kind would be admitted, or {@code -1}
   *                     if waiting would not help.
   * @return A decision to indicate suppressing the notification.
   */
  public static NotificationDecision suppress(Reason reason, long retryAfterMs) {
    if (reason == null) {
      throw new IllegalArgumentException("A suppressed notification must have a reason.");
    }
    return new NotificationDecision(Action.SUPPRESS, reason, retryAfterMs);
  }

  public Action action() {
    return _action;
  }

  /**
   * @return The suppression reason. Valid only if the action is {@link Action#SUPPRESS}.
   */
  public Reason reason() {
    return _reason;
  }

  /**
   * @return The time until a retry may be admitted. Valid only if the action is {@link Action#SUPPRESS}.
   */
  public long retryAfterMs() {
    return _retryAfterMs;
  }

  @Override
  public String toString() {
    return _action == Action.SEND ? "{" + _action + "}" : "{" + _action + "," + _reason + "," + _retryAfterMs + "}";
  }
}
