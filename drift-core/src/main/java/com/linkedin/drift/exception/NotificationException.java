/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.exception;

/**
 * Thrown by a notifier that failed to deliver an event.
 */
public class NotificationException extends DriftException {

  public NotificationException(String message, Throwable cause) {
    super(message, cause);
  }

  public NotificationException(String message) {
    super(message);
  }
}
