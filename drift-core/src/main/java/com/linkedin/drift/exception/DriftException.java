/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.exception;

/**
 * Base class of the checked failures raised while monitoring a metric. Each subclass is scoped to one metric (or one
 * notification) and never aborts a whole check.
 */
public class DriftException extends Exception {

  public DriftException(String message, Throwable cause) {
    super(message, cause);
  }

  public DriftException(String message) {
    super(message);
  }

  public DriftException(Throwable cause) {
    super(cause);
  }
}
