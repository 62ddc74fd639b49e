/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.exception;

/**
 * Thrown when a metric value cannot be collected in the current check.
 */
public class MetricCollectionException extends DriftException {

  public MetricCollectionException(String message, Throwable cause) {
    super(message, cause);
  }

  public MetricCollectionException(String message) {
    super(message);
  }
}
