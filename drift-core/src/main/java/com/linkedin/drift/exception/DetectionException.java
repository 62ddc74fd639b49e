/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.exception;

/**
 * Thrown when a sample cannot be evaluated by a detector, e.g. because it is not a finite number. The detector state
 * of the metric is left untouched.
 */
public class DetectionException extends DriftException {

  public DetectionException(String message) {
    super(message);
  }
}
