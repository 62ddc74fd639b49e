/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import com.linkedin.drift.exception.DetectionException;


/**
 * Helpers shared by the {@link MetricDetector} implementations.
 */
final class DetectorUtils {

  private DetectorUtils() {
  }

  static void ensureFinite(double value) throws DetectionException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new DetectionException("Cannot evaluate non-finite sample " + value);
    }
  }

  static <S extends DetectorState> S ensureState(DetectorState state, Class<S> stateClass) {
    if (!stateClass.isInstance(state)) {
      throw new IllegalArgumentException(String.format("Expected detector state of type %s but got %s.",
                                                       stateClass.getSimpleName(), state));
    }
    return stateClass.cast(state);
  }
}
