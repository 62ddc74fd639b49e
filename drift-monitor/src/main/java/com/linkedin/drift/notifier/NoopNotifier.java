/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import java.util.Map;


/**
 * A notifier that accepts every event without delivering it anywhere.
 */
public class NoopNotifier implements MetricNotifier {

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public boolean notify(DriftEvent event) {
    return true;
  }
}
