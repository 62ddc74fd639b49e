/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.monitor;

/**
 * The state of a drift monitor. A monitor moves between {@link #STOPPED} and {@link #RUNNING} until it is closed.
 */
public enum MonitorState {
  STOPPED, RUNNING, CLOSED
}
