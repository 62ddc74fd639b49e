/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.common.DriftConfigurable;
import com.linkedin.drift.exception.NotificationException;


/**
 * The interface for delivering {@link DriftEvent}s to an external channel. Implementations are instantiated by
 * reflection from the configured class name.
 *
 * <p>The notifier is only invoked for events admitted by the notification policy, on a dedicated thread, one event at
 * a time. It may block on network I/O.
 */
public interface MetricNotifier extends DriftConfigurable {

  /**
   * Deliver the given event.
   *
   * @param event The event to deliver.
   * @return {@code true} if the event was delivered, {@code false} if the channel rejected it or is not set up.
   * @throws NotificationException If the delivery failed.
   */
  boolean notify(DriftEvent event) throws NotificationException;
}
