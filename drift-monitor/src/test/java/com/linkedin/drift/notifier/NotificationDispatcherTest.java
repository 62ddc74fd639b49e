/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.drift.common.DriftThreadFactory;
import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.exception.NotificationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.easymock.EasyMock;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertEquals;


/**
 * Unit test for {@link NotificationDispatcher}.
 */
public class NotificationDispatcherTest {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcherTest.class);
  private static final DriftEvent EVENT = new DriftEvent(DriftEvent.Type.ANOMALY, "cpu_percent", 90.0, 55.0,
                                                         DetectionAlgorithm.CUMULATIVE, AnomalySeverity.HIGH, 3, 0L);

  @Test
  public void testDeliveryOutcomesAreCounted() throws NotificationException {
    MetricNotifier notifier = EasyMock.mock(MetricNotifier.class);
    EasyMock.expect(notifier.notify(EVENT)).andReturn(true);
    EasyMock.expect(notifier.notify(EVENT)).andReturn(false);
    EasyMock.expect(notifier.notify(EVENT)).andThrow(new NotificationException("webhook unreachable"));
    EasyMock.expect(notifier.notify(EVENT)).andThrow(new IllegalArgumentException("bad payload"));
    EasyMock.replay(notifier);

    NotificationDispatcher dispatcher = new NotificationDispatcher(notifier, Runnable::run, 1000L, new MetricRegistry());
    for (int i = 0; i < 4; i++) {
      dispatcher.dispatch(EVENT);
    }
    assertEquals(1, dispatcher.numSent());
    assertEquals(3, dispatcher.numFailed());
    EasyMock.verify(notifier);
  }

  @Test
  public void testShutdownDrainsQueuedDeliveries() throws NotificationException {
    MetricNotifier notifier = EasyMock.mock(MetricNotifier.class);
    EasyMock.expect(notifier.notify(EVENT)).andReturn(true).times(3);
    EasyMock.replay(notifier);

    ExecutorService executor = Executors.newSingleThreadExecutor(DriftThreadFactory.forNotificationDispatcher(LOG));
    NotificationDispatcher dispatcher = new NotificationDispatcher(notifier, executor, 10000L, null);
    for (int i = 0; i < 3; i++) {
      dispatcher.dispatch(EVENT);
    }
    dispatcher.shutdown();
    assertEquals(3, dispatcher.numSent());

    // Events dispatched after shutdown are dropped and counted as failed.
    dispatcher.dispatch(EVENT);
    assertEquals(1, dispatcher.numFailed());
    EasyMock.verify(notifier);
  }
}
