/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.drift.exception.NotificationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.DRIFT_MONITOR_SENSOR;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * Delivers admitted {@link DriftEvent}s to the {@link MetricNotifier} on its own executor, so that a slow or failing
 * notifier never delays a check. Every failed delivery is logged and counted.
 */
public class NotificationDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);
  private final MetricNotifier _notifier;
  private final Executor _executor;
  private final long _shutdownTimeoutMs;
  private final Meter _sentRate;
  private final Meter _failedRate;

  /**
   * @param notifier The notifier to deliver events to.
   * @param executor The executor to run deliveries on, in submission order.
   * @param shutdownTimeoutMs Maximum time to wait for queued deliveries on shutdown.
   * @param dropwizardMetricRegistry The metric registry to report deliveries to, or {@code null}.
   */
  public NotificationDispatcher(MetricNotifier notifier,
                                Executor executor,
                                long shutdownTimeoutMs,
                                MetricRegistry dropwizardMetricRegistry) {
    _notifier = validateNotNull(notifier, "Notifier cannot be null.");
    _executor = validateNotNull(executor, "Executor cannot be null.");
    _shutdownTimeoutMs = shutdownTimeoutMs;
    if (dropwizardMetricRegistry != null) {
      _sentRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "notification-sent-rate"));
      _failedRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "notification-failed-rate"));
    } else {
      _sentRate = new Meter();
      _failedRate = new Meter();
    }
  }

  /**
   * Queue the given event for delivery.
   *
   * @param event An event admitted by the notification policy.
   */
  public void dispatch(DriftEvent event) {
    try {
      _executor.execute(() -> deliver(event));
    } catch (RejectedExecutionException e) {
      LOG.warn("Dropped notification of {} because the dispatcher is shut down.", event, e);
      _failedRate.mark();
    }
  }

  private void deliver(DriftEvent event) {
    try {
      if (_notifier.notify(event)) {
        LOG.debug("Delivered notification of {}.", event);
        _sentRate.mark();
      } else {
        LOG.warn("Notifier {} did not deliver notification of {}.", _notifier.getClass().getSimpleName(), event);
        _failedRate.mark();
      }
    } catch (NotificationException e) {
      LOG.warn("Failed to deliver notification of {}.", event, e);
      _failedRate.mark();
    } catch (RuntimeException e) {
      LOG.error("Unexpected exception in notifier {} while delivering {}.", _notifier.getClass().getName(), event, e);
      _failedRate.mark();
    }
  }

  /**
   * Stop accepting events and wait up to the shutdown timeout for the queued deliveries.
   */
  public void shutdown() {
    if (!(_executor instanceof ExecutorService)) {
      return;
    }
    ExecutorService executorService = (ExecutorService) _executor;
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(_shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        LOG.warn("The notification dispatcher failed to shutdown in {} ms, dropping queued notifications.", _shutdownTimeoutMs);
        executorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for notification dispatcher to shutdown.");
      executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public MetricNotifier notifier() {
    return _notifier;
  }

  /**
   * @return Number of events delivered successfully.
   */
  public long numSent() {
    return _sentRate.getCount();
  }

  /**
   * @return Number of events whose delivery failed.
   */
  public long numFailed() {
    return _failedRate.getCount();
  }
}
