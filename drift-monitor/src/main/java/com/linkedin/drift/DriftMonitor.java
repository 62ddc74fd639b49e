/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.drift.collector.MetricProducer;
import com.linkedin.drift.collector.MetricsCollector;
import com.linkedin.drift.common.DriftThreadFactory;
import com.linkedin.drift.common.utils.AutoCloseableLock;
import com.linkedin.drift.config.DriftMonitorConfig;
import com.linkedin.drift.detector.MetricConfig;
import com.linkedin.drift.exception.MetricCollectionException;
import com.linkedin.drift.monitor.AnomalyEvaluator;
import com.linkedin.drift.monitor.AnomalyRecord;
import com.linkedin.drift.monitor.CheckHistory;
import com.linkedin.drift.monitor.CheckResult;
import com.linkedin.drift.monitor.MetricAnomalyState;
import com.linkedin.drift.monitor.MetricConfigStore;
import com.linkedin.drift.monitor.MetricRegistration;
import com.linkedin.drift.monitor.MonitorLoop;
import com.linkedin.drift.monitor.MonitorState;
import com.linkedin.drift.notifier.DriftEvent;
import com.linkedin.drift.notifier.MetricNotifier;
import com.linkedin.drift.notifier.NotificationDecision;
import com.linkedin.drift.notifier.NotificationDispatcher;
import com.linkedin.drift.notifier.NotificationPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.DRIFT_MONITOR_SENSOR;
import static com.linkedin.drift.DriftUtils.OPERATION_LOGGER;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;
import static com.linkedin.drift.config.constants.MonitorConfig.CHECK_INTERVAL_MS_CONFIG;
import static com.linkedin.drift.config.constants.MonitorConfig.HISTORY_CAPACITY_CONFIG;
import static com.linkedin.drift.config.constants.MonitorConfig.METRICS_COLLECTOR_CLASS_CONFIG;
import static com.linkedin.drift.config.constants.MonitorConfig.MIN_ANOMALY_DURATION_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.ANOMALY_NOTIFIER_CLASS_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.NOTIFICATION_COOL_DOWN_MS_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.NOTIFICATION_RATE_LIMIT_MAX_COUNT_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.NOTIFICATION_RATE_LIMIT_WINDOW_MS_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.NOTIFIER_SHUTDOWN_TIMEOUT_MS_CONFIG;
import static com.linkedin.drift.config.constants.NotifierConfig.RECOVERY_NOTIFICATION_ENABLED_CONFIG;


/**
 * The main class of Drift Monitor.
 *
 * <p>Periodically samples the configured metrics, runs each one through its drift detector and anomaly tracker, keeps
 * the recent check results, and notifies about anomalies as they become active, escalate and recover. All public
 * methods are thread safe. Checks, whether run by the background loop or requested through {@link #checkMetrics()},
 * are serialized, and the state they share with the configuration methods is guarded by a single lock that is never
 * held while collecting metrics or delivering notifications.
 *
 * <p>A monitor is created {@link MonitorState#STOPPED}, may be started and stopped any number of times, and can no
 * longer be started once {@link #close() closed}.
 */
public class DriftMonitor implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(DriftMonitor.class);
  private static final Logger OPERATION_LOG = LoggerFactory.getLogger(OPERATION_LOGGER);
  private static final long LOOP_TERMINATION_LOG_INTERVAL_MS = TimeUnit.SECONDS.toMillis(10);
  private final Time _time;
  // Guards the state shared by checks and configuration calls.
  private final Lock _lock;
  // Serializes checks, held across collection and commit.
  private final Lock _checkLock;
  private final MetricsCollector _collector;
  private final MetricConfigStore _configStore;
  private final AnomalyEvaluator _evaluator;
  private final CheckHistory _history;
  private final NotificationPolicy _notificationPolicy;
  private final NotificationDispatcher _notificationDispatcher;
  private final Meter _checkRate;
  private final Meter _anomalyRate;
  private final Timer _checkTimer;
  private volatile long _checkIntervalMs;
  private volatile MonitorState _state;
  private volatile MonitorLoop _loop;
  private ExecutorService _loopExecutor;
  private Map<String, Double> _latestMetrics;
  private CheckResult _latestResult;

  /**
   * Construct a drift monitor with the system time and its own metric registry.
   *
   * @param props The configuration properties.
   */
  public DriftMonitor(Map<?, ?> props) {
    this(new DriftMonitorConfig(props), Time.SYSTEM, new MetricRegistry());
  }

  /**
   * Construct a drift monitor with the collector and notifier classes given in the config.
   *
   * @param config The configuration of the monitor.
   * @param time The time to timestamp and schedule checks with.
   * @param dropwizardMetricRegistry The metric registry that holds all the metrics for monitoring the drift monitor.
   */
  public DriftMonitor(DriftMonitorConfig config, Time time, MetricRegistry dropwizardMetricRegistry) {
    this(config,
         time,
         dropwizardMetricRegistry,
         config.getConfiguredInstance(METRICS_COLLECTOR_CLASS_CONFIG, MetricsCollector.class),
         config.getConfiguredInstance(ANOMALY_NOTIFIER_CLASS_CONFIG, MetricNotifier.class),
         Executors.newSingleThreadExecutor(DriftThreadFactory.forNotificationDispatcher(LOG)));
  }

  /**
   * Package private for unit tests.
   */
  DriftMonitor(DriftMonitorConfig config,
               Time time,
               MetricRegistry dropwizardMetricRegistry,
               MetricsCollector collector,
               MetricNotifier notifier,
               Executor notificationExecutor) {
    validateNotNull(config, "Config cannot be null.");
    validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
    _time = validateNotNull(time, "Time cannot be null.");
    _collector = validateNotNull(collector, "Metrics collector cannot be null.");
    _lock = new ReentrantLock();
    _checkLock = new ReentrantLock();
    _configStore = new MetricConfigStore(_lock, config.metricConfigs());
    _evaluator = new AnomalyEvaluator(_lock, _configStore, config.getInt(MIN_ANOMALY_DURATION_CONFIG));
    _history = new CheckHistory(_lock, config.getInt(HISTORY_CAPACITY_CONFIG));
    _notificationPolicy = new NotificationPolicy(_lock,
                                                 time,
                                                 config.getLong(NOTIFICATION_COOL_DOWN_MS_CONFIG),
                                                 config.getInt(NOTIFICATION_RATE_LIMIT_MAX_COUNT_CONFIG),
                                                 config.getLong(NOTIFICATION_RATE_LIMIT_WINDOW_MS_CONFIG),
                                                 config.getBoolean(RECOVERY_NOTIFICATION_ENABLED_CONFIG),
                                                 dropwizardMetricRegistry);
    _notificationDispatcher = new NotificationDispatcher(notifier,
                                                         notificationExecutor,
                                                         config.getLong(NOTIFIER_SHUTDOWN_TIMEOUT_MS_CONFIG),
                                                         dropwizardMetricRegistry);
    _checkIntervalMs = config.getLong(CHECK_INTERVAL_MS_CONFIG);
    _state = MonitorState.STOPPED;
    _latestMetrics = Collections.emptyMap();
    _latestResult = null;

    _checkRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "check-rate"));
    _anomalyRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "anomaly-rate"));
    _checkTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "check-timer"));
    registerGaugeSensors(dropwizardMetricRegistry);
  }

  private void registerGaugeSensors(MetricRegistry dropwizardMetricRegistry) {
    dropwizardMetricRegistry.register(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "active-anomalies"),
                                      (Gauge<Integer>) _evaluator::numActiveAnomalies);
    dropwizardMetricRegistry.register(MetricRegistry.name(DRIFT_MONITOR_SENSOR, "history-size"),
                                      (Gauge<Integer>) _history::size);
  }

  /**
   * Start the background checks. Does nothing if the monitor is already running.
   *
   * @throws IllegalStateException If the monitor is closed.
   */
  public synchronized void start() {
    if (_state == MonitorState.CLOSED) {
      throw new IllegalStateException("Cannot start a closed drift monitor.");
    }
    if (_state == MonitorState.RUNNING) {
      if (!_loop.hasExited()) {
        LOG.info("Drift monitor is already running.");
        return;
      }
      LOG.warn("Drift monitor loop exited after {} checks, restarting it.", _loop.numChecks());
      stop();
    }
    _loop = new MonitorLoop(_time, _checkIntervalMs, this::checkMetrics);
    _loopExecutor = Executors.newSingleThreadExecutor(DriftThreadFactory.forMonitorLoop(LOG));
    _loopExecutor.execute(_loop);
    _state = MonitorState.RUNNING;
    LOG.info("Drift monitor started with a check interval of {} ms.", _checkIntervalMs);
  }

  /**
   * Stop the background checks and wait for the loop thread to exit. Does nothing if the monitor is not running.
   */
  public synchronized void stop() {
    if (_state != MonitorState.RUNNING) {
      LOG.debug("Drift monitor is not running.");
      return;
    }
    LOG.info("Stopping drift monitor...");
    _loop.shutdown();
    _loopExecutor.shutdown();
    try {
      while (!_loopExecutor.awaitTermination(LOOP_TERMINATION_LOG_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("Waiting for the drift monitor loop to finish its current check.");
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for the drift monitor loop to stop.");
      Thread.currentThread().interrupt();
    }
    _loop = null;
    _loopExecutor = null;
    _state = MonitorState.STOPPED;
    LOG.info("Drift monitor stopped.");
  }

  /**
   * Stop the monitor, deliver the queued notifications within the notifier shutdown timeout and close the collector.
   * Closing a closed monitor does nothing.
   */
  @Override
  public synchronized void close() {
    if (_state == MonitorState.CLOSED) {
      return;
    }
    stop();
    _state = MonitorState.CLOSED;
    _notificationDispatcher.shutdown();
    try {
      _collector.close();
    } catch (RuntimeException e) {
      LOG.warn("Failed to close metrics collector {}.", _collector.getClass().getName(), e);
    }
    LOG.info("Drift monitor closed.");
  }

  /**
   * @return The state of the monitor. A monitor whose loop has exited on its own is reported as stopped.
   */
  public MonitorState state() {
    MonitorState state = _state;
    MonitorLoop loop = _loop;
    if (state == MonitorState.RUNNING && loop != null && loop.hasExited()) {
      return MonitorState.STOPPED;
    }
    return state;
  }

  public boolean isRunning() {
    return state() == MonitorState.RUNNING;
  }

  /**
   * Run a check now, on fresh samples from the collector and the custom metric producers.
   *
   * @return The result of the check.
   */
  public CheckResult checkMetrics() {
    return check(null);
  }

  /**
   * Run a check now, on the given samples instead of collected ones. Entries that do not name a registered metric
   * are ignored. The detector and anomaly state advance exactly as in a scheduled check, but the schedule of the
   * background checks is not affected.
   *
   * @param samples Metric name to its sampled value.
   * @return The result of the check.
   */
  public CheckResult checkMetrics(Map<String, Double> samples) {
    return check(validateNotNull(samples, "Samples cannot be null."));
  }

  private CheckResult check(Map<String, Double> samples) {
    if (_state == MonitorState.CLOSED) {
      throw new IllegalStateException("Cannot check metrics of a closed drift monitor.");
    }
    CheckResult result;
    List<DriftEvent> admitted = new ArrayList<>();
    try (AutoCloseableLock checkLock = new AutoCloseableLock(_checkLock)) {
      final Timer.Context ctx = _checkTimer.time();
      try {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        if (samples == null) {
          collect(_configStore.enabledRegistrations(), snapshot, errors);
        } else {
          Map<String, MetricConfig> registered = _configStore.listAll();
          samples.forEach((metric, value) -> {
            if (value != null && registered.containsKey(metric)) {
              snapshot.put(metric, value);
            }
          });
        }

        try (AutoCloseableLock commitLock = new AutoCloseableLock(_lock)) {
          AnomalyEvaluator.Evaluation evaluation = _evaluator.evaluate(snapshot, errors, _time.milliseconds());
          result = evaluation.result();
          _history.add(result);
          _latestMetrics = result.metrics();
          _latestResult = result;
          for (DriftEvent transition : evaluation.transitions()) {
            if (_notificationPolicy.onTransition(transition).action() == NotificationDecision.Action.SEND) {
              admitted.add(transition);
            }
          }
          LOG.trace("Committed check of {} metrics in {} ms.", result.scores().size(), commitLock.heldMs());
        }
      } finally {
        ctx.stop();
      }
      // Queued before the next check commits, so notifications go out in check order.
      admitted.forEach(_notificationDispatcher::dispatch);
    }

    _checkRate.mark();
    if (result.hasAnomalies()) {
      _anomalyRate.mark(result.anomalyCount());
      LOG.warn("Detected {} active anomalies.", result.anomalyCount());
      for (AnomalyRecord anomaly : result.anomalies()) {
        LOG.warn("Anomaly {}", anomaly);
      }
    }
    return result;
  }

  /**
   * Sample the collector and the producers of the enabled custom metrics. A custom metric takes precedence over a
   * collected metric of the same name.
   */
  private void collect(List<MetricRegistration> registrations, Map<String, Double> snapshot, Map<String, String> errors) {
    try {
      Map<String, Double> collected = _collector.collect();
      if (collected != null) {
        snapshot.putAll(collected);
      }
    } catch (MetricCollectionException | RuntimeException e) {
      LOG.warn("Failed to collect metrics with {}.", _collector.getClass().getSimpleName(), e);
    }

    for (MetricRegistration registration : registrations) {
      if (!registration.isCustom()) {
        continue;
      }
      String metric = registration.name();
      snapshot.remove(metric);
      try {
        snapshot.put(metric, registration.producer().produce());
      } catch (MetricCollectionException | RuntimeException e) {
        LOG.warn("Failed to produce custom metric {}.", metric, e);
        errors.put(metric, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      }
    }
  }

  /**
   * Set the config of a metric, registering the metric if it is unknown. The detection of the metric restarts with
   * the next check.
   *
   * @param name Name of the metric.
   * @param config The new config of the metric.
   */
  public void configureMetric(String name, MetricConfig config) {
    _configStore.set(name, config);
  }

  /**
   * @param name Name of the metric.
   * @return The config of the metric, or {@code null} if the metric is not registered.
   */
  public MetricConfig metricConfig(String name) {
    return _configStore.get(name);
  }

  /**
   * @return The config of every registered metric by name, in registration order.
   */
  public Map<String, MetricConfig> configuration() {
    return _configStore.listAll();
  }

  /**
   * @param name Name of a registered metric.
   * @param enabled {@code true} to enable the metric, {@code false} to disable it.
   */
  public void setMetricEnabled(String name, boolean enabled) {
    _configStore.setEnabled(name, enabled);
  }

  /**
   * Register a metric sampled by the given producer on every check.
   *
   * @param name Name of the metric.
   * @param producer Supplier of the metric value.
   * @param config Config of the metric.
   */
  public void registerCustomMetric(String name, MetricProducer producer, MetricConfig config) {
    _configStore.registerCustom(name, producer, config);
  }

  /**
   * Remove a metric along with its detection state and its notification cool down.
   *
   * @param name Name of a registered metric.
   */
  public void removeMetric(String name) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _configStore.remove(name);
      _evaluator.forget(name);
      _notificationPolicy.forget(name);
    }
  }

  /**
   * @return The recent check results, oldest first.
   */
  public List<CheckResult> history() {
    return _history.results();
  }

  /**
   * @return The metric snapshot of the last check, empty if no check has run yet.
   */
  public Map<String, Double> latestMetrics() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _latestMetrics;
    }
  }

  /**
   * @return The result of the last check, or {@code null} if no check has run yet.
   */
  public CheckResult latestResult() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _latestResult;
    }
  }

  /**
   * @return The anomaly state of every metric evaluated since it was last configured.
   */
  public Map<String, MetricAnomalyState> anomalyStates() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      return _evaluator.anomalyStates(_notificationPolicy.lastNotifiedMsByMetric());
    }
  }

  /**
   * Forget the detection state of every metric, the check history and the notification cool downs and rate limit.
   * Metric configs are kept.
   */
  public void reset() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      _evaluator.reset();
      _history.clear();
      _notificationPolicy.reset();
      _latestMetrics = Collections.emptyMap();
      _latestResult = null;
    }
    OPERATION_LOG.info("Reset the detection state and check history of the drift monitor.");
  }

  public long checkIntervalMs() {
    return _checkIntervalMs;
  }

  /**
   * @param checkIntervalMs The interval between the starts of two consecutive background checks, effective after
   * the current check.
   */
  public synchronized void setCheckIntervalMs(long checkIntervalMs) {
    if (checkIntervalMs < 1) {
      throw new ConfigException(CHECK_INTERVAL_MS_CONFIG, checkIntervalMs, "Check interval must be positive.");
    }
    if (_loop != null) {
      _loop.setCheckIntervalMs(checkIntervalMs);
    }
    _checkIntervalMs = checkIntervalMs;
    OPERATION_LOG.info("Set check interval to {} ms.", checkIntervalMs);
  }

  public int minAnomalyDuration() {
    return _evaluator.minAnomalyDuration();
  }

  /**
   * @param minAnomalyDuration Number of anomalous samples in a row that make an anomaly active, effective from the
   * next check.
   */
  public void setMinAnomalyDuration(int minAnomalyDuration) {
    _evaluator.setMinAnomalyDuration(minAnomalyDuration);
    OPERATION_LOG.info("Set minimum anomaly duration to {}.", minAnomalyDuration);
  }

  public long coolDownMs() {
    return _notificationPolicy.coolDownMs();
  }

  /**
   * @param coolDownMs Minimum time between two anomaly or escalation notifications of the same metric.
   */
  public void setCoolDownMs(long coolDownMs) {
    _notificationPolicy.setCoolDownMs(coolDownMs);
    OPERATION_LOG.info("Set notification cool down to {} ms.", coolDownMs);
  }

  /**
   * @return Number of notifications delivered successfully.
   */
  public long numNotificationsSent() {
    return _notificationDispatcher.numSent();
  }

  /**
   * @return Number of notifications whose delivery failed.
   */
  public long numNotificationsFailed() {
    return _notificationDispatcher.numFailed();
  }
}
