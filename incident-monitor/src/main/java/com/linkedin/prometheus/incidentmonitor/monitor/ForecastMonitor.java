/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.incidentmonitor.common.FailureType;
import com.linkedin.incidentmonitor.common.Result;
import com.linkedin.incidentmonitor.detector.AnomalyEvaluator;
import com.linkedin.incidentmonitor.exception.InsufficientDataException;
import com.linkedin.incidentmonitor.forecast.ForecastModel;
import com.linkedin.incidentmonitor.forecast.ForecastOracle;
import com.linkedin.incidentmonitor.model.EvaluationResult;
import com.linkedin.incidentmonitor.model.ForecastPoint;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import com.linkedin.incidentmonitor.publisher.MetricPublisher;
import com.linkedin.incidentmonitor.telemetry.TelemetrySource;
import com.linkedin.prometheus.incidentmonitor.IncidentMonitorThreadFactory;
import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MetricsServerConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MonitorConfig;
import com.linkedin.prometheus.incidentmonitor.publisher.MetricNames;
import com.linkedin.prometheus.incidentmonitor.telemetry.TrainingFileLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.incidentmonitor.common.utils.Utils.utcDateFor;
import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.SCHEDULER_SHUTDOWN_TIMEOUT_MS;
import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.shutdownScheduler;

/**
 * Monitors the latency of one source to destination service pair against a forecast.
 *
 * Two task chains share a single thread:
 * <ul>
 *   <li>The evaluation chain fetches the live value, scores it against the active model and publishes the result.
 *   It runs every polling interval, or after the retry backoff if the fetch failed or no model is trained yet.</li>
 *   <li>The retrain chain fits a new model on a trailing window. It runs every retrain interval, or after the retry
 *   backoff if the refresh failed. A failed refresh keeps the previous model.</li>
 * </ul>
 * Failures never stop either chain.
 */
public class ForecastMonitor {
  private static final Logger LOG = LoggerFactory.getLogger(ForecastMonitor.class);
  static final String FORECAST_MONITOR_SENSOR = "ForecastMonitor";
  static final int MIN_VALID_TRAINING_POINTS = 2;
  static final String TRAINING_FILE_SUFFIX = ".json";
  private static final String ANOMALY_COUNT_HELP = "1 if the live value is outside the forecast interval, 0 otherwise.";
  private static final String MAE_SCORE_HELP = "Absolute error of the live value against the forecast.";
  private static final String MAPE_SCORE_HELP = "Absolute percentage error of the live value against the forecast.";
  private static final String CURRENT_VALUE_HELP = "The live value.";
  private static final String PREDICTED_VALUE_HELP = "The forecast value.";
  private static final String YHAT_MIN_HELP = "Lower bound of the forecast interval.";
  private static final String YHAT_MAX_HELP = "Upper bound of the forecast interval.";

  private final ServicePair _servicePair;
  private final TelemetrySource _telemetrySource;
  private final ForecastOracle _forecastOracle;
  private final MetricPublisher _metricPublisher;
  private final AnomalyEvaluator _anomalyEvaluator;
  private final Clock _clock;
  private final ScheduledExecutorService _scheduler;
  private final String _liveQuery;
  private final String _trainingQuery;
  private final long _pollingIntervalMs;
  private final long _retryBackoffMs;
  private final long _trainingLookbackMs;
  private final long _retrainIntervalMs;
  private final Path _trainingFile;
  private final int _perturbationStartIteration;
  private final int _recoveryStartIteration;
  private final String _metricNamePrefix;
  private final EvaluationHistory _history;
  private final long _testStartTimeMs;
  private final Timer _evaluationCycleTimer;
  private final Meter _fetchFailureRate;
  private final Meter _retrainFailureRate;
  // Replaced as a whole by the retrain chain.
  private volatile ActiveModel _activeModel;
  private int _iteration;
  private MonitorPhase _phase;

  public ForecastMonitor(IncidentMonitorConfig config,
                         ServicePair servicePair,
                         TelemetrySource telemetrySource,
                         ForecastOracle forecastOracle,
                         MetricPublisher metricPublisher,
                         MetricRegistry dropwizardMetricRegistry,
                         Clock clock) {
    this(config, servicePair, telemetrySource, forecastOracle, metricPublisher, dropwizardMetricRegistry, clock,
         newScheduler(servicePair));
  }

  /**
   * The chains are one-shot tasks, so pending tasks are dropped on shutdown instead of keeping the scheduler alive
   * until their delay expires.
   *
   * @param servicePair The monitored pair, used in the thread name.
   * @return A single-threaded scheduler for the evaluation and retrain chains.
   */
  static ScheduledExecutorService newScheduler(ServicePair servicePair) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, new IncidentMonitorThreadFactory("ForecastMonitor-" + servicePair.id(), LOG));
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  /**
   * Package private constructor for unit tests.
   */
  ForecastMonitor(IncidentMonitorConfig config,
                  ServicePair servicePair,
                  TelemetrySource telemetrySource,
                  ForecastOracle forecastOracle,
                  MetricPublisher metricPublisher,
                  MetricRegistry dropwizardMetricRegistry,
                  Clock clock,
                  ScheduledExecutorService scheduler) {
    _servicePair = validateNotNull(servicePair, "Service pair cannot be null.");
    _telemetrySource = validateNotNull(telemetrySource, "Telemetry source cannot be null.");
    _forecastOracle = validateNotNull(forecastOracle, "Forecast oracle cannot be null.");
    _metricPublisher = validateNotNull(metricPublisher, "Metric publisher cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _scheduler = validateNotNull(scheduler, "Scheduler cannot be null.");
    _anomalyEvaluator = new AnomalyEvaluator();
    _liveQuery = servicePair.substitute(config.getString(MonitorConfig.MONITOR_LIVE_QUERY_TEMPLATE_CONFIG));
    _trainingQuery = servicePair.substitute(config.getString(MonitorConfig.MONITOR_TRAINING_QUERY_TEMPLATE_CONFIG));
    _pollingIntervalMs = config.getLong(MonitorConfig.MONITOR_POLLING_INTERVAL_MS_CONFIG);
    _retryBackoffMs = config.getLong(MonitorConfig.MONITOR_RETRY_BACKOFF_MS_CONFIG);
    _trainingLookbackMs = config.getLong(MonitorConfig.MONITOR_TRAINING_LOOKBACK_MS_CONFIG);
    _retrainIntervalMs = config.getLong(MonitorConfig.MONITOR_RETRAIN_INTERVAL_MS_CONFIG);
    String trainingDir = config.getString(MonitorConfig.MONITOR_TRAINING_DIR_CONFIG);
    _trainingFile = trainingDir == null ? null : Paths.get(trainingDir, servicePair.id() + TRAINING_FILE_SUFFIX);
    _perturbationStartIteration = config.getInt(MonitorConfig.MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG);
    _recoveryStartIteration = config.getInt(MonitorConfig.MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG);
    _metricNamePrefix = config.getString(MetricsServerConfig.METRICS_NAME_PREFIX_CONFIG);
    _history = new EvaluationHistory(config.getInt(MonitorConfig.MONITOR_SUMMARY_WINDOW_SIZE_CONFIG));
    _testStartTimeMs = clock.millis();
    _evaluationCycleTimer = dropwizardMetricRegistry.timer(
        MetricRegistry.name(FORECAST_MONITOR_SENSOR, servicePair.id(), "evaluation-cycle-timer"));
    _fetchFailureRate = dropwizardMetricRegistry.meter(
        MetricRegistry.name(FORECAST_MONITOR_SENSOR, servicePair.id(), "fetch-failure-rate"));
    _retrainFailureRate = dropwizardMetricRegistry.meter(
        MetricRegistry.name(FORECAST_MONITOR_SENSOR, servicePair.id(), "retrain-failure-rate"));
    _activeModel = null;
    _iteration = 0;
    _phase = null;
  }

  /**
   * Fit the initial model from the training file if there is one, and start the evaluation and retrain chains.
   */
  public void startUp() {
    LOG.info("Starting forecast monitor for {} with live query {}.", _servicePair, _liveQuery);
    boolean seeded = seedFromTrainingFile();
    schedule(this::runRetrain, seeded ? _retrainIntervalMs : 0L);
    schedule(this::runEvaluation, 0L);
  }

  /**
   * Stop the chains and wait for a running cycle to complete.
   */
  public void shutdown() {
    LOG.info("Shutting down forecast monitor for {}.", _servicePair);
    shutdownScheduler(_scheduler, "forecast monitor " + _servicePair, SCHEDULER_SHUTDOWN_TIMEOUT_MS, LOG);
    LOG.info("Forecast monitor for {} shutdown completed.", _servicePair);
  }

  /**
   * Fetch the trailing window ending now. Samples without a numeric value are dropped.
   *
   * @param lookbackMs Length of the window.
   * @return The re-based window, or a failure if the backend returned no usable sample.
   */
  public Result<TrainingWindow> acquireTrainingWindow(long lookbackMs) {
    long endMs = _clock.millis();
    Result<List<Observation>> range = _telemetrySource.fetchRange(_trainingQuery, endMs - lookbackMs, endMs);
    if (!range.isSuccess()) {
      return Result.failure(range.failure());
    }
    List<Observation> valid = new ArrayList<>(range.value().size());
    for (Observation observation : range.value()) {
      if (observation.isValid()) {
        valid.add(observation);
      }
    }
    if (valid.isEmpty()) {
      return Result.failure(FailureType.NO_DATA, "Training query for " + _servicePair + " returned only NaN values.");
    }
    return Result.success(TrainingWindow.rebased(valid));
  }

  /**
   * @param window The training window.
   * @return A model fitted on the window, or a failure if the window has too few valid points.
   */
  public Result<ForecastModel> refreshModel(TrainingWindow window) {
    int validPoints = window.validPointCount();
    if (validPoints < MIN_VALID_TRAINING_POINTS) {
      return Result.failure(FailureType.INSUFFICIENT_DATA,
                            String.format("Training window of %s has %d valid points, at least %d are required.",
                                          _servicePair, validPoints, MIN_VALID_TRAINING_POINTS));
    }
    try {
      return Result.success(_forecastOracle.fit(window));
    } catch (InsufficientDataException ide) {
      return Result.failure(FailureType.INSUFFICIENT_DATA, ide.getMessage(), ide);
    }
  }

  /**
   * @return The live observation, or a failure if it could not be fetched.
   */
  public Result<Observation> fetchLiveObservation() {
    return _telemetrySource.fetchInstant(_liveQuery);
  }

  /**
   * Score the observation against the model. The observation time is re-based on the start time of this monitor,
   * not on the origin of the training window, so a seasonal model sees its phase shifted by the offset between the
   * two (see {@link #trainingOriginOffsetMs()}). The offset is zero modulo the seasonal period only when the training
   * origin and the test start are a whole number of periods apart.
   *
   * @param model The forecast model.
   * @param observation The live observation.
   * @return The evaluation result, carrying the absolute time of the observation.
   */
  public EvaluationResult evaluate(ForecastModel model, Observation observation) {
    long rebasedTimeMs = observation.timestampMs() - _testStartTimeMs;
    List<ForecastPoint> forecast = model.predict(Collections.singletonList(rebasedTimeMs));
    if (forecast.size() != 1) {
      throw new IllegalStateException(String.format("Expected one forecast point for %d, but received %d.",
                                                    rebasedTimeMs, forecast.size()));
    }
    return _anomalyEvaluator.evaluate(observation, forecast.get(0));
  }

  /**
   * Publish the result. Values that are not finite are skipped, so the gauge keeps its previous value.
   *
   * @param result The evaluation result.
   */
  public void publish(EvaluationResult result) {
    publishIfFinite(MetricNames.CURRENT_VALUE, CURRENT_VALUE_HELP, result.observed());
    publishIfFinite(MetricNames.PREDICTED_VALUE, PREDICTED_VALUE_HELP, result.predicted());
    publishIfFinite(MetricNames.YHAT_MIN, YHAT_MIN_HELP, result.lower());
    publishIfFinite(MetricNames.YHAT_MAX, YHAT_MAX_HELP, result.upper());
    publishIfFinite(MetricNames.ANOMALY_COUNT, ANOMALY_COUNT_HELP, result.anomalyCount());
    if (result.mae().isPresent()) {
      publishIfFinite(MetricNames.MAE_SCORE, MAE_SCORE_HELP, result.mae().getAsDouble());
    }
    if (result.mape().isPresent()) {
      publishIfFinite(MetricNames.MAPE_SCORE, MAPE_SCORE_HELP, result.mape().getAsDouble());
    }
  }

  /**
   * Run one evaluation cycle.
   *
   * @return Delay in milliseconds until the next cycle.
   */
  long runEvaluationCycle() {
    final Timer.Context ctx = _evaluationCycleTimer.time();
    try {
      ActiveModel activeModel = _activeModel;
      if (activeModel == null) {
        LOG.info("Skipping evaluation of {} because no model has been trained yet.", _servicePair);
        return _retryBackoffMs;
      }
      Result<Observation> observation = fetchLiveObservation();
      if (!observation.isSuccess()) {
        _fetchFailureRate.mark();
        LOG.warn("Failed to fetch the live value of {}, retrying in {} ms: {}", _servicePair, _retryBackoffMs,
                 observation.failure());
        return _retryBackoffMs;
      }
      updatePhase();
      EvaluationResult result = evaluate(activeModel.model(), observation.value());
      publish(result);
      _history.add(result);
      LOG.info("[{}] {} iteration {}: {}", _servicePair, _phase, _iteration, result);
      LOG.info("[{}] Last {} results: {} anomalies, average MAE {}, average MAPE {}.", _servicePair, _history.size(),
               _history.anomalyCount(), _history.averageMae(), _history.averageMape());
      _iteration++;
      return _pollingIntervalMs;
    } finally {
      ctx.stop();
    }
  }

  /**
   * Fit a new model on the trailing window. On failure the previous model stays active.
   *
   * @return Delay in milliseconds until the next refresh.
   */
  long retrain() {
    Result<TrainingWindow> window = acquireTrainingWindow(_trainingLookbackMs);
    if (!window.isSuccess()) {
      _retrainFailureRate.mark();
      LOG.warn("Failed to acquire the training window of {}, retrying in {} ms: {}", _servicePair, _retryBackoffMs,
               window.failure());
      return _retryBackoffMs;
    }
    if (!activate(window.value())) {
      _retrainFailureRate.mark();
      return _retryBackoffMs;
    }
    return _retrainIntervalMs;
  }

  /**
   * @return The active model, {@code null} if no model has been trained yet.
   */
  @Nullable
  ForecastModel activeModel() {
    ActiveModel activeModel = _activeModel;
    return activeModel == null ? null : activeModel.model();
  }

  /**
   * @return Offset of the training window origin from the test start, {@code null} if no model has been trained yet.
   */
  @Nullable
  Long trainingOriginOffsetMs() {
    ActiveModel activeModel = _activeModel;
    return activeModel == null ? null : activeModel._window.originTimeMs() - _testStartTimeMs;
  }

  MonitorPhase phase() {
    return _phase;
  }

  int iteration() {
    return _iteration;
  }

  long testStartTimeMs() {
    return _testStartTimeMs;
  }

  private boolean activate(TrainingWindow window) {
    Result<ForecastModel> model = refreshModel(window);
    if (!model.isSuccess()) {
      LOG.warn("Failed to refresh the model of {}, keeping the previous one: {}", _servicePair, model.failure());
      return false;
    }
    ActiveModel activeModel = new ActiveModel(window, model.value(), _clock.millis());
    _activeModel = activeModel;
    LOG.info("Activated a new model for {}: {}, training origin is {} ms from the test start.", _servicePair,
             activeModel, window.originTimeMs() - _testStartTimeMs);
    return true;
  }

  private boolean seedFromTrainingFile() {
    if (_trainingFile == null) {
      return false;
    }
    if (!Files.isRegularFile(_trainingFile)) {
      LOG.info("No training file {} for {}, training from Prometheus.", _trainingFile, _servicePair);
      return false;
    }
    TrainingWindow window;
    try {
      window = TrainingFileLoader.load(_trainingFile);
    } catch (IOException ioe) {
      LOG.warn("Failed to load training file {} for {}, training from Prometheus.", _trainingFile, _servicePair, ioe);
      return false;
    }
    return activate(window);
  }

  private void updatePhase() {
    MonitorPhase phase = MonitorPhase.forIteration(_iteration, _perturbationStartIteration, _recoveryStartIteration);
    if (phase != _phase) {
      _phase = phase;
      LOG.info("==================== [{}] {} phase from iteration {} ====================", _servicePair, phase,
               _iteration);
    }
  }

  private void publishIfFinite(String suffix, String help, double value) {
    if (Double.isFinite(value)) {
      _metricPublisher.setGauge(MetricNames.monitorGauge(_metricNamePrefix, _servicePair.id(), suffix), help, value);
    } else {
      LOG.debug("Skipping publication of non-finite {} {} for {}.", suffix, value, _servicePair);
    }
  }

  private void runEvaluation() {
    long delayMs;
    try {
      delayMs = runEvaluationCycle();
    } catch (Exception e) {
      LOG.error("Unexpected exception in the evaluation cycle of {}.", _servicePair, e);
      delayMs = _retryBackoffMs;
    }
    schedule(this::runEvaluation, delayMs);
  }

  private void runRetrain() {
    long delayMs;
    try {
      delayMs = retrain();
    } catch (Exception e) {
      LOG.error("Unexpected exception while retraining the model of {}.", _servicePair, e);
      delayMs = _retryBackoffMs;
    }
    schedule(this::runRetrain, delayMs);
  }

  private void schedule(Runnable task, long delayMs) {
    if (_scheduler.isShutdown()) {
      return;
    }
    try {
      _scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ree) {
      LOG.debug("Forecast monitor for {} is shutting down, dropped the next task.", _servicePair, ree);
    }
  }

  /**
   * The training window and the model fitted on it.
   */
  private static final class ActiveModel {
    private final TrainingWindow _window;
    private final ForecastModel _model;
    private final long _trainedAtMs;

    ActiveModel(TrainingWindow window, ForecastModel model, long trainedAtMs) {
      _window = window;
      _model = model;
      _trainedAtMs = trainedAtMs;
    }

    ForecastModel model() {
      return _model;
    }

    @Override
    public String toString() {
      return String.format("{points: %d, origin: %s, trainedAt: %s}", _window.size(), utcDateFor(_window.originTimeMs()),
                           utcDateFor(_trainedAtMs));
    }
  }
}
