/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.incidentmonitor.common.FailureType;
import com.linkedin.incidentmonitor.common.Result;
import com.linkedin.incidentmonitor.exception.InsufficientDataException;
import com.linkedin.incidentmonitor.forecast.ForecastModel;
import com.linkedin.incidentmonitor.forecast.ForecastOracle;
import com.linkedin.incidentmonitor.model.EvaluationResult;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import com.linkedin.incidentmonitor.telemetry.TelemetrySource;
import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.PrometheusConfig;
import com.linkedin.prometheus.incidentmonitor.publisher.MetricNames;
import com.linkedin.prometheus.incidentmonitor.publisher.PrometheusMetricPublisher;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link ForecastMonitor}. Cycles are run directly on the test thread.
 */
public class ForecastMonitorTest {
  private static final long NOW_MS = 1_700_000_000_000L;
  private static final long POLLING_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  private static final long RETRY_BACKOFF_MS = TimeUnit.SECONDS.toMillis(30);
  private static final long LOOKBACK_MS = TimeUnit.MINUTES.toMillis(10);
  private static final long RETRAIN_INTERVAL_MS = TimeUnit.HOURS.toMillis(1);
  private static final ServicePair PAIR = new ServicePair("frontend", "shippingservice");
  private static final String LIVE_QUERY = "live{src=\"frontend\",dst=\"shippingservice\"}";
  private static final String TRAINING_QUERY = "train{src=\"frontend\",dst=\"shippingservice\"}";
  private static final List<Observation> TRAINING_DATA = Arrays.asList(new Observation(NOW_MS - 120_000L, 4.0),
                                                                       new Observation(NOW_MS - 60_000L, Double.NaN),
                                                                       new Observation(NOW_MS, 6.0));

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  private Properties _props;
  private TelemetrySource _telemetrySource;
  private ScheduledExecutorService _scheduler;
  private MetricRegistry _metricRegistry;
  private PrometheusMetricPublisher _publisher;
  private ConstantForecastOracle _oracle;

  @Before
  public void setUp() {
    _props = new Properties();
    _props.setProperty(PrometheusConfig.PROMETHEUS_SERVER_ENDPOINT_CONFIG, "http://localhost:9090");
    _props.setProperty(MonitorConfig.MONITOR_SERVICE_PAIRS_CONFIG, "frontend:shippingservice");
    _props.setProperty(MonitorConfig.MONITOR_POLLING_INTERVAL_MS_CONFIG, Long.toString(POLLING_INTERVAL_MS));
    _props.setProperty(MonitorConfig.MONITOR_RETRY_BACKOFF_MS_CONFIG, Long.toString(RETRY_BACKOFF_MS));
    _props.setProperty(MonitorConfig.MONITOR_TRAINING_LOOKBACK_MS_CONFIG, Long.toString(LOOKBACK_MS));
    _props.setProperty(MonitorConfig.MONITOR_RETRAIN_INTERVAL_MS_CONFIG, Long.toString(RETRAIN_INTERVAL_MS));
    _props.setProperty(MonitorConfig.MONITOR_LIVE_QUERY_TEMPLATE_CONFIG, "live{src=\"${source}\",dst=\"${destination}\"}");
    _props.setProperty(MonitorConfig.MONITOR_TRAINING_QUERY_TEMPLATE_CONFIG, "train{src=\"${source}\",dst=\"${destination}\"}");
    _props.setProperty(MonitorConfig.MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG, "2");
    _props.setProperty(MonitorConfig.MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG, "3");
    _telemetrySource = EasyMock.mock(TelemetrySource.class);
    _scheduler = EasyMock.mock(ScheduledExecutorService.class);
    _metricRegistry = new MetricRegistry();
    _publisher = new PrometheusMetricPublisher(new PrometheusMeterRegistry(
        io.micrometer.prometheusmetrics.PrometheusConfig.DEFAULT));
    _oracle = new ConstantForecastOracle(100.0, 90.0, 110.0);
  }

  private ForecastMonitor newMonitor(ForecastOracle oracle) {
    IncidentMonitorConfig config = new IncidentMonitorConfig(_props, false);
    return new ForecastMonitor(config, PAIR, _telemetrySource, oracle, _publisher, _metricRegistry,
                               Clock.fixed(Instant.ofEpochMilli(NOW_MS), ZoneOffset.UTC), _scheduler);
  }

  private static String gauge(String suffix) {
    return MetricNames.monitorGauge("monitor", PAIR.id(), suffix);
  }

  private void expectTraining() {
    EasyMock.expect(_telemetrySource.fetchRange(TRAINING_QUERY, NOW_MS - LOOKBACK_MS, NOW_MS))
            .andReturn(Result.success(TRAINING_DATA));
  }

  private void expectLiveValue(double value) {
    EasyMock.expect(_telemetrySource.fetchInstant(LIVE_QUERY)).andReturn(Result.success(new Observation(NOW_MS, value)));
  }

  private void replay() {
    EasyMock.replay(_telemetrySource, _scheduler);
  }

  private void verify() {
    EasyMock.verify(_telemetrySource, _scheduler);
  }

  @Test
  public void testEvaluationIsSkippedWithoutModel() {
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    assertEquals(RETRY_BACKOFF_MS, monitor.runEvaluationCycle());
    assertNull(monitor.activeModel());
    assertNull(_publisher.gaugeValue(gauge(MetricNames.ANOMALY_COUNT)));
    verify();
  }

  @Test
  public void testRetrainDropsNaNAndRebasesWindow() {
    expectTraining();
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    assertEquals(RETRAIN_INTERVAL_MS, monitor.retrain());
    assertNotNull(monitor.activeModel());
    TrainingWindow window = _oracle.windows().get(0);
    assertEquals(NOW_MS - 120_000L, window.originTimeMs());
    assertEquals(Arrays.asList(new Observation(0L, 4.0), new Observation(120_000L, 6.0)), window.observations());
    verify();
  }

  @Test
  public void testFailedRetrainKeepsPreviousModel() {
    expectTraining();
    EasyMock.expect(_telemetrySource.fetchRange(TRAINING_QUERY, NOW_MS - LOOKBACK_MS, NOW_MS))
            .andReturn(Result.failure(FailureType.TRANSPORT_ERROR, "Connection refused"));
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    monitor.retrain();
    ForecastModel model = monitor.activeModel();

    assertEquals(RETRY_BACKOFF_MS, monitor.retrain());
    assertSame(model, monitor.activeModel());
    assertEquals(1, _metricRegistry.meter(
        MetricRegistry.name(ForecastMonitor.FORECAST_MONITOR_SENSOR, PAIR.id(), "retrain-failure-rate")).getCount());
    verify();
  }

  @Test
  public void testAllNaNTrainingWindowIsNoData() {
    EasyMock.expect(_telemetrySource.fetchRange(TRAINING_QUERY, NOW_MS - LOOKBACK_MS, NOW_MS))
            .andReturn(Result.success(Collections.singletonList(new Observation(NOW_MS, Double.NaN))));
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    Result<TrainingWindow> window = monitor.acquireTrainingWindow(LOOKBACK_MS);

    assertFalse(window.isSuccess());
    assertEquals(FailureType.NO_DATA, window.failure().type());
    verify();
  }

  @Test
  public void testRefreshModelRequiresTwoValidPoints() {
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    Result<ForecastModel> model = monitor.refreshModel(
        TrainingWindow.rebased(Arrays.asList(new Observation(NOW_MS, 5.0), new Observation(NOW_MS + 1, Double.NaN))));

    assertEquals(FailureType.INSUFFICIENT_DATA, model.failure().type());
    assertTrue(_oracle.windows().isEmpty());
    verify();
  }

  @Test
  public void testRefreshModelWhenOracleRejectsWindow() {
    replay();
    ForecastMonitor monitor = newMonitor(new ForecastOracle() {
      @Override
      public ForecastModel fit(TrainingWindow window) throws InsufficientDataException {
        throw new InsufficientDataException("Window too short.");
      }

      @Override
      public void configure(Map<String, ?> configs) {

      }
    });

    Result<ForecastModel> model = monitor.refreshModel(TrainingWindow.rebased(TRAINING_DATA));

    assertEquals(FailureType.INSUFFICIENT_DATA, model.failure().type());
    assertEquals("Window too short.", model.failure().message());
    verify();
  }

  @Test
  public void testEvaluateRebasesOnStartTime() {
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    ForecastModel model = fittedModel();

    EvaluationResult result = monitor.evaluate(model, new Observation(NOW_MS + 90_000L, 110.0));

    assertEquals(NOW_MS, monitor.testStartTimeMs());
    assertEquals(Collections.singletonList(90_000L), _oracle.predictedTimestamps());
    assertEquals(NOW_MS + 90_000L, result.timestampMs());
    // On the upper bound, hence not anomalous.
    assertFalse(result.isAnomaly());
    verify();
  }

  @Test
  public void testEvaluateAfterRetrainStaysOnStartTimeAxis() {
    expectTraining();
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    assertNull(monitor.trainingOriginOffsetMs());
    monitor.retrain();

    // The window starts two minutes before the monitor, and its points are re-based on that origin.
    assertEquals(Long.valueOf(-120_000L), monitor.trainingOriginOffsetMs());
    assertEquals(0L, _oracle.windows().get(0).observations().get(0).timestampMs());
    monitor.evaluate(monitor.activeModel(), new Observation(NOW_MS + 90_000L, 100.0));

    // Live points are re-based on the start time, not on the training origin.
    assertEquals(Collections.singletonList(90_000L), _oracle.predictedTimestamps());
    verify();
  }

  private ForecastModel fittedModel() {
    try {
      return _oracle.fit(TrainingWindow.rebased(TRAINING_DATA));
    } catch (InsufficientDataException e) {
      throw new IllegalStateException(e);
    }
  }

  @Test
  public void testEvaluationCyclePublishesGauges() {
    expectTraining();
    expectLiveValue(120.0);
    expectLiveValue(95.0);
    expectLiveValue(100.0);
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    monitor.retrain();

    assertEquals(POLLING_INTERVAL_MS, monitor.runEvaluationCycle());
    assertEquals(MonitorPhase.NORMAL, monitor.phase());
    assertEquals(120.0, _publisher.gaugeValue(gauge(MetricNames.CURRENT_VALUE)), 0.0);
    assertEquals(100.0, _publisher.gaugeValue(gauge(MetricNames.PREDICTED_VALUE)), 0.0);
    assertEquals(90.0, _publisher.gaugeValue(gauge(MetricNames.YHAT_MIN)), 0.0);
    assertEquals(110.0, _publisher.gaugeValue(gauge(MetricNames.YHAT_MAX)), 0.0);
    assertEquals(1.0, _publisher.gaugeValue(gauge(MetricNames.ANOMALY_COUNT)), 0.0);
    assertEquals(20.0, _publisher.gaugeValue(gauge(MetricNames.MAE_SCORE)), 1e-9);
    assertEquals(20.0 / 120.0 * 100.0, _publisher.gaugeValue(gauge(MetricNames.MAPE_SCORE)), 1e-9);

    assertEquals(POLLING_INTERVAL_MS, monitor.runEvaluationCycle());
    assertEquals(0.0, _publisher.gaugeValue(gauge(MetricNames.ANOMALY_COUNT)), 0.0);
    assertEquals(5.0, _publisher.gaugeValue(gauge(MetricNames.MAE_SCORE)), 1e-9);
    assertEquals(MonitorPhase.NORMAL, monitor.phase());

    // Two cycles completed, so the third one is the first of the perturbation phase.
    assertEquals(POLLING_INTERVAL_MS, monitor.runEvaluationCycle());
    assertEquals(MonitorPhase.PERTURBATION, monitor.phase());
    assertEquals(3, monitor.iteration());
    assertEquals(0.0, _publisher.gaugeValue(gauge(MetricNames.MAE_SCORE)), 0.0);
    verify();
  }

  @Test
  public void testFailedFetchLeavesGaugesUnchanged() {
    expectTraining();
    expectLiveValue(120.0);
    EasyMock.expect(_telemetrySource.fetchInstant(LIVE_QUERY))
            .andReturn(Result.failure(FailureType.TRANSPORT_ERROR, "Read timed out"));
    EasyMock.expect(_telemetrySource.fetchInstant(LIVE_QUERY))
            .andReturn(Result.failure(FailureType.NO_DATA, "No series"));
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    monitor.retrain();
    monitor.runEvaluationCycle();

    assertEquals(RETRY_BACKOFF_MS, monitor.runEvaluationCycle());
    assertEquals(RETRY_BACKOFF_MS, monitor.runEvaluationCycle());

    assertEquals(1, monitor.iteration());
    assertEquals(120.0, _publisher.gaugeValue(gauge(MetricNames.CURRENT_VALUE)), 0.0);
    assertEquals(1.0, _publisher.gaugeValue(gauge(MetricNames.ANOMALY_COUNT)), 0.0);
    assertEquals(20.0, _publisher.gaugeValue(gauge(MetricNames.MAE_SCORE)), 1e-9);
    assertEquals(2, _metricRegistry.meter(
        MetricRegistry.name(ForecastMonitor.FORECAST_MONITOR_SENSOR, PAIR.id(), "fetch-failure-rate")).getCount());
    verify();
  }

  @Test
  public void testUndefinedLiveValueIsRetried() {
    expectTraining();
    EasyMock.expect(_telemetrySource.fetchInstant(LIVE_QUERY))
            .andReturn(Result.failure(FailureType.NUMERIC_UNDEFINED, "Division by zero"));
    expectLiveValue(95.0);
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    monitor.retrain();

    assertEquals(RETRY_BACKOFF_MS, monitor.runEvaluationCycle());
    assertEquals(0, monitor.iteration());
    assertNull(_publisher.gaugeValue(gauge(MetricNames.CURRENT_VALUE)));

    assertEquals(POLLING_INTERVAL_MS, monitor.runEvaluationCycle());
    assertEquals(95.0, _publisher.gaugeValue(gauge(MetricNames.CURRENT_VALUE)), 0.0);
    verify();
  }

  @Test
  public void testNaNObservationPublishesOnlyFiniteValues() {
    expectTraining();
    expectLiveValue(120.0);
    expectLiveValue(Double.NaN);
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);
    monitor.retrain();
    monitor.runEvaluationCycle();

    assertEquals(POLLING_INTERVAL_MS, monitor.runEvaluationCycle());

    assertEquals(120.0, _publisher.gaugeValue(gauge(MetricNames.CURRENT_VALUE)), 0.0);
    assertEquals(20.0, _publisher.gaugeValue(gauge(MetricNames.MAE_SCORE)), 1e-9);
    // A missing value is never anomalous.
    assertEquals(0.0, _publisher.gaugeValue(gauge(MetricNames.ANOMALY_COUNT)), 0.0);
    verify();
  }

  @Test
  public void testStartUpWithTrainingFileDelaysRetrain() throws IOException {
    File trainingFile = new File(_folder.getRoot(), PAIR.id() + ForecastMonitor.TRAINING_FILE_SUFFIX);
    Files.write(trainingFile.toPath(), ("{\"status\": \"success\", \"data\": {\"resultType\": \"matrix\", \"result\": "
                                        + "[{\"metric\": {}, \"values\": [[1699990000, \"5\"], [1699990060, \"7\"]]}]}}")
        .getBytes(StandardCharsets.UTF_8));
    _props.setProperty(MonitorConfig.MONITOR_TRAINING_DIR_CONFIG, _folder.getRoot().getAbsolutePath());
    EasyMock.expect(_scheduler.isShutdown()).andReturn(false).anyTimes();
    EasyMock.expect(_scheduler.schedule(EasyMock.anyObject(Runnable.class), EasyMock.eq(RETRAIN_INTERVAL_MS),
                                        EasyMock.eq(TimeUnit.MILLISECONDS))).andReturn(null);
    EasyMock.expect(_scheduler.schedule(EasyMock.anyObject(Runnable.class), EasyMock.eq(0L),
                                        EasyMock.eq(TimeUnit.MILLISECONDS))).andReturn(null);
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    monitor.startUp();

    assertNotNull(monitor.activeModel());
    assertEquals(1699990000000L, _oracle.windows().get(0).originTimeMs());
    verify();
  }

  @Test
  public void testStartUpWithoutTrainingFileRetrainsImmediately() {
    _props.setProperty(MonitorConfig.MONITOR_TRAINING_DIR_CONFIG, _folder.getRoot().getAbsolutePath());
    EasyMock.expect(_scheduler.isShutdown()).andReturn(false).anyTimes();
    EasyMock.expect(_scheduler.schedule(EasyMock.anyObject(Runnable.class), EasyMock.eq(0L),
                                        EasyMock.eq(TimeUnit.MILLISECONDS))).andReturn(null).times(2);
    replay();
    ForecastMonitor monitor = newMonitor(_oracle);

    monitor.startUp();

    assertNull(monitor.activeModel());
    verify();
  }

  @Test
  public void testShutdown() throws InterruptedException {
    _scheduler.shutdown();
    EasyMock.expect(_scheduler.awaitTermination(EasyMock.anyLong(), EasyMock.eq(TimeUnit.MILLISECONDS))).andReturn(true);
    EasyMock.expect(_scheduler.isTerminated()).andReturn(true);
    replay();

    newMonitor(_oracle).shutdown();
    verify();
  }

  @Test
  public void testShutdownDropsPendingCycles() throws InterruptedException {
    EasyMock.expect(_telemetrySource.fetchRange(TRAINING_QUERY, NOW_MS - LOOKBACK_MS, NOW_MS))
            .andReturn(Result.failure(FailureType.NO_DATA, "No series")).anyTimes();
    EasyMock.replay(_telemetrySource);
    ScheduledExecutorService scheduler = ForecastMonitor.newScheduler(PAIR);
    IncidentMonitorConfig config = new IncidentMonitorConfig(_props, false);
    ForecastMonitor monitor = new ForecastMonitor(config, PAIR, _telemetrySource, _oracle, _publisher, _metricRegistry,
                                                  Clock.fixed(Instant.ofEpochMilli(NOW_MS), ZoneOffset.UTC), scheduler);
    monitor.startUp();
    // Let both chains run once and queue their next cycle after the backoff.
    Thread.sleep(300);

    long startMs = System.currentTimeMillis();
    monitor.shutdown();
    long shutdownMs = System.currentTimeMillis() - startMs;

    assertTrue(scheduler.isTerminated());
    assertTrue("Shutdown took " + shutdownMs + " ms.", shutdownMs < TimeUnit.SECONDS.toMillis(2));
  }
}
