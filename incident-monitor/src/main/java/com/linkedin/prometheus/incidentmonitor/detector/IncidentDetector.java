/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.detector;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.incidentmonitor.common.FailureType;
import com.linkedin.incidentmonitor.common.Result;
import com.linkedin.incidentmonitor.detector.IncidentEscalator;
import com.linkedin.incidentmonitor.detector.IncidentSeverity;
import com.linkedin.incidentmonitor.detector.IncidentState;
import com.linkedin.incidentmonitor.model.AnomalySignal;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.publisher.MetricPublisher;
import com.linkedin.incidentmonitor.telemetry.TelemetrySource;
import com.linkedin.prometheus.incidentmonitor.IncidentMonitorThreadFactory;
import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.IncidentDetectorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MetricsServerConfig;
import com.linkedin.prometheus.incidentmonitor.publisher.MetricNames;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.SCHEDULER_SHUTDOWN_TIMEOUT_MS;
import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.shutdownScheduler;

/**
 * Periodically reads the anomaly count gauges of two monitored services from Prometheus, feeds them to an
 * {@link IncidentEscalator} and publishes the resulting temperatures and severity flags.
 *
 * A gauge without any series is read as a measured zero. A failed read is defaulted to zero for the cycle and counted
 * in the {@code read-failure-rate} meter.
 */
public class IncidentDetector {
  private static final Logger LOG = LoggerFactory.getLogger(IncidentDetector.class);
  static final String INCIDENT_DETECTOR_SENSOR = "IncidentDetector";
  private static final String TOTAL_TEMPERATURE_HELP = "Sum of the temperatures of both services.";
  private static final String SERVICE_TEMPERATURE_HELP = "Temperature of %s.";
  private static final String SEV1_INCIDENT_HELP = "1 if both services are degraded, 0 otherwise.";
  private static final String SEV2_INCIDENT_HELP = "1 if a single service is degraded, 0 otherwise.";

  private final String _firstSource;
  private final String _secondSource;
  private final String _firstQuery;
  private final String _secondQuery;
  private final long _pollingIntervalMs;
  private final String _metricNamePrefix;
  private final IncidentEscalator _escalator;
  private final TelemetrySource _telemetrySource;
  private final MetricPublisher _metricPublisher;
  private final Clock _clock;
  private final ScheduledExecutorService _scheduler;
  private final Meter _readFailureRate;
  private IncidentSeverity _lastSeverity;

  public IncidentDetector(IncidentMonitorConfig config,
                          TelemetrySource telemetrySource,
                          MetricPublisher metricPublisher,
                          MetricRegistry dropwizardMetricRegistry,
                          Clock clock) {
    this(config, telemetrySource, metricPublisher, dropwizardMetricRegistry, clock,
         Executors.newSingleThreadScheduledExecutor(new IncidentMonitorThreadFactory("IncidentDetector", LOG)));
  }

  /**
   * Package private constructor for unit tests.
   */
  IncidentDetector(IncidentMonitorConfig config,
                   TelemetrySource telemetrySource,
                   MetricPublisher metricPublisher,
                   MetricRegistry dropwizardMetricRegistry,
                   Clock clock,
                   ScheduledExecutorService scheduler) {
    _telemetrySource = validateNotNull(telemetrySource, "Telemetry source cannot be null.");
    _metricPublisher = validateNotNull(metricPublisher, "Metric publisher cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _scheduler = validateNotNull(scheduler, "Scheduler cannot be null.");
    List<String> sources = config.getList(IncidentDetectorConfig.INCIDENT_SOURCES_CONFIG);
    List<String> anomalyMetrics = config.getList(IncidentDetectorConfig.INCIDENT_ANOMALY_METRICS_CONFIG);
    _firstSource = sources.get(0);
    _secondSource = sources.get(1);
    _firstQuery = anomalyCountQuery(anomalyMetrics.get(0));
    _secondQuery = anomalyCountQuery(anomalyMetrics.get(1));
    _pollingIntervalMs = config.getLong(IncidentDetectorConfig.INCIDENT_POLLING_INTERVAL_MS_CONFIG);
    _metricNamePrefix = config.getString(MetricsServerConfig.METRICS_NAME_PREFIX_CONFIG);
    _escalator = new IncidentEscalator(config.getInt(IncidentDetectorConfig.INCIDENT_THRESHOLD_CONFIG),
                                       config.getInt(IncidentDetectorConfig.INCIDENT_ACCUMULATOR_CAP_CONFIG),
                                       config.getInt(IncidentDetectorConfig.INCIDENT_ACCUMULATOR_INCREMENT_CONFIG),
                                       config.getInt(IncidentDetectorConfig.INCIDENT_ACCUMULATOR_DECREMENT_CONFIG));
    _readFailureRate = dropwizardMetricRegistry.meter(MetricRegistry.name(INCIDENT_DETECTOR_SENSOR, "read-failure-rate"));
    _lastSeverity = IncidentSeverity.QUIESCENT;
  }

  /**
   * @param anomalyMetric Name of an anomaly count gauge.
   * @return A query summing all series of the gauge, which yields zero rather than no series if the gauge is absent.
   */
  static String anomalyCountQuery(String anomalyMetric) {
    return String.format("sum({__name__=\"%s\"}) or vector(0)", anomalyMetric);
  }

  /**
   * Start polling. The first cycle runs immediately.
   */
  public void startUp() {
    LOG.info("Starting incident detector for {} and {} with threshold {} and accumulator cap {}.", _firstSource,
             _secondSource, _escalator.threshold(), _escalator.cap());
    _scheduler.scheduleAtFixedRate(this::runDetection, 0L, _pollingIntervalMs, TimeUnit.MILLISECONDS);
  }

  public void shutdown() {
    LOG.info("Shutting down incident detector.");
    shutdownScheduler(_scheduler, "incident detector", SCHEDULER_SHUTDOWN_TIMEOUT_MS, LOG);
    LOG.info("Incident detector shutdown completed.");
  }

  /**
   * @param sourceId The service the anomaly count belongs to.
   * @param query The anomaly count query.
   * @return The anomaly signal of the service, defaulted to zero if the read failed.
   */
  AnomalySignal readSignal(String sourceId, String query) {
    Result<Observation> result = _telemetrySource.fetchInstant(query);
    long nowMs = _clock.millis();
    if (result.isSuccess()) {
      return AnomalySignal.measured(sourceId, result.value().value(), nowMs);
    }
    if (result.failure().type() == FailureType.NO_DATA) {
      LOG.debug("No anomaly count series for {}, reading it as zero.", sourceId);
      return AnomalySignal.measured(sourceId, 0.0, nowMs);
    }
    _readFailureRate.mark();
    LOG.warn("Failed to read the anomaly count of {}, defaulting it to zero for this cycle: {}", sourceId,
             result.failure());
    return AnomalySignal.defaulted(sourceId, nowMs);
  }

  /**
   * Read both signals, update the escalator and publish the new state.
   *
   * @return The incident state after this cycle.
   */
  IncidentState runDetectionCycle() {
    AnomalySignal first = readSignal(_firstSource, _firstQuery);
    AnomalySignal second = readSignal(_secondSource, _secondQuery);
    IncidentState state = _escalator.update(first, second);
    publish(state);
    logState(first, second, state);
    return state;
  }

  /**
   * @param state The incident state to publish.
   */
  void publish(IncidentState state) {
    setGauge(MetricNames.TOTAL_TEMPERATURE, TOTAL_TEMPERATURE_HELP, state.total());
    setGauge(MetricNames.SERVICE1_TEMPERATURE, String.format(SERVICE_TEMPERATURE_HELP, _firstSource),
             state.firstAccumulator());
    setGauge(MetricNames.SERVICE2_TEMPERATURE, String.format(SERVICE_TEMPERATURE_HELP, _secondSource),
             state.secondAccumulator());
    setGauge(MetricNames.SEV1_INCIDENT, SEV1_INCIDENT_HELP, state.isSev1() ? 1 : 0);
    setGauge(MetricNames.SEV2_INCIDENT, SEV2_INCIDENT_HELP, state.isSev2() ? 1 : 0);
  }

  private void setGauge(String suffix, String help, double value) {
    _metricPublisher.setGauge(MetricNames.incidentGauge(_metricNamePrefix, _firstSource, _secondSource, suffix), help,
                              value);
  }

  private void logState(AnomalySignal first, AnomalySignal second, IncidentState state) {
    IncidentSeverity severity = state.severity();
    if (severity != _lastSeverity) {
      LOG.info("Incident state changed from {} to {}.", _lastSeverity, severity);
      _lastSeverity = severity;
    }
    switch (severity) {
      case SEV1:
        LOG.warn("SEV1 incident: both {} and {} are degraded, state {}.", _firstSource, _secondSource, state);
        break;
      case SEV2:
        String degraded = state.firstAccumulator() > 0 ? _firstSource : _secondSource;
        LOG.warn("SEV2 incident: {} is degraded, state {}.", degraded, state);
        break;
      default:
        LOG.debug("No incident, signals {} and {}, state {}.", first, second, state);
        break;
    }
  }

  private void runDetection() {
    try {
      runDetectionCycle();
    } catch (Exception e) {
      // Rethrowing would cancel the periodic task.
      LOG.error("Unexpected exception in the incident detection cycle.", e);
    }
  }
}
