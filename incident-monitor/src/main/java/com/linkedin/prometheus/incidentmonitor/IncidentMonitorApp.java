/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import com.linkedin.incidentmonitor.exception.IncidentMonitorException;
import com.linkedin.incidentmonitor.forecast.ForecastOracle;
import com.linkedin.incidentmonitor.telemetry.TelemetrySource;
import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.IncidentDetectorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.PrometheusConfig;
import com.linkedin.prometheus.incidentmonitor.detector.IncidentDetector;
import com.linkedin.prometheus.incidentmonitor.monitor.ForecastMonitor;
import com.linkedin.prometheus.incidentmonitor.monitor.ServicePair;
import com.linkedin.prometheus.incidentmonitor.publisher.MetricsHttpServer;
import com.linkedin.prometheus.incidentmonitor.publisher.PrometheusMetricPublisher;
import com.linkedin.prometheus.incidentmonitor.telemetry.PrometheusAdapter;
import com.linkedin.prometheus.incidentmonitor.telemetry.PrometheusTelemetrySource;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires one {@link ForecastMonitor} per configured service pair, the optional {@link IncidentDetector} and the
 * metrics scrape endpoint.
 */
public class IncidentMonitorApp {
  private static final Logger LOG = LoggerFactory.getLogger(IncidentMonitorApp.class);
  static final String METRIC_DOMAIN = "incident.monitor";
  protected final IncidentMonitorConfig _config;
  protected final MetricRegistry _metricRegistry;
  protected final JmxReporter _jmxReporter;
  protected final PrometheusMeterRegistry _prometheusRegistry;
  protected final CloseableHttpClient _httpClient;
  protected final MetricsHttpServer _metricsHttpServer;
  protected final List<ForecastMonitor> _forecastMonitors;
  protected final IncidentDetector _incidentDetector;

  IncidentMonitorApp(IncidentMonitorConfig config, int port, String hostname) throws IncidentMonitorException {
    _config = config;
    _metricRegistry = new MetricRegistry();
    _jmxReporter = JmxReporter.forRegistry(_metricRegistry).inDomain(METRIC_DOMAIN).build();
    _jmxReporter.start();
    _prometheusRegistry = new PrometheusMeterRegistry(io.micrometer.prometheusmetrics.PrometheusConfig.DEFAULT);
    _metricsHttpServer = new MetricsHttpServer(_prometheusRegistry, hostname, port);

    int timeoutMs = config.getInt(PrometheusConfig.PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG);
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(timeoutMs)
                                               .setConnectionRequestTimeout(timeoutMs)
                                               .setSocketTimeout(timeoutMs)
                                               .build();
    _httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
    PrometheusAdapter prometheusAdapter = new PrometheusAdapter(
        _httpClient, config.prometheusEndpoint(), config.getInt(PrometheusConfig.PROMETHEUS_QUERY_RESOLUTION_STEP_MS_CONFIG));
    TelemetrySource telemetrySource = new PrometheusTelemetrySource(prometheusAdapter);
    PrometheusMetricPublisher metricPublisher = new PrometheusMetricPublisher(_prometheusRegistry);
    Clock clock = Clock.systemUTC();

    _forecastMonitors = new ArrayList<>();
    for (ServicePair servicePair : config.servicePairs()) {
      // Each pair gets its own oracle, as oracles may keep state between fits.
      ForecastOracle forecastOracle = config.getConfiguredInstance(MonitorConfig.FORECAST_ORACLE_CLASS_CONFIG,
                                                                   ForecastOracle.class);
      _forecastMonitors.add(new ForecastMonitor(config, servicePair, telemetrySource, forecastOracle, metricPublisher,
                                                _metricRegistry, clock));
    }
    _incidentDetector = config.getBoolean(IncidentDetectorConfig.INCIDENT_DETECTOR_ENABLED_CONFIG)
                        ? new IncidentDetector(config, telemetrySource, metricPublisher, _metricRegistry, clock)
                        : null;
  }

  public void start() throws Exception {
    _metricsHttpServer.start();
    _forecastMonitors.forEach(ForecastMonitor::startUp);
    if (_incidentDetector != null) {
      _incidentDetector.startUp();
    }
    printStartupInfo();
  }

  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop));
  }

  /**
   * Stops the monitors, the incident detector and the scrape endpoint.
   */
  public void stop() {
    if (_incidentDetector != null) {
      _incidentDetector.shutdown();
    }
    _forecastMonitors.forEach(ForecastMonitor::shutdown);
    try {
      _metricsHttpServer.stop();
    } catch (Exception e) {
      LOG.warn("Failed to stop the metrics endpoint.", e);
    }
    try {
      _httpClient.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the Prometheus client.", e);
    }
    _prometheusRegistry.close();
    _jmxReporter.close();
  }

  public String serverUrl() {
    return _metricsHttpServer.serverUrl();
  }

  protected void printStartupInfo() {
    System.out.println(">> ********************************************* <<");
    System.out.println(">> Application directory            : " + System.getProperty("user.dir"));
    System.out.println(">> Prometheus server                : " + _config.prometheusEndpoint());
    System.out.println(">> Monitored service pairs          : " + _config.servicePairs());
    System.out.println(">> Incident detector enabled ?      : " + (_incidentDetector != null));
    System.out.println(">> Metrics available on             : " + serverUrl());
    System.out.println(">> ********************************************* <<");
  }
}
