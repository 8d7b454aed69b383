/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.config;

import com.linkedin.incidentmonitor.common.config.AbstractConfig;
import com.linkedin.incidentmonitor.common.config.ConfigDef;
import com.linkedin.incidentmonitor.common.config.ConfigException;
import com.linkedin.prometheus.incidentmonitor.config.constants.IncidentDetectorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MetricsServerConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.PrometheusConfig;
import com.linkedin.prometheus.incidentmonitor.monitor.ServicePair;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.http.HttpHost;

/**
 * The configuration class of the incident monitor.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.prometheus.incidentmonitor.config.constants}.
 */
public class IncidentMonitorConfig extends AbstractConfig {
  static final int NUM_INCIDENT_SOURCES = 2;
  private static final ConfigDef CONFIG;

  static {
    CONFIG = MetricsServerConfig.define(IncidentDetectorConfig.define(MonitorConfig.define(
        PrometheusConfig.define(new ConfigDef()))));
  }

  public IncidentMonitorConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public IncidentMonitorConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckPrometheusEndpoint();
    sanityCheckServicePairs();
    sanityCheckPhases();
    sanityCheckIncidentDetector();
  }

  /**
   * @return The Prometheus server to query.
   */
  public HttpHost prometheusEndpoint() {
    return parseEndpoint(getString(PrometheusConfig.PROMETHEUS_SERVER_ENDPOINT_CONFIG));
  }

  /**
   * @return The monitored service pairs in the configured order.
   */
  public List<ServicePair> servicePairs() {
    List<ServicePair> servicePairs = new ArrayList<>();
    for (String pair : getList(MonitorConfig.MONITOR_SERVICE_PAIRS_CONFIG)) {
      servicePairs.add(ServicePair.parse(pair));
    }
    return servicePairs;
  }

  private static HttpHost parseEndpoint(String endpoint) {
    HttpHost host;
    try {
      host = HttpHost.create(endpoint);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(PrometheusConfig.PROMETHEUS_SERVER_ENDPOINT_CONFIG, endpoint, e.getMessage());
    }
    if (host.getPort() <= 0) {
      throw new ConfigException(PrometheusConfig.PROMETHEUS_SERVER_ENDPOINT_CONFIG, endpoint,
                                "Expected an endpoint in the form [scheme://]host:port.");
    }
    return host;
  }

  /**
   * Sanity check to ensure that {@link PrometheusConfig#PROMETHEUS_SERVER_ENDPOINT_CONFIG} is a valid host and port.
   */
  private void sanityCheckPrometheusEndpoint() {
    prometheusEndpoint();
  }

  /**
   * Sanity check to ensure that {@link MonitorConfig#MONITOR_SERVICE_PAIRS_CONFIG} holds well formed, distinct pairs.
   */
  private void sanityCheckServicePairs() {
    List<ServicePair> servicePairs = servicePairs();
    Set<ServicePair> distinct = new HashSet<>(servicePairs);
    if (distinct.size() != servicePairs.size()) {
      throw new ConfigException(String.format("Attempt to configure duplicate service pairs in %s.", servicePairs));
    }
  }

  /**
   * Sanity check to ensure that {@link MonitorConfig#MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG} is after
   * {@link MonitorConfig#MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG}.
   */
  private void sanityCheckPhases() {
    int perturbationStart = getInt(MonitorConfig.MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG);
    int recoveryStart = getInt(MonitorConfig.MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG);
    if (recoveryStart <= perturbationStart) {
      throw new ConfigException(String.format("Recovery phase start iteration [%d] must be after the perturbation phase "
                                              + "start iteration [%d].", recoveryStart, perturbationStart));
    }
  }

  /**
   * Sanity check to ensure that, if the incident detector is enabled,
   * <ul>
   *   <li>{@link IncidentDetectorConfig#INCIDENT_SOURCES_CONFIG} and
   *   {@link IncidentDetectorConfig#INCIDENT_ANOMALY_METRICS_CONFIG} each hold exactly two entries, and</li>
   *   <li>{@link IncidentDetectorConfig#INCIDENT_THRESHOLD_CONFIG} is reachable, i.e. no more than twice
   *   {@link IncidentDetectorConfig#INCIDENT_ACCUMULATOR_CAP_CONFIG}.</li>
   * </ul>
   */
  private void sanityCheckIncidentDetector() {
    if (!getBoolean(IncidentDetectorConfig.INCIDENT_DETECTOR_ENABLED_CONFIG)) {
      return;
    }
    List<String> sources = getList(IncidentDetectorConfig.INCIDENT_SOURCES_CONFIG);
    if (sources.size() != NUM_INCIDENT_SOURCES) {
      throw new ConfigException(IncidentDetectorConfig.INCIDENT_SOURCES_CONFIG, sources,
                                "Expected exactly " + NUM_INCIDENT_SOURCES + " sources.");
    }
    List<String> anomalyMetrics = getList(IncidentDetectorConfig.INCIDENT_ANOMALY_METRICS_CONFIG);
    if (anomalyMetrics.size() != NUM_INCIDENT_SOURCES) {
      throw new ConfigException(IncidentDetectorConfig.INCIDENT_ANOMALY_METRICS_CONFIG, anomalyMetrics,
                                "Expected exactly " + NUM_INCIDENT_SOURCES + " anomaly metrics.");
    }
    int threshold = getInt(IncidentDetectorConfig.INCIDENT_THRESHOLD_CONFIG);
    int cap = getInt(IncidentDetectorConfig.INCIDENT_ACCUMULATOR_CAP_CONFIG);
    if (threshold > NUM_INCIDENT_SOURCES * cap) {
      throw new ConfigException(String.format("Incident threshold [%d] cannot be reached with an accumulator cap of [%d].",
                                              threshold, cap));
    }
  }
}
