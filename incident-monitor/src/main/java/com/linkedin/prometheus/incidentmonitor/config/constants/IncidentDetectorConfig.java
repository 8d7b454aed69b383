/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.config.constants;

import com.linkedin.incidentmonitor.common.config.ConfigDef;
import com.linkedin.incidentmonitor.detector.IncidentEscalator;
import java.util.concurrent.TimeUnit;

import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep incident detector configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class IncidentDetectorConfig {

  /**
   * <code>incident.detector.enabled</code>
   */
  public static final String INCIDENT_DETECTOR_ENABLED_CONFIG = "incident.detector.enabled";
  public static final boolean DEFAULT_INCIDENT_DETECTOR_ENABLED = false;
  public static final String INCIDENT_DETECTOR_ENABLED_DOC = "true to run the incident detector, which combines the "
      + "anomaly counts of two monitored services into a severity classified incident.";

  /**
   * <code>incident.sources</code>
   */
  public static final String INCIDENT_SOURCES_CONFIG = "incident.sources";
  public static final String DEFAULT_INCIDENT_SOURCES = "";
  public static final String INCIDENT_SOURCES_DOC = "The names of exactly two monitored services, e.g. "
      + "frontend,checkoutservice. The names are used in the published incident gauges.";

  /**
   * <code>incident.anomaly.metrics</code>
   */
  public static final String INCIDENT_ANOMALY_METRICS_CONFIG = "incident.anomaly.metrics";
  public static final String DEFAULT_INCIDENT_ANOMALY_METRICS = "";
  public static final String INCIDENT_ANOMALY_METRICS_DOC = "The names of the two anomaly count gauges read from "
      + "Prometheus, in the order of " + INCIDENT_SOURCES_CONFIG + ", e.g. "
      + "monitor_frontend_2_shippingservice_anomaly_count,monitor_checkoutservice_2_shippingservice_anomaly_count.";

  /**
   * <code>incident.polling.interval.ms</code>
   */
  public static final String INCIDENT_POLLING_INTERVAL_MS_CONFIG = "incident.polling.interval.ms";
  public static final long DEFAULT_INCIDENT_POLLING_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String INCIDENT_POLLING_INTERVAL_MS_DOC = "The time between two incident detection cycles.";

  /**
   * <code>incident.threshold</code>
   */
  public static final String INCIDENT_THRESHOLD_CONFIG = "incident.threshold";
  public static final int DEFAULT_INCIDENT_THRESHOLD = IncidentEscalator.DEFAULT_THRESHOLD;
  public static final String INCIDENT_THRESHOLD_DOC = "The minimum combined temperature of the two services for an "
      + "incident to be raised.";

  /**
   * <code>incident.accumulator.cap</code>
   */
  public static final String INCIDENT_ACCUMULATOR_CAP_CONFIG = "incident.accumulator.cap";
  public static final int DEFAULT_INCIDENT_ACCUMULATOR_CAP = IncidentEscalator.DEFAULT_ACCUMULATOR_CAP;
  public static final String INCIDENT_ACCUMULATOR_CAP_DOC = "The maximum temperature of a single service.";

  /**
   * <code>incident.accumulator.increment</code>
   */
  public static final String INCIDENT_ACCUMULATOR_INCREMENT_CONFIG = "incident.accumulator.increment";
  public static final int DEFAULT_INCIDENT_ACCUMULATOR_INCREMENT = IncidentEscalator.DEFAULT_INCREMENT;
  public static final String INCIDENT_ACCUMULATOR_INCREMENT_DOC = "The temperature a service gains in a cycle in "
      + "which it reports an anomaly.";

  /**
   * <code>incident.accumulator.decrement</code>
   */
  public static final String INCIDENT_ACCUMULATOR_DECREMENT_CONFIG = "incident.accumulator.decrement";
  public static final int DEFAULT_INCIDENT_ACCUMULATOR_DECREMENT = IncidentEscalator.DEFAULT_DECREMENT;
  public static final String INCIDENT_ACCUMULATOR_DECREMENT_DOC = "The temperature a service loses in a cycle in "
      + "which it reports no anomaly.";

  private IncidentDetectorConfig() {
  }

  /**
   * Define configs for the incident detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the incident detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(INCIDENT_DETECTOR_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_INCIDENT_DETECTOR_ENABLED,
                            ConfigDef.Importance.HIGH,
                            INCIDENT_DETECTOR_ENABLED_DOC)
                    .define(INCIDENT_SOURCES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_INCIDENT_SOURCES,
                            ConfigDef.Importance.HIGH,
                            INCIDENT_SOURCES_DOC)
                    .define(INCIDENT_ANOMALY_METRICS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_INCIDENT_ANOMALY_METRICS,
                            ConfigDef.Importance.HIGH,
                            INCIDENT_ANOMALY_METRICS_DOC)
                    .define(INCIDENT_POLLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_INCIDENT_POLLING_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            INCIDENT_POLLING_INTERVAL_MS_DOC)
                    .define(INCIDENT_THRESHOLD_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_INCIDENT_THRESHOLD,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            INCIDENT_THRESHOLD_DOC)
                    .define(INCIDENT_ACCUMULATOR_CAP_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_INCIDENT_ACCUMULATOR_CAP,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            INCIDENT_ACCUMULATOR_CAP_DOC)
                    .define(INCIDENT_ACCUMULATOR_INCREMENT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_INCIDENT_ACCUMULATOR_INCREMENT,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            INCIDENT_ACCUMULATOR_INCREMENT_DOC)
                    .define(INCIDENT_ACCUMULATOR_DECREMENT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_INCIDENT_ACCUMULATOR_DECREMENT,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            INCIDENT_ACCUMULATOR_DECREMENT_DOC);
  }
}
