/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.config.constants;

import com.linkedin.incidentmonitor.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Prometheus server configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class PrometheusConfig {

  /**
   * <code>prometheus.server.endpoint</code>
   */
  public static final String PROMETHEUS_SERVER_ENDPOINT_CONFIG = "prometheus.server.endpoint";
  public static final String PROMETHEUS_SERVER_ENDPOINT_DOC = "The HTTP endpoint of the Prometheus server which is to be "
      + "queried for telemetry and anomaly counts, in the form [scheme://]host:port, e.g. http://localhost:9090.";

  /**
   * <code>prometheus.query.timeout.ms</code>
   */
  public static final String PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG = "prometheus.query.timeout.ms";
  public static final int DEFAULT_PROMETHEUS_QUERY_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(10);
  public static final String PROMETHEUS_QUERY_TIMEOUT_MS_DOC = "The connect and socket timeout of a single query to the "
      + "Prometheus server. A query that times out is treated as a failed read.";

  /**
   * <code>prometheus.query.resolution.step.ms</code>
   */
  public static final String PROMETHEUS_QUERY_RESOLUTION_STEP_MS_CONFIG = "prometheus.query.resolution.step.ms";
  public static final int DEFAULT_PROMETHEUS_QUERY_RESOLUTION_STEP_MS = (int) TimeUnit.MINUTES.toMillis(1);
  public static final String PROMETHEUS_QUERY_RESOLUTION_STEP_MS_DOC = "The resolution step of the range queries "
      + "used to fetch training windows.";

  private PrometheusConfig() {
  }

  /**
   * Define configs for Prometheus server.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Prometheus server.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PROMETHEUS_SERVER_ENDPOINT_CONFIG,
                            ConfigDef.Type.STRING,
                            ConfigDef.Importance.HIGH,
                            PROMETHEUS_SERVER_ENDPOINT_DOC)
                    .define(PROMETHEUS_QUERY_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROMETHEUS_QUERY_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            PROMETHEUS_QUERY_TIMEOUT_MS_DOC)
                    .define(PROMETHEUS_QUERY_RESOLUTION_STEP_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROMETHEUS_QUERY_RESOLUTION_STEP_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            PROMETHEUS_QUERY_RESOLUTION_STEP_MS_DOC);
  }
}
