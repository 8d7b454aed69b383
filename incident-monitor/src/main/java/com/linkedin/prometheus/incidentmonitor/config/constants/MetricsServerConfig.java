/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.config.constants;

import com.linkedin.incidentmonitor.common.config.ConfigDef;

import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.between;


/**
 * A class to keep metrics scrape endpoint configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MetricsServerConfig {

  /**
   * <code>metrics.http.port</code>
   */
  public static final String METRICS_HTTP_PORT_CONFIG = "metrics.http.port";
  public static final int DEFAULT_METRICS_HTTP_PORT = 8080;
  public static final String METRICS_HTTP_PORT_DOC = "The bind port of the metrics scrape endpoint. 0 binds an "
      + "ephemeral port.";

  /**
   * <code>metrics.http.address</code>
   */
  public static final String METRICS_HTTP_ADDRESS_CONFIG = "metrics.http.address";
  public static final String DEFAULT_METRICS_HTTP_ADDRESS = "0.0.0.0";
  public static final String METRICS_HTTP_ADDRESS_DOC = "The bind ip address of the metrics scrape endpoint.";

  /**
   * <code>metrics.name.prefix</code>
   */
  public static final String METRICS_NAME_PREFIX_CONFIG = "metrics.name.prefix";
  public static final String DEFAULT_METRICS_NAME_PREFIX = "monitor";
  public static final String METRICS_NAME_PREFIX_DOC = "The prefix of every published gauge name, e.g. "
      + "<prefix>_<source>_2_<destination>_anomaly_count.";

  private MetricsServerConfig() {
  }

  /**
   * Define configs for the metrics scrape endpoint.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the metrics scrape endpoint.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(METRICS_HTTP_PORT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_METRICS_HTTP_PORT,
                            between(0, 65535),
                            ConfigDef.Importance.HIGH,
                            METRICS_HTTP_PORT_DOC)
                    .define(METRICS_HTTP_ADDRESS_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_METRICS_HTTP_ADDRESS,
                            ConfigDef.Importance.HIGH,
                            METRICS_HTTP_ADDRESS_DOC)
                    .define(METRICS_NAME_PREFIX_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_METRICS_NAME_PREFIX,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            METRICS_NAME_PREFIX_DOC);
  }
}
