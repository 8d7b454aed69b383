/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.publisher;

import java.util.regex.Pattern;

/**
 * Builds the names of the published gauges.
 */
public final class MetricNames {
  private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^a-zA-Z0-9_:]");
  private static final String SEPARATOR = "_";
  private static final String INCIDENT = "incident";

  // Forecast monitor gauges.
  public static final String ANOMALY_COUNT = "anomaly_count";
  public static final String MAE_SCORE = "mae_score";
  public static final String MAPE_SCORE = "mape_score";
  public static final String CURRENT_VALUE = "current_value";
  public static final String PREDICTED_VALUE = "predicted_value";
  public static final String YHAT_MIN = "yhat_min";
  public static final String YHAT_MAX = "yhat_max";

  // Incident detector gauges.
  public static final String TOTAL_TEMPERATURE = "total_temperature";
  public static final String SERVICE1_TEMPERATURE = "service1_temperature";
  public static final String SERVICE2_TEMPERATURE = "service2_temperature";
  public static final String SEV1_INCIDENT = "sev1_incident";
  public static final String SEV2_INCIDENT = "sev2_incident";

  private MetricNames() {

  }

  /**
   * @param name A metric name.
   * @return The name with every character outside {@code [a-zA-Z0-9_:]} replaced by an underscore.
   */
  public static String sanitize(String name) {
    return INVALID_CHARACTERS.matcher(name).replaceAll(SEPARATOR);
  }

  /**
   * @param prefix Name prefix.
   * @param pairId Identifier of the monitored pair, i.e. source_2_destination.
   * @param suffix One of the forecast monitor gauge suffixes.
   * @return prefix_source_2_destination_suffix, sanitized.
   */
  public static String monitorGauge(String prefix, String pairId, String suffix) {
    return sanitize(String.join(SEPARATOR, prefix, pairId, suffix));
  }

  /**
   * @param prefix Name prefix.
   * @param firstSource The first service of the incident detector.
   * @param secondSource The second service of the incident detector.
   * @param suffix One of the incident detector gauge suffixes.
   * @return prefix_incident_first_second_suffix, sanitized.
   */
  public static String incidentGauge(String prefix, String firstSource, String secondSource, String suffix) {
    return sanitize(String.join(SEPARATOR, prefix, INCIDENT, firstSource, secondSource, suffix));
  }
}
