/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.publisher;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MetricNamesTest {

  @Test
  public void testSanitize() {
    assertEquals("front_end_svc_cluster_local", MetricNames.sanitize("front-end.svc.cluster.local"));
    assertEquals("job:latency_p50", MetricNames.sanitize("job:latency_p50"));
  }

  @Test
  public void testMonitorGauge() {
    assertEquals("monitor_frontend_2_shippingservice_anomaly_count",
                 MetricNames.monitorGauge("monitor", "frontend_2_shippingservice", MetricNames.ANOMALY_COUNT));
    assertEquals("monitor_front_end_2_cart_mape_score",
                 MetricNames.monitorGauge("monitor", "front-end_2_cart", MetricNames.MAPE_SCORE));
  }

  @Test
  public void testIncidentGauge() {
    assertEquals("monitor_incident_frontend_checkoutservice_sev1_incident",
                 MetricNames.incidentGauge("monitor", "frontend", "checkoutservice", MetricNames.SEV1_INCIDENT));
  }
}
