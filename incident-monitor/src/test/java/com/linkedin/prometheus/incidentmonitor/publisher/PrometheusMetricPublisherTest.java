/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.publisher;

import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Unit test for {@link PrometheusMetricPublisher}.
 */
public class PrometheusMetricPublisherTest {
  private static final String GAUGE = "monitor_frontend_2_shippingservice_current_value";
  private static final String HELP = "The live value.";
  private PrometheusMeterRegistry _registry;
  private PrometheusMetricPublisher _publisher;

  @Before
  public void setUp() {
    _registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    _publisher = new PrometheusMetricPublisher(_registry);
  }

  @Test
  public void testGaugeIsOverwritten() {
    _publisher.setGauge(GAUGE, HELP, 12.5);
    _publisher.setGauge(GAUGE, HELP, 7.0);

    assertEquals(7.0, _publisher.gaugeValue(GAUGE), 0.0);
    assertEquals(7.0, _registry.get(GAUGE).gauge().value(), 0.0);
    assertEquals(1, _registry.getMeters().size());
  }

  @Test
  public void testGaugeIsRegisteredOnFirstWrite() {
    assertNull(_publisher.gaugeValue(GAUGE));
    assertFalse(_publisher.scrape().contains(GAUGE));

    _publisher.setGauge(GAUGE, HELP, 3.0);

    String scrape = _publisher.scrape();
    assertTrue(scrape, scrape.contains(GAUGE));
    assertTrue(scrape, scrape.contains(HELP));
  }

  @Test
  public void testNonFiniteValueIsRejected() {
    _publisher.setGauge(GAUGE, HELP, 3.0);
    for (double value : new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
      try {
        _publisher.setGauge(GAUGE, HELP, value);
        fail("Should have rejected " + value);
      } catch (IllegalArgumentException iae) {
        // let it go
      }
    }
    assertEquals(3.0, _publisher.gaugeValue(GAUGE), 0.0);
  }

  @Test
  public void testNonFiniteFirstWriteDoesNotRegister() {
    try {
      _publisher.setGauge(GAUGE, HELP, Double.NaN);
      fail("Should have rejected NaN");
    } catch (IllegalArgumentException iae) {
      // let it go
    }
    assertNull(_publisher.gaugeValue(GAUGE));
    assertTrue(_registry.getMeters().isEmpty());
  }
}
