/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.publisher;

import com.linkedin.incidentmonitor.publisher.MetricPublisher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;

/**
 * A {@link MetricPublisher} holding the gauges in a Micrometer {@link PrometheusMeterRegistry}, from which they are
 * scraped by Prometheus. A gauge is registered on its first write, so a gauge that was never written is not exposed
 * rather than exposed as zero.
 */
public class PrometheusMetricPublisher implements MetricPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(PrometheusMetricPublisher.class);
  private final PrometheusMeterRegistry _registry;
  private final ConcurrentMap<String, GaugeValue> _gaugeValues;

  public PrometheusMetricPublisher(PrometheusMeterRegistry registry) {
    _registry = validateNotNull(registry, "Registry cannot be null.");
    _gaugeValues = new ConcurrentHashMap<>();
  }

  @Override
  public void setGauge(String name, String help, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(String.format("Cannot publish non-finite value %f to gauge %s.", value, name));
    }
    _gaugeValues.computeIfAbsent(name, n -> register(n, help)).set(value);
  }

  /**
   * @param name Name of the gauge.
   * @return The last value written to the gauge, or {@code null} if it was never written.
   */
  @Nullable
  public Double gaugeValue(String name) {
    GaugeValue gaugeValue = _gaugeValues.get(name);
    return gaugeValue == null ? null : gaugeValue.get();
  }

  /**
   * @return The Prometheus text exposition of all published gauges.
   */
  public String scrape() {
    return _registry.scrape();
  }

  private GaugeValue register(String name, String help) {
    GaugeValue gaugeValue = new GaugeValue();
    Gauge.builder(name, gaugeValue, GaugeValue::get).description(help).strongReference(true).register(_registry);
    LOG.debug("Registered gauge {}.", name);
    return gaugeValue;
  }

  private static final class GaugeValue {
    private volatile double _value;

    double get() {
      return _value;
    }

    void set(double value) {
      _value = value;
    }
  }
}
