/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.publisher;

/**
 * Exposes named gauges to a pull-based metrics backend. Setting a gauge overwrites its previous value.
 */
public interface MetricPublisher {

  /**
   * @param name Name of the gauge, valid in the backend naming scheme.
   * @param help Description of the gauge.
   * @param value The new value. Must be finite.
   * @throws IllegalArgumentException if the value is not finite.
   */
  void setGauge(String name, String help, double value);
}
