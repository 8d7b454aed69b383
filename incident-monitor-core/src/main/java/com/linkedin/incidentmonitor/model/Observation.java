/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

import java.util.Objects;

/**
 * A single scalar value of a telemetry series at a given instant.
 */
public final class Observation {
  private final long _timestampMs;
  private final double _value;

  public Observation(long timestampMs, double value) {
    _timestampMs = timestampMs;
    _value = value;
  }

  /**
   * @return The time at which the value was observed, in milliseconds since the Unix epoch (or since the window
   * origin, for observations of a re-based {@link TrainingWindow}).
   */
  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return The observed value, possibly {@link Double#NaN} if the backend reported a missing value.
   */
  public double value() {
    return _value;
  }

  /**
   * @return {@code true} if the value is a number.
   */
  public boolean isValid() {
    return !Double.isNaN(_value);
  }

  @Override
  public String toString() {
    return "Observation{_timestampMs=" + _timestampMs + ", _value=" + _value + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Observation that = (Observation) o;
    return _timestampMs == that._timestampMs && Double.compare(that._value, _value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestampMs, _value);
  }
}
