/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

import java.util.Objects;

/**
 * The point estimate and confidence interval produced by a forecast model for one timestamp.
 */
public final class ForecastPoint {
  private final long _timestampMs;
  private final double _yhat;
  private final double _lower;
  private final double _upper;

  public ForecastPoint(long timestampMs, double yhat, double lower, double upper) {
    _timestampMs = timestampMs;
    _yhat = yhat;
    _lower = lower;
    _upper = upper;
  }

  /**
   * @return The (re-based) timestamp the forecast was requested for.
   */
  public long timestampMs() {
    return _timestampMs;
  }

  public double yhat() {
    return _yhat;
  }

  public double lower() {
    return _lower;
  }

  public double upper() {
    return _upper;
  }

  @Override
  public String toString() {
    return String.format("ForecastPoint{_timestampMs=%d, _yhat=%.3f, _lower=%.3f, _upper=%.3f}", _timestampMs, _yhat, _lower, _upper);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ForecastPoint that = (ForecastPoint) o;
    return _timestampMs == that._timestampMs
           && Double.compare(that._yhat, _yhat) == 0
           && Double.compare(that._lower, _lower) == 0
           && Double.compare(that._upper, _upper) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestampMs, _yhat, _lower, _upper);
  }
}
