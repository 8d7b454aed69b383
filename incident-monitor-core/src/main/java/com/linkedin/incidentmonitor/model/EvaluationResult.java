/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * The outcome of comparing a live observation against the forecast for the same instant.
 */
public final class EvaluationResult {
  private final long _timestampMs;
  private final double _observed;
  private final double _predicted;
  private final double _lower;
  private final double _upper;
  private final boolean _anomaly;
  private final OptionalDouble _mae;
  private final OptionalDouble _mape;

  public EvaluationResult(long timestampMs,
                          double observed,
                          double predicted,
                          double lower,
                          double upper,
                          boolean anomaly,
                          OptionalDouble mae,
                          OptionalDouble mape) {
    _timestampMs = timestampMs;
    _observed = observed;
    _predicted = predicted;
    _lower = lower;
    _upper = upper;
    _anomaly = anomaly;
    _mae = Objects.requireNonNull(mae);
    _mape = Objects.requireNonNull(mape);
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public double observed() {
    return _observed;
  }

  public double predicted() {
    return _predicted;
  }

  public double lower() {
    return _lower;
  }

  public double upper() {
    return _upper;
  }

  /**
   * @return {@code true} if the observed value lies strictly outside the forecast interval.
   */
  public boolean isAnomaly() {
    return _anomaly;
  }

  /**
   * @return 1 if anomalous, 0 otherwise.
   */
  public int anomalyCount() {
    return _anomaly ? 1 : 0;
  }

  /**
   * @return Absolute error, empty if either the observed or the predicted value is not a number.
   */
  public OptionalDouble mae() {
    return _mae;
  }

  /**
   * @return Absolute percentage error, empty if the absolute error is undefined or the observed value is zero.
   */
  public OptionalDouble mape() {
    return _mape;
  }

  @Override
  public String toString() {
    return "EvaluationResult{_timestampMs=" + _timestampMs + ", _observed=" + _observed + ", _predicted=" + _predicted
           + ", _lower=" + _lower + ", _upper=" + _upper + ", _anomaly=" + _anomaly + ", _mae=" + _mae
           + ", _mape=" + _mape + '}';
  }
}
