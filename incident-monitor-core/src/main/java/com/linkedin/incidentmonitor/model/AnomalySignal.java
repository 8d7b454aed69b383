/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

/**
 * The anomaly indicator of one monitor as read by the incident detector in a single cycle.
 */
public final class AnomalySignal {
  private final String _sourceId;
  private final int _count;
  private final long _observedAtMs;
  private final boolean _measured;

  private AnomalySignal(String sourceId, int count, long observedAtMs, boolean measured) {
    _sourceId = sourceId;
    _count = count;
    _observedAtMs = observedAtMs;
    _measured = measured;
  }

  /**
   * Create a signal from a value read from the metrics backend. Any value above zero is an anomaly. A value that is
   * not a number is not.
   *
   * @param sourceId Identifier of the monitored source.
   * @param value The value read from the backend.
   * @param observedAtMs Time of the read.
   * @return A measured signal.
   */
  public static AnomalySignal measured(String sourceId, double value, long observedAtMs) {
    return new AnomalySignal(sourceId, value > 0 ? 1 : 0, observedAtMs, true);
  }

  /**
   * Create a signal substituted with zero because the backend could not be read.
   *
   * @param sourceId Identifier of the monitored source.
   * @param observedAtMs Time of the failed read.
   * @return A defaulted signal.
   */
  public static AnomalySignal defaulted(String sourceId, long observedAtMs) {
    return new AnomalySignal(sourceId, 0, observedAtMs, false);
  }

  public String sourceId() {
    return _sourceId;
  }

  /**
   * @return 0 or 1.
   */
  public int count() {
    return _count;
  }

  public boolean isAnomalous() {
    return _count > 0;
  }

  public long observedAtMs() {
    return _observedAtMs;
  }

  /**
   * @return {@code false} if the count was defaulted to zero after a failed read.
   */
  public boolean isMeasured() {
    return _measured;
  }

  @Override
  public String toString() {
    return "AnomalySignal{_sourceId='" + _sourceId + "', _count=" + _count + ", _observedAtMs=" + _observedAtMs
           + ", _measured=" + _measured + '}';
  }
}
