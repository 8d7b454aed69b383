/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.detector;

import java.util.Objects;

/**
 * A snapshot of the accumulators of an {@link IncidentEscalator} and the severity derived from them.
 */
public final class IncidentState {
  private final int _firstAccumulator;
  private final int _secondAccumulator;
  private final IncidentSeverity _severity;

  public IncidentState(int firstAccumulator, int secondAccumulator, IncidentSeverity severity) {
    _firstAccumulator = firstAccumulator;
    _secondAccumulator = secondAccumulator;
    _severity = severity;
  }

  /**
   * Derive the state of the given accumulators.
   *
   * @param firstAccumulator Accumulator of the first source.
   * @param secondAccumulator Accumulator of the second source.
   * @param threshold Minimum total for an incident to be raised.
   * @return The state.
   */
  public static IncidentState classify(int firstAccumulator, int secondAccumulator, int threshold) {
    IncidentSeverity severity;
    if (firstAccumulator + secondAccumulator < threshold) {
      severity = IncidentSeverity.QUIESCENT;
    } else if (firstAccumulator > 0 && secondAccumulator > 0) {
      severity = IncidentSeverity.SEV1;
    } else {
      severity = IncidentSeverity.SEV2;
    }
    return new IncidentState(firstAccumulator, secondAccumulator, severity);
  }

  public int firstAccumulator() {
    return _firstAccumulator;
  }

  public int secondAccumulator() {
    return _secondAccumulator;
  }

  public int total() {
    return _firstAccumulator + _secondAccumulator;
  }

  public IncidentSeverity severity() {
    return _severity;
  }

  public boolean isSev1() {
    return _severity == IncidentSeverity.SEV1;
  }

  public boolean isSev2() {
    return _severity == IncidentSeverity.SEV2;
  }

  @Override
  public String toString() {
    return "IncidentState{_firstAccumulator=" + _firstAccumulator + ", _secondAccumulator=" + _secondAccumulator
           + ", total=" + total() + ", _severity=" + _severity + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    IncidentState that = (IncidentState) o;
    return _firstAccumulator == that._firstAccumulator
           && _secondAccumulator == that._secondAccumulator
           && _severity == that._severity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_firstAccumulator, _secondAccumulator, _severity);
  }
}
