/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.detector;

import com.linkedin.incidentmonitor.model.AnomalySignal;

/**
 * Turns the anomaly signals of two sources into a debounced incident severity.
 *
 * Each source owns an accumulator (its temperature) in {@code [0, cap]}. Every cycle an anomalous signal raises the
 * accumulator by the increment, any other signal lowers it by the decrement; the result is then clamped. With the
 * default steps a single transient anomaly never raises an incident. The severity is re-derived from the accumulators
 * every cycle, see {@link IncidentState#classify(int, int, int)}.
 *
 * An instance is not thread safe. It is driven by a single detection thread.
 */
public class IncidentEscalator {
  public static final int DEFAULT_THRESHOLD = 5;
  public static final int DEFAULT_ACCUMULATOR_CAP = 10;
  public static final int DEFAULT_INCREMENT = 1;
  public static final int DEFAULT_DECREMENT = 2;

  private final int _threshold;
  private final int _cap;
  private final int _increment;
  private final int _decrement;
  private int _firstAccumulator;
  private int _secondAccumulator;

  public IncidentEscalator() {
    this(DEFAULT_THRESHOLD, DEFAULT_ACCUMULATOR_CAP, DEFAULT_INCREMENT, DEFAULT_DECREMENT);
  }

  public IncidentEscalator(int threshold, int cap, int increment, int decrement) {
    if (cap <= 0 || increment <= 0 || decrement <= 0) {
      throw new IllegalArgumentException(String.format("Cap (%d), increment (%d) and decrement (%d) must be positive.",
                                                       cap, increment, decrement));
    }
    if (threshold <= 0 || threshold > 2 * cap) {
      throw new IllegalArgumentException(String.format("Threshold %d must be in (0, %d].", threshold, 2 * cap));
    }
    _threshold = threshold;
    _cap = cap;
    _increment = increment;
    _decrement = decrement;
    _firstAccumulator = 0;
    _secondAccumulator = 0;
  }

  /**
   * Advance the state machine by one cycle.
   *
   * @param first Signal of the first source.
   * @param second Signal of the second source.
   * @return The state after the update.
   */
  public IncidentState update(AnomalySignal first, AnomalySignal second) {
    return update(first.isAnomalous(), second.isAnomalous());
  }

  /**
   * Advance the state machine by one cycle.
   *
   * @param firstAnomalous {@code true} if the first source reported an anomaly in this cycle.
   * @param secondAnomalous {@code true} if the second source reported an anomaly in this cycle.
   * @return The state after the update.
   */
  public IncidentState update(boolean firstAnomalous, boolean secondAnomalous) {
    _firstAccumulator = step(_firstAccumulator, firstAnomalous);
    _secondAccumulator = step(_secondAccumulator, secondAnomalous);
    return currentState();
  }

  /**
   * @return The state as of the last update.
   */
  public IncidentState currentState() {
    return IncidentState.classify(_firstAccumulator, _secondAccumulator, _threshold);
  }

  public int threshold() {
    return _threshold;
  }

  public int cap() {
    return _cap;
  }

  private int step(int accumulator, boolean anomalous) {
    int next = anomalous ? accumulator + _increment : accumulator - _decrement;
    return Math.max(0, Math.min(_cap, next));
  }
}
