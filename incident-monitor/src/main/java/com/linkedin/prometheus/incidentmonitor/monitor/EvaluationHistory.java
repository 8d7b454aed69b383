/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

import com.linkedin.incidentmonitor.model.EvaluationResult;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * The most recent evaluation results of a monitor. Not thread safe, owned by the monitor thread.
 */
public class EvaluationHistory {
  private final int _capacity;
  private final Deque<EvaluationResult> _results;

  public EvaluationHistory(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("History capacity must be positive, but was " + capacity + ".");
    }
    _capacity = capacity;
    _results = new ArrayDeque<>(capacity);
  }

  /**
   * Add the given result, evicting the oldest one if the history is full.
   *
   * @param result Evaluation result to add.
   */
  public void add(EvaluationResult result) {
    if (_results.size() == _capacity) {
      _results.removeFirst();
    }
    _results.addLast(result);
  }

  public int size() {
    return _results.size();
  }

  /**
   * @return Number of anomalous results in the history.
   */
  public int anomalyCount() {
    int count = 0;
    for (EvaluationResult result : _results) {
      count += result.anomalyCount();
    }
    return count;
  }

  /**
   * @return Average absolute error over the results that have one, empty if none has.
   */
  public OptionalDouble averageMae() {
    return _results.stream().map(EvaluationResult::mae).filter(OptionalDouble::isPresent)
                   .mapToDouble(OptionalDouble::getAsDouble).average();
  }

  /**
   * @return Average absolute percentage error over the results that have one, empty if none has.
   */
  public OptionalDouble averageMape() {
    return _results.stream().map(EvaluationResult::mape).filter(OptionalDouble::isPresent)
                   .mapToDouble(OptionalDouble::getAsDouble).average();
  }
}
