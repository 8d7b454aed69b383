/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;

/**
 * The trailing historical slice of a telemetry series used to fit a forecast model.
 *
 * The observations are ordered by time and re-based so that the first observation sits at the epoch origin. The
 * forecast model is sensitive to seasonality, hence every window must start at the same canonical origin. Relative
 * spacing between observations is preserved exactly.
 */
public final class TrainingWindow {
  private final long _originTimeMs;
  private final List<Observation> _observations;

  private TrainingWindow(long originTimeMs, List<Observation> observations) {
    _originTimeMs = originTimeMs;
    _observations = observations;
  }

  /**
   * Create a training window from observations with absolute timestamps.
   *
   * @param observations Observations in any order, with timestamps in milliseconds since the Unix epoch.
   * @return A window whose first observation is at time zero.
   */
  public static TrainingWindow rebased(List<Observation> observations) {
    validateNotNull(observations, "Observations cannot be null.");
    List<Observation> sorted = new ArrayList<>(observations);
    sorted.sort(Comparator.comparingLong(Observation::timestampMs));
    if (sorted.isEmpty()) {
      return new TrainingWindow(0L, Collections.emptyList());
    }
    long originTimeMs = sorted.get(0).timestampMs();
    List<Observation> rebased = new ArrayList<>(sorted.size());
    for (Observation observation : sorted) {
      rebased.add(new Observation(observation.timestampMs() - originTimeMs, observation.value()));
    }
    return new TrainingWindow(originTimeMs, Collections.unmodifiableList(rebased));
  }

  /**
   * @return The absolute time of the first observation before re-basing, in milliseconds since the Unix epoch.
   */
  public long originTimeMs() {
    return _originTimeMs;
  }

  /**
   * @return Re-based observations ordered by time.
   */
  public List<Observation> observations() {
    return _observations;
  }

  public int size() {
    return _observations.size();
  }

  public boolean isEmpty() {
    return _observations.isEmpty();
  }

  /**
   * @return Number of observations holding a number.
   */
  public int validPointCount() {
    int count = 0;
    for (Observation observation : _observations) {
      if (observation.isValid()) {
        count++;
      }
    }
    return count;
  }

  /**
   * @return Time between the first and the last observation, in milliseconds.
   */
  public long spanMs() {
    return _observations.isEmpty() ? 0L : _observations.get(_observations.size() - 1).timestampMs();
  }

  @Override
  public String toString() {
    return "TrainingWindow{_originTimeMs=" + _originTimeMs + ", size=" + _observations.size() + ", spanMs=" + spanMs() + '}';
  }
}
