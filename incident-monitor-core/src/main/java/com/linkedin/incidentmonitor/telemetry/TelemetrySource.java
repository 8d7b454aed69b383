/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.telemetry;

import com.linkedin.incidentmonitor.common.Result;
import com.linkedin.incidentmonitor.model.Observation;
import java.util.List;

/**
 * A read-only source of time series values. Queries are opaque strings in the language of the backend.
 *
 * Implementations do not throw for expected failures: an answered query with no series is reported as
 * {@link com.linkedin.incidentmonitor.common.FailureType#NO_DATA}, an unreachable backend or an unexpected payload as
 * {@link com.linkedin.incidentmonitor.common.FailureType#TRANSPORT_ERROR}.
 */
public interface TelemetrySource {

  /**
   * Fetch the values of the first series matching the query over the given time range.
   *
   * @param query The backend query.
   * @param startMs Start of the range, in milliseconds since the Unix epoch.
   * @param endMs End of the range, in milliseconds since the Unix epoch.
   * @return The observations ordered by time, or the failure.
   */
  Result<List<Observation>> fetchRange(String query, long startMs, long endMs);

  /**
   * Fetch the current value of the first series matching the query.
   *
   * @param query The backend query.
   * @return The current observation, or the failure.
   */
  Result<Observation> fetchInstant(String query);
}
