/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.common;

/**
 * The kinds of recoverable failures a monitoring cycle can run into.
 */
public enum FailureType {
  /**
   * The backend answered but returned no series.
   */
  NO_DATA,
  /**
   * Too few valid points to fit a forecast model.
   */
  INSUFFICIENT_DATA,
  /**
   * The backend could not be reached, timed out, or returned an unexpected payload.
   */
  TRANSPORT_ERROR,
  /**
   * A numeric computation had no defined value. Reserved for pluggable sources and oracles, e.g. a client of an
   * external model service whose answer is NaN. Undefined error scores of an evaluation are not failures, they are
   * absent from {@link com.linkedin.incidentmonitor.model.EvaluationResult}.
   */
  NUMERIC_UNDEFINED
}
