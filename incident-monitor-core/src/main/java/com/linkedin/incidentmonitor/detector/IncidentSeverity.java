/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.detector;

/**
 * Severity of an incident spanning the monitored sources.
 */
public enum IncidentSeverity {
  /**
   * The combined temperature is below the threshold.
   */
  QUIESCENT,
  /**
   * The combined temperature reached the threshold but only one source contributes to it.
   */
  SEV2,
  /**
   * The combined temperature reached the threshold and both sources contribute to it.
   */
  SEV1
}
