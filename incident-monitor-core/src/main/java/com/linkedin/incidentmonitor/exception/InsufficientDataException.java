/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.incidentmonitor.exception;

/**
 * Thrown if a training window does not hold enough valid points to fit a forecast model.
 */
public class InsufficientDataException extends IncidentMonitorException {
  public InsufficientDataException(String message) {
    super(message);
  }
}
