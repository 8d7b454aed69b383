/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.exception;

public class IncidentMonitorException extends Exception {

  public IncidentMonitorException(String message, Throwable cause) {
    super(message, cause);
  }

  public IncidentMonitorException(String message) {
    super(message);
  }

  public IncidentMonitorException(Throwable cause) {
    super(cause);
  }
}
