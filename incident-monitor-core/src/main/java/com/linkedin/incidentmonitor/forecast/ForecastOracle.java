/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.forecast;

import com.linkedin.incidentmonitor.common.IncidentMonitorConfigurable;
import com.linkedin.incidentmonitor.exception.InsufficientDataException;
import com.linkedin.incidentmonitor.model.TrainingWindow;

/**
 * Fits a {@link ForecastModel} to a training window. Implementations must have a public no-argument constructor and
 * are configured through {@link #configure(java.util.Map)} with the monitor configuration.
 */
public interface ForecastOracle extends IncidentMonitorConfigurable {

  /**
   * @param window A re-based training window.
   * @return A model able to forecast the series the window was taken from.
   * @throws InsufficientDataException if the window does not hold enough valid points to fit a model.
   */
  ForecastModel fit(TrainingWindow window) throws InsufficientDataException;
}
