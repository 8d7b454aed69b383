/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.forecast;

import com.linkedin.incidentmonitor.model.ForecastPoint;
import java.util.List;


public interface ForecastModel {

  /**
   * Callers re-base the timestamps on their own reference time, which may differ from the origin of the training
   * window. Seasonal models then see a phase shift equal to the difference, modulo the period.
   *
   * @param timestampsMs Re-based timestamps in milliseconds.
   * @return One forecast point per timestamp, in the same order.
   */
  List<ForecastPoint> predict(List<Long> timestampsMs);
}
