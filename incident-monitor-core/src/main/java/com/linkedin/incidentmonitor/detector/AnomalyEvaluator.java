/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.detector;

import com.linkedin.incidentmonitor.model.EvaluationResult;
import com.linkedin.incidentmonitor.model.ForecastPoint;
import com.linkedin.incidentmonitor.model.Observation;
import java.util.OptionalDouble;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;

/**
 * Compares a single observation against the forecast for the same instant.
 *
 * An observation is anomalous if it lies strictly outside the forecast interval {@code [lower, upper]}; values on a
 * boundary are not anomalous. The absolute error is {@code |observed - predicted|} and the absolute percentage error
 * is the absolute error over {@code |observed|}, times 100. Both are computed for the single point only.
 */
public class AnomalyEvaluator {

  /**
   * @param observation The live observation.
   * @param forecast The forecast for the same instant.
   * @return The evaluation result.
   */
  public EvaluationResult evaluate(Observation observation, ForecastPoint forecast) {
    validateNotNull(observation, "Observation cannot be null.");
    validateNotNull(forecast, "Forecast cannot be null.");
    double observed = observation.value();
    double predicted = forecast.yhat();
    // Comparisons against NaN are false, hence a missing value is never anomalous.
    boolean anomaly = observed < forecast.lower() || observed > forecast.upper();

    OptionalDouble mae = OptionalDouble.empty();
    OptionalDouble mape = OptionalDouble.empty();
    if (!Double.isNaN(observed) && !Double.isNaN(predicted)) {
      double absoluteError = Math.abs(observed - predicted);
      mae = OptionalDouble.of(absoluteError);
      if (observed != 0.0) {
        mape = OptionalDouble.of(absoluteError / Math.abs(observed) * 100.0);
      }
    }
    return new EvaluationResult(observation.timestampMs(), observed, predicted, forecast.lower(), forecast.upper(),
                                anomaly, mae, mape);
  }
}
