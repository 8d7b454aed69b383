/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.forecast;

import com.linkedin.incidentmonitor.common.config.ConfigException;
import com.linkedin.incidentmonitor.exception.InsufficientDataException;
import com.linkedin.incidentmonitor.model.ForecastPoint;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_INTERVAL_WIDTH_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_MIN_BUCKET_POINTS_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_SEASONALITY_BUCKETS_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_SEASONALITY_PERIOD_MS_CONFIG;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class PercentileForecastOracleTest {
  private static final double DELTA = 1E-9;
  private static final long PERIOD_MS = 60000L;
  private Map<String, Object> _configs;

  @Before
  public void setUp() {
    _configs = new HashMap<>();
    _configs.put(FORECAST_SEASONALITY_PERIOD_MS_CONFIG, Long.toString(PERIOD_MS));
    _configs.put(FORECAST_SEASONALITY_BUCKETS_CONFIG, "2");
    _configs.put(FORECAST_MIN_BUCKET_POINTS_CONFIG, "3");
    _configs.put(FORECAST_INTERVAL_WIDTH_CONFIG, "0.5");
  }

  @Test
  public void testForecastPerSeasonalBucket() throws InsufficientDataException {
    PercentileForecastOracle oracle = new PercentileForecastOracle();
    oracle.configure(_configs);
    ForecastModel model = oracle.fit(seasonalWindow());

    List<ForecastPoint> forecast = model.predict(Arrays.asList(4 * PERIOD_MS, 4 * PERIOD_MS + PERIOD_MS / 2));
    assertEquals(2, forecast.size());

    ForecastPoint first = forecast.get(0);
    assertEquals(4 * PERIOD_MS, first.timestampMs());
    assertEquals(13.0, first.yhat(), DELTA);
    assertEquals(10.5, first.lower(), DELTA);
    assertEquals(15.5, first.upper(), DELTA);

    ForecastPoint second = forecast.get(1);
    assertEquals(100.0, second.yhat(), DELTA);
    assertEquals(100.0, second.lower(), DELTA);
    assertEquals(100.0, second.upper(), DELTA);
  }

  @Test
  public void testSparseBucketsFallBackToWholeWindow() throws InsufficientDataException {
    _configs.put(FORECAST_MIN_BUCKET_POINTS_CONFIG, "5");
    PercentileForecastOracle oracle = new PercentileForecastOracle();
    oracle.configure(_configs);
    ForecastModel model = oracle.fit(seasonalWindow());

    for (ForecastPoint point : model.predict(Arrays.asList(0L, PERIOD_MS / 2))) {
      assertEquals(56.5, point.yhat(), DELTA);
      assertTrue(point.lower() <= point.yhat());
      assertTrue(point.upper() >= point.yhat());
    }
  }

  @Test
  public void testMissingValuesAreIgnored() throws InsufficientDataException {
    List<Observation> observations = new ArrayList<>();
    observations.add(new Observation(0L, 4.0));
    observations.add(new Observation(PERIOD_MS / 4, Double.NaN));
    observations.add(new Observation(PERIOD_MS / 2, 8.0));
    ForecastModel model = new PercentileForecastOracle().fit(TrainingWindow.rebased(observations));

    ForecastPoint point = model.predict(Arrays.asList(0L)).get(0);
    assertEquals(6.0, point.yhat(), DELTA);
  }

  @Test(expected = InsufficientDataException.class)
  public void testFitRequiresTwoValidPoints() throws InsufficientDataException {
    new PercentileForecastOracle().fit(TrainingWindow.rebased(Arrays.asList(new Observation(0L, 1.0),
                                                                            new Observation(1000L, Double.NaN))));
  }

  @Test(expected = ConfigException.class)
  public void testInvalidIntervalWidth() {
    _configs.put(FORECAST_INTERVAL_WIDTH_CONFIG, "1.5");
    new PercentileForecastOracle().configure(_configs);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMoreBucketsThanPeriod() {
    _configs.put(FORECAST_SEASONALITY_PERIOD_MS_CONFIG, "10");
    _configs.put(FORECAST_SEASONALITY_BUCKETS_CONFIG, "20");
    new PercentileForecastOracle().configure(_configs);
  }

  @Test
  public void testBucketForNegativeTimestamp() {
    assertEquals(0, PercentileForecastOracle.bucketFor(0L, PERIOD_MS, 2));
    assertEquals(1, PercentileForecastOracle.bucketFor(PERIOD_MS - 1, PERIOD_MS, 2));
    assertEquals(1, PercentileForecastOracle.bucketFor(-1L, PERIOD_MS, 2));
    assertEquals(0, PercentileForecastOracle.bucketFor(-PERIOD_MS, PERIOD_MS, 2));
  }

  /**
   * Four periods with values 10, 12, 14, 16 in the first half of the period and 100 in the second half.
   */
  private static TrainingWindow seasonalWindow() {
    List<Observation> observations = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      observations.add(new Observation(i * PERIOD_MS, 10.0 + 2 * i));
      observations.add(new Observation(i * PERIOD_MS + PERIOD_MS / 2, 100.0));
    }
    return TrainingWindow.rebased(observations);
  }
}
