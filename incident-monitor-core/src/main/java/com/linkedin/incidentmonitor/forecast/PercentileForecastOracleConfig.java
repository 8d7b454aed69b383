/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.forecast;

import com.linkedin.incidentmonitor.common.config.AbstractConfig;
import com.linkedin.incidentmonitor.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.between;


public class PercentileForecastOracleConfig extends AbstractConfig {
  /**
   * <code>forecast.seasonality.period.ms</code>
   */
  public static final String FORECAST_SEASONALITY_PERIOD_MS_CONFIG = "forecast.seasonality.period.ms";
  public static final long DEFAULT_FORECAST_SEASONALITY_PERIOD_MS = 3600000L;
  public static final String FORECAST_SEASONALITY_PERIOD_MS_DOC = "The length of the seasonal cycle of the forecast "
      + "model in milliseconds. Timestamps that are a whole number of periods apart share the same forecast.";

  /**
   * <code>forecast.seasonality.buckets</code>
   */
  public static final String FORECAST_SEASONALITY_BUCKETS_CONFIG = "forecast.seasonality.buckets";
  public static final int DEFAULT_FORECAST_SEASONALITY_BUCKETS = 12;
  public static final String FORECAST_SEASONALITY_BUCKETS_DOC = "The number of equally sized buckets the seasonal "
      + "period is divided into. Each bucket gets its own point estimate and confidence interval.";

  /**
   * <code>forecast.min.bucket.points</code>
   */
  public static final String FORECAST_MIN_BUCKET_POINTS_CONFIG = "forecast.min.bucket.points";
  public static final int DEFAULT_FORECAST_MIN_BUCKET_POINTS = 5;
  public static final String FORECAST_MIN_BUCKET_POINTS_DOC = "The minimum number of valid training points a seasonal "
      + "bucket must hold to be forecasted on its own. Sparser buckets use the statistics of the whole training window.";

  /**
   * <code>forecast.interval.width</code>
   */
  public static final String FORECAST_INTERVAL_WIDTH_CONFIG = "forecast.interval.width";
  public static final double DEFAULT_FORECAST_INTERVAL_WIDTH = 0.99;
  public static final String FORECAST_INTERVAL_WIDTH_DOC = "The share of the training values the confidence interval "
      + "of a forecast covers. A width of 0.99 spans the 0.5th to the 99.5th percentile.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(FORECAST_SEASONALITY_PERIOD_MS_CONFIG,
                             ConfigDef.Type.LONG,
                             DEFAULT_FORECAST_SEASONALITY_PERIOD_MS,
                             atLeast(1),
                             ConfigDef.Importance.MEDIUM,
                             FORECAST_SEASONALITY_PERIOD_MS_DOC)
                     .define(FORECAST_SEASONALITY_BUCKETS_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_FORECAST_SEASONALITY_BUCKETS,
                             between(1, 10000),
                             ConfigDef.Importance.MEDIUM,
                             FORECAST_SEASONALITY_BUCKETS_DOC)
                     .define(FORECAST_MIN_BUCKET_POINTS_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_FORECAST_MIN_BUCKET_POINTS,
                             atLeast(2),
                             ConfigDef.Importance.LOW,
                             FORECAST_MIN_BUCKET_POINTS_DOC)
                     .define(FORECAST_INTERVAL_WIDTH_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_FORECAST_INTERVAL_WIDTH,
                             between(0.01, 0.99),
                             ConfigDef.Importance.MEDIUM,
                             FORECAST_INTERVAL_WIDTH_DOC);

  PercentileForecastOracleConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
    sanityCheckBuckets();
  }

  /**
   * Sanity check to ensure that {@link #FORECAST_SEASONALITY_BUCKETS_CONFIG} does not exceed the number of
   * milliseconds in {@link #FORECAST_SEASONALITY_PERIOD_MS_CONFIG}.
   */
  private void sanityCheckBuckets() {
    long periodMs = getLong(FORECAST_SEASONALITY_PERIOD_MS_CONFIG);
    int buckets = getInt(FORECAST_SEASONALITY_BUCKETS_CONFIG);
    if (buckets > periodMs) {
      throw new IllegalArgumentException(String.format("Number of seasonal buckets (%d) exceeds the seasonal period (%d ms).",
                                                       buckets, periodMs));
    }
  }
}
