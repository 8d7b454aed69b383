/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.forecast;

import com.linkedin.incidentmonitor.exception.InsufficientDataException;
import com.linkedin.incidentmonitor.model.ForecastPoint;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.incidentmonitor.common.utils.Utils.utcDateFor;
import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.DEFAULT_FORECAST_INTERVAL_WIDTH;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.DEFAULT_FORECAST_MIN_BUCKET_POINTS;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.DEFAULT_FORECAST_SEASONALITY_BUCKETS;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.DEFAULT_FORECAST_SEASONALITY_PERIOD_MS;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_INTERVAL_WIDTH_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_MIN_BUCKET_POINTS_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_SEASONALITY_BUCKETS_CONFIG;
import static com.linkedin.incidentmonitor.forecast.PercentileForecastOracleConfig.FORECAST_SEASONALITY_PERIOD_MS_CONFIG;


/**
 * A forecast oracle with flat growth and a single seasonal cycle.
 *
 * The seasonal period is divided into equally sized buckets. The forecast of a timestamp is derived from the training
 * values that fall into the same bucket: the point estimate is their mean, and the confidence interval spans the
 * percentiles {@code (1 - w) / 2} and {@code (1 + w) / 2} of them, where {@code w} is the configured interval width.
 * Buckets with fewer than the configured minimum number of valid points use the statistics of the whole window.
 */
public class PercentileForecastOracle implements ForecastOracle {
  private static final Logger LOG = LoggerFactory.getLogger(PercentileForecastOracle.class);
  static final int MIN_VALID_POINTS = 2;
  private long _periodMs;
  private int _numBuckets;
  private int _minBucketPoints;
  private double _intervalWidth;

  public PercentileForecastOracle() {
    _periodMs = DEFAULT_FORECAST_SEASONALITY_PERIOD_MS;
    _numBuckets = DEFAULT_FORECAST_SEASONALITY_BUCKETS;
    _minBucketPoints = DEFAULT_FORECAST_MIN_BUCKET_POINTS;
    _intervalWidth = DEFAULT_FORECAST_INTERVAL_WIDTH;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    PercentileForecastOracleConfig config = new PercentileForecastOracleConfig(configs);
    _periodMs = config.getLong(FORECAST_SEASONALITY_PERIOD_MS_CONFIG);
    _numBuckets = config.getInt(FORECAST_SEASONALITY_BUCKETS_CONFIG);
    _minBucketPoints = config.getInt(FORECAST_MIN_BUCKET_POINTS_CONFIG);
    _intervalWidth = config.getDouble(FORECAST_INTERVAL_WIDTH_CONFIG);
  }

  @Override
  public ForecastModel fit(TrainingWindow window) throws InsufficientDataException {
    validateNotNull(window, "Training window cannot be null.");
    int validPoints = window.validPointCount();
    if (validPoints < MIN_VALID_POINTS) {
      throw new InsufficientDataException(String.format("Cannot fit a forecast on %d valid points, at least %d are required.",
                                                        validPoints, MIN_VALID_POINTS));
    }

    DescriptiveStatistics overall = new DescriptiveStatistics();
    List<DescriptiveStatistics> statsByBucket = new ArrayList<>(_numBuckets);
    for (int i = 0; i < _numBuckets; i++) {
      statsByBucket.add(new DescriptiveStatistics());
    }
    for (Observation observation : window.observations()) {
      if (observation.isValid()) {
        overall.addValue(observation.value());
        statsByBucket.get(bucketFor(observation.timestampMs(), _periodMs, _numBuckets)).addValue(observation.value());
      }
    }

    Interval fallback = intervalOf(overall);
    List<Interval> intervalByBucket = new ArrayList<>(_numBuckets);
    int numSparseBuckets = 0;
    for (DescriptiveStatistics stats : statsByBucket) {
      if (stats.getN() >= _minBucketPoints) {
        intervalByBucket.add(intervalOf(stats));
      } else {
        intervalByBucket.add(fallback);
        numSparseBuckets++;
      }
    }
    LOG.debug("Fitted forecast on {} valid points starting at {}: overall {}, {}/{} buckets fell back to the overall interval.",
              validPoints, utcDateFor(window.originTimeMs()), fallback, numSparseBuckets, _numBuckets);
    return new SeasonalModel(Collections.unmodifiableList(intervalByBucket), _periodMs);
  }

  static int bucketFor(long timestampMs, long periodMs, int numBuckets) {
    return (int) (Math.floorMod(timestampMs, periodMs) * numBuckets / periodMs);
  }

  private Interval intervalOf(DescriptiveStatistics stats) {
    double lowerPercentile = (1.0 - _intervalWidth) / 2.0 * 100.0;
    double upperPercentile = (1.0 + _intervalWidth) / 2.0 * 100.0;
    return new Interval(stats.getMean(), stats.getPercentile(lowerPercentile), stats.getPercentile(upperPercentile));
  }

  private static final class Interval {
    private final double _yhat;
    private final double _lower;
    private final double _upper;

    private Interval(double yhat, double lower, double upper) {
      _yhat = yhat;
      _lower = lower;
      _upper = upper;
    }

    @Override
    public String toString() {
      return String.format("%.3f [%.3f, %.3f]", _yhat, _lower, _upper);
    }
  }

  private static final class SeasonalModel implements ForecastModel {
    private final List<Interval> _intervalByBucket;
    private final long _periodMs;

    private SeasonalModel(List<Interval> intervalByBucket, long periodMs) {
      _intervalByBucket = intervalByBucket;
      _periodMs = periodMs;
    }

    @Override
    public List<ForecastPoint> predict(List<Long> timestampsMs) {
      List<ForecastPoint> forecast = new ArrayList<>(timestampsMs.size());
      for (long timestampMs : timestampsMs) {
        Interval interval = _intervalByBucket.get(bucketFor(timestampMs, _periodMs, _intervalByBucket.size()));
        forecast.add(new ForecastPoint(timestampMs, interval._yhat, interval._lower, interval._upper));
      }
      return forecast;
    }
  }
}
