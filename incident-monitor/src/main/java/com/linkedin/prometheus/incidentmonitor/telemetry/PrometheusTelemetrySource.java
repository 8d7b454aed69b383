/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry;

import com.linkedin.incidentmonitor.common.FailureType;
import com.linkedin.incidentmonitor.common.Result;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.telemetry.TelemetrySource;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusQueryResult;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusValue;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;

/**
 * A {@link TelemetrySource} backed by the Prometheus HTTP API. Only the first series matching a query is used.
 */
public class PrometheusTelemetrySource implements TelemetrySource {
  private static final Logger LOG = LoggerFactory.getLogger(PrometheusTelemetrySource.class);
  private final PrometheusAdapter _prometheusAdapter;

  public PrometheusTelemetrySource(PrometheusAdapter prometheusAdapter) {
    _prometheusAdapter = validateNotNull(prometheusAdapter, "Prometheus adapter cannot be null.");
  }

  @Override
  public Result<List<Observation>> fetchRange(String query, long startMs, long endMs) {
    List<PrometheusQueryResult> results;
    try {
      results = _prometheusAdapter.queryRange(query, startMs, endMs);
    } catch (IOException e) {
      return Result.failure(FailureType.TRANSPORT_ERROR, "Range query " + query + " failed.", e);
    }
    if (results.isEmpty()) {
      return Result.failure(FailureType.NO_DATA, "Range query " + query + " matched no series.");
    }
    PrometheusQueryResult series = firstSeries(query, results);
    List<PrometheusValue> values = series.values();
    if (values == null || values.isEmpty()) {
      return Result.failure(FailureType.NO_DATA, "Range query " + query + " returned a series without samples.");
    }
    List<Observation> observations = new ArrayList<>(values.size());
    for (PrometheusValue value : values) {
      observations.add(new Observation(value.timestampMs(), value.value()));
    }
    return Result.success(observations);
  }

  @Override
  public Result<Observation> fetchInstant(String query) {
    List<PrometheusQueryResult> results;
    try {
      results = _prometheusAdapter.queryInstant(query);
    } catch (IOException e) {
      return Result.failure(FailureType.TRANSPORT_ERROR, "Instant query " + query + " failed.", e);
    }
    if (results.isEmpty()) {
      return Result.failure(FailureType.NO_DATA, "Instant query " + query + " matched no series.");
    }
    PrometheusValue value = firstSeries(query, results).value();
    if (value == null) {
      return Result.failure(FailureType.TRANSPORT_ERROR, "Instant query " + query + " returned a series without a sample.");
    }
    return Result.success(new Observation(value.timestampMs(), value.value()));
  }

  private static PrometheusQueryResult firstSeries(String query, List<PrometheusQueryResult> results) {
    if (results.size() > 1) {
      LOG.debug("Query {} matched {} series, using the first one with labels {}.", query, results.size(),
                results.get(0).metric());
    }
    return results.get(0);
  }
}
