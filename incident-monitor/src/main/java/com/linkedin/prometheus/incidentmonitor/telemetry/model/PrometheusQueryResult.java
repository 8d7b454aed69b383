/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import com.google.gson.annotations.SerializedName;

/**
 * Encapsulates the query result obtained from Prometheus API corresponding
 * to a single series that matches the query made in the API call.
 * A query_range call fills in {@link #values()}, an instant query fills in
 * {@link #value()}.
 */
public class PrometheusQueryResult {
    @SerializedName("metric")
    private final Map<String, String> _metric;
    @SerializedName("values")
    @Nullable private final List<PrometheusValue> _values;
    @SerializedName("value")
    @Nullable private final PrometheusValue _value;

    public PrometheusQueryResult(Map<String, String> metric,
                                 @Nullable List<PrometheusValue> values,
                                 @Nullable PrometheusValue value) {
        _metric = metric;
        _values = values;
        _value = value;
    }

    /**
     * @return Labels of the matched series, empty for aggregated series.
     */
    public Map<String, String> metric() {
        return _metric;
    }

    /**
     * @return List of values of a range query, with their respective timestamps.
     */
    @Nullable
    public List<PrometheusValue> values() {
        return _values;
    }

    /**
     * @return The value of an instant query.
     */
    @Nullable
    public PrometheusValue value() {
        return _value;
    }

    @Override
    public String toString() {
        return "PrometheusQueryResult{_metric=" + _metric + ", _values=" + _values + ", _value=" + _value + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusQueryResult result = (PrometheusQueryResult) o;
        return Objects.equals(_metric, result._metric) && Objects.equals(_values, result._values)
               && Objects.equals(_value, result._value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_metric, _values, _value);
    }
}
