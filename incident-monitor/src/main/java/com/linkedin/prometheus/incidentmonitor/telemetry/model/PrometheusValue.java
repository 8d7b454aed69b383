/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry.model;

import java.util.Objects;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;

/**
 * Encapsulates the value of a metric at a given instant in time.
 */
@JsonAdapter(PrometheusValueDeserializer.class)
public class PrometheusValue {
    @SerializedName("timestampMs")
    private final long _timestampMs;
    @SerializedName("value")
    private final double _value;

    public PrometheusValue(final long timestampMs, final double value) {
        _timestampMs = timestampMs;
        _value = value;
    }

    /**
     * @return The timestamp at which the metric obtained this value,
     * represented as milliseconds elapsed since the Unix epoch.
     */
    public long timestampMs() {
        return _timestampMs;
    }

    /**
     * @return The value of the metric at the given time, {@link Double#NaN} if Prometheus reported none.
     */
    public double value() {
        return _value;
    }

    @Override
    public String toString() {
        return "PrometheusValue{_timestampMs=" + _timestampMs + ", _value=" + _value + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrometheusValue that = (PrometheusValue) o;
        return _timestampMs == that._timestampMs && Double.compare(that._value, _value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(_timestampMs, _value);
    }
}
