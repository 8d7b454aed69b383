/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry.model;

import java.lang.reflect.Type;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * Deserializer used to transform a sample obtained from Prometheus'
 * query and query_range API responses to the POJO {@link PrometheusValue}.
 *
 * The sample is represented in the response as a one-dimensional array of
 * length of exactly two. The first element in the array is the timestamp
 * for the metric value in epoch seconds (possibly fractional), and the second
 * element is the raw value as a string, which may be "NaN", "+Inf" or "-Inf".
 */
class PrometheusValueDeserializer implements JsonDeserializer<PrometheusValue> {
    private static final double SEC_TO_MS = 1000.0;
    private static final String POSITIVE_INFINITY = "+Inf";
    private static final String NEGATIVE_INFINITY = "-Inf";

    @Override
    public PrometheusValue deserialize(JsonElement json,
                                       Type typeOfT,
                                       JsonDeserializationContext context) throws JsonParseException {
        if (!json.isJsonArray()) {
            throw new JsonParseException("Every value should be an array, got " + json);
        }
        final JsonArray valueArray = json.getAsJsonArray();
        if (valueArray.size() != 2) {
            throw new JsonParseException("Every value array should have exactly two elements");
        }
        final long timestampMs;
        final double numericValue;
        try {
            timestampMs = Math.round(valueArray.get(0).getAsDouble() * SEC_TO_MS);
            numericValue = parseSampleValue(valueArray.get(1).getAsString());
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new JsonParseException("Malformed sample " + valueArray, e);
        }
        return new PrometheusValue(timestampMs, numericValue);
    }

    static double parseSampleValue(String valueString) {
        switch (valueString) {
            case POSITIVE_INFINITY:
                return Double.POSITIVE_INFINITY;
            case NEGATIVE_INFINITY:
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.parseDouble(valueString);
        }
    }
}
