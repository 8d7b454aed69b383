/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusQueryResult;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusResponse;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusValue;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a training window from a saved Prometheus query_range response. The first series of the response is used,
 * samples without a numeric value are dropped.
 */
public final class TrainingFileLoader {
  private static final Gson GSON = new Gson();

  private TrainingFileLoader() {

  }

  /**
   * @param trainingFile Path to a JSON file holding a query_range response.
   * @return The re-based training window, empty if the file holds no series.
   * @throws IOException if the file cannot be read or is not a valid query_range response.
   */
  public static TrainingWindow load(Path trainingFile) throws IOException {
    PrometheusResponse response;
    try (Reader reader = Files.newBufferedReader(trainingFile, StandardCharsets.UTF_8)) {
      response = GSON.fromJson(reader, PrometheusResponse.class);
    } catch (JsonParseException e) {
      throw new IOException("Training file " + trainingFile + " is not valid JSON.", e);
    }
    if (response == null || response.data() == null || response.data().result() == null) {
      throw new IOException("Training file " + trainingFile + " does not hold a query_range response.");
    }
    List<PrometheusQueryResult> results = response.data().result();
    List<Observation> observations = new ArrayList<>();
    if (!results.isEmpty() && results.get(0).values() != null) {
      for (PrometheusValue value : results.get(0).values()) {
        if (!Double.isNaN(value.value())) {
          observations.add(new Observation(value.timestampMs(), value.value()));
        }
      }
    }
    return TrainingWindow.rebased(observations);
  }
}
