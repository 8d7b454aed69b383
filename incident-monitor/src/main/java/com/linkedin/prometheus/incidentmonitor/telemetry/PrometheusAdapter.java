/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.SEC_TO_MS;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusQueryResult;
import com.linkedin.prometheus.incidentmonitor.telemetry.model.PrometheusResponse;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.servlet.http.HttpServletResponse;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.http.NameValuePair;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;

/**
 * This class provides an adapter to make queries to a Prometheus Server to fetch metric values.
 */
public class PrometheusAdapter {
    private static final Gson GSON = new Gson();
    static final String QUERY_RANGE_API_PATH = "/api/v1/query_range";
    static final String QUERY_API_PATH = "/api/v1/query";
    static final String SUCCESS = "success";
    private static final String QUERY = "query";
    private static final String START = "start";
    private static final String END = "end";
    private static final String STEP = "step";

    private final CloseableHttpClient _httpClient;
    protected final HttpHost _prometheusEndpoint;
    protected final int _resolutionStepMs;

    public PrometheusAdapter(CloseableHttpClient httpClient,
                             HttpHost prometheusEndpoint,
                             int resolutionStepMs) {
        _httpClient = validateNotNull(httpClient, "httpClient cannot be null.");
        _prometheusEndpoint = validateNotNull(prometheusEndpoint, "prometheusEndpoint cannot be null.");
        _resolutionStepMs = resolutionStepMs;
    }

    /**
     * Evaluate the query over a range of time.
     *
     * @param queryString The PromQL query.
     * @param startTimeMs Start of the range in milliseconds since the Unix epoch.
     * @param endTimeMs End of the range in milliseconds since the Unix epoch.
     * @return One result per matching series, each holding {@link PrometheusQueryResult#values()}.
     * @throws IOException if the server cannot be reached or does not return a successful, well formed response.
     */
    public List<PrometheusQueryResult> queryRange(String queryString,
                                                  long startTimeMs,
                                                  long endTimeMs) throws IOException {
        List<NameValuePair> data = new ArrayList<>();
        data.add(new BasicNameValuePair(QUERY, queryString));
        /* "start" and "end" are expected to be unix timestamp in seconds (number of seconds since the Unix epoch).
         They accept values with a decimal point (up to 64 bits). The samples returned are inclusive of the "end"
         timestamp provided.
         */
        data.add(new BasicNameValuePair(START, String.valueOf((double) startTimeMs / SEC_TO_MS)));
        data.add(new BasicNameValuePair(END, String.valueOf((double) endTimeMs / SEC_TO_MS)));
        // step is expected to be in seconds, and accept values with a decimal point (up to 64 bits).
        data.add(new BasicNameValuePair(STEP, String.valueOf((double) _resolutionStepMs / SEC_TO_MS)));
        return execute(QUERY_RANGE_API_PATH, data);
    }

    /**
     * Evaluate the query at the current time of the server.
     *
     * @param queryString The PromQL query.
     * @return One result per matching series, each holding {@link PrometheusQueryResult#value()}.
     * @throws IOException if the server cannot be reached or does not return a successful, well formed response.
     */
    public List<PrometheusQueryResult> queryInstant(String queryString) throws IOException {
        List<NameValuePair> data = new ArrayList<>();
        data.add(new BasicNameValuePair(QUERY, queryString));
        return execute(QUERY_API_PATH, data);
    }

    private List<PrometheusQueryResult> execute(String apiPath, List<NameValuePair> data) throws IOException {
        String queryParams = URLEncodedUtils.format(data, StandardCharsets.UTF_8);
        URI queryUri = URI.create(_prometheusEndpoint.toURI() + apiPath + "?" + queryParams);
        HttpPost httpPost = new HttpPost(queryUri);

        try (CloseableHttpResponse response = _httpClient.execute(httpPost)) {
            int responseCode = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String responseString;
            if (entity == null) {
                responseString = "";
            } else {
                try (InputStream content = entity.getContent()) {
                    responseString = IOUtils.toString(content, StandardCharsets.UTF_8);
                }
            }
            if (responseCode != HttpServletResponse.SC_OK) {
                throw new IOException(String.format("Received non-success response code on Prometheus API HTTP call,"
                                                    + " response code = %d, response body = %s",
                                                    responseCode, responseString));
            }
            PrometheusResponse prometheusResponse;
            try {
                prometheusResponse = GSON.fromJson(responseString, PrometheusResponse.class);
            } catch (JsonParseException e) {
                throw new IOException(String.format(
                    "Response from Prometheus HTTP API is not valid JSON, response body = %s", responseString), e);
            }
            if (prometheusResponse == null) {
                throw new IOException(String.format(
                    "No response received from Prometheus API query, response body = %s", responseString));
            }

            if (!SUCCESS.equals(prometheusResponse.status())) {
                throw new IOException(String.format(
                    "Prometheus API query was not successful, response body = %s", responseString));
            }
            if (prometheusResponse.data() == null
                || prometheusResponse.data().result() == null) {
                throw new IOException(String.format(
                    "Response from Prometheus HTTP API is malformed, response body = %s", responseString));
            }
            EntityUtils.consume(entity);
            return prometheusResponse.data().result();
        }
    }
}
