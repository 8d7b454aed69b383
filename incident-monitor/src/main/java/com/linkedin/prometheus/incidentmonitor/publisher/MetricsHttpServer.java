/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.publisher;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The HTTP server exposing the published gauges to Prometheus under {@link #METRICS_PATH}.
 */
public class MetricsHttpServer {
  private static final Logger LOG = LoggerFactory.getLogger(MetricsHttpServer.class);
  public static final String METRICS_PATH = "/metrics";
  private final Server _server;
  private final ServerConnector _connector;

  public MetricsHttpServer(PrometheusMeterRegistry registry, String hostname, int port) {
    _server = new Server();
    _connector = new ServerConnector(_server);
    _connector.setHost(hostname);
    _connector.setPort(port);
    _server.setConnectors(new Connector[]{_connector});

    ServletContextHandler contextHandler = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
    contextHandler.setContextPath("/");
    contextHandler.addServlet(new ServletHolder(new PrometheusScrapeServlet(registry)), METRICS_PATH);
    _server.setHandler(contextHandler);
  }

  public void start() throws Exception {
    _server.start();
    LOG.info("Metrics endpoint started on {}.", serverUrl());
  }

  public void stop() throws Exception {
    _server.stop();
    LOG.info("Metrics endpoint stopped.");
  }

  /**
   * @return The port the server is bound to, -1 if the server is not started.
   */
  public int localPort() {
    return _connector.getLocalPort();
  }

  /**
   * @return The URL of the scrape endpoint.
   */
  public String serverUrl() {
    String host = _connector.getHost() == null ? "0.0.0.0" : _connector.getHost();
    return String.format("http://%s:%d%s", host, localPort(), METRICS_PATH);
  }
}
