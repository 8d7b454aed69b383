/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor;

import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import com.linkedin.prometheus.incidentmonitor.config.constants.MetricsServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.prometheus.incidentmonitor.IncidentMonitorUtils.readConfig;

/**
 * The main class to run the incident monitor.
 */
public final class IncidentMonitorMain {
  private static final Logger LOG = LoggerFactory.getLogger(IncidentMonitorMain.class);

  private IncidentMonitorMain() { }

  /**
   * The main function to run the incident monitor.
   * @param args Arguments passed while starting the incident monitor.
   */
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException(
              String.format("USAGE: java %s incidentmonitor.properties [port] [ipaddress|hostname]",
                      IncidentMonitorMain.class.getSimpleName()));
    }

    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));

    IncidentMonitorConfig config = readConfig(args[0]);
    int port = parsePort(args, config);
    String hostname = parseHostname(args, config);
    IncidentMonitorApp app = new IncidentMonitorApp(config, port, hostname);
    app.registerShutdownHook();
    app.start();
  }

  static int parsePort(String[] args, IncidentMonitorConfig config) {
    if (args.length > 1) {
      return Integer.parseInt(args[1]);
    } else {
      return config.getInt(MetricsServerConfig.METRICS_HTTP_PORT_CONFIG);
    }
  }

  static String parseHostname(String[] args, IncidentMonitorConfig config) {
    if (args.length > 2) {
      return args[2];
    } else {
      return config.getString(MetricsServerConfig.METRICS_HTTP_ADDRESS_CONFIG);
    }
  }
}
