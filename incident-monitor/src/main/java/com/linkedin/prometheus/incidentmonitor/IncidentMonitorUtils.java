/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor;

import com.linkedin.prometheus.incidentmonitor.config.IncidentMonitorConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Util class for convenience.
 */
public final class IncidentMonitorUtils {
  public static final int SEC_TO_MS = (int) TimeUnit.SECONDS.toMillis(1);
  public static final long SCHEDULER_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(10);

  private IncidentMonitorUtils() {

  }

  /**
   * Read the incident monitor configuration from the given properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The parsed configuration.
   * @throws IOException if the file cannot be read.
   */
  public static IncidentMonitorConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new IncidentMonitorConfig(props);
  }

  /**
   * Shut down the given scheduler and wait for the running task to complete.
   *
   * @param scheduler The scheduler to shut down.
   * @param name Name of the scheduler, used in log messages.
   * @param timeoutMs Maximum time to wait for termination.
   * @param logger Logger of the owner.
   */
  public static void shutdownScheduler(ExecutorService scheduler, String name, long timeoutMs, Logger logger) {
    scheduler.shutdown();
    try {
      scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
      if (!scheduler.isTerminated()) {
        logger.warn("The {} scheduler failed to shutdown in {} ms.", name, timeoutMs);
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for the {} scheduler to shutdown.", name);
      Thread.currentThread().interrupt();
    }
  }
}
