/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Creates non-daemon threads named after the monitoring loop they run. An exception escaping a loop body is logged
 * with the logger of the loop owner.
 */
public class IncidentMonitorThreadFactory implements ThreadFactory {
  private final String _name;
  private final AtomicInteger _id = new AtomicInteger(0);
  private final Logger _logger;

  public IncidentMonitorThreadFactory(String name, Logger logger) {
    _name = name;
    _logger = logger;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, _name + "-" + _id.getAndIncrement());
    t.setDaemon(false);
    t.setUncaughtExceptionHandler((thread, e) -> _logger.error("Uncaught exception in {}.", thread.getName(), e));
    return t;
  }
}
