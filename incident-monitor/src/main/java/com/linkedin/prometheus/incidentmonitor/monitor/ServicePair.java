/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

import com.linkedin.incidentmonitor.common.config.ConfigException;
import com.linkedin.prometheus.incidentmonitor.config.constants.MonitorConfig;
import java.util.Objects;

/**
 * A monitored source to destination service call path.
 */
public final class ServicePair {
  static final String SEPARATOR = ":";
  private final String _source;
  private final String _destination;

  public ServicePair(String source, String destination) {
    _source = source;
    _destination = destination;
  }

  /**
   * @param pair A pair in the form source:destination.
   * @return The parsed pair.
   * @throws ConfigException if the pair is malformed.
   */
  public static ServicePair parse(String pair) {
    String[] services = pair.trim().split(SEPARATOR, -1);
    if (services.length != 2 || services[0].trim().isEmpty() || services[1].trim().isEmpty()) {
      throw new ConfigException(MonitorConfig.MONITOR_SERVICE_PAIRS_CONFIG, pair,
                                "Expected a service pair in the form source" + SEPARATOR + "destination.");
    }
    return new ServicePair(services[0].trim(), services[1].trim());
  }

  public String source() {
    return _source;
  }

  public String destination() {
    return _destination;
  }

  /**
   * @return The identifier of the pair used in gauge and file names: source_2_destination.
   */
  public String id() {
    return _source + "_2_" + _destination;
  }

  /**
   * @param template A query template with source and destination placeholders.
   * @return The query for this pair.
   */
  public String substitute(String template) {
    return template.replace(MonitorConfig.SOURCE_PLACEHOLDER, _source)
                   .replace(MonitorConfig.DESTINATION_PLACEHOLDER, _destination);
  }

  @Override
  public String toString() {
    return _source + "->" + _destination;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ServicePair that = (ServicePair) o;
    return _source.equals(that._source) && _destination.equals(that._destination);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_source, _destination);
  }
}
