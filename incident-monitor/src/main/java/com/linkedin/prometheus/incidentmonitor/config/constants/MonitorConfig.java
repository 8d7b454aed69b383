/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.config.constants;

import com.linkedin.incidentmonitor.common.config.ConfigDef;
import com.linkedin.incidentmonitor.forecast.PercentileForecastOracle;
import java.util.concurrent.TimeUnit;

import static com.linkedin.incidentmonitor.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep forecast monitor configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MonitorConfig {
  public static final String SOURCE_PLACEHOLDER = "${source}";
  public static final String DESTINATION_PLACEHOLDER = "${destination}";

  /**
   * <code>monitor.service.pairs</code>
   */
  public static final String MONITOR_SERVICE_PAIRS_CONFIG = "monitor.service.pairs";
  public static final String DEFAULT_MONITOR_SERVICE_PAIRS = "";
  public static final String MONITOR_SERVICE_PAIRS_DOC = "A comma separated list of source:destination service pairs. "
      + "One forecast monitor is started for each pair, e.g. frontend:shippingservice,checkoutservice:shippingservice.";

  /**
   * <code>monitor.polling.interval.ms</code>
   */
  public static final String MONITOR_POLLING_INTERVAL_MS_CONFIG = "monitor.polling.interval.ms";
  public static final long DEFAULT_MONITOR_POLLING_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String MONITOR_POLLING_INTERVAL_MS_DOC = "The time between two successful evaluation cycles "
      + "of a forecast monitor.";

  /**
   * <code>monitor.retry.backoff.ms</code>
   */
  public static final String MONITOR_RETRY_BACKOFF_MS_CONFIG = "monitor.retry.backoff.ms";
  public static final long DEFAULT_MONITOR_RETRY_BACKOFF_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String MONITOR_RETRY_BACKOFF_MS_DOC = "The time to wait after a failed evaluation cycle or "
      + "model refresh before trying again. Retries are unbounded.";

  /**
   * <code>monitor.training.lookback.ms</code>
   */
  public static final String MONITOR_TRAINING_LOOKBACK_MS_CONFIG = "monitor.training.lookback.ms";
  public static final long DEFAULT_MONITOR_TRAINING_LOOKBACK_MS = TimeUnit.HOURS.toMillis(1);
  public static final String MONITOR_TRAINING_LOOKBACK_MS_DOC = "The length of the trailing window used to fit the "
      + "forecast model.";

  /**
   * <code>monitor.retrain.interval.ms</code>
   */
  public static final String MONITOR_RETRAIN_INTERVAL_MS_CONFIG = "monitor.retrain.interval.ms";
  public static final long DEFAULT_MONITOR_RETRAIN_INTERVAL_MS = TimeUnit.HOURS.toMillis(1);
  public static final String MONITOR_RETRAIN_INTERVAL_MS_DOC = "The time between two successful refreshes of the "
      + "forecast model.";

  /**
   * <code>monitor.live.query.template</code>
   */
  public static final String MONITOR_LIVE_QUERY_TEMPLATE_CONFIG = "monitor.live.query.template";
  public static final String DEFAULT_MONITOR_LIVE_QUERY_TEMPLATE =
      "histogram_quantile(0.5, sum(rate(istio_request_duration_milliseconds_bucket{source_app='${source}', "
      + "destination_app='${destination}', reporter='source'}[1m])) by (le))";
  public static final String MONITOR_LIVE_QUERY_TEMPLATE_DOC = "The PromQL instant query returning the live value of "
      + "a monitored pair. " + SOURCE_PLACEHOLDER + " and " + DESTINATION_PLACEHOLDER + " are replaced by the services "
      + "of the pair.";

  /**
   * <code>monitor.training.query.template</code>
   */
  public static final String MONITOR_TRAINING_QUERY_TEMPLATE_CONFIG = "monitor.training.query.template";
  public static final String DEFAULT_MONITOR_TRAINING_QUERY_TEMPLATE = DEFAULT_MONITOR_LIVE_QUERY_TEMPLATE;
  public static final String MONITOR_TRAINING_QUERY_TEMPLATE_DOC = "The PromQL range query returning the history of "
      + "a monitored pair. " + SOURCE_PLACEHOLDER + " and " + DESTINATION_PLACEHOLDER + " are replaced by the services "
      + "of the pair.";

  /**
   * <code>monitor.training.dir</code>
   */
  public static final String MONITOR_TRAINING_DIR_CONFIG = "monitor.training.dir";
  public static final String DEFAULT_MONITOR_TRAINING_DIR = null;
  public static final String MONITOR_TRAINING_DIR_DOC = "An optional directory holding saved query_range responses "
      + "named <source>_2_<destination>.json. If present, the initial model of a pair is fitted on its file and the "
      + "first refresh from Prometheus happens one retrain interval later.";

  /**
   * <code>monitor.phase.perturbation.start.iteration</code>
   */
  public static final String MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG = "monitor.phase.perturbation.start.iteration";
  public static final int DEFAULT_MONITOR_PHASE_PERTURBATION_START_ITERATION = 10;
  public static final String MONITOR_PHASE_PERTURBATION_START_ITERATION_DOC = "The 0-based evaluation cycle from which "
      + "the monitor log labels results as part of the perturbation phase of an experiment. With the default of 10 the "
      + "phase starts on the 11th successful evaluation.";

  /**
   * <code>monitor.phase.recovery.start.iteration</code>
   */
  public static final String MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG = "monitor.phase.recovery.start.iteration";
  public static final int DEFAULT_MONITOR_PHASE_RECOVERY_START_ITERATION = 20;
  public static final String MONITOR_PHASE_RECOVERY_START_ITERATION_DOC = "The 0-based evaluation cycle from which "
      + "the monitor log labels results as part of the recovery phase of an experiment. With the default of 20 the "
      + "phase starts on the 21st successful evaluation.";

  /**
   * <code>monitor.summary.window.size</code>
   */
  public static final String MONITOR_SUMMARY_WINDOW_SIZE_CONFIG = "monitor.summary.window.size";
  public static final int DEFAULT_MONITOR_SUMMARY_WINDOW_SIZE = 5;
  public static final String MONITOR_SUMMARY_WINDOW_SIZE_DOC = "The number of most recent evaluation results "
      + "summarized in the log after each cycle.";

  /**
   * <code>forecast.oracle.class</code>
   */
  public static final String FORECAST_ORACLE_CLASS_CONFIG = "forecast.oracle.class";
  public static final String DEFAULT_FORECAST_ORACLE_CLASS = PercentileForecastOracle.class.getName();
  public static final String FORECAST_ORACLE_CLASS_DOC = "The class implementing "
      + "com.linkedin.incidentmonitor.forecast.ForecastOracle used to fit the forecast models. A new instance is "
      + "created and configured for each monitored pair.";

  private MonitorConfig() {
  }

  /**
   * Define configs for forecast monitors.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for forecast monitors.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(MONITOR_SERVICE_PAIRS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_MONITOR_SERVICE_PAIRS,
                            ConfigDef.Importance.HIGH,
                            MONITOR_SERVICE_PAIRS_DOC)
                    .define(MONITOR_POLLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MONITOR_POLLING_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_POLLING_INTERVAL_MS_DOC)
                    .define(MONITOR_RETRY_BACKOFF_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MONITOR_RETRY_BACKOFF_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_RETRY_BACKOFF_MS_DOC)
                    .define(MONITOR_TRAINING_LOOKBACK_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MONITOR_TRAINING_LOOKBACK_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_TRAINING_LOOKBACK_MS_DOC)
                    .define(MONITOR_RETRAIN_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MONITOR_RETRAIN_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_RETRAIN_INTERVAL_MS_DOC)
                    .define(MONITOR_LIVE_QUERY_TEMPLATE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_MONITOR_LIVE_QUERY_TEMPLATE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_LIVE_QUERY_TEMPLATE_DOC)
                    .define(MONITOR_TRAINING_QUERY_TEMPLATE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_MONITOR_TRAINING_QUERY_TEMPLATE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            MONITOR_TRAINING_QUERY_TEMPLATE_DOC)
                    .define(MONITOR_TRAINING_DIR_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_MONITOR_TRAINING_DIR,
                            ConfigDef.Importance.LOW,
                            MONITOR_TRAINING_DIR_DOC)
                    .define(MONITOR_PHASE_PERTURBATION_START_ITERATION_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MONITOR_PHASE_PERTURBATION_START_ITERATION,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MONITOR_PHASE_PERTURBATION_START_ITERATION_DOC)
                    .define(MONITOR_PHASE_RECOVERY_START_ITERATION_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MONITOR_PHASE_RECOVERY_START_ITERATION,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MONITOR_PHASE_RECOVERY_START_ITERATION_DOC)
                    .define(MONITOR_SUMMARY_WINDOW_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MONITOR_SUMMARY_WINDOW_SIZE,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MONITOR_SUMMARY_WINDOW_SIZE_DOC)
                    .define(FORECAST_ORACLE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_FORECAST_ORACLE_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            FORECAST_ORACLE_CLASS_DOC);
  }
}
