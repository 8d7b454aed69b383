/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

/**
 * Coarse labels of the evaluation cycles of an experiment. Phases only affect logging.
 */
public enum MonitorPhase {
  NORMAL, PERTURBATION, RECOVERY;

  /**
   * @param iteration The number of evaluation cycles completed before this one, so the first cycle is 0.
   * @param perturbationStartIteration The first cycle of the perturbation phase.
   * @param recoveryStartIteration The first cycle of the recovery phase.
   * @return The phase of the given cycle.
   */
  public static MonitorPhase forIteration(int iteration, int perturbationStartIteration, int recoveryStartIteration) {
    if (iteration >= recoveryStartIteration) {
      return RECOVERY;
    } else if (iteration >= perturbationStartIteration) {
      return PERTURBATION;
    }
    return NORMAL;
  }
}
