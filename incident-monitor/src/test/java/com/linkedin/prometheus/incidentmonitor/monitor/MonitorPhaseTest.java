/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.monitor;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MonitorPhaseTest {

  @Test
  public void testForIteration() {
    assertEquals(MonitorPhase.NORMAL, MonitorPhase.forIteration(0, 10, 20));
    assertEquals(MonitorPhase.NORMAL, MonitorPhase.forIteration(9, 10, 20));
    assertEquals(MonitorPhase.PERTURBATION, MonitorPhase.forIteration(10, 10, 20));
    assertEquals(MonitorPhase.PERTURBATION, MonitorPhase.forIteration(19, 10, 20));
    assertEquals(MonitorPhase.RECOVERY, MonitorPhase.forIteration(20, 10, 20));
    assertEquals(MonitorPhase.RECOVERY, MonitorPhase.forIteration(1000, 10, 20));
  }
}
