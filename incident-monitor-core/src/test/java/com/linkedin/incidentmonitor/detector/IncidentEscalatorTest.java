/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.detector;

import com.linkedin.incidentmonitor.model.AnomalySignal;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class IncidentEscalatorTest {

  @Test
  public void testSingleSourceBurstRaisesSev2() {
    IncidentEscalator escalator = new IncidentEscalator();
    IncidentState state = null;
    for (int cycle = 1; cycle <= 5; cycle++) {
      state = escalator.update(true, false);
      assertEquals(cycle, state.firstAccumulator());
      assertEquals(0, state.secondAccumulator());
      if (cycle < 5) {
        assertEquals(IncidentSeverity.QUIESCENT, state.severity());
      }
    }
    assertEquals(5, state.total());
    assertEquals(IncidentSeverity.SEV2, state.severity());
    assertTrue(state.isSev2());
    assertFalse(state.isSev1());
  }

  @Test
  public void testBothSourcesBurstRaisesSev1() {
    IncidentEscalator escalator = new IncidentEscalator();
    IncidentState state = null;
    for (int cycle = 0; cycle < 5; cycle++) {
      state = escalator.update(true, true);
    }
    assertEquals(new IncidentState(5, 5, IncidentSeverity.SEV1), state);
    assertEquals(10, state.total());
  }

  @Test
  public void testDecayTrajectory() {
    IncidentEscalator escalator = saturatedEscalator();
    assertEquals(new IncidentState(10, 10, IncidentSeverity.SEV1), escalator.currentState());

    assertEquals(new IncidentState(8, 8, IncidentSeverity.SEV1), escalator.update(false, false));
    assertEquals(new IncidentState(6, 6, IncidentSeverity.SEV1), escalator.update(false, false));
    assertEquals(new IncidentState(4, 4, IncidentSeverity.SEV1), escalator.update(false, false));
    assertEquals(new IncidentState(2, 2, IncidentSeverity.QUIESCENT), escalator.update(false, false));
    assertEquals(new IncidentState(0, 0, IncidentSeverity.QUIESCENT), escalator.update(false, false));
    assertEquals(new IncidentState(0, 0, IncidentSeverity.QUIESCENT), escalator.update(false, false));
  }

  @Test
  public void testAccumulatorsAreClamped() {
    IncidentEscalator escalator = saturatedEscalator();
    IncidentState state = escalator.update(true, true);
    assertEquals(10, state.firstAccumulator());
    assertEquals(10, state.secondAccumulator());

    escalator = new IncidentEscalator();
    state = escalator.update(false, false);
    assertEquals(0, state.firstAccumulator());
    assertEquals(0, state.secondAccumulator());

    // 1 - 2 floors at 0 instead of going negative.
    escalator.update(true, false);
    state = escalator.update(false, false);
    assertEquals(0, state.firstAccumulator());
  }

  @Test
  public void testSingleTransientAnomalyNeverRaisesIncident() {
    IncidentEscalator escalator = new IncidentEscalator();
    for (int cycle = 0; cycle < 20; cycle++) {
      IncidentState state = escalator.update(cycle == 7, cycle == 13);
      assertEquals(IncidentSeverity.QUIESCENT, state.severity());
      assertTrue(state.total() <= 1);
    }
  }

  @Test
  public void testSev1DropsToSev2WhenOneSourceCools() {
    IncidentEscalator escalator = saturatedEscalator();
    IncidentState state = null;
    for (int cycle = 0; cycle < 5; cycle++) {
      state = escalator.update(true, false);
    }
    assertEquals(new IncidentState(10, 0, IncidentSeverity.SEV2), state);
  }

  @Test
  public void testUpdateFromSignals() {
    IncidentEscalator escalator = new IncidentEscalator();
    IncidentState state = escalator.update(AnomalySignal.measured("frontend", 3.0, 0L),
                                           AnomalySignal.defaulted("checkout", 0L));
    assertEquals(1, state.firstAccumulator());
    assertEquals(0, state.secondAccumulator());

    state = escalator.update(AnomalySignal.measured("frontend", Double.NaN, 0L),
                             AnomalySignal.measured("checkout", 1.0, 0L));
    assertEquals(0, state.firstAccumulator());
    assertEquals(1, state.secondAccumulator());
  }

  @Test
  public void testCustomSteps() {
    IncidentEscalator escalator = new IncidentEscalator(3, 4, 2, 1);
    IncidentState state = escalator.update(true, false);
    assertEquals(new IncidentState(2, 0, IncidentSeverity.QUIESCENT), state);
    state = escalator.update(true, false);
    assertEquals(new IncidentState(4, 0, IncidentSeverity.SEV2), state);
    state = escalator.update(true, true);
    assertEquals(new IncidentState(4, 2, IncidentSeverity.SEV1), state);
    state = escalator.update(false, false);
    assertEquals(new IncidentState(3, 1, IncidentSeverity.SEV1), state);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testThresholdAboveReachableTotal() {
    new IncidentEscalator(21, 10, 1, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveDecrement() {
    new IncidentEscalator(5, 10, 1, 0);
  }

  private static IncidentEscalator saturatedEscalator() {
    IncidentEscalator escalator = new IncidentEscalator();
    for (int cycle = 0; cycle < 10; cycle++) {
      escalator.update(true, true);
    }
    return escalator;
  }
}
