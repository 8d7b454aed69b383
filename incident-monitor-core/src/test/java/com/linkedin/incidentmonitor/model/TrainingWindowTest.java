/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class TrainingWindowTest {
  private static final long START_MS = 1700000000000L;

  @Test
  public void testRebasePreservesSpacing() {
    List<Observation> observations = Arrays.asList(new Observation(START_MS, 1.0),
                                                   new Observation(START_MS + 15000L, 2.0),
                                                   new Observation(START_MS + 75000L, Double.NaN),
                                                   new Observation(START_MS + 76000L, 4.0));
    TrainingWindow window = TrainingWindow.rebased(observations);

    assertEquals(START_MS, window.originTimeMs());
    assertEquals(4, window.size());
    assertEquals(3, window.validPointCount());
    assertEquals(76000L, window.spanMs());
    for (int i = 0; i < observations.size(); i++) {
      Observation rebased = window.observations().get(i);
      assertEquals(observations.get(i).timestampMs() - START_MS, rebased.timestampMs());
      assertEquals(observations.get(i).value(), rebased.value(), 0.0);
    }
  }

  @Test
  public void testRebaseSortsByTime() {
    TrainingWindow window = TrainingWindow.rebased(Arrays.asList(new Observation(START_MS + 120000L, 3.0),
                                                                 new Observation(START_MS + 60000L, 2.0),
                                                                 new Observation(START_MS, 1.0)));
    assertEquals(new Observation(0L, 1.0), window.observations().get(0));
    assertEquals(new Observation(60000L, 2.0), window.observations().get(1));
    assertEquals(new Observation(120000L, 3.0), window.observations().get(2));
  }

  @Test
  public void testEmptyWindow() {
    TrainingWindow window = TrainingWindow.rebased(Collections.emptyList());
    assertTrue(window.isEmpty());
    assertEquals(0, window.validPointCount());
    assertEquals(0L, window.spanMs());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testObservationsAreImmutable() {
    TrainingWindow window = TrainingWindow.rebased(Collections.singletonList(new Observation(START_MS, 1.0)));
    window.observations().add(new Observation(0L, 2.0));
  }
}
