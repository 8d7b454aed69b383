/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.prometheus.incidentmonitor.telemetry;

import com.linkedin.incidentmonitor.model.Observation;
import com.linkedin.incidentmonitor.model.TrainingWindow;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link TrainingFileLoader}.
 */
public class TrainingFileLoaderTest {
  private static final String TRAINING_FILE = "training/frontend_2_shippingservice.json";

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  private Path writeFile(String content) throws IOException {
    File file = _folder.newFile();
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file.toPath();
  }

  @Test
  public void testLoadDropsNaNAndRebases() throws IOException, URISyntaxException {
    Path trainingFile = Paths.get(getClass().getClassLoader().getResource(TRAINING_FILE).toURI());

    TrainingWindow window = TrainingFileLoader.load(trainingFile);

    assertEquals(1700000000000L, window.originTimeMs());
    assertEquals(Arrays.asList(new Observation(0L, 4.5),
                               new Observation(60000L, 5.0),
                               new Observation(180000L, 6.25),
                               new Observation(240000L, 5.75)),
                 window.observations());
  }

  @Test
  public void testLoadWithoutSeries() throws IOException {
    Path trainingFile = writeFile("{\"status\": \"success\", \"data\": {\"resultType\": \"matrix\", \"result\": []}}");

    assertTrue(TrainingFileLoader.load(trainingFile).isEmpty());
  }

  @Test(expected = IOException.class)
  public void testLoadInvalidJson() throws IOException {
    TrainingFileLoader.load(writeFile("[[1700000000, \"4.5\"]"));
  }

  @Test(expected = IOException.class)
  public void testLoadWithoutData() throws IOException {
    TrainingFileLoader.load(writeFile("{\"status\": \"success\"}"));
  }

  @Test(expected = IOException.class)
  public void testLoadMissingFile() throws IOException {
    TrainingFileLoader.load(_folder.getRoot().toPath().resolve("missing.json"));
  }
}
