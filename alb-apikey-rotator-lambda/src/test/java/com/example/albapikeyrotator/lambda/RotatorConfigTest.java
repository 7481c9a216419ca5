package com.example.albapikeyrotator.lambda;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RotatorConfigTest {

  private static final String[] PROPERTIES = {
    "rotator.log.level",
    "rotator.alb.name",
    "rotator.sync.parallelism",
    "rotator.key.length",
    "rotator.probe.url",
    "rotator.probe.timeout.millis"
  };

  @AfterEach
  void clearProps() {
    for (final var property : PROPERTIES) System.clearProperty(property);
  }

  @Test
  @DisplayName("System properties override defaults")
  void readsSystemProperties() {
    System.setProperty("rotator.log.level", "Debug");
    System.setProperty("rotator.alb.name", " prod ");
    System.setProperty("rotator.sync.parallelism", "8");
    System.setProperty("rotator.key.length", "24");
    System.setProperty("rotator.probe.url", "https://api.example.com/health");
    System.setProperty("rotator.probe.timeout.millis", "1500");

    final var config = RotatorConfig.load();

    assertTrue(config.debug());
    assertEquals("prod", config.loadBalancerFilter());
    assertEquals(8, config.syncParallelism());
    assertEquals(24, config.keyLength());
    assertEquals(URI.create("https://api.example.com/health"), config.probe().orElseThrow());
    assertEquals(Duration.ofMillis(1500), config.probeTimeout());
  }

  @Test
  @DisplayName("Invalid or out-of-range values fall back to defaults")
  void invalidValuesFallBack() {
    System.setProperty("rotator.log.level", "verbose");
    System.setProperty("rotator.sync.parallelism", "-3");
    System.setProperty("rotator.key.length", "abc");
    System.setProperty("rotator.probe.timeout.millis", "0");

    final var config = RotatorConfig.load();

    assertFalse(config.debug());
    assertEquals(1, config.syncParallelism());
    assertEquals(16, config.keyLength());
    assertEquals(Duration.ofMillis(5_000), config.probeTimeout());
  }

  @Test
  @DisplayName("Canonical constructor normalizes missing values")
  void normalizesMissingValues() {
    final var config = new RotatorConfig(false, null, 0, 0, null, null);

    assertEquals("", config.loadBalancerFilter());
    assertEquals(1, config.syncParallelism());
    assertEquals(16, config.keyLength());
    assertTrue(config.probe().isEmpty());
    assertEquals(Duration.ofMillis(5_000), config.probeTimeout());
  }
}
