package com.example.albapikeyrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SecretDescriptionTest {

  private final SecretDescription description =
      new SecretDescription(
          true,
          Map.of(
              "v1", Set.of("AWSCURRENT", "custom"),
              "v2", Set.of("AWSPENDING"),
              "v0", Set.of("AWSPREVIOUS")));

  @Test
  void findsLabelHolders() {
    assertEquals(Optional.of("v1"), description.holderOf(StageLabel.CURRENT));
    assertEquals(Optional.of("v2"), description.holderOf(StageLabel.PENDING));
  }

  @Test
  void answersLabelQueries() {
    assertTrue(description.hasVersion("v0"));
    assertFalse(description.hasVersion("v9"));
    assertTrue(description.hasLabel("v1", StageLabel.CURRENT));
    assertFalse(description.hasLabel("v0", StageLabel.CURRENT));
    assertFalse(description.hasLabel("v9", StageLabel.PENDING));
  }

  @Test
  void emptyWhenNobodyHoldsLabel() {
    assertTrue(new SecretDescription(true, Map.of()).holderOf(StageLabel.CURRENT).isEmpty());
  }
}
