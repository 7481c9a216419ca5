package com.example.albapikeyrotator.core.rotation;

import java.util.Arrays;
import java.util.Locale;

/** The four rotation steps, plus a no-op variant for step names the rotator does not know. */
public enum RotationStep {
  CREATE("createSecret"),
  SET("setSecret"),
  TEST("testSecret"),
  FINISH("finishSecret"),
  UNRECOGNIZED("");

  private final String stepName;

  RotationStep(final String stepName) {
    this.stepName = stepName;
  }

  public String stepName() {
    return stepName;
  }

  /**
   * Resolves a step name case-insensitively.
   *
   * @param name step name as delivered by the rotation framework, may be null
   * @return the matching step, or {@link #UNRECOGNIZED}
   */
  public static RotationStep fromName(final String name) {
    if (name == null) return UNRECOGNIZED;
    final var lower = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(step -> step != UNRECOGNIZED)
        .filter(step -> step.stepName.toLowerCase(Locale.ROOT).equals(lower))
        .findFirst()
        .orElse(UNRECOGNIZED);
  }
}
