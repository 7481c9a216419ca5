package com.example.albapikeyrotator.core;

import java.util.List;

/** The test step could not confirm that the pending key is live. */
public class PendingKeyVerificationException extends RotationException {

  private final List<String> problems;

  public PendingKeyVerificationException(final List<String> problems) {
    super("Pending key verification failed: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }
}
