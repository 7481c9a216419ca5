package com.example.albapikeyrotator.core.secrets;

/** Staging labels the rotation protocol relies on. Other labels on a version are ignored. */
public enum StageLabel {
  CURRENT("AWSCURRENT"),
  PENDING("AWSPENDING");

  private final String wireName;

  StageLabel(final String wireName) {
    this.wireName = wireName;
  }

  /**
   * Label as stored by Secrets Manager.
   *
   * @return the wire label, e.g. {@code AWSCURRENT}
   */
  public String wireName() {
    return wireName;
  }
}
