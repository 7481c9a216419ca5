package com.example.albapikeyrotator.core.secrets;

/** Renders secret material for logs without revealing it. */
public final class Masking {

  private Masking() {}

  /**
   * Keeps the first two characters and the length.
   *
   * @param value secret value, may be null
   * @return e.g. {@code ab****(16)}
   */
  public static String mask(final String value) {
    if (value == null) return "null";
    if (value.length() <= 2) return "****(" + value.length() + ")";
    return value.substring(0, 2) + "****(" + value.length() + ")";
  }
}
