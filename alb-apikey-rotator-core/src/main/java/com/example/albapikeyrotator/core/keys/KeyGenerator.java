package com.example.albapikeyrotator.core.keys;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Produces random API keys drawn uniformly from {@code [A-Za-z0-9]}.
 *
 * <p>Each call is independent. {@link SecureRandom} is used unless a source is injected.
 */
public final class KeyGenerator {

  /** Alphabet of generated keys. */
  public static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

  public static final int DEFAULT_LENGTH = 16;

  private final Random random;
  private final int length;

  public KeyGenerator() {
    this(new SecureRandom(), DEFAULT_LENGTH);
  }

  public KeyGenerator(final int length) {
    this(new SecureRandom(), length);
  }

  /**
   * Creates a generator with an explicit random source.
   *
   * @param random source of randomness, should be a {@link SecureRandom} outside tests
   * @param length number of characters per key, must be >= 1
   */
  public KeyGenerator(final Random random, final int length) {
    if (random == null) throw new IllegalArgumentException("random cannot be null");
    if (length < 1) throw new IllegalArgumentException("length must be >= 1");
    this.random = random;
    this.length = length;
  }

  /**
   * Generates a fresh key.
   *
   * @return a key of {@link #length()} characters
   */
  public String generate() {
    final var key = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      key.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return key.toString();
  }

  public int length() {
    return length;
  }
}
