package com.example.albapikeyrotator.core.keys;

import com.example.albapikeyrotator.core.secrets.CredentialPayload;

/**
 * Derives the next credential payload by sliding the key window one slot.
 *
 * <p>{@code chain({a, b, c}) == {b, c, fresh}}: the oldest key is retired and one freshly generated
 * key becomes active.
 */
public final class KeyChainer {

  private final KeyGenerator generator;

  public KeyChainer(final KeyGenerator generator) {
    this.generator = generator;
  }

  /**
   * Computes the successor of {@code previous}.
   *
   * @param previous payload currently labeled CURRENT
   * @return the payload to stage as PENDING
   */
  public CredentialPayload chain(final CredentialPayload previous) {
    return new CredentialPayload(previous.slotB(), previous.slotC(), generator.generate());
  }
}
