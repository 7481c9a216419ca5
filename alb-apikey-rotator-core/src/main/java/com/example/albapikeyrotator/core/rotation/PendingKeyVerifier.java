package com.example.albapikeyrotator.core.rotation;

import com.example.albapikeyrotator.core.secrets.CredentialPayload;
import java.util.List;

/**
 * Confirms during the test step that the pending key is usable before it becomes CURRENT.
 *
 * <p>Implementations throw {@link com.example.albapikeyrotator.core.PendingKeyVerificationException}
 * when the key is not live and must not mutate any state.
 */
@FunctionalInterface
public interface PendingKeyVerifier {

  void verify(String secretId, CredentialPayload current, CredentialPayload pending);

  /**
   * Runs verifiers in order; the first failure aborts.
   *
   * @param verifiers verifiers to run
   * @return composed verifier
   */
  static PendingKeyVerifier allOf(final List<PendingKeyVerifier> verifiers) {
    final var copy = List.copyOf(verifiers);
    return (secretId, current, pending) ->
        copy.forEach(v -> v.verify(secretId, current, pending));
  }
}
