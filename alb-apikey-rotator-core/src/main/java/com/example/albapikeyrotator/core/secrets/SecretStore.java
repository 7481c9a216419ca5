package com.example.albapikeyrotator.core.secrets;

import java.util.Optional;
import java.util.Set;

/**
 * Versioned secret storage with staging labels.
 *
 * <p>Implementations translate collaborator failures into {@link
 * com.example.albapikeyrotator.core.UpstreamUnavailableException}.
 */
public interface SecretStore {

  /**
   * Reads the secret string of the version holding {@code stage}.
   *
   * @param secretId secret identifier
   * @param stage label the version must hold
   * @param versionToken when non-null, the version must also have this token
   * @return the secret string, or empty when no such version exists
   */
  Optional<String> getVersion(String secretId, StageLabel stage, String versionToken);

  /**
   * Stores a new version under {@code versionToken} with the given labels.
   *
   * @param secretId secret identifier
   * @param versionToken client request token that becomes the version id
   * @param payload secret string
   * @param stages labels to attach
   */
  void putVersion(String secretId, String versionToken, String payload, Set<StageLabel> stages);

  /**
   * Reads rotation metadata.
   *
   * @param secretId secret identifier
   * @return rotation flag and version to stages mapping
   */
  SecretDescription describe(String secretId);

  /**
   * Atomically moves {@code stage} from one version onto another.
   *
   * @param secretId secret identifier
   * @param stage label to move
   * @param toVersion version receiving the label
   * @param fromVersion current holder, or {@code null} when nobody holds it
   */
  void moveStage(String secretId, StageLabel stage, String toVersion, String fromVersion);
}
