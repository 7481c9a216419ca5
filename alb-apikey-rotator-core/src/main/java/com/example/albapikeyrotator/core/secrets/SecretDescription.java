package com.example.albapikeyrotator.core.secrets;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rotation-relevant metadata of a secret.
 *
 * @param rotationEnabled whether the secret has rotation configured
 * @param versionStages version token to the raw stage labels held by that version
 */
public record SecretDescription(boolean rotationEnabled, Map<String, Set<String>> versionStages) {

  public SecretDescription {
    versionStages = Map.copyOf(versionStages);
  }

  public boolean hasVersion(final String versionToken) {
    return versionStages.containsKey(versionToken);
  }

  public boolean hasLabel(final String versionToken, final StageLabel label) {
    return versionStages.getOrDefault(versionToken, Set.of()).contains(label.wireName());
  }

  /**
   * Finds the version currently holding the given label.
   *
   * @param label label to look up
   * @return the holder, or empty when no version carries the label
   */
  public Optional<String> holderOf(final StageLabel label) {
    return versionStages.entrySet().stream()
        .filter(e -> e.getValue().contains(label.wireName()))
        .map(Map.Entry::getKey)
        .findFirst();
  }
}
