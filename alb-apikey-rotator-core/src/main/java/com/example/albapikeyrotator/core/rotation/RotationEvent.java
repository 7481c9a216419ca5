package com.example.albapikeyrotator.core.rotation;

/**
 * One rotation request.
 *
 * @param step resolved step
 * @param stepName step name as received, kept for logging unrecognized steps
 * @param secretId secret identifier
 * @param versionToken client request token identifying the version being rotated
 */
public record RotationEvent(
    RotationStep step, String stepName, String secretId, String versionToken) {

  public RotationEvent {
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("secretId is required");
    if (versionToken == null) versionToken = "";
  }

  /**
   * Builds an event from the raw request fields.
   *
   * @param stepName step name, matched case-insensitively
   * @param secretId secret identifier
   * @param versionToken client request token, may be null
   * @return the event
   */
  public static RotationEvent of(
      final String stepName, final String secretId, final String versionToken) {
    return new RotationEvent(RotationStep.fromName(stepName), stepName, secretId, versionToken);
  }
}
