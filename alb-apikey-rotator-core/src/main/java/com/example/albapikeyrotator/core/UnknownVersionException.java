package com.example.albapikeyrotator.core;

/** The version token of the event is not part of the secret's version map. */
public class UnknownVersionException extends RotationException {

  public UnknownVersionException(final String secretId, final String versionToken) {
    super(
        "Secret version %s has no stage for rotation of secret %s"
            .formatted(versionToken, secretId));
  }
}
