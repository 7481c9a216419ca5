package com.example.albapikeyrotator.core;

/** The secret has no rotation configuration. */
public class NotRotationEnabledException extends RotationException {

  public NotRotationEnabledException(final String secretId) {
    super("Secret %s is not enabled for rotation".formatted(secretId));
  }
}
