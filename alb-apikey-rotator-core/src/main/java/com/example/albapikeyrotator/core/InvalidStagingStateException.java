package com.example.albapikeyrotator.core;

/** The version token exists but is neither CURRENT nor PENDING. */
public class InvalidStagingStateException extends RotationException {

  public InvalidStagingStateException(final String message) {
    super(message);
  }
}
