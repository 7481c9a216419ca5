package com.example.albapikeyrotator.core;

/** The stored secret string is not a complete credential payload. */
public class MalformedPayloadException extends RotationException {

  public MalformedPayloadException(final String message) {
    super(message);
  }

  public MalformedPayloadException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
