package com.example.albapikeyrotator.core;

/**
 * Base type for every failure the rotator surfaces to the calling rotation framework.
 *
 * <p>Subclasses flag whether re-invoking the same step can succeed without operator action.
 */
public class RotationException extends RuntimeException {

  public RotationException(final String message) {
    super(message);
  }

  public RotationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the calling framework may retry the step unchanged.
   *
   * @return {@code true} for transient failures
   */
  public boolean isRetryable() {
    return false;
  }
}
