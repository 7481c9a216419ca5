package com.example.albapikeyrotator.core;

/**
 * A call to Secrets Manager, the load balancer control plane or a probe endpoint failed.
 *
 * <p>The rotator never retries internally; the rotation framework re-invokes the step.
 */
public class UpstreamUnavailableException extends RotationException {

  public UpstreamUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
