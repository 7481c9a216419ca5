package com.example.albapikeyrotator.core.rotation;

/** How a rotation invocation completed. Every outcome is a success for the caller. */
public enum RotationOutcome {
  /** The step handler ran and changed or verified state. */
  COMPLETED,
  /** The version already holds CURRENT; nothing to do. */
  ALREADY_CURRENT,
  /** The create step found a PENDING value for the token and kept it. */
  ALREADY_PENDING,
  /** The step name was not recognized; nothing was done. */
  SKIPPED
}
