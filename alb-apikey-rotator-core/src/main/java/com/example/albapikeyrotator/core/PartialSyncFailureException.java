package com.example.albapikeyrotator.core;

import com.example.albapikeyrotator.core.alb.RuleUpdateFailure;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more rule updates failed while synchronizing the active key into load balancer rules.
 *
 * <p>Carries every failure with its load balancer, listener and rule identifiers. Retrying the set
 * step is safe: rules that already carry the key are rewritten with the same value.
 */
public class PartialSyncFailureException extends RotationException {

  private final List<RuleUpdateFailure> failures;
  private final int updatedRules;

  public PartialSyncFailureException(
      final List<RuleUpdateFailure> failures, final int updatedRules) {
    super(describe(failures, updatedRules), failures.isEmpty() ? null : failures.get(0).cause());
    this.failures = List.copyOf(failures);
    this.updatedRules = updatedRules;
    failures.stream().skip(1).map(RuleUpdateFailure::cause).forEach(this::addSuppressed);
  }

  private static String describe(final List<RuleUpdateFailure> failures, final int updated) {
    return "%d rule update(s) failed, %d succeeded: %s"
        .formatted(
            failures.size(),
            updated,
            failures.stream().map(RuleUpdateFailure::describe).collect(Collectors.joining("; ")));
  }

  public List<RuleUpdateFailure> failures() {
    return failures;
  }

  public int updatedRules() {
    return updatedRules;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
