package com.example.albapikeyrotator.core.alb;

import java.util.List;

/**
 * Outcome of one synchronization pass.
 *
 * @param listenersScanned listeners whose rules were inspected
 * @param updatedRules ARNs of rules rewritten with the new key
 * @param failures rules that could not be updated
 */
public record SyncReport(
    int listenersScanned, List<String> updatedRules, List<RuleUpdateFailure> failures) {

  public SyncReport {
    updatedRules = List.copyOf(updatedRules);
    failures = List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
