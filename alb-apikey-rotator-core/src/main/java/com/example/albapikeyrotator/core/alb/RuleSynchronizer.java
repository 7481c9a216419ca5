package com.example.albapikeyrotator.core.alb;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.albapikeyrotator.core.PartialSyncFailureException;
import com.example.albapikeyrotator.core.secrets.Masking;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * Pushes an API key into every matching load balancer rule.
 *
 * <p>For each matching rule the values of its API-key conditions are replaced with the single key,
 * and the full condition list is submitted together with the unchanged actions. Listeners are
 * processed by up to {@code parallelism} workers; a worker reads a listener's rules immediately
 * before rewriting them, and no two workers share a listener.
 *
 * <p>A failing rule does not stop the pass. All failures are collected and raised together as a
 * {@link PartialSyncFailureException} once every listener has been processed.
 */
public final class RuleSynchronizer {

  private static final System.Logger LOGGER = System.getLogger(RuleSynchronizer.class.getName());

  private final LoadBalancerControlPlane controlPlane;
  private final RuleLocator locator;
  private final int parallelism;

  public RuleSynchronizer(
      final LoadBalancerControlPlane controlPlane,
      final RuleLocator locator,
      final int parallelism) {
    if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
    this.controlPlane = controlPlane;
    this.locator = locator;
    this.parallelism = parallelism;
  }

  public RuleSynchronizer(final LoadBalancerControlPlane controlPlane, final RuleLocator locator) {
    this(controlPlane, locator, 1);
  }

  /**
   * Rewrites every matching rule with {@code apiKey}.
   *
   * @param apiKey key every API-key condition must carry afterwards
   * @return report of updated rules
   * @throws PartialSyncFailureException if any rule could not be updated
   * @throws com.example.albapikeyrotator.core.UpstreamUnavailableException if load balancers or
   *     listeners could not be enumerated
   */
  public SyncReport synchronize(final String apiKey) {
    final var listeners = locator.listeners();
    LOGGER.log(
        INFO,
        "Synchronizing key {0} into {1} listener(s)",
        Masking.mask(apiKey),
        listeners.size());

    final var outcomes =
        parallelism == 1 || listeners.size() <= 1
            ? listeners.stream().map(l -> syncListener(l, apiKey)).toList()
            : syncInParallel(listeners, apiKey);

    final var updated = new ArrayList<String>();
    final var failures = new ArrayList<RuleUpdateFailure>();
    outcomes.forEach(
        outcome -> {
          updated.addAll(outcome.updated());
          failures.addAll(outcome.failures());
        });

    final var report = new SyncReport(listeners.size(), updated, failures);
    if (report.hasFailures()) {
      LOGGER.log(
          WARNING,
          "{0} rule update(s) failed, {1} succeeded",
          failures.size(),
          updated.size());
      throw new PartialSyncFailureException(failures, updated.size());
    }
    LOGGER.log(INFO, "Updated {0} rule(s)", updated.size());
    return report;
  }

  private List<ListenerOutcome> syncInParallel(
      final List<ListenerLocation> listeners, final String apiKey) {
    final var counter = new AtomicInteger();
    final var executor =
        Executors.newFixedThreadPool(
            Math.min(parallelism, listeners.size()),
            r -> {
              final var t = new Thread(r, "RuleSynchronizer-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    try {
      final var futures =
          listeners.stream()
              .map(l -> CompletableFuture.supplyAsync(() -> syncListener(l, apiKey), executor))
              .toList();
      return futures.stream().map(CompletableFuture::join).toList();
    } finally {
      executor.shutdownNow();
    }
  }

  private ListenerOutcome syncListener(final ListenerLocation location, final String apiKey) {
    final List<RuleMatch> matches;
    try {
      matches = locator.matchingRules(location);
    } catch (final RuntimeException e) {
      LOGGER.log(
          WARNING,
          "Failed to list rules of listener {0}: {1}",
          location.listenerArn(),
          e.getMessage());
      return new ListenerOutcome(
          List.of(),
          List.of(
              new RuleUpdateFailure(
                  location.loadBalancerName(), location.listenerArn(), null, e)));
    }
    if (matches.isEmpty()) {
      LOGGER.log(DEBUG, "No API-key rules on listener {0}", location.listenerArn());
    }

    final var updated = new ArrayList<String>();
    final var failures = new ArrayList<RuleUpdateFailure>();
    for (final var match : matches) {
      final var rule = match.rule();
      try {
        controlPlane.updateRule(rule.arn(), rewrite(rule.conditions(), apiKey), rule.actions());
        updated.add(rule.arn());
        LOGGER.log(DEBUG, "Updated rule {0} on {1}", rule.arn(), location.loadBalancerName());
      } catch (final RuntimeException e) {
        LOGGER.log(WARNING, "Failed to update rule {0}: {1}", rule.arn(), e.getMessage());
        failures.add(
            new RuleUpdateFailure(
                location.loadBalancerName(), location.listenerArn(), rule.arn(), e));
      }
    }
    return new ListenerOutcome(updated, failures);
  }

  /**
   * Replaces the values of every API-key condition with {@code apiKey}.
   *
   * @param conditions conditions of one rule
   * @param apiKey new key
   * @return a new list of the same size and order; non-matching conditions are the same instances
   */
  static List<RuleCondition> rewrite(final List<RuleCondition> conditions, final String apiKey) {
    return conditions.stream()
        .map(
            condition ->
                RuleLocator.isApiKeyCondition(condition)
                    ? condition.toBuilder()
                        .httpHeaderConfig(
                            condition.httpHeaderConfig().toBuilder().values(apiKey).build())
                        .build()
                    : condition)
        .toList();
  }

  private record ListenerOutcome(List<String> updated, List<RuleUpdateFailure> failures) {}
}
