package com.example.albapikeyrotator.core.alb;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * Finds the listener rules that authenticate clients with the {@value #API_KEY_HEADER} header.
 *
 * <p>A rule qualifies when it is not a default rule and at least one of its conditions is an
 * {@value #HTTP_HEADER_FIELD} condition on {@value #API_KEY_HEADER}. Load balancers are narrowed
 * by a substring filter on their name; an empty filter selects every load balancer.
 */
public final class RuleLocator {

  private static final System.Logger LOGGER = System.getLogger(RuleLocator.class.getName());

  public static final String API_KEY_HEADER = "X-AWS-API-KEY";
  public static final String HTTP_HEADER_FIELD = "http-header";

  private final LoadBalancerControlPlane controlPlane;
  private final String loadBalancerFilter;

  public RuleLocator(final LoadBalancerControlPlane controlPlane, final String loadBalancerFilter) {
    this.controlPlane = controlPlane;
    this.loadBalancerFilter = Optional.ofNullable(loadBalancerFilter).orElse("");
  }

  /**
   * Tells whether a condition carries the API key.
   *
   * @param condition rule condition
   * @return {@code true} for an http-header condition on the API-key header
   */
  public static boolean isApiKeyCondition(final RuleCondition condition) {
    return HTTP_HEADER_FIELD.equals(condition.field())
        && condition.httpHeaderConfig() != null
        && API_KEY_HEADER.equals(condition.httpHeaderConfig().httpHeaderName());
  }

  boolean selects(final LoadBalancerSummary loadBalancer) {
    return loadBalancerFilter.isEmpty()
        || Optional.ofNullable(loadBalancer.name()).orElse("").contains(loadBalancerFilter);
  }

  /**
   * Enumerates every listener of every selected load balancer.
   *
   * @return listeners in control plane order
   */
  public List<ListenerLocation> listeners() {
    final var locations = new ArrayList<ListenerLocation>();
    for (final var loadBalancer : controlPlane.listLoadBalancers()) {
      if (!selects(loadBalancer)) {
        LOGGER.log(DEBUG, "Skipping load balancer {0}: filter mismatch", loadBalancer.name());
        continue;
      }
      for (final var listenerArn : controlPlane.listListeners(loadBalancer.arn())) {
        locations.add(new ListenerLocation(loadBalancer.name(), loadBalancer.arn(), listenerArn));
      }
    }
    return locations;
  }

  /**
   * Reads the rules of one listener and keeps those carrying an API-key condition.
   *
   * @param location listener to inspect
   * @return matching non-default rules, possibly empty
   */
  public List<RuleMatch> matchingRules(final ListenerLocation location) {
    final var matches = new ArrayList<RuleMatch>();
    for (final var rule : controlPlane.listRules(location.listenerArn())) {
      if (rule.isDefault()) {
        LOGGER.log(DEBUG, "Default rule {0} cannot be modified, skipping", rule.arn());
        continue;
      }
      final var apiKeyConditions =
          rule.conditions().stream().filter(RuleLocator::isApiKeyCondition).toList();
      if (!apiKeyConditions.isEmpty()) {
        matches.add(new RuleMatch(location, rule, apiKeyConditions));
      }
    }
    return matches;
  }

  /**
   * Locates every matching rule across all selected listeners.
   *
   * @return all matches
   */
  public List<RuleMatch> locateAll() {
    final var matches = new ArrayList<RuleMatch>();
    for (final var location : listeners()) {
      matches.addAll(matchingRules(location));
    }
    return matches;
  }
}
