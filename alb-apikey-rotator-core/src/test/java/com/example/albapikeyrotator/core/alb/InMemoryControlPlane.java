package com.example.albapikeyrotator.core.alb;

import com.example.albapikeyrotator.core.UpstreamUnavailableException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.FixedResponseActionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.HttpHeaderConditionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.PathPatternConditionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/** {@link LoadBalancerControlPlane} fake holding rules in memory. Thread-safe for fan-out tests. */
public class InMemoryControlPlane implements LoadBalancerControlPlane {

  public record Update(String ruleArn, List<RuleCondition> conditions, List<Action> actions) {}

  private final List<LoadBalancerSummary> loadBalancers = new ArrayList<>();
  private final Map<String, List<String>> listeners = new LinkedHashMap<>();
  private final Map<String, List<ListenerRule>> rules = new LinkedHashMap<>();
  private final Set<String> failingRules = new HashSet<>();
  private final Set<String> failingListeners = new HashSet<>();

  private final List<Update> updates = new ArrayList<>();

  public synchronized InMemoryControlPlane loadBalancer(final String name, final String arn) {
    loadBalancers.add(new LoadBalancerSummary(name, arn));
    listeners.putIfAbsent(arn, new ArrayList<>());
    return this;
  }

  public synchronized InMemoryControlPlane listener(final String lbArn, final String listenerArn) {
    listeners.computeIfAbsent(lbArn, k -> new ArrayList<>()).add(listenerArn);
    rules.putIfAbsent(listenerArn, new ArrayList<>());
    return this;
  }

  public synchronized InMemoryControlPlane rule(final String listenerArn, final ListenerRule rule) {
    rules.computeIfAbsent(listenerArn, k -> new ArrayList<>()).add(rule);
    return this;
  }

  public synchronized InMemoryControlPlane failUpdatesOf(final String ruleArn) {
    failingRules.add(ruleArn);
    return this;
  }

  public synchronized InMemoryControlPlane failListingOf(final String listenerArn) {
    failingListeners.add(listenerArn);
    return this;
  }

  public synchronized ListenerRule ruleByArn(final String ruleArn) {
    return rules.values().stream()
        .flatMap(List::stream)
        .filter(r -> r.arn().equals(ruleArn))
        .findFirst()
        .orElseThrow();
  }

  public synchronized List<Update> updates() {
    return List.copyOf(updates);
  }

  @Override
  public synchronized List<LoadBalancerSummary> listLoadBalancers() {
    return List.copyOf(loadBalancers);
  }

  @Override
  public synchronized List<String> listListeners(final String loadBalancerArn) {
    return List.copyOf(listeners.getOrDefault(loadBalancerArn, List.of()));
  }

  @Override
  public synchronized List<ListenerRule> listRules(final String listenerArn) {
    if (failingListeners.contains(listenerArn))
      throw new UpstreamUnavailableException(
          "throttled", SdkClientException.create("Rate exceeded"));
    return List.copyOf(rules.getOrDefault(listenerArn, List.of()));
  }

  @Override
  public synchronized void updateRule(
      final String ruleArn, final List<RuleCondition> conditions, final List<Action> actions) {
    updates.add(new Update(ruleArn, List.copyOf(conditions), List.copyOf(actions)));
    if (failingRules.contains(ruleArn))
      throw new UpstreamUnavailableException(
          "modify failed", SdkClientException.create("Rate exceeded"));
    for (final var entry : rules.entrySet()) {
      final var list = entry.getValue();
      for (int i = 0; i < list.size(); i++) {
        final var existing = list.get(i);
        if (existing.arn().equals(ruleArn)) {
          if (existing.isDefault())
            throw new IllegalStateException("default rule " + ruleArn + " cannot be modified");
          list.set(i, new ListenerRule(ruleArn, false, conditions, actions));
          return;
        }
      }
    }
    throw new IllegalStateException("no rule " + ruleArn);
  }

  public static RuleCondition apiKeyCondition(final String... values) {
    return headerCondition(RuleLocator.API_KEY_HEADER, values);
  }

  public static RuleCondition headerCondition(final String header, final String... values) {
    return RuleCondition.builder()
        .field("http-header")
        .httpHeaderConfig(
            HttpHeaderConditionConfig.builder().httpHeaderName(header).values(values).build())
        .build();
  }

  public static RuleCondition pathCondition(final String pattern) {
    return RuleCondition.builder()
        .field("path-pattern")
        .pathPatternConfig(PathPatternConditionConfig.builder().values(pattern).build())
        .build();
  }

  public static Action fixedResponse(final String status) {
    return Action.builder()
        .type(ActionTypeEnum.FIXED_RESPONSE)
        .order(1)
        .fixedResponseConfig(
            FixedResponseActionConfig.builder().statusCode(status).contentType("text/plain").build())
        .build();
  }

  public static Action forward(final String targetGroupArn) {
    return Action.builder()
        .type(ActionTypeEnum.FORWARD)
        .order(1)
        .targetGroupArn(targetGroupArn)
        .build();
  }
}
