package com.example.albapikeyrotator.core.alb;

import java.util.List;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * A non-default rule carrying at least one API-key header condition.
 *
 * @param location listener the rule belongs to
 * @param rule the rule as read
 * @param apiKeyConditions the matching conditions, in rule order
 */
public record RuleMatch(
    ListenerLocation location, ListenerRule rule, List<RuleCondition> apiKeyConditions) {

  public RuleMatch {
    apiKeyConditions = List.copyOf(apiKeyConditions);
  }
}
