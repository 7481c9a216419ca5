package com.example.albapikeyrotator.core.alb;

import java.util.List;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * A listener rule as read from the control plane.
 *
 * @param arn rule ARN
 * @param isDefault whether this is the listener's catch-all rule
 * @param conditions rule conditions in control plane order
 * @param actions rule actions in control plane order
 */
public record ListenerRule(
    String arn, boolean isDefault, List<RuleCondition> conditions, List<Action> actions) {

  public ListenerRule {
    conditions = List.copyOf(conditions);
    actions = List.copyOf(actions);
  }
}
