package com.example.albapikeyrotator.core.alb;

import java.util.List;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * Query and mutate operations of the load balancer control plane.
 *
 * <p>Every listing returns the complete result: implementations consume all pages before
 * returning.
 */
public interface LoadBalancerControlPlane {

  List<LoadBalancerSummary> listLoadBalancers();

  List<String> listListeners(String loadBalancerArn);

  List<ListenerRule> listRules(String listenerArn);

  /**
   * Replaces the conditions and actions of one rule in a single atomic update.
   *
   * @param ruleArn rule to update
   * @param conditions full condition list
   * @param actions full action list
   */
  void updateRule(String ruleArn, List<RuleCondition> conditions, List<Action> actions);
}
