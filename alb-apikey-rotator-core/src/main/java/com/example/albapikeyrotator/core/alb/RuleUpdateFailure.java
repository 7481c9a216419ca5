package com.example.albapikeyrotator.core.alb;

import java.util.Optional;

/**
 * One failed rule update, or a listener whose rules could not be listed.
 *
 * @param loadBalancerName owning load balancer
 * @param listenerArn owning listener
 * @param ruleArn failed rule, {@code null} when listing the listener's rules failed
 * @param cause the failure
 */
public record RuleUpdateFailure(
    String loadBalancerName, String listenerArn, String ruleArn, Throwable cause) {

  public String describe() {
    return "lb=%s listener=%s rule=%s: %s"
        .formatted(
            loadBalancerName,
            listenerArn,
            Optional.ofNullable(ruleArn).orElse("<listing>"),
            cause.getMessage());
  }
}
