package com.example.albapikeyrotator.core.alb;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.albapikeyrotator.core.UpstreamUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeListenersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeListenersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Listener;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyRuleRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;

/**
 * {@link LoadBalancerControlPlane} backed by the Elastic Load Balancing v2 API.
 *
 * <p>Describe calls are followed through {@code NextMarker} until the last page.
 */
public final class ElbV2ControlPlane implements LoadBalancerControlPlane {

  private static final System.Logger LOGGER = System.getLogger(ElbV2ControlPlane.class.getName());

  private final ElasticLoadBalancingV2Client client;

  public ElbV2ControlPlane(final ElasticLoadBalancingV2Client client) {
    this.client = client;
  }

  @Override
  public List<LoadBalancerSummary> listLoadBalancers() {
    return drain(
        marker ->
            client.describeLoadBalancers(
                DescribeLoadBalancersRequest.builder().marker(marker).build()),
        response ->
            response.loadBalancers().stream()
                .map(lb -> new LoadBalancerSummary(lb.loadBalancerName(), lb.loadBalancerArn()))
                .toList(),
        DescribeLoadBalancersResponse::nextMarker,
        "describe load balancers");
  }

  @Override
  public List<String> listListeners(final String loadBalancerArn) {
    return drain(
        marker ->
            client.describeListeners(
                DescribeListenersRequest.builder()
                    .loadBalancerArn(loadBalancerArn)
                    .marker(marker)
                    .build()),
        response -> response.listeners().stream().map(Listener::listenerArn).toList(),
        DescribeListenersResponse::nextMarker,
        "describe listeners of " + loadBalancerArn);
  }

  @Override
  public List<ListenerRule> listRules(final String listenerArn) {
    return drain(
        marker ->
            client.describeRules(
                DescribeRulesRequest.builder().listenerArn(listenerArn).marker(marker).build()),
        response ->
            response.rules().stream()
                .map(
                    rule ->
                        new ListenerRule(
                            rule.ruleArn(),
                            Boolean.TRUE.equals(rule.isDefault()),
                            rule.conditions(),
                            rule.actions()))
                .toList(),
        DescribeRulesResponse::nextMarker,
        "describe rules of " + listenerArn);
  }

  @Override
  public void updateRule(
      final String ruleArn, final List<RuleCondition> conditions, final List<Action> actions) {
    final var request =
        ModifyRuleRequest.builder()
            .ruleArn(ruleArn)
            .conditions(conditions)
            .actions(actions)
            .build();
    call(() -> client.modifyRule(request), "modify rule " + ruleArn);
  }

  private static <R, T> List<T> drain(
      final Function<String, R> fetch,
      final Function<R, List<T>> items,
      final Function<R, String> nextMarker,
      final String what) {
    final var all = new ArrayList<T>();
    String marker = null;
    int pages = 0;
    do {
      final var currentMarker = marker;
      final var response = call(() -> fetch.apply(currentMarker), what);
      all.addAll(items.apply(response));
      marker = nextMarker.apply(response);
      pages++;
    } while (marker != null && !marker.isEmpty());
    LOGGER.log(DEBUG, "{0}: {1} item(s) in {2} page(s)", what, all.size(), pages);
    return all;
  }

  private static <T> T call(final Supplier<T> op, final String what) {
    try {
      return op.get();
    } catch (final SdkException e) {
      throw new UpstreamUnavailableException("Load balancer control plane failed to " + what, e);
    }
  }
}
