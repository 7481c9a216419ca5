package com.example.albapikeyrotator.core.alb;

/**
 * A listener together with the load balancer it belongs to.
 *
 * @param loadBalancerName owning load balancer name
 * @param loadBalancerArn owning load balancer ARN
 * @param listenerArn listener ARN
 */
public record ListenerLocation(
    String loadBalancerName, String loadBalancerArn, String listenerArn) {}
