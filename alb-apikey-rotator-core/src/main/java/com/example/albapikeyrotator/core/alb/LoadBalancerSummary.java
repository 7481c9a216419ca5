package com.example.albapikeyrotator.core.alb;

/**
 * @param name load balancer name
 * @param arn load balancer ARN
 */
public record LoadBalancerSummary(String name, String arn) {}
