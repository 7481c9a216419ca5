/**
 * Root package for the ALB API-key rotator.
 *
 * <p>The rotator implements the four Secrets Manager rotation steps for a three-slot API key and
 * keeps the {@code X-AWS-API-KEY} header conditions of Application Load Balancer rules in sync
 * with the newest slot.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.albapikeyrotator.core.secrets} – versioned secret storage, stage
 *       labels and the canonical {@code CredentialPayload} encoding.
 *   <li>{@link com.example.albapikeyrotator.core.keys} – secure key generation and the sliding
 *       key chain.
 *   <li>{@link com.example.albapikeyrotator.core.alb} – load balancer enumeration, rule location
 *       and rule synchronization.
 *   <li>{@link com.example.albapikeyrotator.core.rotation} – the rotation state machine and the
 *       pending-key verifiers used by the test step.
 *   <li>{@link com.example.albapikeyrotator.core.AwsClients} – lazily configured SDK clients
 *       (supports endpoint/region/credentials overrides).
 *   <li>{@link com.example.albapikeyrotator.core.RotationException} – root of the error
 *       taxonomy surfaced to the rotation framework.
 * </ul>
 */
package com.example.albapikeyrotator.core;
