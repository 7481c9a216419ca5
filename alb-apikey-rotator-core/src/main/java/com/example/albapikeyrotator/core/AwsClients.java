package com.example.albapikeyrotator.core;

import static java.lang.System.Logger.Level.WARNING;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * Provides lazily configured AWS SDK clients for Secrets Manager and Elastic Load Balancing v2.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.elb.endpoint / AWS_ELB_ENDPOINT
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 *
 * <p>Clients are built once per process and reused across invocations of a warm Lambda container.
 */
public final class AwsClients {

  private static final System.Logger LOGGER = System.getLogger(AwsClients.class.getName());

  private static volatile SecretsManagerClient secretsManager;
  private static volatile ElasticLoadBalancingV2Client loadBalancing;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(AwsClients::resetClients));
  }

  private AwsClients() {}

  /** Lazily gets the SecretsManagerClient, building it if necessary. */
  public static synchronized SecretsManagerClient secretsManager() {
    return Optional.ofNullable(secretsManager)
        .orElseGet(() -> secretsManager = buildSecretsManager());
  }

  /** Lazily gets the ElasticLoadBalancingV2Client, building it if necessary. */
  public static synchronized ElasticLoadBalancingV2Client loadBalancing() {
    return Optional.ofNullable(loadBalancing)
        .orElseGet(() -> loadBalancing = buildLoadBalancing());
  }

  /** Closes both clients; next access will lazily rebuild them with current config. */
  public static synchronized void resetClients() {
    close(secretsManager);
    close(loadBalancing);
    secretsManager = null;
    loadBalancing = null;
  }

  private static SecretsManagerClient buildSecretsManager() {
    final var builder =
        SecretsManagerClient.builder().region(region()).credentialsProvider(credentials());
    setting("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return builder.build();
  }

  private static ElasticLoadBalancingV2Client buildLoadBalancing() {
    final var builder =
        ElasticLoadBalancingV2Client.builder().region(region()).credentialsProvider(credentials());
    setting("aws.elb.endpoint", "AWS_ELB_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return builder.build();
  }

  static Region region() {
    return setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
  }

  // Static credentials only when both halves are present, else the default provider chain.
  static AwsCredentialsProvider credentials() {
    return setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .<AwsCredentialsProvider>map(StaticCredentialsProvider::create)
        .orElseGet(() -> DefaultCredentialsProvider.builder().build());
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  private static void close(final SdkClient client) {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final RuntimeException e) {
                LOGGER.log(WARNING, "Failed to close {0}: {1}", c.serviceName(), e.getMessage());
              }
            });
  }
}
