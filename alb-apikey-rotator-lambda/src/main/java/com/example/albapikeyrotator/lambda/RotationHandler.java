package com.example.albapikeyrotator.lambda;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.albapikeyrotator.core.AwsClients;
import com.example.albapikeyrotator.core.RotationException;
import com.example.albapikeyrotator.core.alb.ElbV2ControlPlane;
import com.example.albapikeyrotator.core.alb.LoadBalancerControlPlane;
import com.example.albapikeyrotator.core.alb.RuleLocator;
import com.example.albapikeyrotator.core.alb.RuleSynchronizer;
import com.example.albapikeyrotator.core.keys.KeyChainer;
import com.example.albapikeyrotator.core.keys.KeyGenerator;
import com.example.albapikeyrotator.core.rotation.HttpProbeVerifier;
import com.example.albapikeyrotator.core.rotation.PendingKeyVerifier;
import com.example.albapikeyrotator.core.rotation.RotationEvent;
import com.example.albapikeyrotator.core.rotation.RotationStateMachine;
import com.example.albapikeyrotator.core.rotation.RuleStateVerifier;
import com.example.albapikeyrotator.core.secrets.SecretStore;
import com.example.albapikeyrotator.core.secrets.SecretsManagerSecretStore;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Lambda entry point invoked by Secrets Manager for each rotation step.
 *
 * <p>Input: {@code {"Step": ..., "SecretId": ..., "ClientRequestToken": ...}}, the token being
 * optional. Output on every completed path, including no-ops: {@code {"statusCode": 200, "body":
 * "done."}}. Failures propagate as {@link RotationException} so the rotation framework records
 * them and re-invokes the step.
 *
 * <p>Collaborators are built once per container and reused across warm invocations.
 */
public final class RotationHandler {

  private static final System.Logger LOGGER = System.getLogger(RotationHandler.class.getName());

  static final Map<String, Object> DONE = Map.of("statusCode", 200, "body", "done.");

  private final RotationStateMachine stateMachine;

  /** Used by the Lambda runtime. */
  public RotationHandler() {
    this(RotatorConfig.load());
  }

  RotationHandler(final RotatorConfig config) {
    this(
        config,
        new SecretsManagerSecretStore(AwsClients.secretsManager()),
        new ElbV2ControlPlane(AwsClients.loadBalancing()));
  }

  RotationHandler(
      final RotatorConfig config,
      final SecretStore secretStore,
      final LoadBalancerControlPlane controlPlane) {
    this(stateMachine(config, secretStore, controlPlane), config.debug());
  }

  RotationHandler(final RotationStateMachine stateMachine, final boolean debug) {
    LogLevels.apply(debug);
    this.stateMachine = stateMachine;
  }

  static RotationStateMachine stateMachine(
      final RotatorConfig config,
      final SecretStore secretStore,
      final LoadBalancerControlPlane controlPlane) {
    final var locator = new RuleLocator(controlPlane, config.loadBalancerFilter());
    final var verifiers = new ArrayList<PendingKeyVerifier>();
    verifiers.add(new RuleStateVerifier(locator));
    config
        .probe()
        .ifPresent(url -> verifiers.add(new HttpProbeVerifier(url, config.probeTimeout())));
    return RotationStateMachine.builder()
        .secretStore(secretStore)
        .keyChainer(new KeyChainer(new KeyGenerator(config.keyLength())))
        .ruleSynchronizer(new RuleSynchronizer(controlPlane, locator, config.syncParallelism()))
        .verifier(PendingKeyVerifier.allOf(verifiers))
        .build();
  }

  /**
   * Handles one rotation request.
   *
   * @param input request fields
   * @return the completion response
   * @throws IllegalArgumentException if {@code Step} or {@code SecretId} is missing
   * @throws RotationException if the step fails
   */
  public Map<String, Object> handleRequest(final Map<String, Object> input) {
    final var event =
        RotationEvent.of(
            required(input, "Step"),
            required(input, "SecretId"),
            field(input, "ClientRequestToken").orElse(""));
    LOGGER.log(DEBUG, "Received {0}", event);

    try {
      final var outcome = stateMachine.handle(event);
      LOGGER.log(INFO, "{0} for {1}: {2}", event.stepName(), event.secretId(), outcome);
      return DONE;
    } catch (final RotationException e) {
      LOGGER.log(
          ERROR,
          "{0} for {1} failed (retryable={2}): {3}",
          event.stepName(),
          event.secretId(),
          e.isRetryable(),
          e.getMessage());
      throw e;
    }
  }

  private static String required(final Map<String, Object> input, final String name) {
    return field(input, name)
        .orElseThrow(() -> new IllegalArgumentException("Missing required field " + name));
  }

  private static Optional<String> field(final Map<String, Object> input, final String name) {
    return Optional.ofNullable(input)
        .map(m -> m.get(name))
        .map(Object::toString)
        .filter(val -> !val.isBlank());
  }
}
