package com.example.albapikeyrotator.core.rotation;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.albapikeyrotator.core.InvalidStagingStateException;
import com.example.albapikeyrotator.core.NotRotationEnabledException;
import com.example.albapikeyrotator.core.UnknownVersionException;
import com.example.albapikeyrotator.core.alb.RuleSynchronizer;
import com.example.albapikeyrotator.core.keys.KeyChainer;
import com.example.albapikeyrotator.core.secrets.CredentialPayload;
import com.example.albapikeyrotator.core.secrets.PayloadCodec;
import com.example.albapikeyrotator.core.secrets.SecretStore;
import com.example.albapikeyrotator.core.secrets.StageLabel;
import java.util.Set;

/**
 * Runs one step of the Secrets Manager rotation protocol for a three-slot API key.
 *
 * <p>Before any step the staging state of the event's version is validated:
 *
 * <ul>
 *   <li>rotation must be enabled on the secret, else {@link NotRotationEnabledException};
 *   <li>the version token must exist, else {@link UnknownVersionException};
 *   <li>a version already labeled CURRENT completes immediately;
 *   <li>otherwise the version must be labeled PENDING, else {@link InvalidStagingStateException}.
 * </ul>
 *
 * <p>Every step is safe to repeat for the same token. No step retries internally.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var machine = RotationStateMachine.builder()
 *     .secretStore(new SecretsManagerSecretStore(AwsClients.secretsManager()))
 *     .keyChainer(new KeyChainer(new KeyGenerator()))
 *     .ruleSynchronizer(new RuleSynchronizer(controlPlane, locator))
 *     .verifier(new RuleStateVerifier(locator))
 *     .build();
 *
 * machine.handle(RotationEvent.of("createSecret", secretId, token));
 * }</pre>
 */
public final class RotationStateMachine {

  private static final System.Logger LOGGER =
      System.getLogger(RotationStateMachine.class.getName());

  private final SecretStore secretStore;
  private final KeyChainer keyChainer;
  private final RuleSynchronizer ruleSynchronizer;
  private final PendingKeyVerifier verifier;

  private RotationStateMachine(final Builder builder) {
    this.secretStore = builder.secretStore;
    this.keyChainer = builder.keyChainer;
    this.ruleSynchronizer = builder.ruleSynchronizer;
    this.verifier = builder.verifier;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RotationStateMachine}. All collaborators are required. */
  public static class Builder {
    private SecretStore secretStore;
    private KeyChainer keyChainer;
    private RuleSynchronizer ruleSynchronizer;
    private PendingKeyVerifier verifier;

    private Builder() {}

    public Builder secretStore(final SecretStore secretStore) {
      this.secretStore = secretStore;
      return this;
    }

    public Builder keyChainer(final KeyChainer keyChainer) {
      this.keyChainer = keyChainer;
      return this;
    }

    public Builder ruleSynchronizer(final RuleSynchronizer ruleSynchronizer) {
      this.ruleSynchronizer = ruleSynchronizer;
      return this;
    }

    /**
     * Sets the verification run by the test step.
     *
     * @param verifier pending-key verification
     * @return this builder
     */
    public Builder verifier(final PendingKeyVerifier verifier) {
      this.verifier = verifier;
      return this;
    }

    /**
     * Builds the state machine.
     *
     * @return configured state machine
     * @throws IllegalStateException if a collaborator is missing
     */
    public RotationStateMachine build() {
      if (secretStore == null) throw new IllegalStateException("secretStore is required");
      if (keyChainer == null) throw new IllegalStateException("keyChainer is required");
      if (ruleSynchronizer == null)
        throw new IllegalStateException("ruleSynchronizer is required");
      if (verifier == null) throw new IllegalStateException("verifier is required");
      return new RotationStateMachine(this);
    }
  }

  /**
   * Validates the staging state and runs the event's step.
   *
   * @param event rotation request
   * @return how the invocation completed
   * @throws com.example.albapikeyrotator.core.RotationException if validation or the step fails
   */
  public RotationOutcome handle(final RotationEvent event) {
    final var secretId = event.secretId();
    final var token = event.versionToken();
    LOGGER.log(DEBUG, "Step [{0}] secret [{1}] token [{2}]", event.stepName(), secretId, token);

    final var description = secretStore.describe(secretId);
    if (!description.rotationEnabled()) {
      LOGGER.log(ERROR, "Secret {0} is not enabled for rotation", secretId);
      throw new NotRotationEnabledException(secretId);
    }
    if (!description.hasVersion(token)) {
      LOGGER.log(ERROR, "Secret version {0} has no stage for rotation of {1}", token, secretId);
      throw new UnknownVersionException(secretId, token);
    }
    if (description.hasLabel(token, StageLabel.CURRENT)) {
      LOGGER.log(INFO, "Secret version {0} already set as AWSCURRENT for {1}", token, secretId);
      return RotationOutcome.ALREADY_CURRENT;
    }
    if (!description.hasLabel(token, StageLabel.PENDING)) {
      LOGGER.log(
          ERROR, "Secret version {0} not set as AWSPENDING for rotation of {1}", token, secretId);
      throw new InvalidStagingStateException(
          "Secret version %s not set as AWSPENDING for rotation of secret %s"
              .formatted(token, secretId));
    }

    return switch (event.step()) {
      case CREATE -> createSecret(secretId, token);
      case SET -> setSecret(secretId, token);
      case TEST -> testSecret(secretId, token);
      case FINISH -> finishSecret(secretId, token);
      case UNRECOGNIZED -> {
        LOGGER.log(WARNING, "Unknown step [{0}], nothing to do", event.stepName());
        yield RotationOutcome.SKIPPED;
      }
    };
  }

  private RotationOutcome createSecret(final String secretId, final String token) {
    final var current = readPayload(secretId, StageLabel.CURRENT, null);

    if (secretStore.getVersion(secretId, StageLabel.PENDING, token).isPresent()) {
      LOGGER.log(INFO, "createSecret: pending value already exists for {0}", secretId);
      return RotationOutcome.ALREADY_PENDING;
    }

    final var next = keyChainer.chain(current);
    LOGGER.log(DEBUG, "createSecret: new payload {0}", next);
    secretStore.putVersion(
        secretId, token, PayloadCodec.encode(next), Set.of(StageLabel.PENDING));
    LOGGER.log(
        INFO, "createSecret: put secret for {0} and version {1}", secretId, token);
    return RotationOutcome.COMPLETED;
  }

  private RotationOutcome setSecret(final String secretId, final String token) {
    final var pending = readPayload(secretId, StageLabel.PENDING, token);
    final var report = ruleSynchronizer.synchronize(pending.activeKey());
    LOGGER.log(
        INFO,
        "setSecret: {0} rule(s) updated across {1} listener(s) for {2}",
        report.updatedRules().size(),
        report.listenersScanned(),
        secretId);
    return RotationOutcome.COMPLETED;
  }

  private RotationOutcome testSecret(final String secretId, final String token) {
    final var current = readPayload(secretId, StageLabel.CURRENT, null);
    final var pending = readPayload(secretId, StageLabel.PENDING, token);
    LOGGER.log(DEBUG, "testSecret: current {0}, pending {1}", current, pending);
    if (!pending.slotA().equals(current.slotB()) || !pending.slotB().equals(current.slotC())) {
      LOGGER.log(WARNING, "testSecret: pending value of {0} is not chained from current", secretId);
    }
    verifier.verify(secretId, current, pending);
    LOGGER.log(INFO, "testSecret: pending key verified for {0}", secretId);
    return RotationOutcome.COMPLETED;
  }

  private RotationOutcome finishSecret(final String secretId, final String token) {
    readPayload(secretId, StageLabel.PENDING, token);

    final var holder = secretStore.describe(secretId).holderOf(StageLabel.CURRENT).orElse(null);
    if (token.equals(holder)) {
      LOGGER.log(
          INFO, "finishSecret: version {0} already marked as AWSCURRENT for {1}", token, secretId);
      return RotationOutcome.ALREADY_CURRENT;
    }

    secretStore.moveStage(secretId, StageLabel.CURRENT, token, holder);
    LOGGER.log(
        INFO, "finishSecret: moved AWSCURRENT from {0} to {1} for {2}", holder, token, secretId);
    return RotationOutcome.COMPLETED;
  }

  private CredentialPayload readPayload(
      final String secretId, final StageLabel stage, final String token) {
    return secretStore
        .getVersion(secretId, stage, token)
        .map(PayloadCodec::decode)
        .orElseThrow(
            () ->
                new InvalidStagingStateException(
                    "No %s value for secret %s%s"
                        .formatted(
                            stage.wireName(),
                            secretId,
                            token == null ? "" : " version " + token)));
  }
}
