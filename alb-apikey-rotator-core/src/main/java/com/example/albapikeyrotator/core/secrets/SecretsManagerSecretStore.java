package com.example.albapikeyrotator.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.albapikeyrotator.core.UpstreamUnavailableException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;

/** {@link SecretStore} backed by AWS Secrets Manager. */
public final class SecretsManagerSecretStore implements SecretStore {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerSecretStore.class.getName());

  private final SecretsManagerClient client;

  public SecretsManagerSecretStore(final SecretsManagerClient client) {
    this.client = client;
  }

  @Override
  public Optional<String> getVersion(
      final String secretId, final StageLabel stage, final String versionToken) {
    final var request =
        GetSecretValueRequest.builder().secretId(secretId).versionStage(stage.wireName());
    Optional.ofNullable(versionToken).filter(t -> !t.isBlank()).ifPresent(request::versionId);
    LOGGER.log(DEBUG, "Getting [{0}] secret [{1}]", stage.wireName(), secretId);
    try {
      return Optional.ofNullable(client.getSecretValue(request.build()).secretString());
    } catch (final ResourceNotFoundException e) {
      return Optional.empty();
    } catch (final SdkException e) {
      throw upstream("get %s version of %s".formatted(stage.wireName(), secretId), e);
    }
  }

  @Override
  public void putVersion(
      final String secretId,
      final String versionToken,
      final String payload,
      final Set<StageLabel> stages) {
    final var request =
        PutSecretValueRequest.builder()
            .secretId(secretId)
            .clientRequestToken(versionToken)
            .secretString(payload)
            .versionStages(stages.stream().map(StageLabel::wireName).collect(Collectors.toList()))
            .build();
    call(() -> client.putSecretValue(request), "put version %s of %s", versionToken, secretId);
  }

  @Override
  public SecretDescription describe(final String secretId) {
    final var response =
        call(
            () -> client.describeSecret(DescribeSecretRequest.builder().secretId(secretId).build()),
            "describe %s",
            secretId);
    final Map<String, Set<String>> versions =
        response.versionIdsToStages().entrySet().stream()
            .collect(
                Collectors.toMap(Map.Entry::getKey, e -> Set.copyOf(e.getValue())));
    return new SecretDescription(Boolean.TRUE.equals(response.rotationEnabled()), versions);
  }

  @Override
  public void moveStage(
      final String secretId,
      final StageLabel stage,
      final String toVersion,
      final String fromVersion) {
    final var request =
        UpdateSecretVersionStageRequest.builder()
            .secretId(secretId)
            .versionStage(stage.wireName())
            .moveToVersionId(toVersion);
    Optional.ofNullable(fromVersion).ifPresent(request::removeFromVersionId);
    call(
        () -> client.updateSecretVersionStage(request.build()),
        "move %s of %s to %s",
        stage.wireName(),
        secretId,
        toVersion);
  }

  private static <T> T call(final Supplier<T> op, final String what, final Object... args) {
    try {
      return op.get();
    } catch (final SdkException e) {
      throw upstream(what.formatted(args), e);
    }
  }

  private static UpstreamUnavailableException upstream(final String what, final SdkException e) {
    return new UpstreamUnavailableException("Secrets Manager failed to " + what, e);
  }
}
