package com.example.albapikeyrotator.core.rotation;

import static java.lang.System.Logger.Level.INFO;

import com.example.albapikeyrotator.core.PendingKeyVerificationException;
import com.example.albapikeyrotator.core.UpstreamUnavailableException;
import com.example.albapikeyrotator.core.alb.RuleLocator;
import com.example.albapikeyrotator.core.secrets.CredentialPayload;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Sends an authenticated request through a listener using the pending key.
 *
 * <p>Any status below 400 counts as accepted.
 */
public final class HttpProbeVerifier implements PendingKeyVerifier {

  private static final System.Logger LOGGER = System.getLogger(HttpProbeVerifier.class.getName());

  private final HttpClient client;
  private final URI target;
  private final Duration timeout;

  public HttpProbeVerifier(final HttpClient client, final URI target, final Duration timeout) {
    if (client == null) throw new IllegalArgumentException("client is required");
    if (target == null) throw new IllegalArgumentException("target is required");
    this.client = client;
    this.target = target;
    this.timeout = positive(timeout);
  }

  public HttpProbeVerifier(final URI target, final Duration timeout) {
    this(
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(positive(timeout))
            .build(),
        target,
        timeout);
  }

  private static Duration positive(final Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero())
      throw new IllegalArgumentException("timeout must be positive");
    return timeout;
  }

  @Override
  public void verify(
      final String secretId, final CredentialPayload current, final CredentialPayload pending) {
    final var request =
        HttpRequest.newBuilder(target)
            .timeout(timeout)
            .header(RuleLocator.API_KEY_HEADER, pending.activeKey())
            .GET()
            .build();
    final int status;
    try {
      status = client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    } catch (final IOException e) {
      throw new UpstreamUnavailableException("Probe request to " + target + " failed", e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamUnavailableException("Probe request to " + target + " interrupted", e);
    }
    if (status >= 400) {
      throw new PendingKeyVerificationException(
          List.of("probe %s answered %d with the pending key".formatted(target, status)));
    }
    LOGGER.log(INFO, "Probe {0} accepted the pending key of {1} ({2})", target, secretId, status);
  }
}
