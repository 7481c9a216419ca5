package com.example.albapikeyrotator.core.rotation;

import static org.junit.jupiter.api.Assertions.*;

import com.example.albapikeyrotator.core.PendingKeyVerificationException;
import com.example.albapikeyrotator.core.UpstreamUnavailableException;
import com.example.albapikeyrotator.core.secrets.CredentialPayload;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HttpProbeVerifierTest {

  private static final CredentialPayload CURRENT = new CredentialPayload("a", "b", "c");
  private static final CredentialPayload PENDING = new CredentialPayload("b", "c", "pendingKey");

  private HttpServer server;
  private final AtomicReference<String> receivedKey = new AtomicReference<>();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          final var key = exchange.getRequestHeaders().getFirst("X-AWS-API-KEY");
          receivedKey.set(key);
          final int status = "pendingKey".equals(key) ? 200 : 403;
          exchange.sendResponseHeaders(status, -1);
          exchange.close();
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private URI uri(final String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }

  @Test
  @DisplayName("Sends the pending key in the API-key header and accepts a 2xx answer")
  void acceptsSuccessfulProbe() {
    final var verifier = new HttpProbeVerifier(uri("/health"), Duration.ofSeconds(5));

    assertDoesNotThrow(() -> verifier.verify("s", CURRENT, PENDING));
    assertEquals("pendingKey", receivedKey.get());
  }

  @Test
  @DisplayName("A rejected probe fails verification")
  void rejectsForbiddenProbe() {
    final var verifier = new HttpProbeVerifier(uri("/health"), Duration.ofSeconds(5));

    final var e =
        assertThrows(
            PendingKeyVerificationException.class,
            () -> verifier.verify("s", CURRENT, new CredentialPayload("b", "c", "wrong")));
    assertTrue(e.getMessage().contains("403"));
  }

  @Test
  @DisplayName("An unreachable target is an upstream failure")
  void unreachableTarget() throws IOException {
    final int port;
    try (final var socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    final var verifier =
        new HttpProbeVerifier(
            URI.create("http://127.0.0.1:" + port + "/health"), Duration.ofSeconds(2));

    assertThrows(UpstreamUnavailableException.class, () -> verifier.verify("s", CURRENT, PENDING));
  }

  @Test
  @DisplayName("Rejects a missing target or a non-positive timeout")
  void rejectsInvalidArguments() {
    assertThrows(
        IllegalArgumentException.class, () -> new HttpProbeVerifier(null, Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class, () -> new HttpProbeVerifier(uri("/"), Duration.ZERO));
  }
}
