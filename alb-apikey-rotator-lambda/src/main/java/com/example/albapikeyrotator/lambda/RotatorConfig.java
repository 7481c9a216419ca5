package com.example.albapikeyrotator.lambda;

import com.example.albapikeyrotator.core.keys.KeyGenerator;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Runtime settings of the rotation function.
 *
 * <p>Each setting is read from a system property first, then from an environment variable:
 *
 * <ul>
 *   <li>rotator.log.level / LOGLEVEL ({@code DEBUG} or {@code INFO}, default INFO)
 *   <li>rotator.alb.name / ALBNAME (load balancer name substring, default all)
 *   <li>rotator.sync.parallelism / SYNC_PARALLELISM (default 1)
 *   <li>rotator.key.length / KEY_LENGTH (default 16)
 *   <li>rotator.probe.url / PROBE_URL (optional)
 *   <li>rotator.probe.timeout.millis / PROBE_TIMEOUT_MILLIS (default 5000)
 * </ul>
 *
 * @param debug whether debug logging is enabled
 * @param loadBalancerFilter name substring, empty for all load balancers
 * @param syncParallelism listeners synchronized concurrently, >= 1
 * @param keyLength length of generated keys, >= 1
 * @param probeUrl listener URL probed with the pending key, may be null
 * @param probeTimeout probe request timeout
 */
public record RotatorConfig(
    boolean debug,
    String loadBalancerFilter,
    int syncParallelism,
    int keyLength,
    URI probeUrl,
    Duration probeTimeout) {

  static final int DEFAULT_PARALLELISM = 1;
  static final long DEFAULT_PROBE_TIMEOUT_MILLIS = 5_000L;

  public RotatorConfig {
    loadBalancerFilter = Optional.ofNullable(loadBalancerFilter).orElse("");
    syncParallelism = Math.max(1, syncParallelism);
    if (keyLength < 1) keyLength = KeyGenerator.DEFAULT_LENGTH;
    if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero())
      probeTimeout = Duration.ofMillis(DEFAULT_PROBE_TIMEOUT_MILLIS);
  }

  /**
   * Loads the configuration from system properties and the environment.
   *
   * @return the configuration
   */
  public static RotatorConfig load() {
    return new RotatorConfig(
        setting("rotator.log.level", "LOGLEVEL")
            .map(level -> level.toLowerCase(Locale.ROOT).equals("debug"))
            .orElse(false),
        setting("rotator.alb.name", "ALBNAME").orElse(""),
        setting("rotator.sync.parallelism", "SYNC_PARALLELISM")
            .flatMap(RotatorConfig::parseLong)
            .map(Long::intValue)
            .orElse(DEFAULT_PARALLELISM),
        setting("rotator.key.length", "KEY_LENGTH")
            .flatMap(RotatorConfig::parseLong)
            .map(Long::intValue)
            .orElse(KeyGenerator.DEFAULT_LENGTH),
        setting("rotator.probe.url", "PROBE_URL").map(URI::create).orElse(null),
        setting("rotator.probe.timeout.millis", "PROBE_TIMEOUT_MILLIS")
            .flatMap(RotatorConfig::parseLong)
            .map(Duration::ofMillis)
            .orElse(Duration.ofMillis(DEFAULT_PROBE_TIMEOUT_MILLIS)));
  }

  public Optional<URI> probe() {
    return Optional.ofNullable(probeUrl);
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  private static Optional<Long> parseLong(final String val) {
    try {
      return Optional.of(Long.parseLong(val));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }
}
