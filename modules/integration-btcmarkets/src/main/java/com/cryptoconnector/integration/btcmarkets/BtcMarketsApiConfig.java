package com.cryptoconnector.integration.btcmarkets;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable client settings. {@code credentials} may be {@code null} for a public-only client
 * and {@code timeout} may be {@code null} to send requests without a timeout.
 */
public record BtcMarketsApiConfig(
    URI baseUri, BtcMarketsCredentials credentials, Duration timeout, Clock clock) {
  public static final URI DEFAULT_BASE_URI = URI.create("https://api.btcmarkets.net");

  public BtcMarketsApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0 when set");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
  }

  public static BtcMarketsApiConfig publicOnly(URI baseUri) {
    return new BtcMarketsApiConfig(baseUri, null, null, Clock.systemUTC());
  }

  public static BtcMarketsApiConfig authenticated(URI baseUri, BtcMarketsCredentials credentials) {
    return new BtcMarketsApiConfig(baseUri, credentials, null, Clock.systemUTC());
  }

  public Optional<BtcMarketsCredentials> optionalCredentials() {
    return Optional.ofNullable(credentials);
  }

  public Optional<Duration> optionalTimeout() {
    return Optional.ofNullable(timeout);
  }
}
