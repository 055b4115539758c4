package com.cryptoconnector.integration.btcmarkets;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Builds a new {@link HttpClient} for every call, so no connection is reused by a later call.
 */
public class BtcMarketsHttpClientFactory implements Supplier<HttpClient> {
  private final Duration connectTimeout;

  /** {@code connectTimeout} may be {@code null} for no connect timeout. */
  public BtcMarketsHttpClientFactory(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  @Override
  public HttpClient get() {
    HttpClient.Builder builder = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);
    if (connectTimeout != null) {
      builder.connectTimeout(connectTimeout);
    }
    return builder.build();
  }
}
