package com.cryptoconnector.integration.btcmarkets;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public class MicrometerBtcMarketsTelemetry implements BtcMarketsTelemetry {
  private static final String REQUESTS_TOTAL = "btcmarkets.client.requests.total";
  private static final String REQUESTS_DURATION = "btcmarkets.client.requests.duration";

  private final MeterRegistry meterRegistry;

  public MicrometerBtcMarketsTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void onResponse(String operation, int statusCode, long durationNanos) {
    Counter.builder(REQUESTS_TOTAL)
        .description("Total BTC Markets REST calls by outcome")
        .tag("operation", safeValue(operation))
        .tag("outcome", statusCode == 200 ? "success" : "api_error")
        .tag("status", Integer.toString(statusCode))
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder(REQUESTS_DURATION)
        .description("BTC Markets REST round-trip latency")
        .tag("operation", safeValue(operation))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onFailure(String operation, Throwable error) {
    Counter.builder(REQUESTS_TOTAL)
        .description("Total BTC Markets REST calls by outcome")
        .tag("operation", safeValue(operation))
        .tag("outcome", "failure")
        .tag("status", "none")
        .tag("error", error == null ? "none" : error.getClass().getSimpleName())
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
