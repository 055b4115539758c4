package com.cryptoconnector.integration.btcmarkets;

public class NoOpBtcMarketsTelemetry implements BtcMarketsTelemetry {
  @Override
  public void onResponse(String operation, int statusCode, long durationNanos) {}

  @Override
  public void onFailure(String operation, Throwable error) {}
}
