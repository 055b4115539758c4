package com.cryptoconnector.integration.btcmarkets;

public interface BtcMarketsTelemetry {
  void onResponse(String operation, int statusCode, long durationNanos);

  void onFailure(String operation, Throwable error);
}
