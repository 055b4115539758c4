package com.cryptoconnector.integration.btcmarkets;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Fixed-point rendering of prices and amounts as the exchange expects them. */
public final class BtcMarketsDecimals {
  public static final int API_SCALE = 8;

  private BtcMarketsDecimals() {}

  public static String toApiDecimal(BigDecimal value) {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    return value.setScale(API_SCALE, RoundingMode.HALF_EVEN).toPlainString();
  }
}
