package com.cryptoconnector.integration.btcmarkets;

import java.math.BigDecimal;

public record BtcMarketsReplaceOrderRequest(String orderId, BigDecimal price, BigDecimal amount) {
  public BtcMarketsReplaceOrderRequest {
    BtcMarketsValidation.requirePathSegment(orderId, "orderId");
    BtcMarketsValidation.requirePrice(price);
    BtcMarketsValidation.requireAmount(amount);
  }
}
