package com.cryptoconnector.integration.btcmarkets;

import java.math.BigDecimal;

/**
 * New order. {@code type} is the exchange's order type ({@code Limit}, {@code Market},
 * {@code Stop Limit}, ...) and {@code side} is {@code Bid} or {@code Ask}.
 */
public record BtcMarketsPlaceOrderRequest(
    String marketId, BigDecimal price, BigDecimal amount, String type, String side) {
  public BtcMarketsPlaceOrderRequest {
    BtcMarketsValidation.requireNonBlank(marketId, "marketId");
    BtcMarketsValidation.requirePrice(price);
    BtcMarketsValidation.requireAmount(amount);
    BtcMarketsValidation.requireNonBlank(type, "type");
    BtcMarketsValidation.requireNonBlank(side, "side");
  }
}
