package com.cryptoconnector.integration.btcmarkets;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed entry points for the BTC Markets v3 API. Every method returns the parsed JSON payload
 * of the 200 response as the exchange sent it.
 */
public interface BtcMarketsGateway {
  JsonNode getActiveMarkets();

  /** @param marketId e.g. {@code BTC-AUD} */
  JsonNode getMarketOrderbook(String marketId);

  JsonNode getFeeTier();

  JsonNode getBalances();

  JsonNode placeNewOrder(BtcMarketsPlaceOrderRequest request);

  JsonNode replaceOrder(BtcMarketsReplaceOrderRequest request);

  /** Both filters are optional; {@code null} or blank leaves the filter out. */
  JsonNode listOrders(String marketId, String status);

  default JsonNode listOrders() {
    return listOrders(null, null);
  }

  JsonNode getOrder(String orderId);

  JsonNode cancelOrder(String orderId);

  /** Cancels every open order, or only those of {@code marketId} when it is set. */
  JsonNode cancelOpenOrders(String marketId);

  default JsonNode cancelOpenOrders() {
    return cancelOpenOrders(null);
  }
}
