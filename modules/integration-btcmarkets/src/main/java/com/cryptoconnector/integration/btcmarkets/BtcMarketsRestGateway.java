package com.cryptoconnector.integration.btcmarkets;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class BtcMarketsRestGateway implements BtcMarketsGateway {
  private static final String MARKETS_PATH = "/v3/markets";
  private static final String TRADING_FEES_PATH = "/v3/accounts/me/trading-fees";
  private static final String BALANCES_PATH = "/v3/accounts/me/balances";
  private static final String ORDERS_PATH = "/v3/orders";

  private final BtcMarketsRestClient restClient;

  public BtcMarketsRestGateway(BtcMarketsRestClient restClient) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
  }

  @Override
  public JsonNode getActiveMarkets() {
    return restClient.executePublic(BtcMarketsRequest.get("active_markets", MARKETS_PATH));
  }

  @Override
  public JsonNode getMarketOrderbook(String marketId) {
    BtcMarketsValidation.requirePathSegment(marketId, "marketId");
    return restClient.executePublic(
        BtcMarketsRequest.get("market_orderbook", MARKETS_PATH + "/" + marketId + "/orderbook"));
  }

  @Override
  public JsonNode getFeeTier() {
    return restClient.executePrivate(BtcMarketsRequest.get("fee_tier", TRADING_FEES_PATH));
  }

  @Override
  public JsonNode getBalances() {
    return restClient.executePrivate(BtcMarketsRequest.get("balances", BALANCES_PATH));
  }

  @Override
  public JsonNode placeNewOrder(BtcMarketsPlaceOrderRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    Map<String, String> body = new LinkedHashMap<>();
    body.put("marketId", request.marketId());
    body.put("price", BtcMarketsDecimals.toApiDecimal(request.price()));
    body.put("amount", BtcMarketsDecimals.toApiDecimal(request.amount()));
    body.put("type", request.type());
    body.put("side", request.side());
    return restClient.executePrivate(BtcMarketsRequest.post("place_order", ORDERS_PATH, body));
  }

  @Override
  public JsonNode replaceOrder(BtcMarketsReplaceOrderRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    Map<String, String> body = new LinkedHashMap<>();
    body.put("price", BtcMarketsDecimals.toApiDecimal(request.price()));
    body.put("amount", BtcMarketsDecimals.toApiDecimal(request.amount()));
    return restClient.executePrivate(
        BtcMarketsRequest.put("replace_order", orderPath(request.orderId()), body));
  }

  @Override
  public JsonNode listOrders(String marketId, String status) {
    Map<String, String> params = new LinkedHashMap<>();
    if (hasText(marketId)) {
      params.put("market_id", marketId);
    }
    if (hasText(status)) {
      params.put("status", status);
    }
    return restClient.executePrivate(BtcMarketsRequest.get("list_orders", ORDERS_PATH, params));
  }

  @Override
  public JsonNode getOrder(String orderId) {
    return restClient.executePrivate(BtcMarketsRequest.get("get_order", orderPath(orderId)));
  }

  @Override
  public JsonNode cancelOrder(String orderId) {
    return restClient.executePrivate(BtcMarketsRequest.delete("cancel_order", orderPath(orderId)));
  }

  @Override
  public JsonNode cancelOpenOrders(String marketId) {
    Map<String, String> params = new LinkedHashMap<>();
    if (hasText(marketId)) {
      params.put("market_id", marketId);
    }
    return restClient.executePrivate(
        BtcMarketsRequest.delete("cancel_open_orders", ORDERS_PATH, params));
  }

  private static String orderPath(String orderId) {
    BtcMarketsValidation.requirePathSegment(orderId, "orderId");
    return ORDERS_PATH + "/" + orderId;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
