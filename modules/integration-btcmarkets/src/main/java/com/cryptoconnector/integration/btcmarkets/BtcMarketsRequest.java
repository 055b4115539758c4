package com.cryptoconnector.integration.btcmarkets;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One REST call: method, path, query parameters and JSON body fields. Both maps keep insertion
 * order and are empty when absent.
 */
public record BtcMarketsRequest(
    String operation,
    String method,
    String path,
    Map<String, String> queryParams,
    Map<String, String> body) {
  public BtcMarketsRequest {
    requireNonBlank(operation, "operation");
    requireNonBlank(method, "method");
    requireNonBlank(path, "path");
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/'");
    }
    queryParams = copyOf(queryParams);
    body = copyOf(body);
  }

  public static BtcMarketsRequest get(String operation, String path) {
    return new BtcMarketsRequest(operation, "GET", path, null, null);
  }

  public static BtcMarketsRequest get(
      String operation, String path, Map<String, String> queryParams) {
    return new BtcMarketsRequest(operation, "GET", path, queryParams, null);
  }

  public static BtcMarketsRequest post(String operation, String path, Map<String, String> body) {
    return new BtcMarketsRequest(operation, "POST", path, null, body);
  }

  public static BtcMarketsRequest put(String operation, String path, Map<String, String> body) {
    return new BtcMarketsRequest(operation, "PUT", path, null, body);
  }

  public static BtcMarketsRequest delete(String operation, String path) {
    return new BtcMarketsRequest(operation, "DELETE", path, null, null);
  }

  public static BtcMarketsRequest delete(
      String operation, String path, Map<String, String> queryParams) {
    return new BtcMarketsRequest(operation, "DELETE", path, queryParams, null);
  }

  public boolean hasQuery() {
    return !queryParams.isEmpty();
  }

  public boolean hasBody() {
    return !body.isEmpty();
  }

  private static Map<String, String> copyOf(Map<String, String> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    LinkedHashMap<String, String> copy = new LinkedHashMap<>();
    source.forEach(
        (key, value) -> {
          requireNonBlank(key, "parameter name");
          if (value == null) {
            throw new IllegalArgumentException("value for " + key + " must not be null");
          }
          copy.put(key, value);
        });
    return Collections.unmodifiableMap(copy);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }
}
