package com.cryptoconnector.integration.btcmarkets;

import java.math.BigDecimal;
import java.util.regex.Pattern;

final class BtcMarketsValidation {
  private static final Pattern PATH_SEGMENT = Pattern.compile("[A-Za-z0-9._~-]+");

  private BtcMarketsValidation() {}

  static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  // Ids are interpolated into the request path unencoded.
  static void requirePathSegment(String value, String fieldName) {
    requireNonBlank(value, fieldName);
    if (!PATH_SEGMENT.matcher(value).matches()) {
      throw new IllegalArgumentException(
          fieldName + " may only contain letters, digits, '-', '_', '.' or '~': " + value);
    }
    if (value.chars().allMatch(ch -> ch == '.')) {
      throw new IllegalArgumentException(fieldName + " must not be a dot segment: " + value);
    }
  }

  static void requirePrice(BigDecimal price) {
    if (price == null) {
      throw new IllegalArgumentException("price is required");
    }
    if (price.signum() < 0) {
      throw new IllegalArgumentException("price must be >= 0");
    }
  }

  static void requireAmount(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
  }
}
