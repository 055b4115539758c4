package com.cryptoconnector.integration.btcmarkets;

import java.util.Objects;
import java.util.Optional;

public class BtcMarketsApiException extends BtcMarketsConnectorException {
  private final String errorMessage;
  private final String responseBody;

  public BtcMarketsApiException(
      int statusCode, String errorCode, String errorMessage, String responseBody) {
    super(describe(statusCode, errorCode, errorMessage), statusCode, errorCode);
    this.errorMessage = errorMessage;
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  public BtcMarketsApiException(int statusCode, String responseBody, Throwable cause) {
    super(describe(statusCode, null, null), statusCode, null, cause);
    this.errorMessage = null;
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  public int statusCode() {
    return httpStatus();
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public String responseBody() {
    return responseBody;
  }

  public boolean hasVendorError() {
    return errorCode() != null && errorMessage != null;
  }

  private static String describe(int statusCode, String errorCode, String errorMessage) {
    if (errorCode == null || errorMessage == null) {
      return "BTC Markets API error status=" + statusCode;
    }
    return "BTC Markets API error status="
        + statusCode
        + " code="
        + errorCode
        + " message="
        + errorMessage;
  }
}
