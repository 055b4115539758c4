package com.cryptoconnector.integration.btcmarkets;

public class BtcMarketsConnectorException extends RuntimeException {
  public static final int NO_HTTP_STATUS = -1;

  private final int httpStatus;
  private final String errorCode;

  public BtcMarketsConnectorException(
      String message, int httpStatus, String errorCode, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.errorCode = errorCode;
  }

  public BtcMarketsConnectorException(String message, int httpStatus, String errorCode) {
    super(message);
    this.httpStatus = httpStatus;
    this.errorCode = errorCode;
  }

  /** Vendor error code such as {@code InvalidPrice}, or {@code null} when none was returned. */
  public String errorCode() {
    return errorCode;
  }

  /** HTTP status of the failed call, {@link #NO_HTTP_STATUS} when no response was received. */
  public int httpStatus() {
    return httpStatus;
  }
}
