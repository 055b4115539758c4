package com.cryptoconnector.integration.btcmarkets;

public class BtcMarketsCredentialsException extends BtcMarketsConnectorException {
  public BtcMarketsCredentialsException(String message) {
    super(message, NO_HTTP_STATUS, null);
  }
}
