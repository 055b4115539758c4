package com.cryptoconnector.integration.btcmarkets;

import com.fasterxml.jackson.databind.JsonNode;

public interface BtcMarketsRestClient {
  /** Sends an unsigned request and returns the parsed JSON of a 200 response. */
  JsonNode executePublic(BtcMarketsRequest request);

  /**
   * Signs and sends a request. Fails with {@link BtcMarketsCredentialsException} before any
   * network traffic when the client has no credentials.
   */
  JsonNode executePrivate(BtcMarketsRequest request);
}
