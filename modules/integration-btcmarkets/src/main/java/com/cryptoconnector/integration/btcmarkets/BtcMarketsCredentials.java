package com.cryptoconnector.integration.btcmarkets;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * API key identifier plus the binary secret used as the HMAC key. Both parts are always
 * present; a client without credentials holds no instance at all.
 */
public final class BtcMarketsCredentials {
  private final String apiKey;
  private final byte[] apiSecret;

  private BtcMarketsCredentials(String apiKey, byte[] apiSecret) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required");
    }
    if (apiSecret == null || apiSecret.length == 0) {
      throw new IllegalArgumentException("apiSecret is required");
    }
    this.apiKey = apiKey;
    this.apiSecret = apiSecret.clone();
  }

  public static BtcMarketsCredentials of(String apiKey, byte[] apiSecret) {
    return new BtcMarketsCredentials(apiKey, apiSecret);
  }

  /** Uses the UTF-8 bytes of {@code apiSecret} as the key. */
  public static BtcMarketsCredentials of(String apiKey, String apiSecret) {
    return new BtcMarketsCredentials(
        apiKey, apiSecret == null ? null : apiSecret.getBytes(StandardCharsets.UTF_8));
  }

  /** Decodes {@code apiSecret} from base64, the form in which the exchange issues secrets. */
  public static BtcMarketsCredentials ofBase64Secret(String apiKey, String apiSecret) {
    if (apiSecret == null || apiSecret.isBlank()) {
      throw new IllegalArgumentException("apiSecret is required");
    }
    try {
      return new BtcMarketsCredentials(apiKey, Base64.getDecoder().decode(apiSecret.trim()));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("apiSecret is not valid base64", ex);
    }
  }

  public String apiKey() {
    return apiKey;
  }

  public byte[] apiSecret() {
    return apiSecret.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof BtcMarketsCredentials that)) {
      return false;
    }
    return apiKey.equals(that.apiKey) && Arrays.equals(apiSecret, that.apiSecret);
  }

  @Override
  public int hashCode() {
    return 31 * apiKey.hashCode() + Arrays.hashCode(apiSecret);
  }

  @Override
  public String toString() {
    return "BtcMarketsCredentials[apiKey=" + apiKey + ", apiSecret=***]";
  }
}
