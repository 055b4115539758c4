package com.cryptoconnector.integration.btcmarkets;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public class BtcMarketsRequestSigner {
  private static final String HMAC_ALGORITHM = "HmacSHA512";

  private final BtcMarketsCredentials credentials;
  private final Clock clock;

  /** {@code credentials} may be {@code null}; signing then fails with a credentials error. */
  public BtcMarketsRequestSigner(BtcMarketsCredentials credentials, Clock clock) {
    this.credentials = credentials;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public boolean hasCredentials() {
    return credentials != null;
  }

  /**
   * Signs {@code method + path + timestamp + body} with the current clock time. {@code body} is
   * left out of the signed string when {@code null}. The path must not include the query string.
   */
  public SignedRequest sign(String method, String path, String body) {
    BtcMarketsCredentials current = requireCredentials();
    String timestamp = String.valueOf(clock.millis());
    String signature = signature(current.apiSecret(), method, path, timestamp, body);
    return new SignedRequest(current.apiKey(), timestamp, signature);
  }

  public static String stringToSign(String method, String path, String timestamp, String body) {
    StringBuilder payload = new StringBuilder(method).append(path).append(timestamp);
    if (body != null) {
      payload.append(body);
    }
    return payload.toString();
  }

  public static String signature(
      byte[] secret, String method, String path, String timestamp, String body) {
    String payload = stringToSign(method, path, timestamp, body);
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
      byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign BTC Markets request", ex);
    }
  }

  private BtcMarketsCredentials requireCredentials() {
    if (credentials == null) {
      throw new BtcMarketsCredentialsException("BTC Markets apiKey or apiSecret not set");
    }
    return credentials;
  }

  public record SignedRequest(String apiKey, String timestamp, String signature) {}
}
