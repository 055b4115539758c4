package com.cryptoconnector.integration.btcmarkets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class BtcMarketsRequestSignerTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-25T00:00:00Z"), ZoneOffset.UTC);
  private static final String API_KEY = "4229ee2d-6b83-477e-a1ab-502dd1f5052c";
  private static final String API_SECRET = "anVzdCBhIHRlc3QsIG5vIHNlY3JldHMgaGVyZQ==";
  private static final String ORDER_BODY =
      "{\"marketId\":\"BTC-AUD\",\"price\":\"100000.00000000\",\"amount\":\"0.10000000\","
          + "\"type\":\"Limit\",\"side\":\"Ask\"}";

  @Test
  void shouldMatchPrecomputedSignatureForOrderBody() {
    String signature =
        BtcMarketsRequestSigner.signature(
            API_SECRET.getBytes(StandardCharsets.UTF_8),
            "POST",
            "/v3/orders",
            "1771977600000",
            ORDER_BODY);

    assertEquals(
        "jDGSnbwDo/XwKkenk1wMG9MXr8JBZCFENSsVBogqC3pOOxHJ2i3TjhqOih7Hrbqig3l7b8E4O47+h7ozxvd5Ew==",
        signature);
  }

  @Test
  void shouldSignWithClockTimestampAndOmitAbsentBody() {
    BtcMarketsRequestSigner signer =
        new BtcMarketsRequestSigner(BtcMarketsCredentials.of(API_KEY, API_SECRET), FIXED_CLOCK);

    BtcMarketsRequestSigner.SignedRequest signed =
        signer.sign("GET", "/v3/accounts/me/balances", null);

    assertEquals(API_KEY, signed.apiKey());
    assertEquals("1771977600000", signed.timestamp());
    assertEquals(
        "gRxh3MU/i/9WWEzkus9fqQ/6hQJw6Ev2B237XD3adjwGZmPTWdPDjJV7hWZ1hXPrBX6haM9FRvUOA8JNNW7w7w==",
        signed.signature());
  }

  @Test
  void shouldUseDecodedKeyForBase64Secret() {
    BtcMarketsRequestSigner signer =
        new BtcMarketsRequestSigner(
            BtcMarketsCredentials.ofBase64Secret(API_KEY, API_SECRET), FIXED_CLOCK);

    assertEquals(
        "xhNTXGp3G3nIsYLFbndm4rVOgnhffNWKdqAPeOC2+0yzMuf3LqWhgXUom2N/eXbTbTuRwLoZycDw9C2ZybkPBQ==",
        signer.sign("GET", "/v3/accounts/me/balances", null).signature());
  }

  @Test
  void shouldConcatenateMethodPathTimestampThenBody() {
    assertEquals(
        "POST/v3/orders1771977600000{\"a\":\"b\"}",
        BtcMarketsRequestSigner.stringToSign("POST", "/v3/orders", "1771977600000", "{\"a\":\"b\"}"));
    assertEquals(
        "GET/v3/orders1771977600000",
        BtcMarketsRequestSigner.stringToSign("GET", "/v3/orders", "1771977600000", null));
  }

  @Test
  void shouldRejectSigningWithoutCredentials() {
    BtcMarketsRequestSigner signer = new BtcMarketsRequestSigner(null, FIXED_CLOCK);

    assertFalse(signer.hasCredentials());
    BtcMarketsCredentialsException ex =
        assertThrows(
            BtcMarketsCredentialsException.class, () -> signer.sign("GET", "/v3/orders", null));
    assertEquals(BtcMarketsConnectorException.NO_HTTP_STATUS, ex.httpStatus());
    assertTrue(ex.getMessage().contains("apiKey or apiSecret not set"));
  }

  @Test
  void shouldRequireBothCredentialParts() {
    assertThrows(IllegalArgumentException.class, () -> BtcMarketsCredentials.of(API_KEY, ""));
    assertThrows(IllegalArgumentException.class, () -> BtcMarketsCredentials.of(" ", API_SECRET));
    assertThrows(
        IllegalArgumentException.class,
        () -> BtcMarketsCredentials.ofBase64Secret(API_KEY, "not base64!"));
  }

  @Test
  void shouldHideSecretInCredentialsToString() {
    BtcMarketsCredentials credentials = BtcMarketsCredentials.of(API_KEY, API_SECRET);

    assertFalse(credentials.toString().contains(API_SECRET));
    assertEquals(credentials, BtcMarketsCredentials.of(API_KEY, API_SECRET));
  }
}
