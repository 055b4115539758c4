package com.cryptoconnector.integration.btcmarkets;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.btcmarkets")
public class BtcMarketsConnectorProperties {
  private String baseUrl = BtcMarketsApiConfig.DEFAULT_BASE_URI.toString();
  private String apiKey = "";
  private String apiSecret = "";
  private String apiKeyFile = "";
  private String apiSecretFile = "";
  private SecretEncoding secretEncoding = SecretEncoding.RAW;
  private long timeoutMs = 0L;

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getApiSecret() {
    return apiSecret;
  }

  public void setApiSecret(String apiSecret) {
    this.apiSecret = apiSecret;
  }

  public String getApiKeyFile() {
    return apiKeyFile;
  }

  public void setApiKeyFile(String apiKeyFile) {
    this.apiKeyFile = apiKeyFile;
  }

  public String getApiSecretFile() {
    return apiSecretFile;
  }

  public void setApiSecretFile(String apiSecretFile) {
    this.apiSecretFile = apiSecretFile;
  }

  public SecretEncoding getSecretEncoding() {
    return secretEncoding;
  }

  public void setSecretEncoding(SecretEncoding secretEncoding) {
    this.secretEncoding = secretEncoding;
  }

  /** Per-request timeout; {@code 0} or less sends requests without one. */
  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public enum SecretEncoding {
    /** The UTF-8 bytes of the configured secret are the HMAC key. */
    RAW,
    /** The configured secret is base64 text and is decoded into the HMAC key. */
    BASE64
  }
}
