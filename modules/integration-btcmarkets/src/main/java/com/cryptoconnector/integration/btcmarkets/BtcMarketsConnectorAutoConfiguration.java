package com.cryptoconnector.integration.btcmarkets;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(BtcMarketsConnectorProperties.class)
public class BtcMarketsConnectorAutoConfiguration {
  private static final Logger log =
      LoggerFactory.getLogger(BtcMarketsConnectorAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean(name = "btcMarketsConnectorClock")
  public Clock btcMarketsConnectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(BtcMarketsTelemetry.class)
  public BtcMarketsTelemetry btcMarketsTelemetry(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    if (registry == null) {
      return new NoOpBtcMarketsTelemetry();
    }
    return new MicrometerBtcMarketsTelemetry(registry);
  }

  @Bean
  @ConditionalOnMissingBean
  public BtcMarketsApiConfig btcMarketsApiConfig(
      BtcMarketsConnectorProperties properties, Clock btcMarketsConnectorClock) {
    Duration timeout =
        properties.getTimeoutMs() > 0 ? Duration.ofMillis(properties.getTimeoutMs()) : null;
    return new BtcMarketsApiConfig(
        URI.create(properties.getBaseUrl()),
        resolveCredentials(properties),
        timeout,
        btcMarketsConnectorClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public BtcMarketsRequestSigner btcMarketsRequestSigner(BtcMarketsApiConfig btcMarketsApiConfig) {
    return new BtcMarketsRequestSigner(
        btcMarketsApiConfig.credentials(), btcMarketsApiConfig.clock());
  }

  @Bean
  @ConditionalOnMissingBean
  public BtcMarketsHttpClientFactory btcMarketsHttpClientFactory(
      BtcMarketsApiConfig btcMarketsApiConfig) {
    return new BtcMarketsHttpClientFactory(btcMarketsApiConfig.timeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public BtcMarketsRestClient btcMarketsRestClient(
      BtcMarketsHttpClientFactory btcMarketsHttpClientFactory,
      ObjectProvider<ObjectMapper> objectMapper,
      BtcMarketsApiConfig btcMarketsApiConfig,
      BtcMarketsRequestSigner btcMarketsRequestSigner,
      BtcMarketsTelemetry btcMarketsTelemetry) {
    return new HttpBtcMarketsRestClient(
        btcMarketsHttpClientFactory,
        objectMapper.getIfAvailable(ObjectMapper::new),
        btcMarketsApiConfig,
        btcMarketsRequestSigner,
        btcMarketsTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  public BtcMarketsGateway btcMarketsGateway(BtcMarketsRestClient btcMarketsRestClient) {
    return new BtcMarketsRestGateway(btcMarketsRestClient);
  }

  static BtcMarketsCredentials resolveCredentials(BtcMarketsConnectorProperties properties) {
    String apiKey =
        resolveOptionalSecret(
            properties.getApiKey(),
            properties.getApiKeyFile(),
            "connector.btcmarkets.api-key-file");
    String apiSecret =
        resolveOptionalSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "connector.btcmarkets.api-secret-file");
    boolean hasKey = apiKey != null && !apiKey.isBlank();
    boolean hasSecret = apiSecret != null && !apiSecret.isBlank();
    if (!hasKey && !hasSecret) {
      return null;
    }
    if (!hasKey || !hasSecret) {
      log.warn(
          "BTC Markets connector has only one of api-key and api-secret; private calls will fail");
      return null;
    }
    if (properties.getSecretEncoding() == BtcMarketsConnectorProperties.SecretEncoding.BASE64) {
      return BtcMarketsCredentials.ofBase64Secret(apiKey, apiSecret);
    }
    return BtcMarketsCredentials.of(apiKey, apiSecret);
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}
