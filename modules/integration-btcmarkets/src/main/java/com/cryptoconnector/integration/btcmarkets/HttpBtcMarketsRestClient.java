package com.cryptoconnector.integration.btcmarkets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpBtcMarketsRestClient implements BtcMarketsRestClient {
  private static final Logger log = LoggerFactory.getLogger(HttpBtcMarketsRestClient.class);

  static final String API_KEY_HEADER = "BM-AUTH-APIKEY";
  static final String TIMESTAMP_HEADER = "BM-AUTH-TIMESTAMP";
  static final String SIGNATURE_HEADER = "BM-AUTH-SIGNATURE";
  private static final int SUCCESS_STATUS = 200;

  private final Supplier<HttpClient> httpClientFactory;
  private final ObjectMapper objectMapper;
  private final BtcMarketsApiConfig config;
  private final BtcMarketsRequestSigner signer;
  private final BtcMarketsTelemetry telemetry;

  public HttpBtcMarketsRestClient(ObjectMapper objectMapper, BtcMarketsApiConfig config) {
    this(
        new BtcMarketsHttpClientFactory(config.timeout()),
        objectMapper,
        config,
        new BtcMarketsRequestSigner(config.credentials(), config.clock()),
        new NoOpBtcMarketsTelemetry());
  }

  /**
   * {@code httpClientFactory} is asked for a client on every call; the client is used for that
   * single exchange and then dropped.
   */
  public HttpBtcMarketsRestClient(
      Supplier<HttpClient> httpClientFactory,
      ObjectMapper objectMapper,
      BtcMarketsApiConfig config,
      BtcMarketsRequestSigner signer,
      BtcMarketsTelemetry telemetry) {
    this.httpClientFactory =
        Objects.requireNonNull(httpClientFactory, "httpClientFactory is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.signer = Objects.requireNonNull(signer, "signer is required");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry is required");
  }

  @Override
  public JsonNode executePublic(BtcMarketsRequest request) {
    String body = serializeBody(request);
    HttpRequest httpRequest = newRequest(request, body).build();
    return execute(httpRequest, request);
  }

  @Override
  public JsonNode executePrivate(BtcMarketsRequest request) {
    String body = serializeBody(request);
    BtcMarketsRequestSigner.SignedRequest signed =
        signer.sign(request.method(), request.path(), body);

    HttpRequest httpRequest =
        newRequest(request, body)
            .header(API_KEY_HEADER, signed.apiKey())
            .header(TIMESTAMP_HEADER, signed.timestamp())
            .header(SIGNATURE_HEADER, signed.signature())
            .build();
    return execute(httpRequest, request);
  }

  private HttpRequest.Builder newRequest(BtcMarketsRequest request, String body) {
    HttpRequest.BodyPublisher publisher =
        body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(resolve(request))
            .header("Accept", "application/json")
            .header("Accept-Charset", "UTF-8")
            .header("Content-Type", "application/json")
            .method(request.method(), publisher);
    config.optionalTimeout().ifPresent(builder::timeout);
    return builder;
  }

  private JsonNode execute(HttpRequest httpRequest, BtcMarketsRequest request) {
    String operation = request.operation();
    log.debug(
        "Sending BTC Markets request operation={} method={} path={}",
        operation,
        request.method(),
        request.path());

    long startedAt = System.nanoTime();
    HttpResponse<String> response;
    try {
      HttpClient httpClient =
          Objects.requireNonNull(httpClientFactory.get(), "httpClientFactory returned null");
      response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      telemetry.onFailure(operation, ex);
      throw new BtcMarketsConnectorException(
          "BTC Markets " + operation + " request was interrupted",
          BtcMarketsConnectorException.NO_HTTP_STATUS,
          null,
          ex);
    } catch (IOException ex) {
      telemetry.onFailure(operation, ex);
      throw new BtcMarketsConnectorException(
          "Failed to call BTC Markets " + operation + " endpoint",
          BtcMarketsConnectorException.NO_HTTP_STATUS,
          null,
          ex);
    }
    long elapsed = System.nanoTime() - startedAt;

    if (response.statusCode() == SUCCESS_STATUS) {
      JsonNode result;
      try {
        result = parseJson(response.body());
      } catch (IllegalStateException ex) {
        telemetry.onFailure(operation, ex);
        throw ex;
      }
      telemetry.onResponse(operation, response.statusCode(), elapsed);
      return result;
    }
    telemetry.onResponse(operation, response.statusCode(), elapsed);
    BtcMarketsApiException failure = parseFailure(response.statusCode(), response.body());
    log.warn(
        "BTC Markets {} failed status={} code={}",
        operation,
        failure.statusCode(),
        failure.errorCode());
    throw failure;
  }

  private BtcMarketsApiException parseFailure(int statusCode, String responseBody) {
    JsonNode node;
    try {
      node = objectMapper.readTree(responseBody == null ? "" : responseBody);
    } catch (IOException ex) {
      return new BtcMarketsApiException(statusCode, responseBody, ex);
    }
    if (node != null && node.hasNonNull("code") && node.hasNonNull("message")) {
      return new BtcMarketsApiException(
          statusCode, node.get("code").asText(), node.get("message").asText(), responseBody);
    }
    return new BtcMarketsApiException(statusCode, null, null, responseBody);
  }

  private JsonNode parseJson(String responseBody) {
    if (responseBody == null || responseBody.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw new IllegalStateException(
          "Failed to parse BTC Markets response JSON: " + responseBody, ex);
    }
  }

  private String serializeBody(BtcMarketsRequest request) {
    if (!request.hasBody()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(request.body());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize BTC Markets request body", ex);
    }
  }

  URI resolve(BtcMarketsRequest request) {
    String target = request.path();
    if (request.hasQuery()) {
      target = target + "?" + toQueryString(request.queryParams());
    }
    return config.baseUri().resolve(target);
  }

  private static String toQueryString(Map<String, String> queryParams) {
    StringBuilder query = new StringBuilder();
    boolean first = true;
    for (Map.Entry<String, String> entry : queryParams.entrySet()) {
      if (!first) {
        query.append('&');
      }
      query.append(urlEncode(entry.getKey())).append('=').append(urlEncode(entry.getValue()));
      first = false;
    }
    return query.toString();
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
