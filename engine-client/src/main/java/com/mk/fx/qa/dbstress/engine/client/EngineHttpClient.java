package com.mk.fx.qa.dbstress.engine.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for the remote execution engine. Sends JSON bodies, honours a per-request timeout
 * override and reports transport failures as {@link EngineCallException}. Non-2xx replies are
 * returned as-is; interpreting them is up to the caller. This client does not retry.
 */
@Slf4j
public class EngineHttpClient {

  /** Default request timeout in seconds. */
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  private final HttpClient httpClient;
  private final Map<String, String> headers;
  private final String baseUrl;
  private final Duration requestTimeout;

  public EngineHttpClient(String baseUrl, int connTimeOutSeconds) {
    this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, Map.of());
  }

  /**
   * Constructs a client with a specified default request timeout.
   *
   * @param baseUrl the engine base URL
   * @param connTimeOutSeconds connection timeout in seconds
   * @param requestTimeoutSeconds request timeout used when a request carries none
   * @param headers headers sent with every request
   */
  public EngineHttpClient(
      String baseUrl, int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connTimeOutSeconds)).build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "EngineHttpClient initialised - Base URL: {}, Connection timeout: {}s, Request timeout: {}s",
        this.baseUrl,
        connTimeOutSeconds,
        requestTimeoutSeconds);
  }

  /**
   * Executes a request and waits for the reply.
   *
   * @throws EngineCallException if the request cannot be sent or times out
   */
  public EngineResponse execute(EngineRequest request) {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);
    var timeout = effectiveTimeout(request);
    try {
      var startTime = System.nanoTime();
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponse(response, duration);
    } catch (HttpTimeoutException e) {
      log.error("Request to {} timed out after {}", httpRequest.uri(), timeout);
      throw new EngineCallException(
          "Request timed out after " + timeout.toMillis() + "ms: " + e.getMessage(), e, true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineCallException("Interrupted while calling engine", e);
    } catch (Exception e) {
      log.error("Error executing request to {}: {}", httpRequest.uri(), e.getMessage());
      throw new EngineCallException("Error executing request: " + e.getMessage(), e);
    }
  }

  /**
   * Executes a request asynchronously. The returned future completes exceptionally with an
   * {@link EngineCallException} on transport failure.
   */
  public CompletableFuture<EngineResponse> executeAsync(EngineRequest request) {
    Objects.requireNonNull(request, "Request cannot be null");
    var startTime = System.nanoTime();
    HttpRequest httpRequest;
    try {
      httpRequest = buildHttpRequest(request);
    } catch (EngineCallException e) {
      return CompletableFuture.failedFuture(e);
    }

    log.debug("Executing async {} request to {}", request.getMethod(), httpRequest.uri());
    return httpClient
        .sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
        .handle(
            (response, throwable) -> {
              if (throwable != null) {
                var cause =
                    throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause()
                        : throwable;
                throw new EngineCallException(
                    "Async request failed: " + cause.getMessage(),
                    cause,
                    cause instanceof HttpTimeoutException);
              }
              var duration = (System.nanoTime() - startTime) / 1_000_000;
              log.debug(
                  "Async request completed in {} ms with status {}", duration, response.statusCode());
              return buildResponse(response, duration);
            });
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  private Duration effectiveTimeout(EngineRequest request) {
    return request.getTimeout() != null ? request.getTimeout() : requestTimeout;
  }

  private HttpRequest buildHttpRequest(EngineRequest request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    var url = baseUrl + (request.getPath() != null ? request.getPath() : "");
    if (request.getQuery() != null && !request.getQuery().isEmpty()) {
      url += "?" + buildQueryString(request.getQuery());
    }

    var requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(effectiveTimeout(request));
    headers.forEach(requestBuilder::header);

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .header("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new EngineCallException("Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }
    return requestBuilder.build();
  }

  private EngineResponse buildResponse(HttpResponse<String> response, long durationMs) {
    var result = new EngineResponse();
    result.setStatusCode(response.statusCode());
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String buildQueryString(Map<String, String> query) {
    return query.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
