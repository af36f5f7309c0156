package com.mk.fx.qa.stress.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Synchronous JSON-over-HTTP client bound to a single base URL. Request bodies are serialised with
 * {@link JsonUtil}. Nothing is retried; callers decide what a failed delivery means.
 */
@Slf4j
public class JsonHttpClient implements AutoCloseable {

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Headers sent with every request. */
  private final Map<String, String> headers;

  /** Base URL for all requests, without a trailing slash. */
  private final String baseUrl;

  /** Timeout applied to each request. */
  private final Duration requestTimeout;

  /**
   * Constructs a client for the given base URL.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param requestTimeout per-request timeout
   * @param headers headers to include in all requests, may be {@code null}
   */
  public JsonHttpClient(
      String baseUrl,
      Duration connectTimeout,
      Duration requestTimeout,
      Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
            .build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "JsonHttpClient initialised - Base URL: {}, connect timeout: {}ms, request timeout: {}ms",
        this.baseUrl,
        connectTimeout.toMillis(),
        requestTimeout.toMillis());
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Executes a request and waits for the response.
   *
   * @param request the request to execute
   * @return the response data, whatever its status code
   * @throws RestClientException if the request cannot be built, sent or times out
   */
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);

    try {
      var startTime = System.nanoTime();
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;

      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);

    } catch (HttpTimeoutException e) {
      throw new RestClientException(
          "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RestClientException("Request interrupted: " + httpRequest.uri(), e);
    } catch (Exception e) {
      throw new RestClientException("Error executing request: " + e.getMessage(), e);
    }
  }

  /** Posts {@code body} as JSON to {@code path}. */
  public RestResponseData postJson(String path, Object body) {
    return execute(Request.post(path, body));
  }

  private HttpRequest buildHttpRequest(Request request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    var path = request.getPath() != null ? request.getPath() : "";
    var requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(requestTimeout);

    headers.forEach(requestBuilder::header);
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .setHeader("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new RestClientException("Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }
    return requestBuilder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  /**
   * Validates and normalizes the base URL.
   *
   * @throws IllegalArgumentException if the base URL is empty
   */
  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  @Override
  public void close() {
    // java.net.http.HttpClient has no close() before JDK 21; connections are released on GC.
  }
}
