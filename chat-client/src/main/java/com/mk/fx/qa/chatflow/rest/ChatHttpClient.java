package com.mk.fx.qa.chatflow.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URI;
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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for the chat API. Executes JSON requests either as a single blocking exchange or as
 * a line-oriented stream, and translates transport failures into {@link ChatApiException}. This
 * implementation does not include retry logic.
 */
@Slf4j
public class ChatHttpClient {

  /** Default request timeout in seconds. */
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for all requests. */
  private final String baseUrl;

  /** Timeout applied when a request does not carry its own. */
  private final Duration requestTimeout;

  public ChatHttpClient(String baseUrl, Duration connectTimeout, Map<String, String> headers) {
    this(baseUrl, connectTimeout, Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS), headers);
  }

  /**
   * Constructs a client with a specified default request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param requestTimeout default request timeout
   * @param headers global headers to include in all requests
   */
  public ChatHttpClient(
      String baseUrl, Duration connectTimeout, Duration requestTimeout, Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
    this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "ChatHttpClient initialised - Base URL: {}, Connection timeout: {}s, Request timeout: {}s",
        this.baseUrl,
        connectTimeout.toSeconds(),
        requestTimeout.toSeconds());
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /**
   * Executes a synchronous request and returns the full response, whatever its status code.
   *
   * @param request the request to execute
   * @return the response data
   * @throws ChatApiException on timeout, connection failure or interruption
   */
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    var timeout = effectiveTimeout(request);
    var httpRequest = buildHttpRequest(request, timeout);

    log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());
    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);
    } catch (HttpTimeoutException e) {
      throw ChatApiException.timeout(timeout, e);
    } catch (IOException e) {
      throw ChatApiException.connection(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ChatApiException.interrupted();
    }
  }

  /**
   * Executes a request whose response body is consumed line by line. Non-success statuses are
   * raised before the reader sees the body. The whole exchange, body included, is bounded by the
   * request timeout.
   *
   * @param request the request to execute
   * @param bodyReader consumes the response lines and produces the result
   * @return the value produced by the reader
   * @throws ChatApiException on non-success status, timeout, connection failure or interruption
   */
  public <T> T stream(Request request, Function<Stream<String>, T> bodyReader) {
    Objects.requireNonNull(request, "Request cannot be null");
    Objects.requireNonNull(bodyReader, "Body reader cannot be null");
    var timeout = effectiveTimeout(request);
    var httpRequest = buildHttpRequest(request, timeout);

    log.debug("Streaming {} request to {}", request.getMethod(), httpRequest.uri());
    var body = new AtomicReference<InputStream>();
    var aborted = new AtomicBoolean();
    var exchange = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
    var future =
        exchange.thenApply(
            response -> {
              body.set(response.body());
              if (aborted.get()) {
                closeBody(body.get());
                throw ChatApiException.interrupted();
              }
              return readLines(response, bodyReader);
            });
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      abort(exchange, body, aborted);
      throw ChatApiException.timeout(timeout, e);
    } catch (InterruptedException e) {
      abort(exchange, body, aborted);
      Thread.currentThread().interrupt();
      throw ChatApiException.interrupted();
    } catch (ExecutionException e) {
      throw translate(e.getCause(), timeout);
    }
  }

  private static <T> T readLines(
      HttpResponse<InputStream> response, Function<Stream<String>, T> bodyReader) {
    try (var reader =
        new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
      Stream<String> lines = reader.lines();
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw ChatApiException.httpStatus(
            response.statusCode(), lines.collect(Collectors.joining("\n")));
      }
      return bodyReader.apply(lines);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Closing the body wakes a reader blocked on it and releases the connection. */
  private void abort(
      CompletableFuture<?> exchange, AtomicReference<InputStream> body, AtomicBoolean aborted) {
    aborted.set(true);
    exchange.cancel(true);
    closeBody(body.get());
  }

  private static void closeBody(InputStream body) {
    if (body == null) {
      return;
    }
    try {
      body.close();
    } catch (IOException e) {
      log.debug("Failed to close aborted response body: {}", e.getMessage());
    }
  }

  private ChatApiException translate(Throwable failure, Duration timeout) {
    var cause = failure;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof ChatApiException apiException) {
      return apiException;
    }
    if (cause instanceof HttpTimeoutException) {
      return ChatApiException.timeout(timeout, cause);
    }
    if (cause instanceof IOException || cause instanceof UncheckedIOException) {
      return ChatApiException.connection(cause);
    }
    return ChatApiException.malformed("Unexpected streaming failure: " + cause.getMessage(), cause);
  }

  private Duration effectiveTimeout(Request request) {
    return request.getTimeout() != null ? request.getTimeout() : requestTimeout;
  }

  private HttpRequest buildHttpRequest(Request request, Duration timeout) {
    var path = request.getPath() != null ? request.getPath() : "";
    var requestBuilder = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(timeout);

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
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
        throw new IllegalArgumentException(
            "Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }
    return requestBuilder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
      throw new IllegalArgumentException("Base URL must start with http:// or https://");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
