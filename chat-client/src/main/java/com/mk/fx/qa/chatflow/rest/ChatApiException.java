package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;

/**
 * Failure of a single call to the chat API. The {@link Kind} decides whether the call may be
 * retried under a classified retry policy.
 */
public class ChatApiException extends RuntimeException {

  private static final int MAX_BODY_PREVIEW = 200;

  public enum Kind {
    TIMEOUT(true),
    CONNECTION(true),
    SERVER_ERROR(true),
    RATE_LIMITED(true),
    MALFORMED_RESPONSE(true),
    STREAM_ERROR(true),
    CLIENT_ERROR(false),
    AUTHENTICATION(false),
    INTERRUPTED(false);

    private final boolean retryable;

    Kind(boolean retryable) {
      this.retryable = retryable;
    }

    public boolean isRetryable() {
      return retryable;
    }
  }

  private final Kind kind;
  private final Integer statusCode;

  public ChatApiException(Kind kind, Integer statusCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public ChatApiException(Kind kind, String message) {
    this(kind, null, message, null);
  }

  public static ChatApiException timeout(Duration timeout, Throwable cause) {
    return new ChatApiException(
        Kind.TIMEOUT, null, "Request timed out after " + format(timeout), cause);
  }

  public static ChatApiException connection(Throwable cause) {
    return new ChatApiException(
        Kind.CONNECTION, null, "Connection to chat API failed: " + describe(cause), cause);
  }

  public static ChatApiException interrupted() {
    return new ChatApiException(Kind.INTERRUPTED, "Call interrupted");
  }

  public static ChatApiException malformed(String message, Throwable cause) {
    return new ChatApiException(Kind.MALFORMED_RESPONSE, null, message, cause);
  }

  public static ChatApiException streamError(String message) {
    return new ChatApiException(Kind.STREAM_ERROR, "Streaming response error: " + message);
  }

  /** Maps a non-success HTTP status to the matching failure kind. */
  public static ChatApiException httpStatus(int statusCode, String detail) {
    Kind kind;
    if (statusCode == 429) {
      kind = Kind.RATE_LIMITED;
    } else if (statusCode == 401 || statusCode == 403) {
      kind = Kind.AUTHENTICATION;
    } else if (statusCode >= 500) {
      kind = Kind.SERVER_ERROR;
    } else {
      kind = Kind.CLIENT_ERROR;
    }
    var message = "HTTP " + statusCode;
    if (detail != null && !detail.isBlank()) {
      message += ": " + preview(detail);
    }
    return new ChatApiException(kind, statusCode, message, null);
  }

  public Kind getKind() {
    return kind;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  private static String format(Duration duration) {
    return duration.compareTo(Duration.ofSeconds(1)) < 0
        ? duration.toMillis() + "ms"
        : duration.toSeconds() + "s";
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown cause";
    }
    var message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  private static String preview(String text) {
    var trimmed = text.strip();
    return trimmed.length() > MAX_BODY_PREVIEW
        ? trimmed.substring(0, MAX_BODY_PREVIEW) + "..."
        : trimmed;
  }
}
