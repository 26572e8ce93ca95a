package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One user message sent to the chat API.
 *
 * @param query the user message
 * @param user end-user identifier sent with every call
 * @param conversationId remote session handle, null to open a new conversation
 * @param inputs extra workflow inputs, never null
 * @param timeout per-call timeout, null for the client default
 */
public record ChatRequest(
    String query, String user, String conversationId, Map<String, Object> inputs, Duration timeout) {

  public ChatRequest {
    inputs =
        inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
  }

  /** Builds the {@code chat-messages} request body for the given delivery mode. */
  public Map<String, Object> toPayload(ResponseMode mode) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("inputs", inputs);
    payload.put("query", query);
    payload.put("response_mode", mode.apiValue());
    payload.put("user", user);
    if (conversationId != null && !conversationId.isBlank()) {
      payload.put("conversation_id", conversationId);
    }
    return payload;
  }

  Request toHttpRequest(String path, ResponseMode mode) {
    var request = new Request();
    request.setMethod(HttpMethod.POST);
    request.setPath(path);
    request.setBody(toPayload(mode));
    request.setTimeout(timeout);
    if (mode == ResponseMode.STREAMING) {
      request.setHeaders(Map.of("Accept", "text/event-stream"));
    }
    return request;
  }
}
