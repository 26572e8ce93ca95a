package com.mk.fx.qa.chatflow.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Delivers a reply as one JSON document ({@code response_mode=blocking}). */
@Slf4j
public class BlockingDelivery implements ResponseDelivery {

  private static final List<String> FALLBACK_ANSWER_FIELDS =
      List.of("message", "content", "text", "response");

  private final ChatHttpClient client;

  public BlockingDelivery(ChatHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public ResponseMode mode() {
    return ResponseMode.BLOCKING;
  }

  @Override
  public ChatReply deliver(ChatRequest request) {
    var response = client.execute(request.toHttpRequest(CHAT_MESSAGES_PATH, mode()));
    if (response.getStatusCode() != 200) {
      throw ChatApiException.httpStatus(response.getStatusCode(), errorDetail(response.getBody()));
    }

    JsonNode body;
    try {
      body = JsonUtil.readTree(response.getBody());
    } catch (JsonProcessingException e) {
      throw ChatApiException.malformed("Response is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (body == null || !body.isObject()) {
      throw ChatApiException.malformed("Response is not a JSON object", null);
    }
    if (body.hasNonNull("error")) {
      throw new ChatApiException(
          ChatApiException.Kind.SERVER_ERROR, "API returned error: " + text(body, "message"));
    }
    if (!body.has("answer") || !body.has("conversation_id")) {
      log.warn("Response is missing answer or conversation_id: {}", body.fieldNames());
    }

    var messageId = text(body, "message_id");
    return new ChatReply(
        extractAnswer(body),
        text(body, "conversation_id"),
        messageId != null ? messageId : text(body, "id"),
        Duration.ofMillis(response.getResponseTimeMs()));
  }

  private String extractAnswer(JsonNode body) {
    if (body.has("answer")) {
      return body.path("answer").asText("").strip();
    }
    for (String field : FALLBACK_ANSWER_FIELDS) {
      var value = text(body, field);
      if (value != null && !value.isBlank()) {
        log.warn("Answer taken from '{}' instead of 'answer'", field);
        return value.strip();
      }
    }
    log.warn("No answer content found in response");
    return "";
  }

  private String errorDetail(String responseBody) {
    if (responseBody == null || responseBody.isBlank()) {
      return null;
    }
    try {
      var node = JsonUtil.readTree(responseBody);
      var message = node != null ? text(node, "message") : null;
      return message != null ? message : responseBody;
    } catch (JsonProcessingException e) {
      return responseBody;
    }
  }

  static String text(JsonNode node, String field) {
    var value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
