package com.mk.fx.qa.chatflow.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers a reply as a server-sent event stream ({@code response_mode=streaming}). Answer chunks
 * from {@code message} events are concatenated until {@code message_end}; an {@code error} event
 * fails the call.
 */
@Slf4j
public class StreamingDelivery implements ResponseDelivery {

  private static final String DATA_PREFIX = "data:";

  private final ChatHttpClient client;

  public StreamingDelivery(ChatHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public ResponseMode mode() {
    return ResponseMode.STREAMING;
  }

  @Override
  public ChatReply deliver(ChatRequest request) {
    var startTime = System.nanoTime();
    var assembled = client.stream(request.toHttpRequest(CHAT_MESSAGES_PATH, mode()), this::assemble);
    var latency = Duration.ofNanos(System.nanoTime() - startTime);
    return new ChatReply(
        assembled.answer.toString().strip(), assembled.conversationId, assembled.messageId, latency);
  }

  private Assembly assemble(Stream<String> lines) {
    var assembly = new Assembly();
    Iterator<String> iterator = lines.iterator();
    while (iterator.hasNext()) {
      var line = iterator.next();
      if (line == null || !line.startsWith(DATA_PREFIX)) {
        continue;
      }
      var json = line.substring(DATA_PREFIX.length()).strip();
      if (json.isEmpty()) {
        continue;
      }
      if (assembly.accept(json)) {
        return assembly;
      }
    }
    if (!assembly.ended) {
      log.debug("Stream closed without message_end event");
    }
    return assembly;
  }

  private static final class Assembly {
    private final StringBuilder answer = new StringBuilder();
    private String conversationId;
    private String messageId;
    private boolean ended;

    /** Applies one event; returns true once the terminal event has been seen. */
    boolean accept(String json) {
      JsonNode event;
      try {
        event = JsonUtil.readTree(json);
      } catch (JsonProcessingException e) {
        log.warn("Skipping unparseable stream line: {} ({})", json, e.getOriginalMessage());
        return false;
      }
      var type = event.path("event").asText("");
      switch (type) {
        case "message" -> {
          answer.append(event.path("answer").asText(""));
          captureIds(event, "message_id");
          return false;
        }
        case "message_end" -> {
          captureIds(event, "id");
          ended = true;
          return true;
        }
        case "error" -> {
          var message = BlockingDelivery.text(event, "message");
          throw ChatApiException.streamError(message != null ? message : "unknown error");
        }
        default -> {
          return false;
        }
      }
    }

    private void captureIds(JsonNode event, String messageIdField) {
      if (conversationId == null) {
        conversationId = BlockingDelivery.text(event, "conversation_id");
      }
      if (messageId == null) {
        messageId = BlockingDelivery.text(event, messageIdField);
      }
    }
  }
}
