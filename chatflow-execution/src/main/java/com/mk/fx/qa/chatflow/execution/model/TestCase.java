package com.mk.fx.qa.chatflow.execution.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One validated conversational turn to replay.
 *
 * @param groupId conversation this turn belongs to
 * @param turnNumber 1-based position within the conversation
 * @param userMessage message sent to the chat API
 * @param expectedReply reference answer, informational only
 * @param extraInputs additional workflow inputs sent with the message
 * @param rowIndex 1-based position of the source row in the uploaded input
 */
public record TestCase(
    String groupId,
    int turnNumber,
    String userMessage,
    String expectedReply,
    Map<String, Object> extraInputs,
    int rowIndex) {

  public TestCase {
    extraInputs =
        extraInputs != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(extraInputs))
            : Map.of();
  }

  public String label() {
    return groupId + "#" + turnNumber;
  }
}
