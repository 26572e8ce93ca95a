package com.mk.fx.qa.chatflow.execution.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw test-case row as uploaded. Fields stay loosely typed so that a bad row is reported by the
 * grouper instead of rejecting the whole upload. Column names of spreadsheet exports are accepted
 * as aliases.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TestCaseRow {

  @JsonProperty("group_id")
  @JsonAlias({"groupId", "conversation_id", "对话ID"})
  private String groupId;

  @JsonProperty("turn_number")
  @JsonAlias({"turnNumber", "round", "轮次"})
  private String turnNumber;

  @JsonProperty("user_message")
  @JsonAlias({"userMessage", "question", "user_question", "用户问题"})
  private String userMessage;

  @JsonProperty("expected_reply")
  @JsonAlias({"expectedReply", "expected_answer", "期待回复"})
  private String expectedReply;

  /** JSON object, or a string containing one. */
  @JsonProperty("extra_inputs")
  @JsonAlias({"extraInputs", "inputs"})
  private JsonNode extraInputs;
}
