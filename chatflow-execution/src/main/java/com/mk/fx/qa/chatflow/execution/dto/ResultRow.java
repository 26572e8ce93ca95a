package com.mk.fx.qa.chatflow.execution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import lombok.Data;

/** Exported result row. Field names follow the result file columns. */
@Data
public class ResultRow {

  @JsonProperty("group_id")
  private String groupId;

  @JsonProperty("turn_number")
  private int turnNumber;

  @JsonProperty("user_message")
  private String userMessage;

  @JsonProperty("expected_reply")
  private String expectedReply;

  @JsonProperty("extra_inputs")
  private Map<String, Object> extraInputs;

  @JsonProperty("actual_reply")
  private String actualReply;

  @JsonProperty("latency_seconds")
  private Double latencySeconds;

  @JsonProperty("final_status")
  private String finalStatus;

  @JsonProperty("error_detail")
  private String errorDetail;

  @JsonProperty("completed_at")
  private Instant completedAt;

  @JsonProperty("session_id")
  private String sessionId;

  @JsonProperty("attempts")
  private int attempts;
}
