package com.mk.fx.qa.chatflow.execution.runner;

import com.mk.fx.qa.chatflow.execution.model.FinalStatus;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import java.util.List;

/**
 * Records produced for one conversation, in turn order, one per turn.
 *
 * @param cancelled true if a stop request cut the conversation short
 */
public record ConversationOutcome(String groupId, List<ResultRecord> records, boolean cancelled) {

  public ConversationOutcome {
    records = List.copyOf(records);
  }

  public long count(FinalStatus status) {
    return records.stream().filter(record -> record.finalStatus() == status).count();
  }

  public boolean allSucceeded() {
    return records.stream().allMatch(ResultRecord::isSuccess);
  }
}
