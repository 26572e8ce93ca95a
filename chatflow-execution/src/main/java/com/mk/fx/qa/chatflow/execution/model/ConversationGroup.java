package com.mk.fx.qa.chatflow.execution.model;

import java.util.List;
import java.util.Objects;

/** The turns of one conversation, ordered by turn number and numbered 1..N without gaps. */
public class ConversationGroup {

  private final String groupId;
  private final List<TestCase> turns;

  public ConversationGroup(String groupId, List<TestCase> turns) {
    this.groupId = Objects.requireNonNull(groupId, "groupId");
    if (turns == null || turns.isEmpty()) {
      throw new IllegalArgumentException("Conversation " + groupId + " has no turns");
    }
    for (int i = 0; i < turns.size(); i++) {
      if (turns.get(i).turnNumber() != i + 1) {
        throw new IllegalArgumentException(
            "Conversation " + groupId + " is not numbered contiguously from 1");
      }
    }
    this.turns = List.copyOf(turns);
  }

  public String getGroupId() {
    return groupId;
  }

  public List<TestCase> getTurns() {
    return turns;
  }

  public int size() {
    return turns.size();
  }
}
