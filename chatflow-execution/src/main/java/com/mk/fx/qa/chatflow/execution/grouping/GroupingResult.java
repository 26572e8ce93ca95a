package com.mk.fx.qa.chatflow.execution.grouping;

import com.mk.fx.qa.chatflow.execution.model.ConversationGroup;
import com.mk.fx.qa.chatflow.execution.model.ValidationError;
import java.util.List;

/**
 * Valid conversations in first-seen order, plus the defects that excluded the others.
 */
public record GroupingResult(List<ConversationGroup> groups, List<ValidationError> validationErrors) {

  public GroupingResult {
    groups = List.copyOf(groups);
    validationErrors = List.copyOf(validationErrors);
  }

  public int totalTurns() {
    return groups.stream().mapToInt(ConversationGroup::size).sum();
  }

  public boolean hasExecutableGroups() {
    return !groups.isEmpty();
  }
}
