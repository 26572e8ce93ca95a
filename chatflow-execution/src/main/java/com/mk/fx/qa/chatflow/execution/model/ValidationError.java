package com.mk.fx.qa.chatflow.execution.model;

/**
 * A defect that excluded a conversation from the run.
 *
 * @param groupId offending conversation, {@code <missing>} for rows without one
 * @param rowIndex 1-based input row, null when the defect concerns the whole group
 */
public record ValidationError(String groupId, Integer rowIndex, String defect) {

  public static final String MISSING_GROUP = "<missing>";

  public static ValidationError ofGroup(String groupId, String defect) {
    return new ValidationError(groupId, null, defect);
  }

  public static ValidationError ofRow(String groupId, int rowIndex, String defect) {
    return new ValidationError(groupId, rowIndex, defect);
  }

  @Override
  public String toString() {
    return rowIndex == null
        ? groupId + ": " + defect
        : groupId + " (row " + rowIndex + "): " + defect;
  }
}
