package com.mk.fx.qa.chatflow.execution.model;

import java.util.Arrays;

/** Which result records an export returns. */
public enum ExportScope {
  ALL,
  SUCCESS,
  /** Every record that is not a success, skipped and cancelled turns included. */
  FAILED;

  public boolean includes(ResultRecord record) {
    return switch (this) {
      case ALL -> true;
      case SUCCESS -> record.isSuccess();
      case FAILED -> !record.isSuccess();
    };
  }

  public static ExportScope fromValue(String value) {
    if (value == null || value.isBlank()) {
      return ALL;
    }
    return Arrays.stream(values())
        .filter(scope -> scope.name().equalsIgnoreCase(value.strip()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported export scope: " + value + ". Allowed: " + Arrays.toString(values())));
  }
}
