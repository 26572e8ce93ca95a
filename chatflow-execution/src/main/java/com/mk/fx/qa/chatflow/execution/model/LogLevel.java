package com.mk.fx.qa.chatflow.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LogLevel {
  INFO,
  SUCCESS,
  WARNING,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
