package com.mk.fx.qa.chatflow.rest;

import java.util.Arrays;

/** How the chat API delivers a reply. Sent verbatim as {@code response_mode}. */
public enum ResponseMode {
  BLOCKING("blocking"),
  STREAMING("streaming");

  private final String apiValue;

  ResponseMode(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }

  public static ResponseMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(mode -> mode.apiValue.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported response mode: " + value));
  }
}
