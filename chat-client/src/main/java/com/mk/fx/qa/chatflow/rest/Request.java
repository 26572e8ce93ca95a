package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;
import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Object body;

  /** Per-call timeout; the client default applies when null. */
  private Duration timeout;
}
