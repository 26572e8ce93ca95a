package com.mk.fx.qa.chatflow.execution.model;

import java.time.Instant;

/** One line of the user-facing run log. */
public record LogEntry(Instant timestamp, LogLevel level, String message) {}
