package com.mk.fx.qa.chatflow.execution.dto;

/** Effective chat API settings, with the key masked. */
public record ApiInfoResponse(
    String endpoint,
    String apiKey,
    long timeoutSeconds,
    String responseMode,
    String userId,
    int maxRetries,
    long retryDelaySeconds,
    String retryPolicy) {}
