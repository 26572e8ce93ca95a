package com.mk.fx.qa.chatflow.execution.dto;

/**
 * Outcome of a single test message sent to the chat API.
 *
 * @param latencySeconds round-trip time of the test message, null when it failed before a reply
 */
public record ConnectionTestResponse(
    boolean success, String message, Double latencySeconds, String reply) {}
