package com.mk.fx.qa.chatflow.execution.dto;

/** Response object for health check endpoint. Contains the status of the service. */
public record HealthResponse(String status) {}
