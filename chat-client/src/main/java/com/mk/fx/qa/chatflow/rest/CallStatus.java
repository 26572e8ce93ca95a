package com.mk.fx.qa.chatflow.rest;

public enum CallStatus {
  SUCCESS,
  RETRYABLE_FAILURE,
  FATAL_FAILURE
}
