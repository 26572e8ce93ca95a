package com.mk.fx.qa.chatflow.execution.sink;

/** Failure to write or read durable results. Fatal for the run that hit it. */
public class ResultSinkException extends RuntimeException {

  public ResultSinkException(String message, Throwable cause) {
    super(message, cause);
  }

  public ResultSinkException(String message) {
    super(message);
  }
}
