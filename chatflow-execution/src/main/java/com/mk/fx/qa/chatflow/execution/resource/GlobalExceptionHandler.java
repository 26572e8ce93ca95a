package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.cfg.ErrorResponse;
import com.mk.fx.qa.chatflow.execution.sink.ResultSinkException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    log.warn("Constraint violation: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Parameter", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid Request Body", ex.getMostSpecificCause().getMessage()));
  }

  @ExceptionHandler(ResultSinkException.class)
  public ResponseEntity<ErrorResponse> handleResultSink(ResultSinkException ex) {
    log.error("Result storage error", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Result Storage Error", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
