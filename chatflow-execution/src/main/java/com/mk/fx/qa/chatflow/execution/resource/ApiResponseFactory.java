package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.cfg.ErrorResponse;
import com.mk.fx.qa.chatflow.execution.model.ControlResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, message));
  }

  public <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok(body);
  }

  /** 200 when accepted, otherwise a status matching the rejection reason. */
  public ResponseEntity<ControlResult> control(ControlResult result) {
    if (result.success()) {
      return ResponseEntity.ok(result);
    }
    var status =
        switch (result.error()) {
          case INVALID_STATE -> HttpStatus.CONFLICT;
          case NO_EXECUTABLE_CASES -> HttpStatus.BAD_REQUEST;
          case SINK_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    return ResponseEntity.status(status).body(result);
  }
}
