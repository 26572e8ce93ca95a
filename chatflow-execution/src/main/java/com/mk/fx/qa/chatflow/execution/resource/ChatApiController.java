package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.dto.ApiInfoResponse;
import com.mk.fx.qa.chatflow.execution.dto.ConnectionTestResponse;
import com.mk.fx.qa.chatflow.execution.service.ChatConnectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Chat API", description = "Connectivity check and settings of the target chat API")
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatApiController {

  private final ChatConnectionService connectionService;

  @Operation(
      summary = "Test connection",
      description = "Sends a single test message to the chat API, without retries.")
  @PostMapping("/connection-test")
  public ResponseEntity<ConnectionTestResponse> testConnection() {
    return ResponseEntity.ok(connectionService.testConnection());
  }

  @Operation(summary = "API settings", description = "Returns the effective chat API settings.")
  @GetMapping("/info")
  public ResponseEntity<ApiInfoResponse> info() {
    return ResponseEntity.ok(connectionService.info());
  }
}
