package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.dto.HealthResponse;
import com.mk.fx.qa.chatflow.execution.model.ControlResult;
import com.mk.fx.qa.chatflow.execution.model.ExecutionStatus;
import com.mk.fx.qa.chatflow.execution.model.LogEntry;
import com.mk.fx.qa.chatflow.execution.model.RunSummary;
import com.mk.fx.qa.chatflow.execution.service.ChatflowExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Execution", description = "Endpoints for controlling and monitoring test runs")
@RestController
@RequestMapping("/api/execution")
@Validated
@RequiredArgsConstructor
public class ExecutionController {

  private final ChatflowExecutionService executionService;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run control
  // -----------------------------------------------------
  @Operation(
      summary = "Start a run",
      description = "Validates the uploaded test cases and starts executing them.")
  @PostMapping("/start")
  public ResponseEntity<ControlResult> start() {
    return control("start", executionService.start());
  }

  @Operation(
      summary = "Pause the run",
      description = "Pauses after the conversation in progress has finished.")
  @PostMapping("/pause")
  public ResponseEntity<ControlResult> pause() {
    return control("pause", executionService.pause());
  }

  @Operation(summary = "Resume the run", description = "Resumes a paused run.")
  @PostMapping("/resume")
  public ResponseEntity<ControlResult> resume() {
    return control("resume", executionService.resume());
  }

  @Operation(
      summary = "Stop the run",
      description = "Stops at the next turn boundary; unsent turns are recorded as cancelled.")
  @PostMapping("/stop")
  public ResponseEntity<ControlResult> stop() {
    return control("stop", executionService.stop());
  }

  @Operation(summary = "Restart", description = "Discards a finished run and starts a new one.")
  @PostMapping("/restart")
  public ResponseEntity<ControlResult> restart() {
    return control("restart", executionService.restart());
  }

  @Operation(summary = "Reset", description = "Discards a finished run and returns to idle.")
  @PostMapping("/reset")
  public ResponseEntity<ControlResult> reset() {
    return control("reset", executionService.reset());
  }

  // -----------------------------------------------------
  // Status, logs and history
  // -----------------------------------------------------
  @Operation(summary = "Run status", description = "Returns the current execution status.")
  @GetMapping("/status")
  public ResponseEntity<ExecutionStatus> status() {
    return ResponseEntity.ok(executionService.getStatus());
  }

  @Operation(summary = "Recent log", description = "Returns the most recent run log entries.")
  @GetMapping("/logs")
  public ResponseEntity<List<LogEntry>> logs(
      @RequestParam(defaultValue = "0") @Min(0) int limit) {
    return ResponseEntity.ok(executionService.getLogs(limit));
  }

  @Operation(summary = "Full log", description = "Returns every log entry of the current run.")
  @GetMapping("/logs/full")
  public ResponseEntity<List<LogEntry>> fullLog() {
    return ResponseEntity.ok(executionService.getFullLog());
  }

  @Operation(summary = "Run history", description = "Returns summaries of recently finished runs.")
  @GetMapping("/history")
  public ResponseEntity<List<RunSummary>> history() {
    return ResponseEntity.ok(executionService.getRunHistory());
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = executionService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }

  private ResponseEntity<ControlResult> control(String operation, ControlResult result) {
    if (result.success()) {
      log.info("{} accepted -> {}", operation, result.phase());
    } else {
      log.info("{} rejected ({}): {}", operation, result.error(), result.message());
    }
    return responseFactory.control(result);
  }
}
