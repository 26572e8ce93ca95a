package com.mk.fx.qa.chatflow.execution.resource;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mk.fx.qa.chatflow.execution.model.ControlError;
import com.mk.fx.qa.chatflow.execution.model.ControlResult;
import com.mk.fx.qa.chatflow.execution.model.ExecutionPhase;
import com.mk.fx.qa.chatflow.execution.model.ExecutionStatus;
import com.mk.fx.qa.chatflow.execution.model.LogEntry;
import com.mk.fx.qa.chatflow.execution.model.LogLevel;
import com.mk.fx.qa.chatflow.execution.service.ChatflowExecutionService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ExecutionController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class})
@DisplayName("ExecutionController Tests")
class ExecutionControllerTest {

  @Autowired MockMvc mockMvc;

  @MockBean ChatflowExecutionService executionService;

  @Nested
  @DisplayName("Run control")
  class RunControl {

    @Test
    void acceptedStartReturnsOk() throws Exception {
      when(executionService.start())
          .thenReturn(ControlResult.accepted(ExecutionPhase.RUNNING, "Run run-1 started"));

      mockMvc
          .perform(post("/api/execution/start"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success", is(true)))
          .andExpect(jsonPath("$.phase", is("running")))
          .andExpect(jsonPath("$.message", is("Run run-1 started")));
    }

    @Test
    void wrongPhaseIsConflict() throws Exception {
      when(executionService.pause())
          .thenReturn(
              ControlResult.rejected(
                  ExecutionPhase.IDLE, ControlError.INVALID_STATE, "Cannot pause while idle"));

      mockMvc
          .perform(post("/api/execution/pause"))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.success", is(false)))
          .andExpect(jsonPath("$.error", is("INVALID_STATE")))
          .andExpect(jsonPath("$.phase", is("idle")));
    }

    @Test
    void nothingToRunIsBadRequest() throws Exception {
      when(executionService.restart())
          .thenReturn(
              ControlResult.rejected(
                  ExecutionPhase.IDLE,
                  ControlError.NO_EXECUTABLE_CASES,
                  "No test cases uploaded"));

      mockMvc.perform(post("/api/execution/restart")).andExpect(status().isBadRequest());
    }

    @Test
    void unavailableStorageIsServiceUnavailable() throws Exception {
      when(executionService.start())
          .thenReturn(
              ControlResult.rejected(
                  ExecutionPhase.IDLE, ControlError.SINK_UNAVAILABLE, "read-only"));

      mockMvc.perform(post("/api/execution/start")).andExpect(status().isServiceUnavailable());
    }

    @Test
    void stopResumeAndResetDelegateToTheService() throws Exception {
      when(executionService.stop())
          .thenReturn(ControlResult.accepted(ExecutionPhase.STOPPING, "Stop requested"));
      when(executionService.resume())
          .thenReturn(ControlResult.accepted(ExecutionPhase.RUNNING, "Run resumed"));
      when(executionService.reset())
          .thenReturn(ControlResult.accepted(ExecutionPhase.IDLE, "Execution state reset"));

      mockMvc
          .perform(post("/api/execution/stop"))
          .andExpect(jsonPath("$.phase", is("stopping")));
      mockMvc.perform(post("/api/execution/resume")).andExpect(status().isOk());
      mockMvc.perform(post("/api/execution/reset")).andExpect(jsonPath("$.phase", is("idle")));

      verify(executionService).stop();
      verify(executionService).resume();
      verify(executionService).reset();
    }
  }

  @Nested
  @DisplayName("Status and logs")
  class StatusAndLogs {

    @Test
    void statusIsSerialisedWithLowercasePhase() throws Exception {
      when(executionService.getStatus()).thenReturn(ExecutionStatus.idle());

      mockMvc
          .perform(get("/api/execution/status"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.phase", is("idle")))
          .andExpect(jsonPath("$.progress.total", is(0)))
          .andExpect(jsonPath("$.statistics.successRate", is(0.0)));
    }

    @Test
    void logsAreLimited() throws Exception {
      when(executionService.getLogs(1))
          .thenReturn(
              List.of(
                  new LogEntry(Instant.parse("2026-01-01T00:00:00Z"), LogLevel.SUCCESS, "done")));

      mockMvc
          .perform(get("/api/execution/logs").param("limit", "1"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$", hasSize(1)))
          .andExpect(jsonPath("$[0].level", is("success")))
          .andExpect(jsonPath("$[0].timestamp", is("2026-01-01T00:00:00Z")));
    }

    @Test
    void negativeLogLimitIsRejected() throws Exception {
      mockMvc
          .perform(get("/api/execution/logs").param("limit", "-1"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error", is("Invalid Parameter")));
    }

    @Test
    void healthReflectsTheService() throws Exception {
      when(executionService.isHealthy()).thenReturn(false);

      mockMvc
          .perform(get("/api/execution/healthy"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status", is("DOWN")));
    }

    @Test
    void unexpectedErrorsAreMappedToServerError() throws Exception {
      when(executionService.getRunHistory()).thenThrow(new IllegalStateException("broken"));

      mockMvc
          .perform(get("/api/execution/history"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.details", is("broken")));
    }
  }
}
