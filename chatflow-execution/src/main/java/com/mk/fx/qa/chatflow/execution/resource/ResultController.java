package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.dto.ResultRow;
import com.mk.fx.qa.chatflow.execution.model.ExportScope;
import com.mk.fx.qa.chatflow.execution.service.ChatflowExecutionService;
import com.mk.fx.qa.chatflow.execution.sink.ResultSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Results", description = "Endpoints for exporting stored run results")
@RestController
@RequestMapping("/api/results")
@RequiredArgsConstructor
public class ResultController {

  private final ResultSink resultSink;
  private final ChatflowExecutionService executionService;
  private final ResultRowMapper resultRowMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Export results",
      description =
          "Returns the stored result rows of a run (default: the current or latest run),"
              + " filtered by scope all, success or failed.")
  @GetMapping
  public ResponseEntity<?> export(
      @RequestParam(required = false) String scope,
      @RequestParam(required = false) String runId) {
    var exportScope = ExportScope.fromValue(scope);
    var knownRuns = resultSink.runIds();
    var targetRun = runId;
    if (targetRun == null || targetRun.isBlank()) {
      targetRun =
          executionService
              .getCurrentRunId()
              .orElse(knownRuns.isEmpty() ? null : knownRuns.get(knownRuns.size() - 1));
    }
    if (targetRun == null || !knownRuns.contains(targetRun)) {
      log.warn("Results not found for run {}", targetRun);
      return responseFactory.error(
          HttpStatus.NOT_FOUND,
          "Not Found",
          targetRun == null ? "No results stored yet" : "No results for run: " + targetRun);
    }
    List<ResultRow> rows = resultRowMapper.toRows(resultSink.export(targetRun, exportScope));
    log.info("Exporting {} {} row(s) of run {}", rows.size(), exportScope, targetRun);
    return ResponseEntity.ok(rows);
  }

  @Operation(summary = "Stored runs", description = "Lists the ids of runs with stored results.")
  @GetMapping("/runs")
  public ResponseEntity<List<String>> runs() {
    return ResponseEntity.ok(resultSink.runIds());
  }
}
