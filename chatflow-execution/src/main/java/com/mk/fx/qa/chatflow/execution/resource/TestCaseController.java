package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.dto.TestCaseRow;
import com.mk.fx.qa.chatflow.execution.dto.TestCaseValidationResponse;
import com.mk.fx.qa.chatflow.execution.grouping.CaseGrouper;
import com.mk.fx.qa.chatflow.execution.service.TestCaseStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Test Cases", description = "Endpoints for uploading and validating test cases")
@RestController
@RequestMapping("/api/test-cases")
@RequiredArgsConstructor
public class TestCaseController {

  private final TestCaseStore testCaseStore;
  private final CaseGrouper caseGrouper;

  @Operation(
      summary = "Upload test cases",
      description =
          "Replaces the uploaded test cases and reports which conversations are executable.")
  @PostMapping
  public ResponseEntity<TestCaseValidationResponse> upload(@RequestBody List<TestCaseRow> rows) {
    log.info("Received {} test case row(s)", rows.size());
    testCaseStore.replace(rows);
    return ResponseEntity.status(HttpStatus.CREATED).body(validate(rows));
  }

  @Operation(summary = "List test cases", description = "Returns the uploaded test case rows.")
  @GetMapping
  public ResponseEntity<List<TestCaseRow>> list() {
    return ResponseEntity.ok(testCaseStore.getAll());
  }

  @Operation(summary = "Clear test cases", description = "Removes all uploaded test cases.")
  @DeleteMapping
  public ResponseEntity<Void> clear() {
    testCaseStore.clear();
    return ResponseEntity.noContent().build();
  }

  @Operation(
      summary = "Validate test cases",
      description = "Groups and validates the given rows without storing them.")
  @PostMapping("/validate")
  public ResponseEntity<TestCaseValidationResponse> dryRun(@RequestBody List<TestCaseRow> rows) {
    return ResponseEntity.ok(validate(rows));
  }

  private TestCaseValidationResponse validate(List<TestCaseRow> rows) {
    var grouping = caseGrouper.group(rows);
    return new TestCaseValidationResponse(
        rows.size(), grouping.groups().size(), grouping.totalTurns(), grouping.validationErrors());
  }
}
