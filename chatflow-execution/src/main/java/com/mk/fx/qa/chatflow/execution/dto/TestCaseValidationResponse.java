package com.mk.fx.qa.chatflow.execution.dto;

import com.mk.fx.qa.chatflow.execution.model.ValidationError;
import java.util.List;

/** Result of grouping the uploaded rows: what would run and what was rejected. */
public record TestCaseValidationResponse(
    int rows, int validGroups, int validTurns, List<ValidationError> validationErrors) {}
