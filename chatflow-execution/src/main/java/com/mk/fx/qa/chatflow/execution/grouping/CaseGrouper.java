package com.mk.fx.qa.chatflow.execution.grouping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.chatflow.execution.dto.TestCaseRow;
import com.mk.fx.qa.chatflow.execution.model.ConversationGroup;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.execution.model.ValidationError;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Partitions uploaded rows into conversations and validates them.
 *
 * <p>Conversations keep the order in which their group id first appears. A defect in any row
 * excludes the whole conversation; other conversations are unaffected. Turn numbers must form the
 * sequence 1..N with no gaps or duplicates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseGrouper {

  private static final TypeReference<Map<String, Object>> INPUTS_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public GroupingResult group(List<TestCaseRow> rows) {
    Map<String, List<TestCase>> turnsByGroup = new LinkedHashMap<>();
    Map<String, List<ValidationError>> defectsByGroup = new LinkedHashMap<>();
    List<ValidationError> errors = new ArrayList<>();

    for (int i = 0; i < rows.size(); i++) {
      var rowIndex = i + 1;
      var row = rows.get(i);
      var groupId = row != null ? trimToNull(row.getGroupId()) : null;
      if (groupId == null) {
        errors.add(
            ValidationError.ofRow(ValidationError.MISSING_GROUP, rowIndex, "group id is missing"));
        continue;
      }
      turnsByGroup.computeIfAbsent(groupId, key -> new ArrayList<>());
      var rowDefects = new ArrayList<String>();
      var testCase = toTestCase(groupId, row, rowIndex, rowDefects);
      if (rowDefects.isEmpty()) {
        turnsByGroup.get(groupId).add(testCase);
      } else {
        var groupDefects = defectsByGroup.computeIfAbsent(groupId, key -> new ArrayList<>());
        for (String defect : rowDefects) {
          groupDefects.add(ValidationError.ofRow(groupId, rowIndex, defect));
        }
      }
    }

    List<ConversationGroup> groups = new ArrayList<>();
    for (var entry : turnsByGroup.entrySet()) {
      var groupId = entry.getKey();
      var groupDefects = defectsByGroup.getOrDefault(groupId, new ArrayList<>());
      var turns = new ArrayList<>(entry.getValue());
      turns.sort(Comparator.comparingInt(TestCase::turnNumber));
      if (groupDefects.isEmpty()) {
        sequenceDefect(turns)
            .ifPresent(defect -> groupDefects.add(ValidationError.ofGroup(groupId, defect)));
      }
      if (groupDefects.isEmpty()) {
        groups.add(new ConversationGroup(groupId, turns));
      } else {
        errors.addAll(groupDefects);
      }
    }

    if (!errors.isEmpty()) {
      log.warn("{} validation error(s) in {} uploaded row(s)", errors.size(), rows.size());
    }
    log.debug("Grouped {} row(s) into {} valid conversation(s)", rows.size(), groups.size());
    return new GroupingResult(groups, errors);
  }

  private TestCase toTestCase(
      String groupId, TestCaseRow row, int rowIndex, List<String> defects) {
    var turnNumber = parseTurnNumber(row.getTurnNumber(), defects);
    var message = row.getUserMessage();
    if (message == null || message.isBlank()) {
      defects.add("user message is missing");
    }
    var inputs = parseInputs(row.getExtraInputs(), defects);
    if (!defects.isEmpty()) {
      return null;
    }
    return new TestCase(
        groupId, turnNumber, message.strip(), trimToNull(row.getExpectedReply()), inputs, rowIndex);
  }

  private int parseTurnNumber(String raw, List<String> defects) {
    var value = trimToNull(raw);
    if (value == null) {
      defects.add("turn number is missing");
      return -1;
    }
    try {
      // spreadsheet exports write whole numbers as 2.0
      var number = new BigDecimal(value).stripTrailingZeros();
      if (number.scale() > 0) {
        defects.add("turn number is not an integer: " + value);
        return -1;
      }
      var turn = number.intValueExact();
      if (turn < 1) {
        defects.add("turn number must be positive: " + value);
        return -1;
      }
      return turn;
    } catch (NumberFormatException | ArithmeticException e) {
      defects.add("turn number is not an integer: " + value);
      return -1;
    }
  }

  private Map<String, Object> parseInputs(JsonNode raw, List<String> defects) {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      return Map.of();
    }
    JsonNode node = raw;
    if (raw.isTextual()) {
      var text = raw.asText().strip();
      if (text.isEmpty()) {
        return Map.of();
      }
      try {
        node = objectMapper.readTree(text);
      } catch (JsonProcessingException e) {
        defects.add("extra inputs are not valid JSON: " + e.getOriginalMessage());
        return Map.of();
      }
    }
    if (!node.isObject()) {
      defects.add("extra inputs must be a JSON object");
      return Map.of();
    }
    return objectMapper.convertValue(node, INPUTS_TYPE);
  }

  /** Returns a description of the defect when the sorted turns are not exactly 1..N. */
  private static Optional<String> sequenceDefect(List<TestCase> sortedTurns) {
    for (int i = 0; i < sortedTurns.size(); i++) {
      if (sortedTurns.get(i).turnNumber() != i + 1) {
        var found = sortedTurns.stream().map(TestCase::turnNumber).toList();
        return Optional.of(
            "turn numbers must run 1.." + sortedTurns.size() + " without gaps or duplicates, found "
                + found);
      }
    }
    return Optional.empty();
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    var trimmed = value.strip();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
