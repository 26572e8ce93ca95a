package com.mk.fx.qa.chatflow.execution.grouping;

import static com.mk.fx.qa.chatflow.execution.TestRows.rows;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.mk.fx.qa.chatflow.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.chatflow.execution.dto.TestCaseRow;
import com.mk.fx.qa.chatflow.execution.model.ConversationGroup;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.execution.model.ValidationError;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CaseGrouper Tests")
class CaseGrouperTest {

  private final ObjectMapper objectMapper = new ObjectMapperConfig().objectMapper();
  private final CaseGrouper grouper = new CaseGrouper(objectMapper);

  @Nested
  @DisplayName("Grouping")
  class Grouping {

    @Test
    void keepsFirstSeenOrderAndSortsTurns() {
      var input =
          rows()
              .row("B", "2", "b2")
              .row("A", "1", "a1")
              .row("B", "1", "b1")
              .row("A", "2", "a2")
              .build();

      var result = grouper.group(input);

      assertThat(result.validationErrors()).isEmpty();
      assertThat(result.groups()).extracting(ConversationGroup::getGroupId).containsExactly("B", "A");
      assertThat(result.groups().get(0).getTurns())
          .extracting(TestCase::userMessage)
          .containsExactly("b1", "b2");
      assertThat(result.totalTurns()).isEqualTo(4);
      assertThat(result.groups().get(1).getTurns().get(0).rowIndex()).isEqualTo(2);
    }

    @Test
    void gapInTurnSequenceExcludesOnlyThatConversation() {
      var input =
          rows()
              .conversation("ok", "hello", "again")
              .row("gap", "1", "one")
              .row("gap", "2", "two")
              .row("gap", "4", "four")
              .build();

      var result = grouper.group(input);

      assertThat(result.groups()).extracting(ConversationGroup::getGroupId).containsExactly("ok");
      assertThat(result.validationErrors()).hasSize(1);
      var error = result.validationErrors().get(0);
      assertThat(error.groupId()).isEqualTo("gap");
      assertThat(error.rowIndex()).isNull();
      assertThat(error.defect()).contains("1..3").contains("[1, 2, 4]");
    }

    @Test
    void duplicateTurnNumberIsRejected() {
      var result = grouper.group(rows().row("dup", "1", "a").row("dup", "1", "b").build());

      assertThat(result.hasExecutableGroups()).isFalse();
      assertThat(result.validationErrors()).extracting(ValidationError::groupId).containsExactly("dup");
    }

    @Test
    void turnsNotStartingAtOneAreRejected() {
      var result = grouper.group(rows().row("late", "2", "a").row("late", "3", "b").build());

      assertThat(result.groups()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Row defects")
  class RowDefects {

    @Test
    void rowWithoutGroupIdIsReportedUnderMissingGroup() {
      var result = grouper.group(rows().row("  ", "1", "orphan").conversation("A", "hi").build());

      assertThat(result.groups()).hasSize(1);
      assertThat(result.validationErrors())
          .containsExactly(
              ValidationError.ofRow(ValidationError.MISSING_GROUP, 1, "group id is missing"));
    }

    @Test
    void missingMessageInvalidatesWholeConversation() {
      var result =
          grouper.group(rows().row("A", "1", "first").row("A", "2", " ").build());

      assertThat(result.groups()).isEmpty();
      assertThat(result.validationErrors())
          .containsExactly(ValidationError.ofRow("A", 2, "user message is missing"));
    }

    @Test
    void wholeNumberWrittenAsDecimalIsAccepted() {
      var result = grouper.group(rows().row("A", "1.0", "x").row("A", " 2 ", "y").build());

      assertThat(result.validationErrors()).isEmpty();
      assertThat(result.groups().get(0).getTurns())
          .extracting(TestCase::turnNumber)
          .containsExactly(1, 2);
    }

    @Test
    void fractionalZeroAndTextTurnNumbersAreRejected() {
      var result =
          grouper.group(
              rows().row("a", "1.5", "x").row("b", "0", "x").row("c", "one", "x").build());

      assertThat(result.groups()).isEmpty();
      assertThat(result.validationErrors())
          .extracting(ValidationError::defect)
          .containsExactly(
              "turn number is not an integer: 1.5",
              "turn number must be positive: 0",
              "turn number is not an integer: one");
    }

    @Test
    void extraInputsAcceptJsonTextAndRejectNonObjects() {
      var good = new TestCaseRow("A", "1", "hi", null, new TextNode("{\"lang\": \"en\"}"));
      var badJson = new TestCaseRow("B", "1", "hi", null, new TextNode("{lang"));
      var notObject = new TestCaseRow("C", "1", "hi", null, objectMapper.valueToTree(List.of(1)));

      var result = grouper.group(List.of(good, badJson, notObject));

      assertThat(result.groups()).hasSize(1);
      assertThat(result.groups().get(0).getTurns().get(0).extraInputs()).containsEntry("lang", "en");
      assertThat(result.validationErrors())
          .extracting(ValidationError::groupId)
          .containsExactly("B", "C");
      assertThat(result.validationErrors().get(1).defect())
          .isEqualTo("extra inputs must be a JSON object");
    }
  }

  @Test
  @DisplayName("Spreadsheet column names are accepted as aliases")
  void spreadsheetColumnNamesAreAccepted() throws Exception {
    var json =
        "[{\"对话ID\":\"c1\",\"轮次\":1,\"用户问题\":\"你好\",\"期待回复\":\"hi\"},"
            + "{\"conversation_id\":\"c1\",\"round\":\"2\",\"question\":\"bye\","
            + "\"inputs\":{\"k\":\"v\"}}]";
    List<TestCaseRow> input = objectMapper.readValue(json, new TypeReference<>() {});

    var result = grouper.group(input);

    assertThat(result.validationErrors()).isEmpty();
    var turns = result.groups().get(0).getTurns();
    assertThat(turns.get(0).userMessage()).isEqualTo("你好");
    assertThat(turns.get(0).expectedReply()).isEqualTo("hi");
    assertThat(turns.get(1).extraInputs()).containsEntry("k", "v");
  }
}
