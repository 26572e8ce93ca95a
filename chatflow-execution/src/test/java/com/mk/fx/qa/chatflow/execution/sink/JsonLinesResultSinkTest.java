package com.mk.fx.qa.chatflow.execution.sink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.chatflow.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.chatflow.execution.model.ExportScope;
import com.mk.fx.qa.chatflow.execution.model.FinalStatus;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.rest.CallOutcome;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesResultSinkTest {

  private static final Instant AT = Instant.parse("2026-03-01T10:15:30Z");

  @TempDir Path dir;

  private JsonLinesResultSink sink;

  @BeforeEach
  void setUp() {
    sink = new JsonLinesResultSink(new ObjectMapperConfig().objectMapper(), dir);
  }

  @AfterEach
  void tearDown() {
    sink.close();
  }

  private static TestCase turn(int number) {
    return new TestCase("g1", number, "question " + number, "expected", Map.of("lang", "zh"), number);
  }

  private static ResultRecord success(int number) {
    return ResultRecord.fromOutcome(
        turn(number),
        CallOutcome.success("answer " + number, "conv-1", Duration.ofMillis(1250), 1),
        null,
        AT);
  }

  @Test
  void appendedRecordsAreReadBackInOrder() {
    sink.open("run-1");
    sink.append(success(1));
    sink.append(ResultRecord.skipped(turn(2), "Turn 1 failed: x", AT));

    var records = sink.read("run-1");

    assertThat(records).containsExactly(success(1), ResultRecord.skipped(turn(2), "Turn 1 failed: x", AT));
    assertThat(records.get(0).latencySeconds()).isEqualTo(1.25);
    assertThat(records.get(0).extraInputs()).containsEntry("lang", "zh");
  }

  @Test
  void eachRecordIsOneLineWithSnakeCaseStatus() throws Exception {
    sink.open("run-1");
    sink.append(ResultRecord.cancelled(turn(1), AT));

    var lines = Files.readAllLines(dir.resolve("run-1.jsonl"));

    assertThat(lines).hasSize(1);
    assertThat(lines.get(0))
        .contains("\"finalStatus\":\"cancelled\"")
        .contains("\"completedAt\":\"2026-03-01T10:15:30Z\"")
        .doesNotContain("actualReply");
  }

  @Test
  void recordsAreReadableBeforeTheStreamIsClosed() {
    sink.open("run-1");
    sink.append(success(1));

    assertThat(sink.read("run-1")).hasSize(1);
  }

  @Test
  void unterminatedTrailingLineIsIgnored() throws Exception {
    sink.open("run-1");
    sink.append(success(1));
    sink.close();
    Files.writeString(
        dir.resolve("run-1.jsonl"),
        "{\"groupId\":\"g1\",\"turnNum",
        StandardCharsets.UTF_8,
        StandardOpenOption.APPEND);

    assertThat(sink.read("run-1")).containsExactly(success(1));
  }

  @Test
  void trailingLineCutInsideMultiByteCharacterIsIgnored() throws Exception {
    var record =
        ResultRecord.fromOutcome(
            turn(1), CallOutcome.success("回复内容", "conv-1", Duration.ofMillis(20), 1), null, AT);
    sink.open("run-1");
    sink.append(record);
    sink.close();
    byte[] character = "回".getBytes(StandardCharsets.UTF_8);
    Files.write(
        dir.resolve("run-1.jsonl"),
        Arrays.copyOf(character, 2),
        StandardOpenOption.APPEND);

    var records = sink.read("run-1");

    assertThat(records).containsExactly(record);
    assertThat(records.get(0).actualReply()).isEqualTo("回复内容");
  }

  @Test
  void corruptLineIsSkipped() throws Exception {
    Files.writeString(dir.resolve("run-2.jsonl"), "not json\n", StandardCharsets.UTF_8);

    assertThat(sink.read("run-2")).isEmpty();
  }

  @Test
  void exportFiltersByScope() {
    sink.open("run-1");
    sink.append(success(1));
    sink.append(
        ResultRecord.fromOutcome(
            turn(2), CallOutcome.fatalFailure("HTTP 400", Duration.ofMillis(10), 1), "conv-1", AT));
    sink.append(ResultRecord.skipped(turn(3), "Turn 2 failed: HTTP 400", AT));

    assertThat(sink.export("run-1", ExportScope.ALL)).hasSize(3);
    assertThat(sink.export("run-1", ExportScope.SUCCESS))
        .extracting(ResultRecord::turnNumber)
        .containsExactly(1);
    assertThat(sink.export("run-1", ExportScope.FAILED))
        .extracting(ResultRecord::finalStatus)
        .containsExactly(FinalStatus.FAILED, FinalStatus.SKIPPED_DUE_TO_PRIOR_FAILURE);
  }

  @Test
  void runIdsAreListedInOrder() {
    sink.open("run-20260102");
    sink.open("run-20260101");

    assertThat(sink.runIds()).containsExactly("run-20260101", "run-20260102");
  }

  @Test
  void openingAnExistingRunFails() {
    sink.open("run-1");
    sink.close();

    assertThatThrownBy(() -> sink.open("run-1")).isInstanceOf(ResultSinkException.class);
  }

  @Test
  void appendWithoutOpenStreamFails() {
    assertThatThrownBy(() -> sink.append(success(1)))
        .isInstanceOf(ResultSinkException.class)
        .hasMessageContaining("No result file is open");
  }

  @Test
  void unknownOrMalformedRunIds() {
    assertThatThrownBy(() -> sink.read("missing")).isInstanceOf(ResultSinkException.class);
    assertThatThrownBy(() -> sink.read("../etc/passwd"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
