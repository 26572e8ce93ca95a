package com.mk.fx.qa.chatflow.execution.runner;

import com.mk.fx.qa.chatflow.execution.model.ConversationGroup;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.rest.RetryingChatClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Replays one conversation turn by turn, carrying the remote session from each reply into the next
 * call.
 *
 * <p>A fatal call failure marks that turn failed and every later turn skipped. A stop request is
 * observed only between turns: the in-flight call always finishes, and the turns not yet sent are
 * recorded as cancelled.
 */
@Slf4j
public class ConversationRunner {

  private final TurnPacer pacer;
  private final Clock clock;

  public ConversationRunner(TurnPacer pacer, Clock clock) {
    this.pacer = pacer;
    this.clock = clock;
  }

  public ConversationRunner(TurnPacer pacer) {
    this(pacer, Clock.systemUTC());
  }

  public ConversationOutcome runGroup(
      ConversationGroup group,
      RetryingChatClient client,
      TurnCompletionListener listener,
      BooleanSupplier shouldContinue) {
    List<ResultRecord> records = new ArrayList<>(group.size());
    var turns = group.getTurns();
    String session = null;

    for (int i = 0; i < turns.size(); i++) {
      var turn = turns.get(i);

      if (i > 0 && !readyForNextTurn(shouldContinue)) {
        log.info(
            "Conversation {} cancelled before turn {}/{}", group.getGroupId(), i + 1, turns.size());
        for (TestCase remaining : turns.subList(i, turns.size())) {
          emit(ResultRecord.cancelled(remaining, clock.instant()), records, listener);
        }
        return new ConversationOutcome(group.getGroupId(), records, true);
      }

      listener.onTurnStart(turn);
      log.debug("Sending turn {} (session={})", turn.label(), session);
      var outcome =
          client.executeTurn(
              session,
              turn.userMessage(),
              turn.extraInputs(),
              client.defaultTimeout(),
              (failedAttempt, delay) -> listener.onRetry(turn, failedAttempt, delay));
      var record = ResultRecord.fromOutcome(turn, outcome, session, clock.instant());
      emit(record, records, listener);

      if (!outcome.isSuccess()) {
        log.warn("Turn {} failed: {}", turn.label(), outcome.errorDetail());
        var reason = "Turn " + turn.turnNumber() + " failed: " + outcome.errorDetail();
        for (TestCase remaining : turns.subList(i + 1, turns.size())) {
          emit(ResultRecord.skipped(remaining, reason, clock.instant()), records, listener);
        }
        return new ConversationOutcome(group.getGroupId(), records, false);
      }
      session = outcome.sessionHandle();
    }
    return new ConversationOutcome(group.getGroupId(), records, false);
  }

  private boolean readyForNextTurn(BooleanSupplier shouldContinue) {
    if (!shouldContinue.getAsBoolean()) {
      return false;
    }
    try {
      return pacer.pause(shouldContinue);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void emit(
      ResultRecord record, List<ResultRecord> records, TurnCompletionListener listener) {
    listener.onTurnComplete(record);
    records.add(record);
  }
}
