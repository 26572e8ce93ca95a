package com.mk.fx.qa.chatflow.execution;

import com.mk.fx.qa.chatflow.rest.ChatApiException;
import com.mk.fx.qa.chatflow.rest.ChatReply;
import com.mk.fx.qa.chatflow.rest.ChatRequest;
import com.mk.fx.qa.chatflow.rest.ResponseDelivery;
import com.mk.fx.qa.chatflow.rest.ResponseMode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * In-memory chat API. Replies echo the query and open a conversation named after the first
 * message. Calls can be held back with {@link #hold()} and let through with {@link #release}.
 */
public class FakeResponseDelivery implements ResponseDelivery {

  private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
  private volatile Function<ChatRequest, ChatReply> responder = FakeResponseDelivery::echo;
  private volatile Semaphore gate;

  public static ChatReply echo(ChatRequest request) {
    var conversation =
        request.conversationId() != null ? request.conversationId() : "conv-" + request.query();
    return new ChatReply("echo: " + request.query(), conversation, "m", Duration.ofMillis(15));
  }

  public FakeResponseDelivery respondWith(Function<ChatRequest, ChatReply> responder) {
    this.responder = responder;
    return this;
  }

  /** Fails every call whose query equals {@code query} with the given error. */
  public FakeResponseDelivery failOn(String query, ChatApiException failure) {
    return respondWith(
        request -> {
          if (request.query().equals(query)) {
            throw failure;
          }
          return echo(request);
        });
  }

  public FakeResponseDelivery hold() {
    gate = new Semaphore(0);
    return this;
  }

  public void release(int calls) {
    var currentGate = gate;
    if (currentGate != null) {
      currentGate.release(calls);
    }
  }

  public List<ChatRequest> requests() {
    return requests;
  }

  public List<String> queries() {
    return requests.stream().map(ChatRequest::query).toList();
  }

  @Override
  public ResponseMode mode() {
    return ResponseMode.BLOCKING;
  }

  @Override
  public ChatReply deliver(ChatRequest request) {
    requests.add(request);
    var currentGate = gate;
    if (currentGate != null) {
      try {
        currentGate.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw ChatApiException.interrupted();
      }
    }
    return responder.apply(request);
  }
}
