package com.mk.fx.qa.chatflow.rest;

/** Sends one chat request and returns the assembled reply. */
public interface ResponseDelivery {

  String CHAT_MESSAGES_PATH = "/chat-messages";

  ResponseMode mode();

  /**
   * Delivers the request and waits for the complete reply.
   *
   * @throws ChatApiException when the call fails for any reason
   */
  ChatReply deliver(ChatRequest request);
}
