package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;

/**
 * A complete reply from the chat API, whichever mode delivered it.
 *
 * @param answer reply text, empty when the API returned none
 * @param conversationId session handle returned by the API, may be null
 * @param messageId identifier of the reply message, may be null
 * @param latency time from sending the request to the complete reply
 */
public record ChatReply(String answer, String conversationId, String messageId, Duration latency) {}
