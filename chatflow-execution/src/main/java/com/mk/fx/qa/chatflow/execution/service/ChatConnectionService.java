package com.mk.fx.qa.chatflow.execution.service;

import com.mk.fx.qa.chatflow.execution.cfg.ChatflowApiCfg;
import com.mk.fx.qa.chatflow.execution.dto.ApiInfoResponse;
import com.mk.fx.qa.chatflow.execution.dto.ConnectionTestResponse;
import com.mk.fx.qa.chatflow.rest.ChatApiException;
import com.mk.fx.qa.chatflow.rest.ChatRequest;
import com.mk.fx.qa.chatflow.rest.ResponseDelivery;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Connectivity check and effective settings of the chat API. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatConnectionService {

  static final String TEST_MESSAGE = "Connection test";

  private final ChatflowApiCfg cfg;
  private final ResponseDelivery delivery;

  /** Sends one test message without retries. */
  public ConnectionTestResponse testConnection() {
    var request = new ChatRequest(TEST_MESSAGE, cfg.getUserId(), null, Map.of(), cfg.getTimeout());
    try {
      var reply = delivery.deliver(request);
      var seconds = reply.latency().toNanos() / 1_000_000_000.0;
      log.info("Connection test succeeded in {} ms", reply.latency().toMillis());
      return new ConnectionTestResponse(
          true,
          String.format(Locale.ROOT, "Connected, response time %.2fs", seconds),
          seconds,
          reply.answer());
    } catch (ChatApiException ex) {
      log.warn("Connection test failed ({}): {}", ex.getKind(), ex.getMessage());
      return new ConnectionTestResponse(false, "Connection failed: " + ex.getMessage(), null, null);
    }
  }

  public ApiInfoResponse info() {
    var retry = cfg.getRetry();
    return new ApiInfoResponse(
        stripTrailingSlash(cfg.getBaseUrl()) + ResponseDelivery.CHAT_MESSAGES_PATH,
        maskApiKey(cfg.getApiKey()),
        cfg.getTimeout().toSeconds(),
        delivery.mode().apiValue(),
        cfg.getUserId(),
        retry.getMaxRetries(),
        retry.getDelay().toSeconds(),
        retry.getPolicy().name());
  }

  /** Keeps the first and last four characters of keys longer than eight. */
  static String maskApiKey(String apiKey) {
    if (apiKey == null || apiKey.isEmpty()) {
      return "";
    }
    if (apiKey.length() <= 8) {
      return "*".repeat(apiKey.length());
    }
    return apiKey.substring(0, 4)
        + "*".repeat(apiKey.length() - 8)
        + apiKey.substring(apiKey.length() - 4);
  }

  private static String stripTrailingSlash(String url) {
    var trimmed = url.strip();
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
