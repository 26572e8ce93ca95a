package com.mk.fx.qa.chatflow.execution.cfg;

import com.mk.fx.qa.chatflow.rest.BlockingDelivery;
import com.mk.fx.qa.chatflow.rest.ChatHttpClient;
import com.mk.fx.qa.chatflow.rest.ResponseDelivery;
import com.mk.fx.qa.chatflow.rest.RetryingChatClient;
import com.mk.fx.qa.chatflow.rest.StreamingDelivery;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the chat API client from {@link ChatflowApiCfg}. */
@Slf4j
@Configuration
public class ChatClientCfg {

  @Bean
  public ChatHttpClient chatHttpClient(ChatflowApiCfg cfg) {
    Map<String, String> headers = new HashMap<>();
    if (cfg.getApiKey() != null && !cfg.getApiKey().isBlank()) {
      headers.put("Authorization", "Bearer " + cfg.getApiKey());
    } else {
      log.warn("No chat API key configured; requests will be sent without Authorization");
    }
    return new ChatHttpClient(cfg.getBaseUrl(), cfg.getConnectTimeout(), cfg.getTimeout(), headers);
  }

  @Bean
  public ResponseDelivery responseDelivery(ChatflowApiCfg cfg, ChatHttpClient httpClient) {
    return switch (cfg.getResponseMode()) {
      case BLOCKING -> new BlockingDelivery(httpClient);
      case STREAMING -> new StreamingDelivery(httpClient);
    };
  }

  @Bean
  public RetryingChatClient retryingChatClient(ChatflowApiCfg cfg, ResponseDelivery delivery) {
    var policy = cfg.getRetry().toPolicy();
    log.info(
        "Chat client using {} delivery, {} retries every {} ms ({} policy)",
        delivery.mode(),
        policy.maxRetries(),
        policy.delay().toMillis(),
        policy.classification());
    return new RetryingChatClient(delivery, policy, cfg.getUserId(), cfg.getTimeout());
  }
}
