package com.mk.fx.qa.chatflow.execution.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.chatflow.execution.cfg.ChatflowApiCfg;
import com.mk.fx.qa.chatflow.rest.ChatApiException;
import com.mk.fx.qa.chatflow.rest.ChatReply;
import com.mk.fx.qa.chatflow.rest.ChatRequest;
import com.mk.fx.qa.chatflow.rest.ResponseDelivery;
import com.mk.fx.qa.chatflow.rest.ResponseMode;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatConnectionServiceTest {

  @Mock private ResponseDelivery delivery;

  private ChatflowApiCfg cfg;
  private ChatConnectionService service;

  @BeforeEach
  void setUp() {
    cfg = new ChatflowApiCfg();
    cfg.setBaseUrl("https://chat.example.com/v1/");
    cfg.setApiKey("app-1234567890abcd");
    cfg.setUserId("qa-bot");
    service = new ChatConnectionService(cfg, delivery);
  }

  @Test
  void successfulConnectionTestReportsLatencyAndReply() {
    when(delivery.deliver(any()))
        .thenReturn(new ChatReply("hello", "conv-1", "m-1", Duration.ofMillis(1500)));

    var response = service.testConnection();

    assertThat(response.success()).isTrue();
    assertThat(response.latencySeconds()).isEqualTo(1.5);
    assertThat(response.reply()).isEqualTo("hello");
    assertThat(response.message()).isEqualTo("Connected, response time 1.50s");
    var request = ArgumentCaptor.forClass(ChatRequest.class);
    verify(delivery).deliver(request.capture());
    assertThat(request.getValue().query()).isEqualTo(ChatConnectionService.TEST_MESSAGE);
    assertThat(request.getValue().user()).isEqualTo("qa-bot");
    assertThat(request.getValue().conversationId()).isNull();
  }

  @Test
  void failedConnectionTestIsReportedWithoutRetrying() {
    when(delivery.deliver(any())).thenThrow(ChatApiException.httpStatus(503, "maintenance"));

    var response = service.testConnection();

    assertThat(response.success()).isFalse();
    assertThat(response.message()).startsWith("Connection failed:").contains("503");
    assertThat(response.latencySeconds()).isNull();
    verify(delivery, times(1)).deliver(any());
  }

  @Test
  void infoMasksTheApiKey() {
    when(delivery.mode()).thenReturn(ResponseMode.STREAMING);

    var info = service.info();

    assertThat(info.endpoint()).isEqualTo("https://chat.example.com/v1/chat-messages");
    assertThat(info.apiKey()).isEqualTo("app-**********abcd");
    assertThat(info.responseMode()).isEqualTo("streaming");
    assertThat(info.userId()).isEqualTo("qa-bot");
    assertThat(info.maxRetries()).isEqualTo(3);
  }

  @Test
  void shortKeysAreFullyMasked() {
    assertThat(ChatConnectionService.maskApiKey("abcdefgh")).isEqualTo("********");
    assertThat(ChatConnectionService.maskApiKey("abcdefghi")).isEqualTo("abcd*fghi");
    assertThat(ChatConnectionService.maskApiKey(null)).isEmpty();
  }
}
