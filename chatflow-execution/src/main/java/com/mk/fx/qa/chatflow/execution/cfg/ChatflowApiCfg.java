package com.mk.fx.qa.chatflow.execution.cfg;

import com.mk.fx.qa.chatflow.rest.ResponseMode;
import com.mk.fx.qa.chatflow.rest.RetryClassification;
import com.mk.fx.qa.chatflow.rest.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Connection settings for the remote chat API. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "chatflow.api")
public class ChatflowApiCfg {

  @NotBlank
  @Pattern(regexp = "^https?://.+", message = "must start with http:// or https://")
  private String baseUrl = "http://localhost/v1";

  private String apiKey = "";

  @NotBlank private String userId = "chatflow-tester";

  @NotNull private Duration connectTimeout = Duration.ofSeconds(10);

  /** Per-call timeout, covering the whole streamed reply. */
  @NotNull private Duration timeout = Duration.ofSeconds(30);

  @NotNull private ResponseMode responseMode = ResponseMode.STREAMING;

  @Valid @NotNull private Retry retry = new Retry();

  @Data
  public static class Retry {

    @Min(0)
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;

    @NotNull private Duration delay = RetryPolicy.DEFAULT_DELAY;

    @NotNull private RetryClassification policy = RetryClassification.CLASSIFIED;

    public RetryPolicy toPolicy() {
      return new RetryPolicy(maxRetries, delay, policy);
    }
  }
}
