package com.mk.fx.qa.chatflow.execution.cfg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "chatflow.execution")
public class ExecutionCfg {

  /** Entries kept in the rolling run log exposed with the status. */
  @Positive private int logBufferSize = 100;

  /** Finished runs kept in the in-memory history. */
  @Positive private int historySize = 50;

  /** Directory holding one JSON Lines result file per run. */
  @NotBlank private String resultsDir = "results";

  /** Pause between consecutive turns of a conversation. */
  @NotNull private Duration turnInterval = Duration.ofSeconds(2);
}
