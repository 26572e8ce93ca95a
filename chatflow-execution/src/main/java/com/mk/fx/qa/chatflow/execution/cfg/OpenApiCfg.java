package com.mk.fx.qa.chatflow.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Chatflow Execution Runner API")
                .description(
                    "API for uploading conversation test cases, controlling test runs and"
                        + " exporting results."));
  }
}
