package com.mk.fx.qa.chatflow.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatflowExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatflowExecutionApplication.class, args);
  }
}
