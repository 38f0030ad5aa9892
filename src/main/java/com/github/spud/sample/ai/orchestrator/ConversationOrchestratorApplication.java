package com.github.spud.sample.ai.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ConversationOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConversationOrchestratorApplication.class, args);
  }

}
