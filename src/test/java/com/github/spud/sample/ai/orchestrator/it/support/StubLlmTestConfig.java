package com.github.spud.sample.ai.orchestrator.it.support;

import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.support.StubLlmClient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 用可编排的桩替换真实模型调用
 */
@TestConfiguration
public class StubLlmTestConfig {

  @Bean
  @Primary
  public StubLlmClient stubLlmClient() {
    return new StubLlmClient();
  }
}
