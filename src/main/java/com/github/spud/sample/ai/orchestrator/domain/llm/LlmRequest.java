package com.github.spud.sample.ai.orchestrator.domain.llm;

import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LlmRequest {

  /**
   * 发起调用的节点名，用于日志
   */
  String agentName;

  String systemPrompt;

  @Builder.Default
  List<ChatMessage> history = List.of();

  String userMessage;
}
