package com.github.spud.sample.ai.orchestrator.domain.llm;

import lombok.Value;

@Value
public class LlmReply {

  String text;
  int tokensUsed;
}
