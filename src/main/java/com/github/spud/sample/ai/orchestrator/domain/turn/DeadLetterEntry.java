package com.github.spud.sample.ai.orchestrator.domain.turn;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeadLetterEntry {

  public static final String STAGE_AI_PROCESSING = "ai_processing";

  String tenantId;
  String conversationId;
  Map<String, Object> payload;
  String error;
  String stage;
}
