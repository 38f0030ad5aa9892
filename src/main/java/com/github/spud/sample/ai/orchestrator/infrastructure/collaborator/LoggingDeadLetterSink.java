package com.github.spud.sample.ai.orchestrator.infrastructure.collaborator;

import com.github.spud.sample.ai.orchestrator.domain.turn.DeadLetterEntry;
import com.github.spud.sample.ai.orchestrator.domain.turn.DeadLetterSink;
import lombok.extern.slf4j.Slf4j;

/**
 * 默认死信实现：只记录日志
 */
@Slf4j
public class LoggingDeadLetterSink implements DeadLetterSink {

  @Override
  public void send(DeadLetterEntry entry) {
    log.error("Dead letter: tenant={}, conversation={}, stage={}, error={}, payload={}",
      entry.getTenantId(), entry.getConversationId(), entry.getStage(), entry.getError(),
      entry.getPayload());
  }
}
