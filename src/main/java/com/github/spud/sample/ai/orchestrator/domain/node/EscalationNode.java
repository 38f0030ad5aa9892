package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 转人工。总是流向 finalize，不再交接
 */
@Slf4j
@Component
public class EscalationNode implements GraphNode {

  @Value("${orchestrator.turn.escalation-response:Gracias por tu mensaje. Un asesor de nuestro equipo te atenderá en breve.}")
  private String escalationResponse;

  @Override
  public NodeId id() {
    return NodeId.ESCALATION;
  }

  @Override
  public StatePatch execute(ConversationState state) {
    String reason = state.getControl().getEscalationReason();
    if (reason == null || reason.isBlank()) {
      reason = state.iterationLimitReached()
        ? String.format("Max iterations reached (%d/%d)",
          state.getControl().getIterationCount(), state.maxIterations())
        : "Escalated to a human agent";
    }
    log.info("Escalating conversation {}: {}", state.getConversationId(), reason);

    return StatePatch.builder()
      .finalResponse(escalationResponse)
      .control(ControlPatch.builder()
        .shouldEscalate(true)
        .escalationReason(reason)
        .responseReady(true)
        .build())
      .build();
  }
}
