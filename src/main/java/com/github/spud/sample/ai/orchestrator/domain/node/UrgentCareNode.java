package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * 疼痛/紧急情况。疼痛等级达到阈值时直接升级
 */
@Component
public class UrgentCareNode extends SpecialistNode {

  public UrgentCareNode(LlmClient llmClient) {
    super(NodeId.URGENT_CARE, llmClient);
  }

  @Override
  protected Optional<String> checkEscalation(ConversationState state) {
    Integer pain = state.getExtractedData() != null ? state.getExtractedData().getPainLevel() : null;
    if (pain != null && pain >= IntentDetector.ESCALATION_PAIN_LEVEL) {
      return Optional.of("Pain level " + pain + " needs human attention");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "The customer reports discomfort. Show empathy, offer the earliest visit and the branches:\n"
      + BusinessPrompts.branches(state.getBusiness(), true);
  }
}
