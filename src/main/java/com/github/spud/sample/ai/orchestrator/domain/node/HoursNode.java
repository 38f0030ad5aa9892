package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class HoursNode extends SpecialistNode {

  public HoursNode(LlmClient llmClient) {
    super(NodeId.HOURS, llmClient);
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (state.getBusiness() == null || !state.getBusiness().hasBranches()) {
      return handoffTo(NodeId.GENERAL, "no branches configured");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Answer the question about opening hours:\n"
      + BusinessPrompts.branches(state.getBusiness(), true);
  }
}
