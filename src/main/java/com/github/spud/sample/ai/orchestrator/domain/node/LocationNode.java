package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class LocationNode extends SpecialistNode {

  public LocationNode(LlmClient llmClient) {
    super(NodeId.LOCATION, llmClient);
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
    return "Tell the customer where to find us:\n"
      + BusinessPrompts.branches(state.getBusiness(), false);
  }
}
