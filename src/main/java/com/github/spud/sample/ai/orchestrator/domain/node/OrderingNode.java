package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.Vertical;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class OrderingNode extends SpecialistNode {

  public OrderingNode(LlmClient llmClient) {
    super(NodeId.ORDERING_RESTAURANT, llmClient);
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (state.vertical() != Vertical.RESTAURANT) {
      return handoffTo(NodeId.GENERAL, "ordering is only available for restaurants");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Take the customer's order from the menu below and confirm items, quantities and pickup or delivery:\n"
      + BusinessPrompts.services(state.getBusiness());
  }
}
