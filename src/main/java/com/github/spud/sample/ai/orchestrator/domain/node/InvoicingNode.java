package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.Vertical;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class InvoicingNode extends SpecialistNode {

  public InvoicingNode(LlmClient llmClient) {
    super(NodeId.INVOICING_RESTAURANT, llmClient);
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (state.vertical() != Vertical.RESTAURANT) {
      return handoffTo(NodeId.GENERAL, "invoicing is only available for restaurants");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "The customer needs an invoice. Ask for the ticket number, tax id (RFC), legal name, "
      + "tax regime, postal code and email, one item at a time.";
  }
}
