package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class FaqNode extends SpecialistNode {

  public FaqNode(LlmClient llmClient) {
    super(NodeId.FAQ, llmClient);
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (state.getBusiness() == null || !state.getBusiness().hasFaqs()) {
      return handoffTo(NodeId.GENERAL, "no FAQs configured");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Answer using the FAQ below. If it does not cover the question, say so:\n"
      + BusinessPrompts.faqs(state.getBusiness());
  }
}
