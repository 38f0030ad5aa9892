package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import org.springframework.stereotype.Component;

@Component
public class GreetingNode extends SpecialistNode {

  public GreetingNode(LlmClient llmClient) {
    super(NodeId.GREETING, llmClient);
  }

  @Override
  protected String instructions(ConversationState state) {
    String name = state.getLead() != null ? state.getLead().getName() : null;
    return "Greet the customer" + (name != null ? " (" + name + ")" : "")
      + " warmly and ask how you can help. Services offered:\n"
      + BusinessPrompts.services(state.getBusiness());
  }
}
