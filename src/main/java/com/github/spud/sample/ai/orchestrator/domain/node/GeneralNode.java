package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import org.springframework.stereotype.Component;

/**
 * 兜底专家，总是直接回复
 */
@Component
public class GeneralNode extends SpecialistNode {

  public GeneralNode(LlmClient llmClient) {
    super(NodeId.GENERAL, llmClient);
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Help the customer with their request. Known services:\n"
      + BusinessPrompts.services(state.getBusiness()) + "\nBranches:\n"
      + BusinessPrompts.branches(state.getBusiness(), true);
  }
}
