package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 价格咨询；消息里已经表达预约意愿时交给对应的预约节点
 */
@Component
public class PricingNode extends SpecialistNode {

  private static final Pattern BOOKING_WORDS = Pattern.compile("\\b(cita|agendar|reservar|agenda)\\b");

  public PricingNode(LlmClient llmClient) {
    super(NodeId.PRICING, llmClient);
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (BOOKING_WORDS.matcher(IntentDetector.normalize(state.getCurrentMessage())).find()) {
      return handoffTo("booking_" + state.vertical().code(), "customer wants to book after asking prices");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Answer the price question using only this price list:\n"
      + BusinessPrompts.services(state.getBusiness());
  }
}
