package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import com.github.spud.sample.ai.orchestrator.domain.state.Vertical;
import org.springframework.stereotype.Component;

/**
 * 根据意图与业务垂直领域选择专家节点，只设置 next_agent
 */
@Component
public class VerticalRouterNode implements GraphNode {

  @Override
  public NodeId id() {
    return NodeId.VERTICAL_ROUTER;
  }

  @Override
  public StatePatch execute(ConversationState state) {
    Intent intent = state.getDetectedIntent() != null ? state.getDetectedIntent() : Intent.UNKNOWN;
    String next = specialistFor(intent, state.vertical());
    return StatePatch.builder()
      .nextAgent(next)
      .handoffReason("intent " + intent)
      .build();
  }

  /**
   * 预约按垂直领域区分为 booking_&lt;vertical&gt;；点餐和开票只对餐厅开放
   */
  static String specialistFor(Intent intent, Vertical vertical) {
    switch (intent) {
      case GREETING:
        return NodeId.GREETING.nodeName();
      case PRICE_INQUIRY:
        return NodeId.PRICING.nodeName();
      case BOOK_APPOINTMENT:
        return "booking_" + vertical.code();
      case ORDER_REQUEST:
        return vertical == Vertical.RESTAURANT
          ? NodeId.ORDERING_RESTAURANT.nodeName() : NodeId.GENERAL.nodeName();
      case INVOICE_REQUEST:
        return vertical == Vertical.RESTAURANT
          ? NodeId.INVOICING_RESTAURANT.nodeName() : NodeId.GENERAL.nodeName();
      case PAIN_URGENT:
        return NodeId.URGENT_CARE.nodeName();
      case LOCATION:
        return NodeId.LOCATION.nodeName();
      case HOURS:
        return NodeId.HOURS.nodeName();
      case FAQ:
        return NodeId.FAQ.nodeName();
      default:
        return NodeId.GENERAL.nodeName();
    }
  }
}
