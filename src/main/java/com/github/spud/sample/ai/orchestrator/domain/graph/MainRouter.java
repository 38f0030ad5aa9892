package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * supervisor 之后的路由。升级检查先于「已有回复」检查
 */
@Component
public class MainRouter implements Router {

  private static final Set<NodeId> TARGETS =
    EnumSet.of(NodeId.ESCALATION, NodeId.FINALIZE, NodeId.VERTICAL_ROUTER);

  @Override
  public String name() {
    return "mainRouter";
  }

  @Override
  public Set<NodeId> targets() {
    return TARGETS;
  }

  @Override
  public NodeId route(ConversationState state) {
    if (state.getControl().isShouldEscalate()) {
      return NodeId.ESCALATION;
    }
    if (state.iterationLimitReached()) {
      return NodeId.ESCALATION;
    }
    if (state.getControl().isResponseReady() && state.hasFinalResponse()) {
      return NodeId.FINALIZE;
    }
    return NodeId.VERTICAL_ROUTER;
  }
}
