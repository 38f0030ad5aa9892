package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 专家节点之后的路由：升级 > 完成 > 交接 > 兜底 general
 */
@Component
@RequiredArgsConstructor
public class PostAgentRouter implements Router {

  private final AgentRouter agentRouter;

  @Override
  public String name() {
    return "postAgentRouter";
  }

  @Override
  public Set<NodeId> targets() {
    Set<NodeId> targets = EnumSet.of(NodeId.ESCALATION, NodeId.FINALIZE);
    targets.addAll(agentRouter.targets());
    return targets;
  }

  @Override
  public NodeId route(ConversationState state) {
    if (state.getControl().isShouldEscalate()) {
      return NodeId.ESCALATION;
    }
    if (state.hasFinalResponse() && state.getControl().isResponseReady()) {
      return NodeId.FINALIZE;
    }
    if (state.getNextAgent() != null
      && !Objects.equals(state.getNextAgent(), state.getCurrentAgent())) {
      // 交接只在迭代次数未达上限时生效
      if (state.iterationLimitReached()) {
        return NodeId.ESCALATION;
      }
      return agentRouter.route(state);
    }
    if (state.hasFinalResponse()) {
      return NodeId.FINALIZE;
    }
    return NodeId.GENERAL;
  }
}
