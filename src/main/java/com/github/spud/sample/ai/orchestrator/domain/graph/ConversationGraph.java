package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.util.Collection;
import lombok.experimental.UtilityClass;

/**
 * 对话图的拓扑定义
 * <pre>
 *   initialize → supervisor
 *   supervisor ──mainRouter──→ vertical_router | escalation | finalize
 *   vertical_router ──agentRouter──→ 专家节点
 *   专家节点 ──postAgentRouter──→ 专家节点 | escalation | finalize
 *   escalation → finalize
 *   finalize → END
 * </pre>
 */
@UtilityClass
public class ConversationGraph {

  public static CompiledGraph compile(Collection<? extends GraphNode> nodes, MainRouter mainRouter,
    AgentRouter agentRouter, PostAgentRouter postAgentRouter) {
    GraphBuilder builder = new GraphBuilder();
    nodes.forEach(builder::addNode);

    builder
      .entry(NodeId.INITIALIZE)
      .edge(NodeId.INITIALIZE, NodeId.SUPERVISOR)
      .conditionalEdge(NodeId.SUPERVISOR, mainRouter)
      .conditionalEdge(NodeId.VERTICAL_ROUTER, agentRouter);
    for (NodeId specialist : NodeId.specialists()) {
      builder.conditionalEdge(specialist, postAgentRouter);
    }
    return builder
      .edge(NodeId.ESCALATION, NodeId.FINALIZE)
      .end(NodeId.FINALIZE)
      .compile();
  }
}
