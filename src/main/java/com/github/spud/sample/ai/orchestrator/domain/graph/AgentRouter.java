package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * next_agent -> 专家节点。缺失或未知的名字回落到 general，不让本轮失败
 */
@Slf4j
@Component
public class AgentRouter implements Router {

  private static final Map<NodeId, NodeId> TABLE;

  static {
    Map<NodeId, NodeId> table = new EnumMap<>(NodeId.class);
    for (NodeId specialist : NodeId.specialists()) {
      table.put(specialist, specialist);
    }
    TABLE = Collections.unmodifiableMap(table);
  }

  @Override
  public String name() {
    return "agentRouter";
  }

  @Override
  public Set<NodeId> targets() {
    return NodeId.specialists();
  }

  @Override
  public NodeId route(ConversationState state) {
    String requested = state.getNextAgent();
    NodeId target = NodeId.fromName(requested).map(TABLE::get).orElse(null);
    if (target == null) {
      log.debug("Unknown next_agent '{}', falling back to {}", requested, NodeId.GENERAL);
      return NodeId.GENERAL;
    }
    return target;
  }
}
