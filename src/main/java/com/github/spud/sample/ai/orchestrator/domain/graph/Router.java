package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.Set;

/**
 * 路由函数：根据当前状态决定下一个节点。必须是纯函数
 */
public interface Router {

  String name();

  /**
   * 该路由可能返回的全部节点，编译图时校验
   */
  Set<NodeId> targets();

  NodeId route(ConversationState state);
}
