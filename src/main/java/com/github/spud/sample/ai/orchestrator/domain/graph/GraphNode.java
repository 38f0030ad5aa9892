package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;

/**
 * 图中的一个节点：读取当前状态，返回部分更新
 */
public interface GraphNode {

  NodeId id();

  /**
   * 执行节点逻辑。抛出的异常由执行器捕获并降级为升级处理
   */
  StatePatch execute(ConversationState state) throws Exception;
}
