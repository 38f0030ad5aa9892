package com.github.spud.sample.ai.orchestrator.support;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 行为由测试脚本决定的节点
 */
public class ScriptedNode implements GraphNode {

  @FunctionalInterface
  public interface Script {

    StatePatch run(ConversationState state) throws Exception;
  }

  private final NodeId id;
  private final Script script;
  private final AtomicInteger invocations = new AtomicInteger();

  public ScriptedNode(NodeId id, Script script) {
    this.id = id;
    this.script = script;
  }

  @Override
  public NodeId id() {
    return id;
  }

  @Override
  public StatePatch execute(ConversationState state) throws Exception {
    invocations.incrementAndGet();
    return script.run(state);
  }

  public int invocations() {
    return invocations.get();
  }
}
