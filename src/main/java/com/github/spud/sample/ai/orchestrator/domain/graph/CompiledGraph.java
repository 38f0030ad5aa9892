package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 编译后的图。构造后只读，可在并发的轮次之间共享；所有可变状态都在每轮的 ConversationState 中
 */
public final class CompiledGraph {

  private final NodeId entry;
  private final Map<NodeId, GraphNode> nodes;
  private final Map<NodeId, Transition> transitions;

  CompiledGraph(NodeId entry, Map<NodeId, GraphNode> nodes, Map<NodeId, Transition> transitions) {
    this.entry = entry;
    this.nodes = Collections.unmodifiableMap(new EnumMap<>(nodes));
    this.transitions = Collections.unmodifiableMap(new EnumMap<>(transitions));
  }

  public NodeId entry() {
    return entry;
  }

  public GraphNode node(NodeId id) {
    GraphNode node = nodes.get(id);
    if (node == null) {
      throw new RoutingDefectException("No node registered for " + id);
    }
    return node;
  }

  public Transition transition(NodeId id) {
    return transitions.get(id);
  }

  public boolean contains(NodeId id) {
    return nodes.containsKey(id);
  }

  public Set<NodeId> nodeIds() {
    return nodes.keySet();
  }
}
