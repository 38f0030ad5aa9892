package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.util.EnumMap;
import java.util.Map;

/**
 * 组装节点与边并在 {@link #compile()} 时一次性校验。
 * <p>
 * 所有路由可能的返回值都必须对应已注册节点，缺失映射是启动期错误而不是运行期错误。
 */
public class GraphBuilder {

  private final Map<NodeId, GraphNode> nodes = new EnumMap<>(NodeId.class);
  private final Map<NodeId, Transition> transitions = new EnumMap<>(NodeId.class);
  private NodeId entry;

  public GraphBuilder addNode(GraphNode node) {
    if (nodes.putIfAbsent(node.id(), node) != null) {
      throw new GraphDefinitionException("Node registered twice: " + node.id());
    }
    return this;
  }

  public GraphBuilder entry(NodeId entry) {
    this.entry = entry;
    return this;
  }

  public GraphBuilder edge(NodeId from, NodeId to) {
    return transition(from, Transition.to(to));
  }

  public GraphBuilder conditionalEdge(NodeId from, Router router) {
    return transition(from, Transition.route(router));
  }

  public GraphBuilder end(NodeId from) {
    return transition(from, Transition.end());
  }

  private GraphBuilder transition(NodeId from, Transition transition) {
    if (transitions.putIfAbsent(from, transition) != null) {
      throw new GraphDefinitionException("Node has more than one outgoing transition: " + from);
    }
    return this;
  }

  public CompiledGraph compile() {
    if (entry == null) {
      throw new GraphDefinitionException("Graph has no entry node");
    }
    if (!nodes.containsKey(entry)) {
      throw new GraphDefinitionException("Entry node is not registered: " + entry);
    }

    for (NodeId id : nodes.keySet()) {
      if (!transitions.containsKey(id)) {
        throw new GraphDefinitionException("Node has no outgoing transition: " + id);
      }
    }

    boolean hasEnd = false;
    for (Map.Entry<NodeId, Transition> e : transitions.entrySet()) {
      NodeId from = e.getKey();
      Transition transition = e.getValue();
      if (!nodes.containsKey(from)) {
        throw new GraphDefinitionException("Transition declared for unregistered node: " + from);
      }
      if (transition.isEnd()) {
        if (from == NodeId.ESCALATION) {
          throw new GraphDefinitionException("escalation must flow to finalize, it cannot end the graph");
        }
        hasEnd = true;
        continue;
      }
      if (transition.isConditional() && transition.getRouter().targets().isEmpty()) {
        throw new GraphDefinitionException(
          "Router " + transition.getRouter().name() + " on " + from + " declares no targets");
      }
      for (NodeId target : transition.possibleTargets()) {
        if (!nodes.containsKey(target)) {
          throw new GraphDefinitionException(String.format(
            "Transition %s on %s can reach unregistered node %s", transition, from, target));
        }
      }
    }
    if (!hasEnd) {
      throw new GraphDefinitionException("Graph has no terminal node");
    }

    return new CompiledGraph(entry, nodes, transitions);
  }
}
