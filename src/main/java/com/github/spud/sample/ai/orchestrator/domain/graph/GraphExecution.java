package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * 一次图执行的结果
 */
@Value
public class GraphExecution {

  ConversationState finalState;
  List<NodeId> path;
  List<NodeWrite> writes;
  int steps;

  public List<String> agentsUsed() {
    Set<String> names = path.stream()
      .map(NodeId::nodeName)
      .collect(Collectors.toCollection(LinkedHashSet::new));
    return List.copyOf(names);
  }

  public NodeId lastNode() {
    return path.isEmpty() ? null : path.get(path.size() - 1);
  }
}
