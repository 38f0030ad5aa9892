package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.util.List;
import lombok.Getter;

/**
 * 图执行被致命错误中止，携带中止前的进度
 */
@Getter
public class GraphAbortedException extends RuntimeException {

  private final transient ConversationState partialState;
  private final List<NodeId> path;
  private final transient List<NodeWrite> writes;

  public GraphAbortedException(String message, Throwable cause, ConversationState partialState,
    List<NodeId> path, List<NodeWrite> writes) {
    super(message, cause);
    this.partialState = partialState;
    this.path = List.copyOf(path);
    this.writes = List.copyOf(writes);
  }
}
