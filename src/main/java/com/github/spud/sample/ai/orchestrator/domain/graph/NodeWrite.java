package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import lombok.Value;

/**
 * 一个节点在某一步产生的写入
 */
@Value
public class NodeWrite {

  NodeId node;
  int step;
  StatePatch patch;
}
