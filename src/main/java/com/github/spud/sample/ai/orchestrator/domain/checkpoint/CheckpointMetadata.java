package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 诊断用元数据，不影响正确性
 */
@Value
@Builder
public class CheckpointMetadata {

  /**
   * 写入该检查点的节点名
   */
  String source;

  /**
   * 写入时的 iteration_count
   */
  int step;

  /**
   * namespace -> 父检查点 ID
   */
  @Builder.Default
  Map<String, String> parents = Map.of();
}
