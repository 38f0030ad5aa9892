package com.github.spud.sample.ai.orchestrator.domain.state;

import lombok.Builder;
import lombok.Value;

/**
 * 本轮的控制标志：迭代计数、升级标志、响应就绪
 */
@Value
@Builder(toBuilder = true)
public class ControlFlags {

  @Builder.Default
  int iterationCount = 0;

  @Builder.Default
  int maxIterations = 5;

  @Builder.Default
  boolean shouldEscalate = false;

  String escalationReason;

  @Builder.Default
  boolean responseReady = false;

  public static ControlFlags initial(int maxIterations) {
    return ControlFlags.builder().maxIterations(maxIterations).build();
  }
}
