package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Value;

/**
 * 线程最新检查点的只读视图，用于监控与清理
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ThreadState {

  String threadId;
  String lastCheckpointId;
  Instant lastUpdated;
}
