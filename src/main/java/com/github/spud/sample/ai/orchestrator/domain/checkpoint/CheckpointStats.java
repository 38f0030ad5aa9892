package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Builder
public class CheckpointStats {

  long totalCheckpoints;
  long totalThreads;
  Instant oldestCheckpoint;
  Instant newestCheckpoint;

  public static CheckpointStats empty() {
    return CheckpointStats.builder().build();
  }
}
