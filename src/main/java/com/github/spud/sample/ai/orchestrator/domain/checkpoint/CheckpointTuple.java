package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CheckpointTuple {

  String threadId;
  String namespace;
  Checkpoint checkpoint;
  CheckpointMetadata metadata;
  Instant createdAt;
}
