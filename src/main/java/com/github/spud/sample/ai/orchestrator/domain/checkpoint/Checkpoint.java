package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 持久化快照。同一线程的检查点通过 parentCheckpointId 形成链，但「最新」只按创建时间判断
 */
@Value
@Builder
public class Checkpoint {

  String id;
  Instant ts;

  /**
   * ConversationState 的可序列化投影，见 {@link CheckpointStateCodec}
   */
  ObjectNode channelValues;

  @Builder.Default
  Map<String, Integer> channelVersions = Map.of();

  String parentCheckpointId;
}
