package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * 某个任务（节点）对某个通道的一次写入
 */
@Value
public class PendingWrite {

  String taskId;
  int idx;
  String channel;
  JsonNode value;
}
