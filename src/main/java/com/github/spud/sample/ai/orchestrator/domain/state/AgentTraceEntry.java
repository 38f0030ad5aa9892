package com.github.spud.sample.ai.orchestrator.domain.state;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * 节点访问记录，每访问一个节点追加一条
 */
@Value
@Builder(toBuilder = true)
public class AgentTraceEntry {

  String agentName;
  Instant startedAt;

  /**
   * 节点耗时，节点执行完成后才有值
   */
  Long durationMs;
}
