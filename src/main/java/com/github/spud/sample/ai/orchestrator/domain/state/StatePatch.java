package com.github.spud.sample.ai.orchestrator.domain.state;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 节点返回的部分状态更新。
 * <p>
 * null 表示该字段未返回（保持原值）。messages / agentTrace / errors 为追加字段，
 * 返回时必须是「原序列 + 新增元素」的完整序列。
 */
@Value
@Builder(toBuilder = true)
public class StatePatch {

  List<ChatMessage> messages;
  List<AgentTraceEntry> agentTrace;
  List<String> errors;

  ControlPatch control;

  String currentAgent;
  String nextAgent;
  String handoffReason;
  String finalResponse;

  Intent detectedIntent;
  List<DetectedSignal> detectedSignals;
  Integer scoreChange;
  ExtractedData extractedData;
  BookingResult bookingResult;

  Integer tokensUsed;
  Instant processingStartedAt;
  Long processingTimeMs;

  public static StatePatch empty() {
    return StatePatch.builder().build();
  }

  public boolean escalates() {
    return control != null && control.requestsEscalation();
  }

  public boolean hasFinalResponse() {
    return finalResponse != null;
  }

  public boolean hasHandoff() {
    return nextAgent != null;
  }
}
