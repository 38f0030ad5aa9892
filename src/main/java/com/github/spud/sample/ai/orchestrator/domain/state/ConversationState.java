package com.github.spud.sample.ai.orchestrator.domain.state;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 一轮对话在图中流转的状态。
 * <p>
 * 不可变：节点只返回 {@link StatePatch}，由 {@link StateMerger} 生成新状态。
 * 上下文引用（tenant / lead / conversation / business）在轮次开始时注入，节点不修改。
 */
@Value
@Builder(toBuilder = true)
public class ConversationState {

  String tenantId;
  String conversationId;
  String leadId;
  Channel channel;

  @Builder.Default
  List<ChatMessage> messages = List.of();

  String currentMessage;

  @Builder.Default
  ControlFlags control = ControlFlags.builder().build();

  String currentAgent;
  String nextAgent;
  String handoffReason;

  @Builder.Default
  List<AgentTraceEntry> agentTrace = List.of();

  String finalResponse;

  TenantContext tenant;
  LeadContext lead;
  ConversationContext conversation;
  BusinessContext business;

  Intent detectedIntent;

  @Builder.Default
  List<DetectedSignal> detectedSignals = List.of();

  int scoreChange;

  ExtractedData extractedData;
  BookingResult bookingResult;

  @Builder.Default
  List<String> errors = List.of();

  int tokensUsed;
  Instant processingStartedAt;
  Long processingTimeMs;

  /**
   * 当前生效的最大迭代次数，每次路由决策时重新读取：优先租户配置，其次 control 中的值
   */
  public int maxIterations() {
    if (tenant != null && tenant.getAiConfig() != null) {
      Integer configured = tenant.getAiConfig().getMaxIterations();
      if (configured != null && configured > 0) {
        return configured;
      }
    }
    return control.getMaxIterations();
  }

  public boolean iterationLimitReached() {
    return control.getIterationCount() >= maxIterations();
  }

  public boolean hasFinalResponse() {
    return finalResponse != null && !finalResponse.isEmpty();
  }

  public Vertical vertical() {
    return tenant != null ? tenant.verticalOrDefault() : Vertical.GENERAL;
  }
}
