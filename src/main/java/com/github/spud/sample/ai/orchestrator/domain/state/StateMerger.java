package com.github.spud.sample.ai.orchestrator.domain.state;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 将节点补丁合并到状态上。
 * <pre>
 * 合并策略:
 *   messages / agentTrace / errors  追加：补丁必须以原序列为前缀
 *   control                         逐字段合并
 *   其他字段                         按键替换，null 表示不修改
 * </pre>
 */
@Component
public class StateMerger {

  public ConversationState apply(ConversationState state, StatePatch patch) {
    if (patch == null) {
      return state;
    }
    ConversationState.ConversationStateBuilder builder = state.toBuilder();

    if (patch.getMessages() != null) {
      builder.messages(extend("messages", state.getMessages(), patch.getMessages()));
    }
    if (patch.getAgentTrace() != null) {
      builder.agentTrace(extend("agent_trace", state.getAgentTrace(), patch.getAgentTrace()));
    }
    if (patch.getErrors() != null) {
      builder.errors(extend("errors", state.getErrors(), patch.getErrors()));
    }
    if (patch.getControl() != null) {
      builder.control(mergeControl(state.getControl(), patch.getControl()));
    }

    if (patch.getCurrentAgent() != null) {
      builder.currentAgent(patch.getCurrentAgent());
    }
    if (patch.getNextAgent() != null) {
      builder.nextAgent(patch.getNextAgent());
    }
    if (patch.getHandoffReason() != null) {
      builder.handoffReason(patch.getHandoffReason());
    }
    if (patch.getFinalResponse() != null) {
      builder.finalResponse(patch.getFinalResponse());
    }
    if (patch.getDetectedIntent() != null) {
      builder.detectedIntent(patch.getDetectedIntent());
    }
    if (patch.getDetectedSignals() != null) {
      builder.detectedSignals(List.copyOf(patch.getDetectedSignals()));
    }
    if (patch.getScoreChange() != null) {
      builder.scoreChange(patch.getScoreChange());
    }
    if (patch.getExtractedData() != null) {
      builder.extractedData(patch.getExtractedData());
    }
    if (patch.getBookingResult() != null) {
      builder.bookingResult(patch.getBookingResult());
    }
    if (patch.getTokensUsed() != null) {
      builder.tokensUsed(patch.getTokensUsed());
    }
    if (patch.getProcessingStartedAt() != null) {
      builder.processingStartedAt(patch.getProcessingStartedAt());
    }
    if (patch.getProcessingTimeMs() != null) {
      builder.processingTimeMs(patch.getProcessingTimeMs());
    }
    return builder.build();
  }

  /**
   * 便捷方法：构造「原序列 + 新元素」供节点返回
   */
  public static <T> List<T> appended(List<T> current, T element) {
    ArrayList<T> result = new ArrayList<>(current.size() + 1);
    result.addAll(current);
    result.add(element);
    return result;
  }

  private ControlFlags mergeControl(ControlFlags current, ControlPatch patch) {
    ControlFlags.ControlFlagsBuilder builder = current.toBuilder();
    if (patch.getIterationCount() != null) {
      builder.iterationCount(patch.getIterationCount());
    }
    if (patch.getMaxIterations() != null) {
      builder.maxIterations(patch.getMaxIterations());
    }
    if (patch.getShouldEscalate() != null) {
      builder.shouldEscalate(patch.getShouldEscalate());
    }
    if (patch.getEscalationReason() != null) {
      builder.escalationReason(patch.getEscalationReason());
    }
    if (patch.getResponseReady() != null) {
      builder.responseReady(patch.getResponseReady());
    }
    return builder.build();
  }

  private <T> List<T> extend(String field, List<T> current, List<T> proposed) {
    if (proposed.size() < current.size()) {
      throw new StateMergeException(String.format(
        "Patch would shrink append-only field '%s' from %d to %d entries",
        field, current.size(), proposed.size()));
    }
    for (int i = 0; i < current.size(); i++) {
      if (!current.get(i).equals(proposed.get(i))) {
        throw new StateMergeException(String.format(
          "Patch would rewrite entry %d of append-only field '%s'", i, field));
      }
    }
    return List.copyOf(proposed);
  }
}
