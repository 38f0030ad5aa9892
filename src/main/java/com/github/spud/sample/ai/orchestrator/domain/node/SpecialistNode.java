package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmReply;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmRequest;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import com.github.spud.sample.ai.orchestrator.domain.state.TenantContext;
import java.util.List;
import java.util.Optional;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 专家节点基类。
 * <p>
 * 每次执行恰好产生一种结果：<p> - 交接：{next_agent, handoff_reason}<p> - 升级：{should_escalate, escalation_reason}<p> -
 * 回复：{final_response, response_ready}，由 LLM 生成<p>
 */
@Slf4j
public abstract class SpecialistNode implements GraphNode {

  private final NodeId id;
  protected final LlmClient llmClient;

  protected SpecialistNode(NodeId id, LlmClient llmClient) {
    this.id = id;
    this.llmClient = llmClient;
  }

  @Override
  public NodeId id() {
    return id;
  }

  @Override
  public final StatePatch execute(ConversationState state) {
    Optional<Handoff> handoff = checkHandoff(state);
    if (handoff.isPresent()) {
      log.debug("[{}] handoff to {}: {}", id, handoff.get().getTarget(), handoff.get().getReason());
      return StatePatch.builder()
        .nextAgent(handoff.get().getTarget())
        .handoffReason(handoff.get().getReason())
        .build();
    }

    Optional<String> escalation = checkEscalation(state);
    if (escalation.isPresent()) {
      return StatePatch.builder()
        .control(ControlPatch.escalate(escalation.get()))
        .build();
    }

    LlmReply reply = llmClient.complete(LlmRequest.builder()
      .agentName(id.nodeName())
      .systemPrompt(basePrompt(state) + "\n\n" + instructions(state))
      .history(history(state))
      .userMessage(state.getCurrentMessage())
      .build());
    if (reply == null || reply.getText() == null || reply.getText().isBlank()) {
      throw new IllegalStateException("LLM returned an empty reply for " + id);
    }

    StatePatch.StatePatchBuilder patch = StatePatch.builder()
      .finalResponse(reply.getText().trim())
      .control(ControlPatch.responseReady())
      .tokensUsed(state.getTokensUsed() + Math.max(0, reply.getTokensUsed()));
    return enrich(patch, state).build();
  }

  /**
   * 执行前检查是否应交给其他专家，默认不交接
   */
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    return Optional.empty();
  }

  /**
   * 执行前检查是否应直接升级，默认不升级
   */
  protected Optional<String> checkEscalation(ConversationState state) {
    return Optional.empty();
  }

  /**
   * 该专家的系统提示词（业务数据部分）
   */
  protected abstract String instructions(ConversationState state);

  /**
   * 在回复结果上附加额外字段
   */
  protected StatePatch.StatePatchBuilder enrich(StatePatch.StatePatchBuilder patch,
    ConversationState state) {
    return patch;
  }

  protected static Optional<Handoff> handoffTo(NodeId target, String reason) {
    return Optional.of(new Handoff(target.nodeName(), reason));
  }

  protected static Optional<Handoff> handoffTo(String target, String reason) {
    return Optional.of(new Handoff(target, reason));
  }

  private String basePrompt(ConversationState state) {
    TenantContext tenant = state.getTenant();
    if (tenant != null && tenant.getAiConfig() != null
      && tenant.getAiConfig().getSystemPrompt() != null) {
      return tenant.getAiConfig().getSystemPrompt();
    }
    String name = tenant != null && tenant.getTenantName() != null ? tenant.getTenantName() : "the business";
    return "You are the customer assistant of " + name + ". Reply briefly in the customer's language.";
  }

  /**
   * 历史消息，不含本轮刚追加的用户消息
   */
  private List<ChatMessage> history(ConversationState state) {
    List<ChatMessage> messages = state.getMessages();
    if (messages.isEmpty()) {
      return messages;
    }
    ChatMessage last = messages.get(messages.size() - 1);
    if (last.getRole() == ChatMessage.Role.HUMAN
      && last.getContent() != null && last.getContent().equals(state.getCurrentMessage())) {
      return messages.subList(0, messages.size() - 1);
    }
    return messages;
  }

  @Value
  public static class Handoff {

    String target;
    String reason;
  }
}
