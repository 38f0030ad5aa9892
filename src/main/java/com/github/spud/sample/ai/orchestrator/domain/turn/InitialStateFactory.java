package com.github.spud.sample.ai.orchestrator.domain.turn;

import com.github.spud.sample.ai.orchestrator.domain.state.Channel;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.TenantContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 根据请求构建本轮的初始状态
 */
@Component
public class InitialStateFactory {

  @Value("${orchestrator.graph.default-max-iterations:5}")
  private int defaultMaxIterations = 5;

  /**
   * @throws ContextLoadException 租户或业务上下文缺失
   */
  public ConversationState create(TurnRequest request) {
    if (request.getTenantContext() == null) {
      throw new ContextLoadException("Tenant context not loaded for tenant " + request.getTenantId());
    }
    if (request.getBusinessContext() == null) {
      throw new ContextLoadException("Business context not loaded for tenant " + request.getTenantId());
    }

    List<ChatMessage> history = new ArrayList<>();
    if (request.getPreviousMessages() != null) {
      request.getPreviousMessages().stream()
        .filter(Objects::nonNull)
        .filter(m -> m.getRole() != null && m.getContent() != null)
        .forEach(history::add);
    }

    return ConversationState.builder()
      .tenantId(request.getTenantId())
      .conversationId(request.getConversationId())
      .leadId(request.getLeadId())
      .channel(request.getChannel() != null ? request.getChannel() : Channel.WEBCHAT)
      .currentMessage(request.getCurrentMessage())
      .messages(List.copyOf(history))
      .control(ControlFlags.initial(maxIterations(request.getTenantContext())))
      .tenant(request.getTenantContext())
      .lead(request.getLeadContext())
      .conversation(request.getConversationContext())
      .business(request.getBusinessContext())
      .build();
  }

  private int maxIterations(TenantContext tenant) {
    if (tenant.getAiConfig() != null && tenant.getAiConfig().getMaxIterations() != null
      && tenant.getAiConfig().getMaxIterations() > 0) {
      return tenant.getAiConfig().getMaxIterations();
    }
    return defaultMaxIterations;
  }
}
