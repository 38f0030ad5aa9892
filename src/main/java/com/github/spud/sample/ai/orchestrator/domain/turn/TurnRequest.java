package com.github.spud.sample.ai.orchestrator.domain.turn;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.sample.ai.orchestrator.domain.state.BusinessContext;
import com.github.spud.sample.ai.orchestrator.domain.state.Channel;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationContext;
import com.github.spud.sample.ai.orchestrator.domain.state.LeadContext;
import com.github.spud.sample.ai.orchestrator.domain.state.TenantContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一轮对话的输入
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnRequest {

  @NotBlank
  private String tenantId;

  /**
   * 同时作为检查点的 thread_id
   */
  @NotBlank
  private String conversationId;

  private String leadId;

  @NotBlank
  @Size(max = 4000)
  private String currentMessage;

  private Channel channel;

  private TenantContext tenantContext;
  private LeadContext leadContext;
  private ConversationContext conversationContext;
  private BusinessContext businessContext;

  @Builder.Default
  private List<ChatMessage> previousMessages = new ArrayList<>();

  @Valid
  @Builder.Default
  private TurnOptions options = new TurnOptions();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class TurnOptions {

    @Builder.Default
    private boolean enableCheckpointing = true;

    /**
     * 显式开启后才会从最新检查点恢复/重放
     */
    @Builder.Default
    private boolean resumeFromCheckpoint = false;
  }
}
