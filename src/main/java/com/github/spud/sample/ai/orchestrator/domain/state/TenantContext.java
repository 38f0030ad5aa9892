package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 租户上下文，每轮开始时注入，节点只读
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TenantContext {

  private String tenantId;
  private String tenantName;
  private Vertical vertical;
  private String timezone;
  private AiConfig aiConfig;

  public Vertical verticalOrDefault() {
    return vertical != null ? vertical : Vertical.GENERAL;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class AiConfig {

    private String systemPrompt;
    private String responseStyle;

    /**
     * 租户级最大迭代次数，为空时使用全局默认值
     */
    private Integer maxIterations;

    @Builder.Default
    private List<String> autoEscalateKeywords = new ArrayList<>();
  }
}
