package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * control 的部分更新，null 字段表示不修改
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ControlPatch {

  Integer iterationCount;
  Integer maxIterations;
  Boolean shouldEscalate;
  String escalationReason;
  Boolean responseReady;

  public static ControlPatch escalate(String reason) {
    return ControlPatch.builder().shouldEscalate(true).escalationReason(reason).build();
  }

  public static ControlPatch responseReady() {
    return ControlPatch.builder().responseReady(true).build();
  }

  public boolean requestsEscalation() {
    return Boolean.TRUE.equals(shouldEscalate);
  }
}
