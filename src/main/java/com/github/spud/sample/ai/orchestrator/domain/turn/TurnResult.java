package com.github.spud.sample.ai.orchestrator.domain.turn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.sample.ai.orchestrator.domain.state.BookingResult;
import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一轮对话的输出。任何致命情况下也会带一个可直接发给客户的兜底回复
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnResult {

  private boolean success;
  private String response;
  private Intent intent;

  @Builder.Default
  private List<DetectedSignal> signals = new ArrayList<>();

  private int scoreChange;
  private boolean escalated;
  private String escalationReason;
  private int tokensUsed;
  private long processingTimeMs;

  @Builder.Default
  private List<String> agentsUsed = new ArrayList<>();

  private BookingResult bookingResult;

  @Builder.Default
  private List<String> errors = new ArrayList<>();

  /**
   * 本轮在瞬时错误后由检查点恢复
   */
  private boolean recovered;

  /**
   * 本轮直接重放了检查点中的回复，未执行任何节点
   */
  private boolean replayed;

  private TurnLifecycleState turnState;

  private String checkpointId;
}
