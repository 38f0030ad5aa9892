package com.github.spud.sample.ai.orchestrator.domain.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评分信号：命中的规则名与分值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectedSignal {

  private String signal;
  private int points;
}
