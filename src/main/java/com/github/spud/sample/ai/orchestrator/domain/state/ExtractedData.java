package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 从消息中抽取的结构化数据
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractedData {

  private String email;
  private String phone;
  private String preferredDate;
  private String preferredTime;

  /**
   * 疼痛等级: 5 强烈, 3 中等, 1 轻微
   */
  private Integer painLevel;

  private List<String> symptoms;
}
