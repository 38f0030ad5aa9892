package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 预约节点产生的预约结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BookingResult {

  private boolean success;
  private String appointmentId;
  private String branchId;
  private String branchName;
  private String preferredDate;
  private String preferredTime;
  private String status;
  private String error;
}
