package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LeadContext {

  private String leadId;
  private String name;
  private String phone;
  private String email;
  private int score;
  private String classification;
  private boolean returningCustomer;
}
