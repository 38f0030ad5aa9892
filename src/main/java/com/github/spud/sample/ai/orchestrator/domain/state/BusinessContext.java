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
 * 业务数据（服务、分店、FAQ、评分规则），由外部加载后注入
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BusinessContext {

  @Builder.Default
  private List<Service> services = new ArrayList<>();

  @Builder.Default
  private List<Branch> branches = new ArrayList<>();

  @Builder.Default
  private List<Faq> faqs = new ArrayList<>();

  @Builder.Default
  private List<ScoringRule> scoringRules = new ArrayList<>();

  public boolean hasBranches() {
    return branches != null && !branches.isEmpty();
  }

  public boolean hasFaqs() {
    return faqs != null && !faqs.isEmpty();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Service {

    private String id;
    private String name;
    private String description;
    private Double priceMin;
    private Double priceMax;
    private String currency;
    private Integer durationMinutes;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Branch {

    private String id;
    private String name;
    private String address;
    private String city;
    private String phone;
    private String googleMapsUrl;
    private String openingHours;
    private boolean headquarters;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Faq {

    private String question;
    private String answer;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ScoringRule {

    private String signalName;
    private int points;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();
  }
}
