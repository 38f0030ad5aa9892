package com.github.spud.sample.ai.orchestrator.domain.turn;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SanitizationResult {

  boolean valid;
  String sanitizedText;

  @Builder.Default
  List<String> issues = List.of();

  public static SanitizationResult passThrough(String text) {
    return SanitizationResult.builder().valid(true).sanitizedText(text).build();
  }
}
