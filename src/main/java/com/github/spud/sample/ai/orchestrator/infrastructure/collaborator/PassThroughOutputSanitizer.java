package com.github.spud.sample.ai.orchestrator.infrastructure.collaborator;

import com.github.spud.sample.ai.orchestrator.domain.turn.OutputSanitizer;
import com.github.spud.sample.ai.orchestrator.domain.turn.SanitizationResult;
import java.util.List;

/**
 * 默认不过滤；空白回复视为无效
 */
public class PassThroughOutputSanitizer implements OutputSanitizer {

  @Override
  public SanitizationResult sanitize(String tenantId, String text) {
    if (text == null || text.isBlank()) {
      return SanitizationResult.builder()
        .valid(false)
        .sanitizedText(text)
        .issues(List.of("empty_response"))
        .build();
    }
    return SanitizationResult.passThrough(text);
  }
}
