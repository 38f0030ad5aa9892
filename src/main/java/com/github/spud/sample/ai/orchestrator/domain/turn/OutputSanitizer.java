package com.github.spud.sample.ai.orchestrator.domain.turn;

/**
 * 最终回复发给客户前的过滤
 */
public interface OutputSanitizer {

  SanitizationResult sanitize(String tenantId, String text);
}
