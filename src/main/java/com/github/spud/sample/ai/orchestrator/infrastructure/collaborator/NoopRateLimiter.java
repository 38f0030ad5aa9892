package com.github.spud.sample.ai.orchestrator.infrastructure.collaborator;

import com.github.spud.sample.ai.orchestrator.domain.turn.RateLimitDecision;
import com.github.spud.sample.ai.orchestrator.domain.turn.RateLimiter;

/**
 * 默认不限流，部署时由外部限流服务替换
 */
public class NoopRateLimiter implements RateLimiter {

  @Override
  public RateLimitDecision check(String tenantId) {
    return RateLimitDecision.allow();
  }
}
