package com.github.spud.sample.ai.orchestrator.domain.turn;

/**
 * 租户级限流，轮次开始前调用
 */
public interface RateLimiter {

  RateLimitDecision check(String tenantId);
}
