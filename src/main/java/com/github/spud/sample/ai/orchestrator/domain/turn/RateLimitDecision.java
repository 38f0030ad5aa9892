package com.github.spud.sample.ai.orchestrator.domain.turn;

import lombok.Value;

@Value
public class RateLimitDecision {

  boolean allowed;
  long retryAfterMs;

  public static RateLimitDecision allow() {
    return new RateLimitDecision(true, 0);
  }

  public static RateLimitDecision deny(long retryAfterMs) {
    return new RateLimitDecision(false, retryAfterMs);
  }
}
