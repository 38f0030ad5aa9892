package com.github.spud.sample.ai.orchestrator.domain.turn;

import java.util.EnumSet;
import java.util.Set;

/**
 * 一轮对话的生命周期状态，仅用于观测，路由不依赖它
 */
public enum TurnLifecycleState {
  RECEIVED,
  LOADING,
  RUNNING,
  PERSISTING,
  COMPLETED,
  REPLAYED,
  RECOVERING,
  RECOVERED,
  FAILED,
  REJECTED;

  private static final Set<TurnLifecycleState> FINAL_STATES =
    EnumSet.of(COMPLETED, REPLAYED, RECOVERED, FAILED, REJECTED);

  public static boolean isFinal(TurnLifecycleState state) {
    return FINAL_STATES.contains(state);
  }
}
