package com.github.spud.sample.ai.orchestrator.domain.turn;

public enum TurnLifecycleEvent {
  START,
  CONTEXT_READY,
  GRAPH_DONE,
  PERSISTED,
  REPLAY,
  TRANSIENT_FAILURE,
  RECOVERED,
  FAIL,
  REJECT
}
