package com.github.spud.sample.ai.orchestrator.domain.turn;

/**
 * 租户或业务上下文无法加载，本轮在任何节点运行前中止
 */
public class ContextLoadException extends RuntimeException {

  public ContextLoadException(String message) {
    super(message);
  }
}
