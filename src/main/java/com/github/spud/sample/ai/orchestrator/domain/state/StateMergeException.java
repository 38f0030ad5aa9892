package com.github.spud.sample.ai.orchestrator.domain.state;

/**
 * 补丁试图缩短或重排追加字段时抛出，属于内部致命错误
 */
public class StateMergeException extends RuntimeException {

  public StateMergeException(String message) {
    super(message);
  }
}
