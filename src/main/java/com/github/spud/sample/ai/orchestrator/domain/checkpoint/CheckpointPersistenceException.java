package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

/**
 * 检查点写入失败。调用方必须捕获并记录，不能让它导致本轮失败
 */
public class CheckpointPersistenceException extends RuntimeException {

  public CheckpointPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
