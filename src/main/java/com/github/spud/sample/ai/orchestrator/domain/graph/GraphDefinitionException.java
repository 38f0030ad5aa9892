package com.github.spud.sample.ai.orchestrator.domain.graph;

/**
 * 图定义不合法（编译期/启动期错误）
 */
public class GraphDefinitionException extends RuntimeException {

  public GraphDefinitionException(String message) {
    super(message);
  }
}
