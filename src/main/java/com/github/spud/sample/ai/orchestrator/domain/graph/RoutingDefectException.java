package com.github.spud.sample.ai.orchestrator.domain.graph;

/**
 * 路由缺陷：路由返回了未声明/未注册的节点，或超过步数上限
 */
public class RoutingDefectException extends RuntimeException {

  public RoutingDefectException(String message) {
    super(message);
  }
}
