package com.github.spud.sample.ai.orchestrator.domain.graph;

/**
 * 节点返回值违反约定（专家节点必须恰好给出一种结果）
 */
public class NodeContractViolationException extends RuntimeException {

  public NodeContractViolationException(String message) {
    super(message);
  }
}
