package com.github.spud.sample.ai.orchestrator.domain.llm;

/**
 * 专家节点调用的 LLM 协作方。超时等由实现方负责
 */
public interface LlmClient {

  LlmReply complete(LlmRequest request);
}
