package com.github.spud.sample.ai.orchestrator.domain.turn;

/**
 * 死信队列，接收硬失败的轮次供离线排查或重试
 */
public interface DeadLetterSink {

  void send(DeadLetterEntry entry);
}
