package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StateMerger;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * 入口节点：保留已有消息并追加本轮的用户消息，迭代计数归零
 */
@Component
public class InitializeNode implements GraphNode {

  @Override
  public NodeId id() {
    return NodeId.INITIALIZE;
  }

  @Override
  public StatePatch execute(ConversationState state) {
    String message = state.getCurrentMessage();
    if (message == null || message.isBlank()) {
      throw new IllegalStateException("current_message is empty");
    }
    return StatePatch.builder()
      .messages(StateMerger.appended(state.getMessages(), ChatMessage.human(message)))
      .processingStartedAt(Instant.now())
      .control(ControlPatch.builder().iterationCount(0).build())
      .build();
  }
}
