package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StateMerger;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * 收尾：标记响应就绪、计算处理耗时，并把最终回复追加为 assistant 消息
 */
@Component
public class FinalizeNode implements GraphNode {

  @Override
  public NodeId id() {
    return NodeId.FINALIZE;
  }

  @Override
  public StatePatch execute(ConversationState state) {
    StatePatch.StatePatchBuilder patch = StatePatch.builder()
      .control(ControlPatch.responseReady());

    if (state.getProcessingStartedAt() != null) {
      patch.processingTimeMs(Duration.between(state.getProcessingStartedAt(), Instant.now()).toMillis());
    }
    if (state.hasFinalResponse()) {
      patch.messages(StateMerger.appended(state.getMessages(),
        ChatMessage.assistant(state.getFinalResponse())));
    }
    return patch.build();
  }
}
