package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 识别意图、评分信号与结构化数据，必要时直接请求升级。不设置 next_agent
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupervisorNode implements GraphNode {

  private final IntentDetector intentDetector;

  @Override
  public NodeId id() {
    return NodeId.SUPERVISOR;
  }

  @Override
  public StatePatch execute(ConversationState state) {
    String message = state.getCurrentMessage();
    Intent intent = intentDetector.detectIntent(message);
    List<DetectedSignal> signals = intentDetector.detectSignals(message, state.getBusiness());
    ExtractedData extracted = intentDetector.extract(message);
    int score = signals.stream().mapToInt(DetectedSignal::getPoints).sum();

    List<String> keywords = state.getTenant() != null && state.getTenant().getAiConfig() != null
      ? state.getTenant().getAiConfig().getAutoEscalateKeywords()
      : List.of();
    Optional<String> escalation =
      intentDetector.escalationReason(intent, signals, extracted, message, keywords);

    log.debug("Supervisor: intent={}, signals={}, score={}, escalate={}",
      intent, signals.size(), score, escalation.isPresent());

    StatePatch.StatePatchBuilder patch = StatePatch.builder()
      .detectedIntent(intent)
      .detectedSignals(signals)
      .scoreChange(score)
      .extractedData(extracted);
    escalation.ifPresent(reason -> patch.control(ControlPatch.escalate(reason)));
    return patch.build();
  }
}
