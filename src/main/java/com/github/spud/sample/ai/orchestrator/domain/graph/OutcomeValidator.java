package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 专家节点必须恰好给出一种结果：回复、交接或升级
 */
@Component
public class OutcomeValidator {

  public void validate(NodeId node, StatePatch patch) {
    List<String> outcomes = new ArrayList<>(3);
    if (patch.hasFinalResponse()) {
      outcomes.add("final_response");
    }
    if (patch.hasHandoff()) {
      outcomes.add("next_agent");
    }
    if (patch.escalates()) {
      outcomes.add("should_escalate");
    }
    if (outcomes.size() != 1) {
      throw new NodeContractViolationException(String.format(
        "Specialist %s must return exactly one outcome but returned %s",
        node, outcomes.isEmpty() ? "none" : outcomes));
    }
  }
}
