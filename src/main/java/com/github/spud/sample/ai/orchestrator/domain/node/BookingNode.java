package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.state.BookingResult;
import com.github.spud.sample.ai.orchestrator.domain.state.BusinessContext;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.util.Optional;

/**
 * 预约专家，每个垂直领域一个实例（booking_dental / booking_restaurant / booking_medical）。
 * 只产出待确认的预约请求，实际落库由业务系统完成
 */
public class BookingNode extends SpecialistNode {

  public BookingNode(NodeId id, LlmClient llmClient) {
    super(id, llmClient);
    if (!id.nodeName().startsWith("booking_")) {
      throw new IllegalArgumentException("Not a booking node: " + id);
    }
  }

  @Override
  protected Optional<Handoff> checkHandoff(ConversationState state) {
    if (state.getBusiness() == null || !state.getBusiness().hasBranches()) {
      return handoffTo(NodeId.GENERAL, "no branches configured for booking");
    }
    return Optional.empty();
  }

  @Override
  protected String instructions(ConversationState state) {
    return "Help the customer book. Confirm date, time and branch; say the request will be confirmed shortly.\n"
      + "Services:\n" + BusinessPrompts.services(state.getBusiness())
      + "\nBranches:\n" + BusinessPrompts.branches(state.getBusiness(), true);
  }

  @Override
  protected StatePatch.StatePatchBuilder enrich(StatePatch.StatePatchBuilder patch,
    ConversationState state) {
    BusinessContext.Branch branch = state.getBusiness().getBranches().stream()
      .filter(BusinessContext.Branch::isHeadquarters)
      .findFirst()
      .orElse(state.getBusiness().getBranches().get(0));
    ExtractedData extracted = state.getExtractedData();
    return patch.bookingResult(BookingResult.builder()
      .success(true)
      .branchId(branch.getId())
      .branchName(branch.getName())
      .preferredDate(extracted != null ? extracted.getPreferredDate() : null)
      .preferredTime(extracted != null ? extracted.getPreferredTime() : null)
      .status("PENDING_CONFIRMATION")
      .build());
  }
}
