package com.github.spud.sample.ai.orchestrator.domain.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ControlNodesTest {

  @Test
  void initializeShouldAppendHumanMessageAndResetIterations() {
    ConversationState state = TestStates.state("hola de nuevo").toBuilder()
      .messages(List.of(ChatMessage.human("hola"), ChatMessage.assistant("Bienvenida")))
      .control(ControlFlags.builder().iterationCount(3).build())
      .build();

    StatePatch patch = new InitializeNode().execute(state);

    assertThat(patch.getMessages()).hasSize(3);
    assertThat(patch.getMessages().get(2)).isEqualTo(ChatMessage.human("hola de nuevo"));
    assertThat(patch.getControl().getIterationCount()).isZero();
    assertThat(patch.getProcessingStartedAt()).isNotNull();
  }

  @Test
  void initializeShouldRejectBlankMessage() {
    assertThatThrownBy(() -> new InitializeNode().execute(TestStates.state("  ")))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void finalizeShouldAppendAssistantMessage() {
    ConversationState state = TestStates.initialized("hola").toBuilder()
      .finalResponse("Hola Ana")
      .processingStartedAt(Instant.now().minusMillis(20))
      .build();

    StatePatch patch = new FinalizeNode().execute(state);

    assertThat(patch.getMessages()).containsExactly(
      ChatMessage.human("hola"), ChatMessage.assistant("Hola Ana"));
    assertThat(patch.getControl().getResponseReady()).isTrue();
    assertThat(patch.getProcessingTimeMs()).isGreaterThanOrEqualTo(0L);
  }

  @Test
  void finalizeShouldNotAppendWithoutResponse() {
    StatePatch patch = new FinalizeNode().execute(TestStates.initialized("hola"));

    assertThat(patch.getMessages()).isNull();
    assertThat(patch.getProcessingTimeMs()).isNull();
  }

  @Test
  void escalationShouldKeepExistingReason() {
    ConversationState state = TestStates.initialized("asesor").toBuilder()
      .control(ControlFlags.builder().shouldEscalate(true)
        .escalationReason("Customer asked to talk to a human").build())
      .build();

    StatePatch patch = TestStates.escalationNode().execute(state);

    assertThat(patch.getFinalResponse()).isEqualTo(TestStates.ESCALATION_TEXT);
    assertThat(patch.getControl().getEscalationReason()).isEqualTo("Customer asked to talk to a human");
    assertThat(patch.getControl().getShouldEscalate()).isTrue();
  }

  @Test
  void escalationShouldReportIterationLimit() {
    ConversationState state = TestStates.initialized("hola").toBuilder()
      .control(ControlFlags.builder().iterationCount(5).maxIterations(5).build())
      .build();

    StatePatch patch = TestStates.escalationNode().execute(state);

    assertThat(patch.getControl().getEscalationReason()).isEqualTo("Max iterations reached (5/5)");
  }

  @Test
  void escalationShouldUseGenericReason() {
    StatePatch patch = TestStates.escalationNode().execute(TestStates.initialized("hola"));

    assertThat(patch.getControl().getEscalationReason()).isEqualTo("Escalated to a human agent");
  }
}
