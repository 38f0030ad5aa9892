package com.github.spud.sample.ai.orchestrator.domain.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmRequest;
import com.github.spud.sample.ai.orchestrator.domain.state.BusinessContext;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import com.github.spud.sample.ai.orchestrator.domain.state.Vertical;
import com.github.spud.sample.ai.orchestrator.support.StubLlmClient;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SpecialistNodesTest {

  private StubLlmClient llm;

  @BeforeEach
  void setUp() {
    llm = new StubLlmClient();
  }

  @Test
  void shouldReplyWithLlmTextAndAccumulateTokens() {
    llm.replyWith("  Hola Ana, ¿en qué te ayudo?  ", 42);
    ConversationState state = TestStates.initialized("hola").toBuilder().tokensUsed(8).build();

    StatePatch patch = new GreetingNode(llm).execute(state);

    assertThat(patch.getFinalResponse()).isEqualTo("Hola Ana, ¿en qué te ayudo?");
    assertThat(patch.getControl().getResponseReady()).isTrue();
    assertThat(patch.getTokensUsed()).isEqualTo(50);
    assertThat(patch.hasHandoff()).isFalse();
  }

  @Test
  void shouldSendTenantPromptAndHistoryWithoutCurrentMessage() {
    ConversationState state = TestStates.state("y el precio?").toBuilder()
      .messages(List.of(
        ChatMessage.human("hola"),
        ChatMessage.assistant("Hola, bienvenida"),
        ChatMessage.human("y el precio?")))
      .build();

    new GeneralNode(llm).execute(state);

    LlmRequest request = llm.getRequests().get(0);
    assertThat(request.getAgentName()).isEqualTo("general");
    assertThat(request.getSystemPrompt()).startsWith("Eres el asistente de Clinica Sonrisa.");
    assertThat(request.getHistory()).extracting(ChatMessage::getContent)
      .containsExactly("hola", "Hola, bienvenida");
    assertThat(request.getUserMessage()).isEqualTo("y el precio?");
  }

  @Test
  void shouldHandOffPricingToVerticalBooking() {
    StatePatch patch = new PricingNode(llm)
      .execute(TestStates.initialized("Cuanto cuesta? quiero agendar una cita"));

    assertThat(patch.getNextAgent()).isEqualTo("booking_dental");
    assertThat(patch.getHandoffReason()).isNotBlank();
    assertThat(llm.calls()).isZero();
  }

  @Test
  void shouldAnswerPricingWithServiceList() {
    new PricingNode(llm).execute(TestStates.initialized("Cuanto cuesta la limpieza?"));

    assertThat(llm.getRequests().get(0).getSystemPrompt()).contains("Limpieza dental");
  }

  @Test
  void shouldEscalateUrgentCareOnHighPain() {
    ConversationState state = TestStates.initialized("tengo mucho dolor").toBuilder()
      .extractedData(ExtractedData.builder().painLevel(5).build())
      .build();

    StatePatch patch = new UrgentCareNode(llm).execute(state);

    assertThat(patch.escalates()).isTrue();
    assertThat(patch.getControl().getEscalationReason()).contains("Pain level 5");
    assertThat(llm.calls()).isZero();
  }

  @Test
  void shouldReplyUrgentCareOnMildPain() {
    ConversationState state = TestStates.initialized("tengo una molestia leve").toBuilder()
      .extractedData(ExtractedData.builder().painLevel(1).build())
      .build();

    StatePatch patch = new UrgentCareNode(llm).execute(state);

    assertThat(patch.escalates()).isFalse();
    assertThat(patch.getFinalResponse()).isEqualTo("[urgent_care] ok");
  }

  @Test
  void shouldHandOffOrderingOutsideRestaurants() {
    StatePatch patch = new OrderingNode(llm).execute(TestStates.initialized("quiero pedir"));

    assertThat(patch.getNextAgent()).isEqualTo("general");
  }

  @Test
  void shouldTakeOrderForRestaurant() {
    ConversationState state = TestStates.state("quiero pedir", Vertical.RESTAURANT).toBuilder()
      .messages(List.of(ChatMessage.human("quiero pedir")))
      .build();

    StatePatch patch = new OrderingNode(llm).execute(state);

    assertThat(patch.getFinalResponse()).isEqualTo("[ordering_restaurant] ok");
  }

  @Test
  void shouldBookHeadquartersWithExtractedPreferences() {
    ConversationState state = TestStates.initialized("quiero una cita mañana temprano").toBuilder()
      .extractedData(ExtractedData.builder().preferredDate("tomorrow").preferredTime("morning").build())
      .build();

    StatePatch patch = new BookingNode(NodeId.BOOKING_DENTAL, llm).execute(state);

    assertThat(patch.getBookingResult().getBranchId()).isEqualTo("br-1");
    assertThat(patch.getBookingResult().getBranchName()).isEqualTo("Matriz");
    assertThat(patch.getBookingResult().getPreferredDate()).isEqualTo("tomorrow");
    assertThat(patch.getBookingResult().getPreferredTime()).isEqualTo("morning");
    assertThat(patch.getBookingResult().getStatus()).isEqualTo("PENDING_CONFIRMATION");
  }

  @Test
  void shouldHandOffBookingWithoutBranches() {
    ConversationState state = TestStates.initialized("quiero una cita").toBuilder()
      .business(BusinessContext.builder().build())
      .build();

    StatePatch patch = new BookingNode(NodeId.BOOKING_MEDICAL, llm).execute(state);

    assertThat(patch.getNextAgent()).isEqualTo("general");
  }

  @Test
  void shouldRejectNonBookingId() {
    assertThatThrownBy(() -> new BookingNode(NodeId.PRICING, llm))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldFailOnBlankLlmReply() {
    llm.replyWith("   ", 3);

    assertThatThrownBy(() -> new FaqNode(llm).execute(TestStates.initialized("aceptan tarjeta?")))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("empty reply");
  }
}
