package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.state.AgentTraceEntry;
import com.github.spud.sample.ai.orchestrator.domain.state.BookingResult;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import com.github.spud.sample.ai.orchestrator.util.JsonUtils;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CheckpointStateCodecTest {

  private final CheckpointStateCodec codec = new CheckpointStateCodec(new ObjectMapper());

  @Test
  void shouldRestorePersistedFieldsAndDropContexts() {
    Instant startedAt = Instant.parse("2025-05-01T10:00:00Z");
    ConversationState state = TestStates.state("quiero una cita").toBuilder()
      .messages(List.of(ChatMessage.human("quiero una cita"), ChatMessage.assistant("Claro")))
      .control(ControlFlags.builder().iterationCount(2).maxIterations(4)
        .shouldEscalate(true).escalationReason("High-value lead detected").responseReady(true).build())
      .agentTrace(List.of(AgentTraceEntry.builder().agentName("supervisor")
        .startedAt(startedAt).durationMs(12L).build()))
      .errors(List.of("supervisor: boom"))
      .currentAgent("booking_dental")
      .finalResponse("Claro")
      .detectedIntent(Intent.BOOK_APPOINTMENT)
      .detectedSignals(List.of(new DetectedSignal("implant_interest", 20)))
      .scoreChange(20)
      .extractedData(ExtractedData.builder().preferredDate("tomorrow").build())
      .bookingResult(BookingResult.builder().success(true).branchId("br-1").build())
      .tokensUsed(33)
      .processingTimeMs(120L)
      .build();

    ObjectNode encoded = codec.encode(state);
    ConversationState decoded = codec.decode(encoded);

    assertThat(encoded.get(CheckpointStateCodec.VERSION_FIELD).asInt()).isEqualTo(2);
    assertThat(encoded.has("tenant")).isFalse();
    assertThat(decoded.getMessages()).isEqualTo(state.getMessages());
    assertThat(decoded.getControl()).isEqualTo(state.getControl());
    assertThat(decoded.getAgentTrace()).isEqualTo(state.getAgentTrace());
    assertThat(decoded.getErrors()).containsExactly("supervisor: boom");
    assertThat(decoded.getCurrentMessage()).isEqualTo("quiero una cita");
    assertThat(decoded.getCurrentAgent()).isEqualTo("booking_dental");
    assertThat(decoded.getFinalResponse()).isEqualTo("Claro");
    assertThat(decoded.getDetectedIntent()).isEqualTo(Intent.BOOK_APPOINTMENT);
    assertThat(decoded.getDetectedSignals()).containsExactly(new DetectedSignal("implant_interest", 20));
    assertThat(decoded.getScoreChange()).isEqualTo(20);
    assertThat(decoded.getExtractedData().getPreferredDate()).isEqualTo("tomorrow");
    assertThat(decoded.getBookingResult().getBranchId()).isEqualTo("br-1");
    assertThat(decoded.getTokensUsed()).isEqualTo(33);
    assertThat(decoded.getProcessingTimeMs()).isEqualTo(120L);
    assertThat(decoded.getTenant()).isNull();
    assertThat(decoded.getBusiness()).isNull();
  }

  @Test
  void shouldUpgradeVersionOneMessages() {
    JsonNode v1 = JsonUtils.readTree("{"
      + "\"messages\":["
      + "{\"type\":\"human\",\"content\":\"hola\"},"
      + "{\"lc\":1,\"type\":\"constructor\",\"id\":[\"langchain_core\",\"messages\",\"AIMessage\"],"
      + "\"kwargs\":{\"content\":\"Hola, bienvenida\"}},"
      + "{\"role\":\"user\",\"content\":\"precio?\"},"
      + "{\"role\":\"system\",\"content\":\"ignored\"}"
      + "],"
      + "\"agent_trace\":[{\"agent_name\":\"greeting\",\"timestamp\":\"2025-05-01T10:00:00Z\"}],"
      + "\"current_message\":\"precio?\""
      + "}");

    ConversationState decoded = codec.decode(v1);

    assertThat(decoded.getMessages()).containsExactly(
      ChatMessage.human("hola"),
      ChatMessage.assistant("Hola, bienvenida"),
      ChatMessage.human("precio?"));
    assertThat(decoded.getAgentTrace().get(0).getStartedAt())
      .isEqualTo(Instant.parse("2025-05-01T10:00:00Z"));
  }

  @Test
  void shouldDropMalformedFields() {
    JsonNode broken = JsonUtils.readTree("{"
      + "\"schema_version\":2,"
      + "\"messages\":[{\"role\":\"human\",\"content\":42},{\"role\":\"ai\",\"content\":\"ok\"}],"
      + "\"control\":{\"iteration_count\":-1,\"max_iterations\":0,\"should_escalate\":\"yes\"},"
      + "\"detected_intent\":\"TELEPORT\","
      + "\"detected_signals\":[{\"signal\":\"x\"},{\"signal\":\"y\",\"points\":3}],"
      + "\"errors\":[\"e1\",7],"
      + "\"extracted_data\":\"nope\","
      + "\"tokens_used\":\"many\""
      + "}");

    ConversationState decoded = codec.decode(broken);

    assertThat(decoded.getMessages()).containsExactly(ChatMessage.assistant("ok"));
    assertThat(decoded.getControl()).isEqualTo(ControlFlags.builder().build());
    assertThat(decoded.getDetectedIntent()).isNull();
    assertThat(decoded.getDetectedSignals()).containsExactly(new DetectedSignal("y", 3));
    assertThat(decoded.getErrors()).containsExactly("e1");
    assertThat(decoded.getExtractedData()).isNull();
    assertThat(decoded.getTokensUsed()).isZero();
  }

  @Test
  void shouldReadKnownFieldsFromNewerSchema() {
    JsonNode newer = JsonUtils.readTree(
      "{\"schema_version\":9,\"current_message\":\"hola\",\"future_field\":{\"a\":1}}");

    assertThat(codec.decode(newer).getCurrentMessage()).isEqualTo("hola");
  }

  @Test
  void shouldReturnEmptyStateForNonObject() {
    ConversationState decoded = codec.decode(JsonUtils.objectMapper().createArrayNode());

    assertThat(decoded.getMessages()).isEmpty();
    assertThat(decoded.getCurrentMessage()).isNull();
  }

  @Test
  void shouldEncodeOnlyPresentPatchChannels() {
    StatePatch patch = StatePatch.builder()
      .nextAgent("pricing")
      .control(ControlPatch.escalate("reason"))
      .scoreChange(5)
      .build();

    Map<String, JsonNode> channels = codec.encodePatch(patch);

    assertThat(channels).containsOnlyKeys("next_agent", "control", "score_change");
    assertThat(channels.get("control").get("should_escalate").asBoolean()).isTrue();
    assertThat(channels.get("control").has("iteration_count")).isFalse();
  }

  @Test
  void shouldIncrementChannelVersions() {
    ObjectNode values = codec.encode(TestStates.state("hola"));

    Map<String, Integer> first = codec.nextChannelVersions(null, values);
    Map<String, Integer> second = codec.nextChannelVersions(first, values);

    assertThat(first).doesNotContainKey(CheckpointStateCodec.VERSION_FIELD);
    assertThat(first.get("messages")).isEqualTo(1);
    assertThat(second.get("messages")).isEqualTo(2);
  }
}
