package com.github.spud.sample.ai.orchestrator.it.rest;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointWriter;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.domain.turn.TurnLifecycleState;
import com.github.spud.sample.ai.orchestrator.domain.turn.TurnRequest;
import com.github.spud.sample.ai.orchestrator.domain.turn.TurnResult;
import com.github.spud.sample.ai.orchestrator.it.support.ContainersSupport;
import com.github.spud.sample.ai.orchestrator.it.support.StubLlmTestConfig;
import com.github.spud.sample.ai.orchestrator.support.StubLlmClient;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * 端到端：HTTP → 轮次执行 → 图 → PostgreSQL 检查点
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("it")
@Import(StubLlmTestConfig.class)
class ConversationTurnIT extends ContainersSupport {

  @Autowired
  private WebTestClient webTestClient;

  @Autowired
  private CheckpointWriter checkpointWriter;

  @Autowired
  private StubLlmClient llm;

  @Test
  @DisplayName("A turn is answered, checkpointed and replayed on resume")
  void shouldAnswerCheckpointAndReplay() throws Exception {
    String conversationId = "it-" + UUID.randomUUID();
    TurnRequest request = TestStates.request("Hola, buenos dias").toBuilder()
      .conversationId(conversationId)
      .build();

    TurnResult first = postTurn(conversationId, request);

    assertThat(first.isSuccess()).isTrue();
    assertThat(first.getIntent()).isEqualTo(Intent.GREETING);
    assertThat(first.getResponse()).isEqualTo("[greeting] ok");
    assertThat(first.getTurnState()).isEqualTo(TurnLifecycleState.COMPLETED);

    checkpointWriter.flush(conversationId).get(10, TimeUnit.SECONDS);

    webTestClient.get()
      .uri("/api/v1/conversations/{id}/checkpoints/latest", conversationId)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.checkpoint_id").isEqualTo(first.getCheckpointId())
      .jsonPath("$.channel_values.final_response").isEqualTo("[greeting] ok");

    int callsBefore = llm.calls();
    TurnRequest retry = request.toBuilder().build();
    retry.setOptions(new TurnRequest.TurnOptions(true, true));

    TurnResult replayed = postTurn(conversationId, retry);

    assertThat(replayed.isReplayed()).isTrue();
    assertThat(replayed.getResponse()).isEqualTo(first.getResponse());
    assertThat(replayed.getTurnState()).isEqualTo(TurnLifecycleState.REPLAYED);
    assertThat(llm.calls()).isEqualTo(callsBefore);

    webTestClient.delete()
      .uri("/api/v1/conversations/{id}/checkpoints", conversationId)
      .exchange()
      .expectStatus().isNoContent();
  }

  @Test
  @DisplayName("Escalation keyword routes the turn to a human")
  void shouldEscalateOnKeyword() {
    String conversationId = "it-" + UUID.randomUUID();
    TurnRequest request = TestStates.request("Voy a llamar a mi abogado").toBuilder()
      .conversationId(conversationId)
      .build();

    TurnResult result = postTurn(conversationId, request);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason()).isEqualTo("Escalation keyword: abogado");
    assertThat(result.getAgentsUsed()).contains("escalation");
  }

  private TurnResult postTurn(String conversationId, TurnRequest request) {
    return webTestClient.post()
      .uri("/api/v1/conversations/{id}/turns", conversationId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(request)
      .exchange()
      .expectStatus().isOk()
      .expectBody(TurnResult.class)
      .returnResult()
      .getResponseBody();
  }
}
