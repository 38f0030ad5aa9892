package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.github.spud.sample.ai.orchestrator.domain.turn.TurnExecutor;
import com.github.spud.sample.ai.orchestrator.domain.turn.TurnRequest;
import com.github.spud.sample.ai.orchestrator.domain.turn.TurnResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 对话轮次 Api
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationTurnController {

  private final TurnExecutor turnExecutor;

  /**
   * 执行一轮对话。轮次内部的失败也以 200 + success=false 返回，带兜底回复
   */
  @PostMapping("/{conversationId}/turns")
  public Mono<ResponseEntity<TurnResult>> executeTurn(
    @PathVariable String conversationId,
    @Valid @RequestBody TurnRequest request
  ) {
    return Mono.fromCallable(() -> {
        if (request.getConversationId() != null
          && !request.getConversationId().equals(conversationId)) {
          throw new IllegalArgumentException(
            "conversation_id in body does not match path: " + request.getConversationId());
        }
        request.setConversationId(conversationId);
        log.info("Turn request: tenant={}, conversation={}", request.getTenantId(), conversationId);
        return ResponseEntity.ok(turnExecutor.execute(request));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }
}
