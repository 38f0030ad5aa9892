package com.github.spud.sample.ai.orchestrator.domain.turn;

import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStateCodec;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStore;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointTuple;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointWriter;
import com.github.spud.sample.ai.orchestrator.domain.graph.CompiledGraph;
import com.github.spud.sample.ai.orchestrator.domain.graph.GraphAbortedException;
import com.github.spud.sample.ai.orchestrator.domain.graph.GraphExecution;
import com.github.spud.sample.ai.orchestrator.domain.graph.GraphExecutor;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.graph.TransientErrorClassifier;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Service;

/**
 * 轮次执行器：图执行器外的一层容错包装
 * <p>
 * 流程：限流 → 加载上下文 → (可选) 从检查点重放/续跑 → 执行图 → 输出过滤 → 异步写检查点。
 * <p>
 * 失败处理：<p> - 瞬时错误：查一次最新检查点，已有同一消息的回复则返回并标记 recovered<p>
 * - 硬失败：返回兜底回复并升级，同时交给死信队列<p> - 检查点读写失败：只记录日志<p>
 * 同一会话线程上的轮次由 {@link ThreadTurnGuard} 串行化。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnExecutor {

  public static final String SOURCE_FINALIZE = "finalize";
  public static final String OUTPUT_VALIDATION_FAILED = "output_validation_failed";

  private final ThreadTurnGuard threadTurnGuard;
  private final TurnLifecycleDriver lifecycleDriver;
  private final InitialStateFactory initialStateFactory;
  private final CompiledGraph graph;
  private final GraphExecutor graphExecutor;
  private final CheckpointStore checkpointStore;
  private final CheckpointStateCodec checkpointStateCodec;
  private final CheckpointWriter checkpointWriter;
  private final TransientErrorClassifier transientErrorClassifier;
  private final RateLimiter rateLimiter;
  private final DeadLetterSink deadLetterSink;
  private final OutputSanitizer outputSanitizer;

  @Value("${orchestrator.checkpoint.enabled:true}")
  private boolean checkpointEnabled = true;

  /**
   * 读取最新检查点前，等待本线程上一轮写入完成的最长时间
   */
  @Value("${orchestrator.checkpoint.flush-timeout-ms:2000}")
  private long flushTimeoutMs = 2000;

  @Value("${orchestrator.turn.fallback-response:Lo siento, ocurrió un error al procesar tu mensaje. Un asesor te atenderá pronto.}")
  private String fallbackResponse;

  @Value("${orchestrator.turn.rate-limited-response:Estamos recibiendo muchos mensajes. Por favor intenta de nuevo en unos momentos.}")
  private String rateLimitedResponse;

  @Value("${orchestrator.turn.invalid-output-response:Gracias por tu mensaje. Un asesor te responderá en breve.}")
  private String invalidOutputResponse;

  public TurnResult execute(TurnRequest request) {
    return threadTurnGuard.runExclusive(request.getConversationId(), () -> executeExclusive(request));
  }

  private TurnResult executeExclusive(TurnRequest request) {
    Instant startedAt = Instant.now();
    String threadId = request.getConversationId();
    String checkpointId = UUID.randomUUID().toString();
    TurnRequest.TurnOptions options =
      request.getOptions() != null ? request.getOptions() : new TurnRequest.TurnOptions();
    boolean checkpointing = checkpointEnabled && options.isEnableCheckpointing();

    StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm = lifecycleDriver.create(threadId);
    log.info("Turn started: tenant={}, thread={}, checkpointId={}, resume={}",
      request.getTenantId(), threadId, checkpointId, options.isResumeFromCheckpoint());
    try {
      RateLimitDecision decision = checkRateLimit(request.getTenantId());
      if (!decision.isAllowed()) {
        lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.REJECT);
        log.info("Turn rejected by rate limiter: tenant={}, retryAfterMs={}",
          request.getTenantId(), decision.getRetryAfterMs());
        return finish(sm, rateLimited(decision, startedAt));
      }
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.START);

      ConversationState initial;
      try {
        initial = initialStateFactory.create(request);
      } catch (ContextLoadException e) {
        lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.FAIL);
        return finish(sm, hardFailure(request, e, List.of(), startedAt));
      }

      if (checkpointing && options.isResumeFromCheckpoint()) {
        Optional<CheckpointTuple> latest = loadLatest(threadId);
        if (latest.isPresent()) {
          ConversationState restored =
            checkpointStateCodec.decode(latest.get().getCheckpoint().getChannelValues());
          if (answersSameMessage(restored, request)) {
            lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.REPLAY);
            log.info("Turn replayed from checkpoint: thread={}, checkpointId={}",
              threadId, latest.get().getCheckpoint().getId());
            return finish(sm, replayed(restored, latest.get(), startedAt));
          }
          initial = continueFrom(initial, restored);
          log.info("Resuming thread={} from checkpoint {} ({} messages)",
            threadId, latest.get().getCheckpoint().getId(), initial.getMessages().size());
        }
      }
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.CONTEXT_READY);

      GraphExecution execution;
      try {
        execution = graphExecutor.execute(graph, initial);
      } catch (GraphAbortedException e) {
        return finish(sm, handleAbort(sm, request, e, checkpointing, checkpointId, startedAt));
      }
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.GRAPH_DONE);

      ConversationState finalState = execution.getFinalState();
      TurnResult result = completed(request, execution, startedAt);
      ConversationState persisted = persistedState(finalState, result);
      if (checkpointing) {
        submitCheckpoint(threadId, checkpointId, persisted);
        result.setCheckpointId(checkpointId);
      }
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.PERSISTED);

      log.info("Turn finished: thread={}, success={}, escalated={}, agents={}, tokens={}, {}ms",
        threadId, result.isSuccess(), result.isEscalated(), result.getAgentsUsed(),
        result.getTokensUsed(), result.getProcessingTimeMs());
      return finish(sm, result);
    } catch (RuntimeException e) {
      if (lifecycleDriver.getCurrentState(sm) == TurnLifecycleState.RECEIVED) {
        lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.START);
      }
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.FAIL);
      return finish(sm, hardFailure(request, e, List.of(), startedAt));
    } finally {
      lifecycleDriver.stop(sm);
    }
  }

  // ===== abort / recovery =====

  private TurnResult handleAbort(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm,
    TurnRequest request, GraphAbortedException error, boolean checkpointing, String checkpointId,
    Instant startedAt) {
    String threadId = request.getConversationId();
    List<String> path = error.getPath().stream().map(NodeId::nodeName).collect(Collectors.toList());
    if (checkpointing) {
      submitPendingWrites(threadId, checkpointId, error);
    }

    Throwable cause = error.getCause() != null ? error.getCause() : error;
    if (checkpointing && transientErrorClassifier.isTransient(cause)) {
      lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.TRANSIENT_FAILURE);
      log.warn("Transient failure on thread={}, trying checkpoint recovery: {}",
        threadId, error.getMessage());
      Optional<CheckpointTuple> latest = loadLatest(threadId);
      if (latest.isPresent()) {
        ConversationState restored =
          checkpointStateCodec.decode(latest.get().getCheckpoint().getChannelValues());
        if (answersSameMessage(restored, request)) {
          lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.RECOVERED);
          log.info("Turn recovered from checkpoint: thread={}, checkpointId={}",
            threadId, latest.get().getCheckpoint().getId());
          TurnResult recovered = replayed(restored, latest.get(), startedAt);
          recovered.setReplayed(false);
          recovered.setRecovered(true);
          return recovered;
        }
      }
      log.warn("No usable checkpoint to recover thread={}", threadId);
    }

    lifecycleDriver.sendEvent(sm, TurnLifecycleEvent.FAIL);
    return hardFailure(request, error, path, startedAt);
  }

  private TurnResult hardFailure(TurnRequest request, Exception error, List<String> agentsUsed,
    Instant startedAt) {
    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    log.error("Turn failed: tenant={}, thread={}: {}",
      request.getTenantId(), request.getConversationId(), message, error);
    sendToDeadLetter(request, message);
    return TurnResult.builder()
      .success(false)
      .response(fallbackResponse)
      .intent(Intent.UNKNOWN)
      .escalated(true)
      .escalationReason(message)
      .agentsUsed(new ArrayList<>(agentsUsed))
      .errors(new ArrayList<>(List.of(message)))
      .processingTimeMs(elapsed(startedAt))
      .build();
  }

  private void sendToDeadLetter(TurnRequest request, String error) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("original_message", request.getCurrentMessage());
    payload.put("channel", request.getChannel() != null ? request.getChannel().code() : null);
    payload.put("lead_id", request.getLeadId());
    payload.put("conversation_history",
      request.getPreviousMessages() != null ? request.getPreviousMessages().size() : 0);
    try {
      deadLetterSink.send(DeadLetterEntry.builder()
        .tenantId(request.getTenantId())
        .conversationId(request.getConversationId())
        .payload(payload)
        .error(error)
        .stage(DeadLetterEntry.STAGE_AI_PROCESSING)
        .build());
    } catch (RuntimeException e) {
      log.error("Failed to add thread={} to dead letter queue: {}",
        request.getConversationId(), e.getMessage());
    }
  }

  // ===== results =====

  private TurnResult completed(TurnRequest request, GraphExecution execution, Instant startedAt) {
    ConversationState state = execution.getFinalState();
    ControlFlags control = state.getControl();
    boolean escalated = control.isShouldEscalate();
    String escalationReason = control.getEscalationReason();
    boolean success = true;

    String response = state.hasFinalResponse() ? state.getFinalResponse() : fallbackResponse;
    SanitizationResult sanitized = outputSanitizer.sanitize(request.getTenantId(), response);
    if (sanitized == null || !sanitized.isValid()) {
      log.warn("Output rejected by sanitizer on thread={}: {}", request.getConversationId(),
        sanitized != null ? sanitized.getIssues() : "no result");
      response = invalidOutputResponse;
      escalated = true;
      escalationReason = OUTPUT_VALIDATION_FAILED;
      success = false;
    } else if (sanitized.getSanitizedText() != null) {
      response = sanitized.getSanitizedText();
    }

    return TurnResult.builder()
      .success(success)
      .response(response)
      .intent(state.getDetectedIntent() != null ? state.getDetectedIntent() : Intent.UNKNOWN)
      .signals(new ArrayList<>(state.getDetectedSignals()))
      .scoreChange(state.getScoreChange())
      .escalated(escalated)
      .escalationReason(escalated ? escalationReason : null)
      .tokensUsed(state.getTokensUsed())
      .processingTimeMs(state.getProcessingTimeMs() != null
        ? state.getProcessingTimeMs() : elapsed(startedAt))
      .agentsUsed(new ArrayList<>(execution.agentsUsed()))
      .bookingResult(state.getBookingResult())
      .errors(new ArrayList<>(state.getErrors()))
      .build();
  }

  private TurnResult replayed(ConversationState restored, CheckpointTuple tuple, Instant startedAt) {
    ControlFlags control = restored.getControl();
    boolean rejected = control.isShouldEscalate()
      && OUTPUT_VALIDATION_FAILED.equals(control.getEscalationReason());
    return TurnResult.builder()
      .success(!rejected)
      .response(restored.getFinalResponse())
      .intent(restored.getDetectedIntent() != null ? restored.getDetectedIntent() : Intent.UNKNOWN)
      .signals(new ArrayList<>(restored.getDetectedSignals()))
      .scoreChange(restored.getScoreChange())
      .escalated(control.isShouldEscalate())
      .escalationReason(control.isShouldEscalate() ? control.getEscalationReason() : null)
      .processingTimeMs(elapsed(startedAt))
      .bookingResult(restored.getBookingResult())
      .errors(new ArrayList<>(restored.getErrors()))
      .replayed(true)
      .checkpointId(tuple.getCheckpoint().getId())
      .build();
  }

  private TurnResult rateLimited(RateLimitDecision decision, Instant startedAt) {
    return TurnResult.builder()
      .success(false)
      .response(rateLimitedResponse)
      .intent(Intent.RATE_LIMITED)
      .escalated(false)
      .errors(new ArrayList<>(List.of(
        "Rate limit exceeded, retry after " + decision.getRetryAfterMs() + "ms")))
      .processingTimeMs(elapsed(startedAt))
      .build();
  }

  private TurnResult finish(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm,
    TurnResult result) {
    result.setTurnState(lifecycleDriver.getCurrentState(sm));
    return result;
  }

  // ===== checkpoint helpers =====

  /**
   * 检查点是否已经回答了本轮的同一条消息
   */
  private static boolean answersSameMessage(ConversationState restored, TurnRequest request) {
    return restored.hasFinalResponse()
      && Objects.equals(restored.getCurrentMessage(), request.getCurrentMessage());
  }

  /**
   * 在新加载的上下文上接续检查点：只取消息与 trace；同一条消息的未完成进度另外保留 control 与 errors
   */
  ConversationState continueFrom(ConversationState fresh, ConversationState restored) {
    List<ChatMessage> messages = restored.getMessages().isEmpty()
      ? fresh.getMessages() : restored.getMessages();
    ConversationState.ConversationStateBuilder builder = fresh.toBuilder()
      .agentTrace(restored.getAgentTrace());

    boolean sameMessage = Objects.equals(restored.getCurrentMessage(), fresh.getCurrentMessage());
    if (sameMessage) {
      // initialize 会重新追加本轮用户消息
      if (!messages.isEmpty()) {
        ChatMessage last = messages.get(messages.size() - 1);
        if (last.getRole() == ChatMessage.Role.HUMAN
          && Objects.equals(last.getContent(), fresh.getCurrentMessage())) {
          messages = messages.subList(0, messages.size() - 1);
        }
      }
      builder
        .control(restored.getControl().toBuilder()
          .maxIterations(fresh.getControl().getMaxIterations())
          .responseReady(false)
          .build())
        .errors(restored.getErrors());
    }
    return builder.messages(List.copyOf(messages)).build();
  }

  /**
   * 写入检查点的状态：回复文本与返回给客户的一致，输出被拦截时同时记下升级原因
   */
  private static ConversationState persistedState(ConversationState finalState, TurnResult result) {
    ConversationState state = withReturnedResponse(finalState, result.getResponse());
    if (!OUTPUT_VALIDATION_FAILED.equals(result.getEscalationReason())) {
      return state;
    }
    return state.toBuilder()
      .control(state.getControl().toBuilder()
        .shouldEscalate(true)
        .escalationReason(OUTPUT_VALIDATION_FAILED)
        .build())
      .build();
  }

  private static ConversationState withReturnedResponse(ConversationState state, String response) {
    if (Objects.equals(state.getFinalResponse(), response)) {
      return state;
    }
    List<ChatMessage> messages = new ArrayList<>(state.getMessages());
    if (!messages.isEmpty()
      && messages.get(messages.size() - 1).getRole() == ChatMessage.Role.ASSISTANT) {
      messages.set(messages.size() - 1, ChatMessage.assistant(response));
    }
    return state.toBuilder()
      .finalResponse(response)
      .messages(List.copyOf(messages))
      .build();
  }

  private Optional<CheckpointTuple> loadLatest(String threadId) {
    awaitPendingCheckpoint(threadId);
    try {
      return checkpointStore.getLatest(threadId);
    } catch (RuntimeException e) {
      log.warn("Failed to load latest checkpoint for thread={}: {}", threadId, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * 上一轮的检查点是异步写的，读之前先等它落盘，超时则用已有的数据继续
   */
  private void awaitPendingCheckpoint(String threadId) {
    try {
      checkpointWriter.flush(threadId).get(flushTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Pending checkpoint for thread={} not written after {}ms, reading latest anyway",
        threadId, flushTimeoutMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for pending checkpoint of thread={}", threadId);
    } catch (ExecutionException e) {
      log.warn("Pending checkpoint for thread={} failed: {}", threadId, e.getMessage());
    }
  }

  private void submitCheckpoint(String threadId, String checkpointId, ConversationState state) {
    try {
      checkpointWriter.submit(threadId, checkpointId, state, SOURCE_FINALIZE);
    } catch (RuntimeException e) {
      log.warn("Failed to schedule checkpoint for thread={}: {}", threadId, e.getMessage());
    }
  }

  private void submitPendingWrites(String threadId, String checkpointId, GraphAbortedException error) {
    try {
      checkpointWriter.submitWrites(threadId, checkpointId, error.getWrites());
    } catch (RuntimeException e) {
      log.warn("Failed to schedule pending writes for thread={}: {}", threadId, e.getMessage());
    }
  }

  private RateLimitDecision checkRateLimit(String tenantId) {
    try {
      RateLimitDecision decision = rateLimiter.check(tenantId);
      return decision != null ? decision : RateLimitDecision.allow();
    } catch (RuntimeException e) {
      log.warn("Rate limiter unavailable for tenant={}, allowing turn: {}", tenantId, e.getMessage());
      return RateLimitDecision.allow();
    }
  }

  private static long elapsed(Instant startedAt) {
    return Duration.between(startedAt, Instant.now()).toMillis();
  }
}
