package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStats;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStore;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointTuple;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.ThreadState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 检查点查询与维护 Api
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class CheckpointController {

  private static final int MAX_LIMIT = 100;

  private final CheckpointStore checkpointStore;

  @GetMapping("/{conversationId}/checkpoints")
  public Mono<ResponseEntity<List<CheckpointView>>> listCheckpoints(
    @PathVariable String conversationId,
    @RequestParam(defaultValue = "10") int limit
  ) {
    return Mono.fromCallable(() -> {
        List<CheckpointView> views = checkpointStore.list(conversationId, clamp(limit)).stream()
          .map(CheckpointView::from)
          .collect(Collectors.toList());
        return ResponseEntity.ok(views);
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{conversationId}/checkpoints/latest")
  public Mono<ResponseEntity<CheckpointView>> latestCheckpoint(@PathVariable String conversationId) {
    return Mono.fromCallable(() -> checkpointStore.getLatest(conversationId)
        .map(CheckpointView::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @DeleteMapping("/{conversationId}/checkpoints")
  public Mono<ResponseEntity<Void>> deleteThread(@PathVariable String conversationId) {
    return Mono.fromCallable(() -> {
        log.info("Deleting checkpoints of thread={}", conversationId);
        checkpointStore.deleteThread(conversationId);
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/threads/active")
  public Mono<ResponseEntity<List<ThreadState>>> activeThreads(
    @RequestParam(defaultValue = "20") int limit
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(checkpointStore.activeThreads(clamp(limit))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/checkpoints/stats")
  public Mono<ResponseEntity<CheckpointStats>> stats() {
    return Mono.fromCallable(() -> ResponseEntity.ok(checkpointStore.stats()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  private static int clamp(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return Math.min(limit, MAX_LIMIT);
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class CheckpointView {

    private String threadId;
    private String checkpointNs;
    private String checkpointId;
    private String parentCheckpointId;
    private String source;
    private int step;
    private Instant createdAt;
    private Map<String, Integer> channelVersions;
    private ObjectNode channelValues;

    static CheckpointView from(CheckpointTuple tuple) {
      return new CheckpointView(
        tuple.getThreadId(),
        tuple.getNamespace(),
        tuple.getCheckpoint().getId(),
        tuple.getCheckpoint().getParentCheckpointId(),
        tuple.getMetadata() != null ? tuple.getMetadata().getSource() : null,
        tuple.getMetadata() != null ? tuple.getMetadata().getStep() : 0,
        tuple.getCreatedAt(),
        tuple.getCheckpoint().getChannelVersions(),
        tuple.getCheckpoint().getChannelValues());
    }
  }
}
