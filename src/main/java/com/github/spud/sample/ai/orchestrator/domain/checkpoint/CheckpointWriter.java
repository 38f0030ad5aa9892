package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeWrite;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * 异步写检查点，同一线程内按提交顺序串行执行，不同线程之间互不影响。
 * <p>
 * 写入失败只记录日志，不向调用方抛出。
 */
@Slf4j
public class CheckpointWriter {

  private final CheckpointStore store;
  private final CheckpointStateCodec codec;
  private final Executor executor;
  private final String namespace;
  private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  public CheckpointWriter(CheckpointStore store, CheckpointStateCodec codec, Executor executor,
    String namespace) {
    this.store = store;
    this.codec = codec;
    this.executor = executor;
    this.namespace = namespace;
  }

  /**
   * 提交一个检查点，父检查点在真正写入时按「最新」解析
   */
  public CompletableFuture<Void> submit(String threadId, String checkpointId,
    ConversationState state, String source) {
    ObjectNode values = codec.encode(state);
    int step = state.getControl().getIterationCount();
    return enqueue(threadId, () -> writeCheckpoint(threadId, checkpointId, values, source, step));
  }

  /**
   * 提交中止轮次的节点写入，task_id 为节点名
   */
  public CompletableFuture<Void> submitWrites(String threadId, String checkpointId,
    List<NodeWrite> writes) {
    if (writes.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    List<TaskWrites> encoded = new ArrayList<>();
    for (NodeWrite write : writes) {
      List<PendingWrite> pending = new ArrayList<>();
      int idx = 0;
      for (Map.Entry<String, JsonNode> channel : codec.encodePatch(write.getPatch()).entrySet()) {
        pending.add(new PendingWrite(write.getNode().nodeName(), idx++, channel.getKey(), channel.getValue()));
      }
      encoded.add(new TaskWrites(write.getStep() + ":" + write.getNode().nodeName(), pending));
    }
    return enqueue(threadId, () -> {
      for (TaskWrites task : encoded) {
        try {
          store.putWrites(threadId, checkpointId, task.taskId, task.writes);
        } catch (RuntimeException e) {
          log.warn("Failed to save pending writes for thread={}, task={}: {}",
            threadId, task.taskId, e.getMessage());
        }
      }
    });
  }

  /**
   * 等待该线程已提交的写入全部完成
   */
  public CompletableFuture<Void> flush(String threadId) {
    CompletableFuture<Void> tail = tails.get(threadId);
    return tail != null ? tail.handle((v, e) -> null) : CompletableFuture.completedFuture(null);
  }

  private CompletableFuture<Void> enqueue(String threadId, Runnable job) {
    // 先登记为新的队尾，再挂到前一个任务之后，提交给线程池时不持有 map 的锁
    CompletableFuture<Void> ready = new CompletableFuture<>();
    CompletableFuture<Void> next = ready.thenRunAsync(job, executor);
    CompletableFuture<Void> previous = tails.put(threadId, next);
    if (previous == null) {
      ready.complete(null);
    } else {
      previous.whenComplete((v, e) -> ready.complete(null));
    }
    next.whenComplete((v, e) -> {
      tails.remove(threadId, next);
      if (e != null) {
        log.warn("Checkpoint job for thread={} did not run: {}", threadId, e.getMessage());
      }
    });
    return next;
  }

  private void writeCheckpoint(String threadId, String checkpointId, ObjectNode values,
    String source, int step) {
    try {
      Optional<CheckpointTuple> parent = store.getLatest(threadId);
      Checkpoint previous = parent.map(CheckpointTuple::getCheckpoint).orElse(null);
      String parentId = previous != null && !checkpointId.equals(previous.getId()) ? previous.getId() : null;

      Checkpoint checkpoint = Checkpoint.builder()
        .id(checkpointId)
        .ts(Instant.now())
        .channelValues(values)
        .channelVersions(codec.nextChannelVersions(
          previous != null ? previous.getChannelVersions() : null, values))
        .parentCheckpointId(parentId)
        .build();
      CheckpointMetadata metadata = CheckpointMetadata.builder()
        .source(source)
        .step(step)
        .parents(parentId != null ? Map.of(namespace, parentId) : Map.of())
        .build();

      store.put(threadId, checkpoint, metadata);
      log.info("Checkpoint saved: thread={}, checkpointId={}, source={}", threadId, checkpointId, source);
    } catch (RuntimeException e) {
      log.warn("Failed to save checkpoint for thread={}: {}", threadId, e.getMessage());
    }
  }

  private static final class TaskWrites {

    private final String taskId;
    private final List<PendingWrite> writes;

    private TaskWrites(String taskId, List<PendingWrite> writes) {
      this.taskId = taskId;
      this.writes = writes;
    }
  }
}
