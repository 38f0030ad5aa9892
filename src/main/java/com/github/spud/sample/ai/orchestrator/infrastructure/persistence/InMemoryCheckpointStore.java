package com.github.spud.sample.ai.orchestrator.infrastructure.persistence;

import com.github.spud.sample.ai.orchestrator.domain.checkpoint.Checkpoint;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointMetadata;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStats;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStore;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointTuple;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.PendingWrite;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.ThreadState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 进程内检查点存储，用于本地开发和测试。语义与 JDBC 实现一致（同 ID 覆盖，按创建时间取最新）
 */
public class InMemoryCheckpointStore implements CheckpointStore {

  private final Map<String, List<Entry>> threads = new ConcurrentHashMap<>();
  private final Map<String, Map<String, List<PendingWrite>>> writes = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final String namespace;
  private final Clock clock;

  public InMemoryCheckpointStore(String namespace) {
    this(namespace, Clock.systemUTC());
  }

  public InMemoryCheckpointStore(String namespace, Clock clock) {
    this.namespace = namespace != null ? namespace : "";
    this.clock = clock;
  }

  @Override
  public boolean isReady() {
    return true;
  }

  @Override
  public void put(String threadId, Checkpoint checkpoint, CheckpointMetadata metadata) {
    Entry entry = new Entry(checkpoint, metadata, clock.instant(), sequence.incrementAndGet());
    threads.compute(threadId, (key, entries) -> {
      List<Entry> updated = entries != null ? new ArrayList<>(entries) : new ArrayList<>();
      updated.removeIf(e -> e.checkpoint.getId().equals(checkpoint.getId()));
      updated.add(entry);
      return updated;
    });
  }

  @Override
  public Optional<CheckpointTuple> getLatest(String threadId) {
    return sorted(threadId).stream().findFirst().map(e -> e.toTuple(threadId, namespace));
  }

  @Override
  public List<CheckpointTuple> list(String threadId, int limit) {
    return sorted(threadId).stream()
      .limit(Math.max(0, limit))
      .map(e -> e.toTuple(threadId, namespace))
      .collect(Collectors.toList());
  }

  @Override
  public void putWrites(String threadId, String checkpointId, String taskId, List<PendingWrite> pending) {
    writes.computeIfAbsent(threadId + "/" + checkpointId, key -> new ConcurrentHashMap<>())
      .put(taskId, List.copyOf(pending));
  }

  @Override
  public List<PendingWrite> getWrites(String threadId, String checkpointId) {
    Map<String, List<PendingWrite>> byTask = writes.get(threadId + "/" + checkpointId);
    if (byTask == null) {
      return List.of();
    }
    return byTask.entrySet().stream()
      .sorted(Map.Entry.comparingByKey())
      .flatMap(e -> e.getValue().stream())
      .collect(Collectors.toList());
  }

  @Override
  public void deleteThread(String threadId) {
    threads.remove(threadId);
    writes.keySet().removeIf(key -> key.startsWith(threadId + "/"));
  }

  @Override
  public int cleanupOlderThan(Duration age) {
    Instant cutoff = clock.instant().minus(age);
    int deleted = 0;
    Iterator<Map.Entry<String, List<Entry>>> it = threads.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, List<Entry>> thread = it.next();
      List<Entry> kept = new ArrayList<>(thread.getValue());
      int before = kept.size();
      kept.removeIf(e -> e.createdAt.isBefore(cutoff));
      deleted += before - kept.size();
      if (kept.isEmpty()) {
        it.remove();
      } else {
        thread.setValue(kept);
      }
    }
    return deleted;
  }

  @Override
  public List<ThreadState> activeThreads(int limit) {
    Map<String, Entry> latest = new LinkedHashMap<>();
    for (String threadId : threads.keySet()) {
      sorted(threadId).stream().findFirst().ifPresent(e -> latest.put(threadId, e));
    }
    return latest.entrySet().stream()
      .sorted(Comparator.comparing((Map.Entry<String, Entry> e) -> e.getValue().sequence).reversed())
      .limit(Math.max(0, limit))
      .map(e -> new ThreadState(e.getKey(), e.getValue().checkpoint.getId(), e.getValue().createdAt))
      .collect(Collectors.toList());
  }

  @Override
  public CheckpointStats stats() {
    List<Entry> all = threads.values().stream()
      .flatMap(List::stream)
      .collect(Collectors.toList());
    return CheckpointStats.builder()
      .totalCheckpoints(all.size())
      .totalThreads(threads.size())
      .oldestCheckpoint(all.stream().map(e -> e.createdAt).min(Comparator.naturalOrder()).orElse(null))
      .newestCheckpoint(all.stream().map(e -> e.createdAt).max(Comparator.naturalOrder()).orElse(null))
      .build();
  }

  /**
   * 最新在前；创建时间相同时按写入顺序
   */
  private List<Entry> sorted(String threadId) {
    List<Entry> entries = threads.getOrDefault(threadId, List.of());
    return entries.stream()
      .sorted(Comparator.comparing((Entry e) -> e.createdAt)
        .thenComparingLong(e -> e.sequence)
        .reversed())
      .collect(Collectors.toList());
  }

  private static final class Entry {

    private final Checkpoint checkpoint;
    private final CheckpointMetadata metadata;
    private final Instant createdAt;
    private final long sequence;

    private Entry(Checkpoint checkpoint, CheckpointMetadata metadata, Instant createdAt, long sequence) {
      this.checkpoint = checkpoint;
      this.metadata = metadata;
      this.createdAt = createdAt;
      this.sequence = sequence;
    }

    private CheckpointTuple toTuple(String threadId, String namespace) {
      return CheckpointTuple.builder()
        .threadId(threadId)
        .namespace(namespace)
        .checkpoint(checkpoint)
        .metadata(metadata)
        .createdAt(createdAt)
        .build();
    }
  }
}
