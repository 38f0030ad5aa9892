package com.github.spud.sample.ai.orchestrator.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.Checkpoint;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointMetadata;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStats;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.PendingWrite;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.ThreadState;
import com.github.spud.sample.ai.orchestrator.util.JsonUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryCheckpointStoreTest {

  private MutableClock clock;
  private InMemoryCheckpointStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-05-01T10:00:00Z"));
    store = new InMemoryCheckpointStore("", clock);
  }

  @Test
  void shouldReturnLatestByCreationTime() {
    store.put("t1", checkpoint("b"), metadata());
    clock.advance(Duration.ofSeconds(1));
    store.put("t1", checkpoint("a"), metadata());

    assertThat(store.getLatest("t1").orElseThrow().getCheckpoint().getId()).isEqualTo("a");
    assertThat(store.list("t1", 10)).extracting(t -> t.getCheckpoint().getId()).containsExactly("a", "b");
    assertThat(store.list("t1", 1)).hasSize(1);
    assertThat(store.getLatest("missing")).isEmpty();
  }

  @Test
  void shouldOverwriteSameCheckpointId() {
    store.put("t1", checkpoint("a"), metadata());
    ObjectNode values = JsonUtils.objectMapper().createObjectNode().put("final_response", "v2");
    store.put("t1", Checkpoint.builder().id("a").channelValues(values).build(), metadata());

    assertThat(store.list("t1", 10)).hasSize(1);
    assertThat(store.getLatest("t1").orElseThrow().getCheckpoint().getChannelValues()
      .get("final_response").asText()).isEqualTo("v2");
  }

  @Test
  void shouldDeleteThreadWithWrites() {
    store.put("t1", checkpoint("a"), metadata());
    store.putWrites("t1", "a", "1:supervisor",
      List.of(new PendingWrite("supervisor", 0, "score_change", JsonUtils.readTree("5"))));
    store.put("t2", checkpoint("b"), metadata());

    store.deleteThread("t1");

    assertThat(store.getLatest("t1")).isEmpty();
    assertThat(store.getWrites("t1", "a")).isEmpty();
    assertThat(store.getLatest("t2")).isPresent();
  }

  @Test
  void shouldCleanupOldCheckpoints() {
    store.put("old", checkpoint("a"), metadata());
    clock.advance(Duration.ofDays(8));
    store.put("new", checkpoint("b"), metadata());

    int deleted = store.cleanupOlderThan(Duration.ofDays(7));

    assertThat(deleted).isEqualTo(1);
    assertThat(store.getLatest("old")).isEmpty();
    assertThat(store.getLatest("new")).isPresent();
  }

  @Test
  void shouldListActiveThreadsAndStats() {
    store.put("t1", checkpoint("a"), metadata());
    clock.advance(Duration.ofSeconds(1));
    store.put("t2", checkpoint("b"), metadata());
    clock.advance(Duration.ofSeconds(1));
    store.put("t1", checkpoint("c"), metadata());

    List<ThreadState> active = store.activeThreads(10);
    CheckpointStats stats = store.stats();

    assertThat(active).extracting(ThreadState::getThreadId).containsExactly("t1", "t2");
    assertThat(active.get(0).getLastCheckpointId()).isEqualTo("c");
    assertThat(store.activeThreads(1)).hasSize(1);
    assertThat(stats.getTotalCheckpoints()).isEqualTo(3);
    assertThat(stats.getTotalThreads()).isEqualTo(2);
    assertThat(stats.getOldestCheckpoint()).isEqualTo(Instant.parse("2025-05-01T10:00:00Z"));
    assertThat(stats.getNewestCheckpoint()).isEqualTo(Instant.parse("2025-05-01T10:00:02Z"));
  }

  @Test
  void shouldReturnWritesOrderedByTask() {
    store.putWrites("t1", "a", "2:pricing",
      List.of(new PendingWrite("pricing", 0, "final_response", JsonUtils.readTree("\"hola\""))));
    store.putWrites("t1", "a", "1:supervisor", List.of(
      new PendingWrite("supervisor", 0, "detected_intent", JsonUtils.readTree("\"PRICE_INQUIRY\"")),
      new PendingWrite("supervisor", 1, "score_change", JsonUtils.readTree("5"))));

    assertThat(store.getWrites("t1", "a")).extracting(PendingWrite::getChannel)
      .containsExactly("detected_intent", "score_change", "final_response");
  }

  private static Checkpoint checkpoint(String id) {
    return Checkpoint.builder()
      .id(id)
      .ts(Instant.now())
      .channelValues(JsonUtils.objectMapper().createObjectNode())
      .build();
  }

  private static CheckpointMetadata metadata() {
    return CheckpointMetadata.builder().source("finalize").step(1).build();
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
