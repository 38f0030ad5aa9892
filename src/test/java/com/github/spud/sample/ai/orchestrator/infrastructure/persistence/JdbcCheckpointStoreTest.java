package com.github.spud.sample.ai.orchestrator.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.orchestrator.domain.checkpoint.Checkpoint;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointMetadata;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStats;
import com.github.spud.sample.ai.orchestrator.util.JsonUtils;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 数据库不可用时检查点存储退化为空操作
 */
class JdbcCheckpointStoreTest {

  private JdbcTemplate jdbcTemplate;
  private JdbcCheckpointStore store;

  @BeforeEach
  void setUp() {
    jdbcTemplate = mock(JdbcTemplate.class);
    when(jdbcTemplate.queryForObject(eq("SELECT 1"), eq(Integer.class)))
      .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));
    store = new JdbcCheckpointStore(jdbcTemplate, mock(TransactionTemplate.class), "");
  }

  @Test
  void shouldBeNoOpWhenDatabaseUnavailable() {
    assertThat(store.isReady()).isFalse();

    store.put("t1", Checkpoint.builder().id("a")
        .channelValues(JsonUtils.objectMapper().createObjectNode()).build(),
      CheckpointMetadata.builder().source("finalize").build());
    store.putWrites("t1", "a", "1:supervisor", List.of());
    store.deleteThread("t1");

    assertThat(store.getLatest("t1")).isEmpty();
    assertThat(store.list("t1", 10)).isEmpty();
    assertThat(store.getWrites("t1", "a")).isEmpty();
    assertThat(store.cleanupOlderThan(Duration.ofDays(7))).isZero();
    assertThat(store.activeThreads(10)).isEmpty();
    assertThat(store.stats()).isEqualTo(CheckpointStats.empty());
  }

  @Test
  void shouldProbeConnectionOnlyOnce() {
    store.isReady();
    store.getLatest("t1");
    store.stats();

    verify(jdbcTemplate, times(1)).queryForObject(eq("SELECT 1"), eq(Integer.class));
    verifyNoMoreInteractions(jdbcTemplate);
  }
}
