package com.github.spud.sample.ai.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.Checkpoint;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointMetadata;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointPersistenceException;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStats;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStore;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointTuple;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.PendingWrite;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.ThreadState;
import com.github.spud.sample.ai.orchestrator.util.JsonUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL 检查点存储（langgraph_checkpoints / langgraph_checkpoint_writes）。
 * <p>
 * 第一次使用时校验连接并建表；连接不可用则保持禁用，所有操作变为空操作。
 * 读操作出错返回空结果，写操作出错抛出 {@link CheckpointPersistenceException}。
 */
@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {

  private static final String SCHEMA = "schema.sql";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final String namespace;

  private final Object initLock = new Object();
  private volatile Boolean ready;

  private final RowMapper<CheckpointTuple> tupleMapper = new RowMapper<CheckpointTuple>() {
    @Override
    public CheckpointTuple mapRow(ResultSet rs, int rowNum) throws SQLException {
      Instant createdAt = rs.getTimestamp("created_at").toInstant();
      return CheckpointTuple.builder()
        .threadId(rs.getString("thread_id"))
        .namespace(rs.getString("checkpoint_ns"))
        .checkpoint(readCheckpoint(rs.getString("checkpoint"), rs.getString("checkpoint_id"),
          rs.getString("parent_checkpoint_id"), createdAt))
        .metadata(readMetadata(rs.getString("metadata")))
        .createdAt(createdAt)
        .build();
    }
  };

  public JdbcCheckpointStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
    String namespace) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    this.namespace = namespace != null ? namespace : "";
  }

  @Override
  public boolean isReady() {
    Boolean current = ready;
    if (current != null) {
      return current;
    }
    synchronized (initLock) {
      if (ready == null) {
        ready = initialize();
      }
      return ready;
    }
  }

  private boolean initialize() {
    try {
      jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA));
      populator.execute(jdbcTemplate.getDataSource());
      log.info("Checkpoint store ready (namespace='{}')", namespace);
      return true;
    } catch (RuntimeException e) {
      log.warn("Checkpoint store unavailable, checkpointing disabled: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void put(String threadId, Checkpoint checkpoint, CheckpointMetadata metadata) {
    if (!isReady()) {
      return;
    }
    String sql =
      "INSERT INTO langgraph_checkpoints " +
        "(thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, checkpoint, metadata, created_at) " +
        "VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, NOW()) " +
        "ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id) DO UPDATE SET " +
        "parent_checkpoint_id = EXCLUDED.parent_checkpoint_id, " +
        "checkpoint = EXCLUDED.checkpoint, metadata = EXCLUDED.metadata, created_at = NOW()";
    try {
      jdbcTemplate.update(sql,
        threadId,
        namespace,
        checkpoint.getId(),
        checkpoint.getParentCheckpointId(),
        JsonUtils.toJson(writeCheckpoint(checkpoint)),
        JsonUtils.toJson(writeMetadata(metadata)));
    } catch (DataAccessException e) {
      throw new CheckpointPersistenceException("Failed to save checkpoint " + checkpoint.getId(), e);
    }
  }

  @Override
  public Optional<CheckpointTuple> getLatest(String threadId) {
    if (!isReady()) {
      return Optional.empty();
    }
    String sql =
      "SELECT * FROM langgraph_checkpoints WHERE thread_id = ? AND checkpoint_ns = ? " +
        "ORDER BY created_at DESC LIMIT 1";
    try {
      List<CheckpointTuple> results = jdbcTemplate.query(sql, tupleMapper, threadId, namespace);
      return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    } catch (DataAccessException e) {
      log.warn("Failed to load latest checkpoint for thread={}: {}", threadId, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public List<CheckpointTuple> list(String threadId, int limit) {
    if (!isReady()) {
      return List.of();
    }
    String sql =
      "SELECT * FROM langgraph_checkpoints WHERE thread_id = ? AND checkpoint_ns = ? " +
        "ORDER BY created_at DESC LIMIT ?";
    try {
      return jdbcTemplate.query(sql, tupleMapper, threadId, namespace, limit);
    } catch (DataAccessException e) {
      log.warn("Failed to list checkpoints for thread={}: {}", threadId, e.getMessage());
      return List.of();
    }
  }

  @Override
  public void putWrites(String threadId, String checkpointId, String taskId, List<PendingWrite> writes) {
    if (!isReady() || writes.isEmpty()) {
      return;
    }
    String sql =
      "INSERT INTO langgraph_checkpoint_writes " +
        "(thread_id, checkpoint_ns, checkpoint_id, task_id, idx, channel, type, value) " +
        "VALUES (?, ?, ?, ?, ?, ?, 'json', ?::jsonb) " +
        "ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id, task_id, idx) DO UPDATE SET " +
        "channel = EXCLUDED.channel, type = EXCLUDED.type, value = EXCLUDED.value";
    List<Object[]> batch = new ArrayList<>(writes.size());
    for (PendingWrite write : writes) {
      batch.add(new Object[]{threadId, namespace, checkpointId, taskId, write.getIdx(),
        write.getChannel(), JsonUtils.toJson(write.getValue())});
    }
    try {
      jdbcTemplate.batchUpdate(sql, batch);
    } catch (DataAccessException e) {
      throw new CheckpointPersistenceException(
        "Failed to save pending writes for checkpoint " + checkpointId, e);
    }
  }

  @Override
  public List<PendingWrite> getWrites(String threadId, String checkpointId) {
    if (!isReady()) {
      return List.of();
    }
    String sql =
      "SELECT task_id, idx, channel, value FROM langgraph_checkpoint_writes " +
        "WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ? ORDER BY task_id, idx";
    try {
      return jdbcTemplate.query(sql, (rs, rowNum) -> new PendingWrite(
          rs.getString("task_id"),
          rs.getInt("idx"),
          rs.getString("channel"),
          JsonUtils.readTree(rs.getString("value"))),
        threadId, namespace, checkpointId);
    } catch (DataAccessException e) {
      log.warn("Failed to load pending writes for thread={}: {}", threadId, e.getMessage());
      return List.of();
    }
  }

  @Override
  public void deleteThread(String threadId) {
    if (!isReady()) {
      return;
    }
    try {
      transactionTemplate.executeWithoutResult(status -> {
        jdbcTemplate.update(
          "DELETE FROM langgraph_checkpoint_writes WHERE thread_id = ? AND checkpoint_ns = ?",
          threadId, namespace);
        int deleted = jdbcTemplate.update(
          "DELETE FROM langgraph_checkpoints WHERE thread_id = ? AND checkpoint_ns = ?",
          threadId, namespace);
        log.info("Deleted {} checkpoints for thread={}", deleted, threadId);
      });
    } catch (DataAccessException e) {
      throw new CheckpointPersistenceException("Failed to delete checkpoints of thread " + threadId, e);
    }
  }

  @Override
  public int cleanupOlderThan(Duration age) {
    if (!isReady()) {
      return 0;
    }
    Timestamp cutoff = Timestamp.from(Instant.now().minus(age));
    try {
      Integer deleted = transactionTemplate.execute(status -> {
        jdbcTemplate.update(
          "DELETE FROM langgraph_checkpoint_writes WHERE checkpoint_ns = ? AND created_at < ?",
          namespace, cutoff);
        return jdbcTemplate.update(
          "DELETE FROM langgraph_checkpoints WHERE checkpoint_ns = ? AND created_at < ?",
          namespace, cutoff);
      });
      return deleted != null ? deleted : 0;
    } catch (DataAccessException e) {
      throw new CheckpointPersistenceException("Failed to clean up checkpoints older than " + age, e);
    }
  }

  @Override
  public List<ThreadState> activeThreads(int limit) {
    if (!isReady()) {
      return List.of();
    }
    String sql =
      "SELECT thread_id, checkpoint_id, created_at FROM (" +
        "SELECT DISTINCT ON (thread_id) thread_id, checkpoint_id, created_at " +
        "FROM langgraph_checkpoints WHERE checkpoint_ns = ? " +
        "ORDER BY thread_id, created_at DESC) latest " +
        "ORDER BY created_at DESC LIMIT ?";
    try {
      return jdbcTemplate.query(sql, (rs, rowNum) -> new ThreadState(
        rs.getString("thread_id"),
        rs.getString("checkpoint_id"),
        rs.getTimestamp("created_at").toInstant()), namespace, limit);
    } catch (DataAccessException e) {
      log.warn("Failed to list active threads: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  public CheckpointStats stats() {
    if (!isReady()) {
      return CheckpointStats.empty();
    }
    String sql =
      "SELECT COUNT(*) AS total, COUNT(DISTINCT thread_id) AS threads, " +
        "MIN(created_at) AS oldest, MAX(created_at) AS newest " +
        "FROM langgraph_checkpoints WHERE checkpoint_ns = ?";
    try {
      return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> CheckpointStats.builder()
        .totalCheckpoints(rs.getLong("total"))
        .totalThreads(rs.getLong("threads"))
        .oldestCheckpoint(toInstant(rs.getTimestamp("oldest")))
        .newestCheckpoint(toInstant(rs.getTimestamp("newest")))
        .build(), namespace);
    } catch (DataAccessException e) {
      log.warn("Failed to load checkpoint stats: {}", e.getMessage());
      return CheckpointStats.empty();
    }
  }

  // ===== JSON columns =====

  private ObjectNode writeCheckpoint(Checkpoint checkpoint) {
    ObjectNode node = JsonUtils.objectMapper().createObjectNode();
    node.put("v", 1);
    node.put("id", checkpoint.getId());
    node.put("ts", checkpoint.getTs() != null ? checkpoint.getTs().toString() : Instant.now().toString());
    node.set("channel_values", checkpoint.getChannelValues());
    node.set("channel_versions", JsonUtils.objectMapper().valueToTree(checkpoint.getChannelVersions()));
    return node;
  }

  private Checkpoint readCheckpoint(String json, String id, String parentId, Instant createdAt) {
    ObjectNode node = JsonUtils.readObject(json);
    JsonNode values = node.get("channel_values");
    return Checkpoint.builder()
      .id(id)
      .ts(parseInstant(node.path("ts").asText(null), createdAt))
      .channelValues(values instanceof ObjectNode ? (ObjectNode) values : JsonUtils.objectMapper().createObjectNode())
      .channelVersions(readVersions(node.get("channel_versions")))
      .parentCheckpointId(parentId)
      .build();
  }

  private ObjectNode writeMetadata(CheckpointMetadata metadata) {
    ObjectNode node = JsonUtils.objectMapper().createObjectNode();
    node.put("source", metadata.getSource());
    node.put("step", metadata.getStep());
    node.set("parents", JsonUtils.objectMapper().valueToTree(metadata.getParents()));
    return node;
  }

  private CheckpointMetadata readMetadata(String json) {
    ObjectNode node = JsonUtils.readObject(json);
    Map<String, String> parents = new LinkedHashMap<>();
    JsonNode parentsNode = node.get("parents");
    if (parentsNode != null && parentsNode.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = parentsNode.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (field.getValue().isTextual()) {
          parents.put(field.getKey(), field.getValue().asText());
        }
      }
    }
    return CheckpointMetadata.builder()
      .source(node.path("source").asText(null))
      .step(node.path("step").asInt(0))
      .parents(parents)
      .build();
  }

  private static Map<String, Integer> readVersions(JsonNode node) {
    Map<String, Integer> versions = new LinkedHashMap<>();
    if (node == null || !node.isObject()) {
      return versions;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().canConvertToInt()) {
        versions.put(field.getKey(), field.getValue().asInt());
      }
    }
    return versions;
  }

  private static Instant parseInstant(String value, Instant fallback) {
    if (value == null) {
      return fallback;
    }
    try {
      return Instant.parse(value);
    } catch (RuntimeException e) {
      return fallback;
    }
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
