package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 定时清理过期检查点，与请求处理完全解耦
 */
@Slf4j
public class CheckpointCleanupScheduler {

  private final CheckpointStore store;
  private final Duration maxAge;

  public CheckpointCleanupScheduler(CheckpointStore store, Duration maxAge) {
    this.store = store;
    this.maxAge = maxAge;
  }

  @Scheduled(
    initialDelayString = "${orchestrator.checkpoint.cleanup-initial-delay:PT5M}",
    fixedDelayString = "${orchestrator.checkpoint.cleanup-interval:PT6H}")
  public void cleanup() {
    if (!store.isReady()) {
      log.debug("Checkpoint store not ready, skipping cleanup");
      return;
    }
    try {
      int deleted = store.cleanupOlderThan(maxAge);
      log.info("Checkpoint cleanup removed {} checkpoints older than {}", deleted, maxAge);
    } catch (RuntimeException e) {
      log.warn("Checkpoint cleanup failed: {}", e.getMessage());
    }
  }
}
