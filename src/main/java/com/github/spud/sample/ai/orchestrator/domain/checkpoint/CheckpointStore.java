package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 检查点存储，按 (thread_id, checkpoint_ns, checkpoint_id) 寻址。
 * <p>
 * 存储不可用时所有操作都是空操作（返回空结果），检查点只是尽力而为的恢复手段。
 */
public interface CheckpointStore {

  /**
   * 写入检查点；相同 ID 再次写入会覆盖
   */
  void put(String threadId, Checkpoint checkpoint, CheckpointMetadata metadata);

  Optional<CheckpointTuple> getLatest(String threadId);

  /**
   * 按创建时间倒序
   */
  List<CheckpointTuple> list(String threadId, int limit);

  void putWrites(String threadId, String checkpointId, String taskId, List<PendingWrite> writes);

  List<PendingWrite> getWrites(String threadId, String checkpointId);

  void deleteThread(String threadId);

  /**
   * 删除早于 age 的检查点，返回删除的数量
   */
  int cleanupOlderThan(Duration age);

  /**
   * 每个线程的最新检查点，最近更新的在前
   */
  List<ThreadState> activeThreads(int limit);

  CheckpointStats stats();

  boolean isReady();
}
