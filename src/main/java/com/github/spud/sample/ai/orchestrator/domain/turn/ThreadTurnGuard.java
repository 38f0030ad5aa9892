package com.github.spud.sample.ai.orchestrator.domain.turn;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * 同一会话线程上的轮次互斥执行；不同线程互不阻塞。
 * <p>
 * 锁按引用计数保留，最后一个持有者释放后即从表中移除。
 */
@Component
public class ThreadTurnGuard {

  private final ConcurrentHashMap<String, Holder> locks = new ConcurrentHashMap<>();

  public <T> T runExclusive(String threadId, Supplier<T> action) {
    Holder holder = locks.compute(threadId, (key, existing) -> {
      Holder h = existing != null ? existing : new Holder();
      h.refs++;
      return h;
    });
    holder.lock.lock();
    try {
      return action.get();
    } finally {
      holder.lock.unlock();
      locks.compute(threadId, (key, existing) -> {
        if (existing == null) {
          return null;
        }
        existing.refs--;
        return existing.refs == 0 ? null : existing;
      });
    }
  }

  /**
   * 当前持有或等待锁的线程数
   */
  int activeThreads() {
    return locks.size();
  }

  private static final class Holder {

    private final ReentrantLock lock = new ReentrantLock();
    // 只在 compute 内修改
    private int refs;
  }
}
