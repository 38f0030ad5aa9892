package com.github.spud.sample.ai.orchestrator.domain.turn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ThreadTurnGuardTest {

  private final ThreadTurnGuard guard = new ThreadTurnGuard();

  @Test
  void shouldSerializeTurnsOnSameThread() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        futures.add(pool.submit(() -> guard.runExclusive("conv-1", () -> {
          int now = inside.incrementAndGet();
          maxInside.accumulateAndGet(now, Math::max);
          sleep(2);
          inside.decrementAndGet();
          return now;
        })));
      }
      for (Future<Integer> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(guard.activeThreads()).isZero();
  }

  @Test
  void shouldNotBlockOtherThreads() throws Exception {
    CountDownLatch holding = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<String> blocked = pool.submit(() -> guard.runExclusive("conv-1", () -> {
        holding.countDown();
        await(release);
        return "first";
      }));
      assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(guard.runExclusive("conv-2", () -> "second")).isEqualTo("second");
      assertThat(guard.activeThreads()).isEqualTo(1);

      release.countDown();
      assertThat(blocked.get(5, TimeUnit.SECONDS)).isEqualTo("first");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void shouldReleaseLockWhenActionFails() {
    assertThatThrownBy(() -> guard.runExclusive("conv-1", () -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(guard.activeThreads()).isZero();
    assertThat(guard.runExclusive("conv-1", () -> "ok")).isEqualTo("ok");
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
