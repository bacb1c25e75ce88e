package ca.gc.cra.tracker.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void dispatchExecutorRejectsWhenQueueIsFull() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    AtomicReference<Thread> worker = new AtomicReference<>();
    ThreadPoolExecutor executor = ExecutorFactories.newDispatchExecutor(1, "test-dispatch", (t, e) -> { });
    try {
      executor.execute(() -> {
        worker.set(Thread.currentThread());
        started.countDown();
        awaitQuietly(release);
      });
      assertTrue(started.await(5, TimeUnit.SECONDS));
      executor.execute(() -> { });

      assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
      assertTrue(worker.get().isDaemon());
      assertTrue(worker.get().getName().startsWith("test-dispatch"));
      assertEquals(1, executor.getMaximumPoolSize());
    } finally {
      release.countDown();
      executor.shutdown();
      executor.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
