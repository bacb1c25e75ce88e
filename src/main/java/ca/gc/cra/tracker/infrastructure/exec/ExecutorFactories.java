package ca.gc.cra.tracker.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors backing tracking dispatch.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread dispatch executor with a bounded queue. Submissions beyond {@code capacity}
   * are rejected instead of blocking the tracking caller.
   *
   * @param capacity maximum number of queued tasks
   * @param prefix thread-name prefix used to tag the worker thread
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newDispatchExecutor(int capacity, String prefix, UncaughtExceptionHandler handler) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "tracker-dispatch" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          // Tracking must never keep the host JVM alive.
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(capacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
