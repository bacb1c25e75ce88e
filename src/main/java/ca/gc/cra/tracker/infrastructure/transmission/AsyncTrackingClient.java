package ca.gc.cra.tracker.infrastructure.transmission;

import ca.gc.cra.tracker.application.port.MetricsPort;
import ca.gc.cra.tracker.application.port.TrackerDelegate;
import ca.gc.cra.tracker.application.port.TrackingClient;
import ca.gc.cra.tracker.application.port.TrackingTransport;
import ca.gc.cra.tracker.application.port.TrackingTransport.EncodedEvent;
import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import ca.gc.cra.tracker.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.tracker.infrastructure.json.EventJsonEncoder;
import ca.gc.cra.tracker.validation.Numbers;
import java.io.IOException;
import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TrackingClient} that delivers tasks on a single background worker.
 * <p><strong>Flow:</strong> {@link #track(TrackingTask)} claims the task and enqueues it on a bounded queue; the
 * worker lets the delegate intercept the event, encodes it, and sends it through the {@link TrackingTransport}
 * with exponential backoff between attempts.</p>
 * <p><strong>Lifecycle:</strong> {@code PENDING -> SENT} on the first attempt, then {@code ACKNOWLEDGED} on success,
 * {@code FAILED} after the last attempt or on an encoding error, {@code DROPPED} when the queue is full or the
 * client closes before delivery.</p>
 * <p><strong>Thread-safety:</strong> {@link #track(TrackingTask)} and {@link #setDelegate(TrackerDelegate)} may be
 * called from any thread; delivery is serialized on the worker, so tasks are sent in submission order.</p>
 * <p><strong>Metrics:</strong> {@code tracking.enqueued}, {@code tracking.dropped}, {@code tracking.retried},
 * {@code tracking.acknowledged}, {@code tracking.failed} and {@code tracking.send.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class AsyncTrackingClient implements TrackingClient {
  private static final Logger log = LoggerFactory.getLogger(AsyncTrackingClient.class);

  private final TrackingTransport transport;
  private final EventJsonEncoder encoder;
  private final MetricsPort metrics;
  private final Settings settings;
  private final Sleeper sleeper;
  private final ThreadPoolExecutor executor;
  private final AtomicReference<WeakReference<TrackerDelegate>> delegate =
      new AtomicReference<>(new WeakReference<>(null));
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a client.
   *
   * @param transport wire used for delivery; never {@code null}
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param settings dispatch settings; never {@code null}
   */
  public AsyncTrackingClient(TrackingTransport transport, MetricsPort metrics, Settings settings) {
    this(transport, metrics, settings, Sleeper.THREAD);
  }

  AsyncTrackingClient(TrackingTransport transport, MetricsPort metrics, Settings settings, Sleeper sleeper) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.encoder = new EventJsonEncoder();
    this.executor = ExecutorFactories.newDispatchExecutor(
        settings.queueCapacity(),
        "tracker-dispatch",
        (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex));
  }

  @Override
  public void track(TrackingTask task) {
    Objects.requireNonNull(task, "task");
    TrackingTask.Completion completion = task.tryClaim().orElse(null);
    if (completion == null) {
      log.warn("Task {} already claimed by another client; ignoring", task.taskId());
      return;
    }
    if (closed.get()) {
      drop(completion, new IllegalStateException("tracking client closed"));
      return;
    }
    try {
      executor.execute(new DeliveryJob(completion));
      metrics.increment("tracking.enqueued");
    } catch (RejectedExecutionException ex) {
      log.warn("Dispatch queue full or closed; dropping task {}", task.taskId());
      drop(completion, ex);
    }
  }

  @Override
  public TrackerDelegate delegate() {
    return delegate.get().get();
  }

  @Override
  public void setDelegate(TrackerDelegate value) {
    delegate.set(new WeakReference<>(value));
  }

  /**
   * Stops accepting tasks, waits up to the configured shutdown timeout for queued deliveries and drops
   * whatever is still pending, then closes the transport.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        dropPending(executor.shutdownNow());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      dropPending(executor.shutdownNow());
    }
    try {
      transport.close();
    } catch (IOException ex) {
      log.warn("Failed to close tracking transport cleanly", ex);
    }
  }

  private void dropPending(List<Runnable> pending) {
    if (!pending.isEmpty()) {
      log.warn("Dropping {} undelivered tracking tasks on shutdown", pending.size());
    }
    for (Runnable runnable : pending) {
      if (runnable instanceof DeliveryJob job) {
        drop(job.completion, new IllegalStateException("tracking client closed before delivery"));
      }
    }
  }

  private void deliver(TrackingTask.Completion completion) {
    TrackingTask task = completion.task();
    Event event = intercept(task.event());
    if (!event.eventName().isValid()) {
      log.warn("Event name '{}' should match [a-z0-9_]+ and must not start with '_'; sending anyway",
          event.eventName());
    }

    EncodedEvent encoded;
    try {
      encoded = encoder.encode(task, event);
    } catch (RuntimeException ex) {
      log.warn("Failed to encode task {}: {}", task.taskId(), ex.getMessage());
      fail(completion, ex);
      return;
    }

    Throwable lastError = null;
    for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
      completion.beginAttempt();
      if (attempt == 1) {
        notifyDelegate(d -> d.onSent(task));
      } else {
        metrics.increment("tracking.retried");
      }
      long start = System.nanoTime();
      try {
        transport.send(encoded);
        metrics.observe("tracking.send.latencyNanos", System.nanoTime() - start);
        completion.acknowledge();
        metrics.increment("tracking.acknowledged");
        notifyDelegate(d -> d.onAcknowledged(task));
        return;
      } catch (IOException | RuntimeException ex) {
        lastError = ex;
        log.debug("Attempt {}/{} for task {} failed", attempt, settings.maxAttempts(), task.taskId(), ex);
      }
      if (attempt < settings.maxAttempts()) {
        try {
          sleeper.sleep(settings.backoffFor(attempt));
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          drop(completion, ex);
          return;
        }
      }
    }
    log.warn("Giving up on task {} after {} attempts", task.taskId(), settings.maxAttempts());
    fail(completion, lastError);
  }

  private Event intercept(Event original) {
    TrackerDelegate current = delegate();
    if (current == null) {
      return original;
    }
    try {
      Event replaced = current.intercept(original);
      return replaced == null ? original : replaced;
    } catch (RuntimeException ex) {
      log.warn("Tracker delegate failed to intercept event {}; sending original", original.eventName(), ex);
      return original;
    }
  }

  private void fail(TrackingTask.Completion completion, Throwable cause) {
    completion.fail(cause);
    metrics.increment("tracking.failed");
    notifyDelegate(d -> d.onFailed(completion.task(), cause));
  }

  private void drop(TrackingTask.Completion completion, Throwable cause) {
    completion.drop(cause);
    metrics.increment("tracking.dropped");
  }

  private void notifyDelegate(Consumer<TrackerDelegate> callback) {
    TrackerDelegate current = delegate();
    if (current == null) {
      return;
    }
    try {
      callback.accept(current);
    } catch (RuntimeException ex) {
      log.warn("Tracker delegate callback failed", ex);
    }
  }

  private final class DeliveryJob implements Runnable {
    private final TrackingTask.Completion completion;

    private DeliveryJob(TrackingTask.Completion completion) {
      this.completion = completion;
    }

    @Override
    public void run() {
      deliver(completion);
    }
  }

  /**
   * Pause between delivery attempts.
   */
  @FunctionalInterface
  interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
  }

  /**
   * Dispatch settings.
   *
   * @param queueCapacity maximum queued tasks before new ones are dropped
   * @param maxAttempts delivery attempts per task, including the first
   * @param initialBackoff pause after the first failed attempt; doubles per attempt
   * @param maxBackoff upper bound for the pause between attempts
   * @param shutdownTimeout how long {@link #close()} waits for queued deliveries
   */
  public record Settings(
      int queueCapacity,
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      Duration shutdownTimeout) {

    public Settings {
      Numbers.requireRange("queueCapacity", queueCapacity, 1, 1_000_000);
      Numbers.requireRange("maxAttempts", maxAttempts, 1, 100);
      Objects.requireNonNull(initialBackoff, "initialBackoff");
      Objects.requireNonNull(maxBackoff, "maxBackoff");
      Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0 || shutdownTimeout.isNegative()) {
        throw new IllegalArgumentException("backoff and shutdown durations must be non-negative with max >= initial");
      }
    }

    /**
     * Returns the default settings: 1000 queued tasks, 3 attempts, 500 ms backoff doubling up to 30 s,
     * 5 s shutdown drain.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(1000, 3, Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    Duration backoffFor(int failedAttempt) {
      int shift = Math.min(failedAttempt - 1, 20);
      Duration backoff = initialBackoff.multipliedBy(1L << shift);
      return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
    }
  }
}
