package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.HostApplication;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide registry of the active {@link HostApplication} and the shared {@link TrackerDelegateSlot}.
 *
 * <p>Until a host is installed, {@link #host()} lazily provides a {@link DefaultHostApplication} with a
 * generated visitor id and no transmission client, so tracking calls made during startup are accepted
 * and silently not dispatched.</p>
 *
 * @since 0.1.0
 */
public final class TrackerApp {
  private static final Logger log = LoggerFactory.getLogger(TrackerApp.class);

  private static final TrackerDelegateSlot DELEGATE_SLOT = new TrackerDelegateSlot();
  private static final AtomicReference<HostApplication> HOST = new AtomicReference<>();

  private TrackerApp() {}

  /**
   * Returns the active host, creating the default one on first use.
   *
   * @return active host; never {@code null}
   */
  public static HostApplication host() {
    HostApplication current = HOST.get();
    if (current != null) {
      return current;
    }
    HOST.compareAndSet(null, new DefaultHostApplication());
    return HOST.get();
  }

  /**
   * Installs a host and hands the current process-wide delegate to its client.
   *
   * @param host host to install; never {@code null}
   * @return previously installed host, or {@code null}
   */
  public static HostApplication install(HostApplication host) {
    Objects.requireNonNull(host, "host");
    HostApplication previous = HOST.getAndSet(host);
    host.trackingClient().ifPresent(DELEGATE_SLOT::bind);
    log.info("Tracker host installed (client {})", host.trackingClient().isPresent() ? "active" : "absent");
    return previous;
  }

  /**
   * Removes the installed host; the next {@link #host()} call creates a fresh default host.
   *
   * @return removed host, or {@code null}
   */
  public static HostApplication reset() {
    return HOST.getAndSet(null);
  }

  /**
   * Returns the process-wide delegate slot.
   *
   * @return delegate slot
   */
  public static TrackerDelegateSlot delegateSlot() {
    return DELEGATE_SLOT;
  }
}
