package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.HostApplication;
import ca.gc.cra.tracker.application.port.OverlayPort;
import ca.gc.cra.tracker.application.port.TrackingClient;
import ca.gc.cra.tracker.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable host session holding the global visitor id, the active transmission client and the overlay port.
 *
 * <p><strong>Thread-safety:</strong> Each field is an independent {@link AtomicReference} with overwrite semantics.</p>
 *
 * @since 0.1.0
 */
public final class DefaultHostApplication implements HostApplication {
  private final AtomicReference<String> visitorId;
  private final AtomicReference<TrackingClient> client = new AtomicReference<>();
  private final AtomicReference<OverlayPort> overlay;
  private final TrackerDelegateSlot delegateSlot;

  /**
   * Creates a host with a generated visitor id, no client and no overlay subsystem.
   */
  public DefaultHostApplication() {
    this(newVisitorId(), OverlayPort.NO_OP, TrackerApp.delegateSlot());
  }

  /**
   * Creates a host with explicit collaborators.
   *
   * @param visitorId initial visitor id; must be non-blank
   * @param overlay overlay port; {@code null} falls back to {@link OverlayPort#NO_OP}
   * @param delegateSlot slot consulted whenever a client is installed; never {@code null}
   */
  public DefaultHostApplication(String visitorId, OverlayPort overlay, TrackerDelegateSlot delegateSlot) {
    this.visitorId = new AtomicReference<>(Strings.requireNonBlank("visitorId", visitorId));
    this.overlay = new AtomicReference<>(overlay == null ? OverlayPort.NO_OP : overlay);
    this.delegateSlot = Objects.requireNonNull(delegateSlot, "delegateSlot");
  }

  @Override
  public String visitorId() {
    return visitorId.get();
  }

  /**
   * Replaces the global visitor id. Trackers created earlier keep the id they captured.
   *
   * @param value new visitor id; must be non-blank
   */
  public void setVisitorId(String value) {
    visitorId.set(Strings.requireNonBlank("visitorId", value));
  }

  /**
   * Issues a fresh random visitor id, e.g. on logout.
   *
   * @return the new visitor id
   */
  public String renewVisitorId() {
    String renewed = newVisitorId();
    visitorId.set(renewed);
    return renewed;
  }

  @Override
  public Optional<TrackingClient> trackingClient() {
    return Optional.ofNullable(client.get());
  }

  /**
   * Installs the transmission client, handing it the current process-wide delegate.
   *
   * @param trackingClient new client; {@code null} removes the current one
   * @return previously installed client, or {@code null}
   */
  public TrackingClient setTrackingClient(TrackingClient trackingClient) {
    TrackingClient previous = client.getAndSet(trackingClient);
    delegateSlot.bind(trackingClient);
    return previous;
  }

  @Override
  public OverlayPort overlay() {
    return overlay.get();
  }

  /**
   * Replaces the overlay consulted on view transitions.
   *
   * @param value new overlay; {@code null} restores {@link OverlayPort#NO_OP}
   */
  public void setOverlay(OverlayPort value) {
    overlay.set(value == null ? OverlayPort.NO_OP : value);
  }

  private static String newVisitorId() {
    return UUID.randomUUID().toString();
  }
}
