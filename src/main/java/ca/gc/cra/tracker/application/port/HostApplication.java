package ca.gc.cra.tracker.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Port onto the host application session that owns visitor identity and the
 * transmission collaborator.
 * <p><strong>Role:</strong> Read by the tracker at construction (visitor id) and on every call (client, overlay).</p>
 * <p><strong>Thread-safety:</strong> Reads may race with reconfiguration and must tolerate an absent client.</p>
 *
 * @since 0.1.0
 */
public interface HostApplication {
  /**
   * Returns the current global visitor identity.
   *
   * @return visitor id; never {@code null}
   */
  String visitorId();

  /**
   * Returns the active transmission collaborator.
   *
   * @return client, or empty before setup or after teardown
   */
  Optional<TrackingClient> trackingClient();

  /**
   * Returns the overlay subsystem.
   *
   * @return overlay port; {@link OverlayPort#NO_OP} when the host has none
   */
  OverlayPort overlay();
}
