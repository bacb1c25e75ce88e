package ca.gc.cra.tracker.infrastructure.transmission;

import ca.gc.cra.tracker.application.port.TrackingTransport;
import ca.gc.cra.tracker.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport that writes each encoded event to the log instead of a network endpoint. Every send succeeds.
 *
 * @since 0.1.0
 */
public final class LoggingTrackingTransport implements TrackingTransport {
  private static final Logger log = LoggerFactory.getLogger(LoggingTrackingTransport.class);
  private static final int MAX_BODY_BYTES = 1024;

  private final boolean includeBody;

  /**
   * Creates a transport that logs event metadata only.
   */
  public LoggingTrackingTransport() {
    this(false);
  }

  /**
   * Creates a logging transport.
   *
   * @param includeBody whether to include the (truncated) JSON body; bodies may contain visitor attributes
   */
  public LoggingTrackingTransport(boolean includeBody) {
    this.includeBody = includeBody;
  }

  @Override
  public void send(EncodedEvent event) {
    Objects.requireNonNull(event, "event");
    if (includeBody) {
      log.info("tracking.event name={} task={} body={}",
          event.eventName(), event.taskId(), Logs.truncate(event.json(), MAX_BODY_BYTES));
    } else {
      log.info("tracking.event name={} task={} visitor={}",
          event.eventName(), event.taskId(), Logs.redact(event.visitorId()));
    }
  }
}
