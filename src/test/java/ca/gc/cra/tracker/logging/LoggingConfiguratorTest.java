package ca.gc.cra.tracker.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void enableVerboseLoggingRaisesTrackerLoggerToDebug() {
    Logger logger = (Logger) LoggerFactory.getLogger(LoggingConfigurator.TRACKER_LOGGER);
    Level original = logger.getLevel();
    logger.setLevel(Level.WARN);
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, logger.getLevel());
    } finally {
      logger.setLevel(original);
    }
  }
}
