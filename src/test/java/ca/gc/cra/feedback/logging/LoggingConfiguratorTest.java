package ca.gc.cra.feedback.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void restoreLevels() {
    context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).setLevel(null);
  }

  @Test
  void verboseRaisesOnlyApplicationLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    Logger pipeline = context.getLogger("ca.gc.cra.feedback.application.pipeline.FeedbackMessageHandler");
    assertEquals(Level.DEBUG, pipeline.getEffectiveLevel());
    assertNotEquals(Level.DEBUG, context.getLogger("org.apache.kafka.clients.consumer").getEffectiveLevel());
  }
}
