package ca.gc.cra.feedback.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code --verbose} CLI flag to Logback.
 *
 * <p>Only the pipeline's own loggers ({@value #APPLICATION_LOGGER}) move to DEBUG; Kafka and
 * OpenTelemetry keep the levels from {@code logback.xml}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  static final String APPLICATION_LOGGER = "ca.gc.cra.feedback";
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the application logger to DEBUG. Non-Logback backends are left unchanged with a warning.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: SLF4J backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger application = context.getLogger(APPLICATION_LOGGER);
    if (application.getLevel() != Level.DEBUG) {
      application.setLevel(Level.DEBUG);
      log.debug("DEBUG logging enabled for {}", APPLICATION_LOGGER);
    }
    return true;
  }
}
