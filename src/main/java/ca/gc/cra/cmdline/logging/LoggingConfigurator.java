package ca.gc.cra.cmdline.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts library logging verbosity at runtime.
 * <p><strong>Why:</strong> Hosts can trace command resolution ({@code verbose: true} in the dispatch
 * configuration) without editing {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup; relies on the backend's own
 * synchronization.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their levels.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String LIBRARY_LOGGER = "ca.gc.cra.cmdline";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the library's logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was applied, {@code false} when the backend does not support it
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(LIBRARY_LOGGER);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
