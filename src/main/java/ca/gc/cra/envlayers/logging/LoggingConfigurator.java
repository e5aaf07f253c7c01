package ca.gc.cra.envlayers.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts envlayers logging for CLI runs.
 * <p><strong>Why:</strong> {@code --verbose} should reveal reload cascades without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the level of the {@code ca.gc.cra.envlayers} logger hierarchy and of the root logger.
   *
   * @param level level to apply
   * @return {@code true} when the active backend is Logback and accepted the change
   */
  public static boolean setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot set level {}: backend {} is not Logback", level, factory.getClass().getName());
      return false;
    }
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    context.getLogger("ca.gc.cra.envlayers").setLevel(level);
    return true;
  }

  /**
   * Shorthand for {@code setLevel(Level.DEBUG)}, used by {@code --verbose}.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(Level.DEBUG);
  }
}
