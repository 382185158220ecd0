package ca.gc.cra.helm.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the root logging level at runtime from CLI flags or configuration.
 * <p><strong>Why:</strong> Operators raise verbosity while troubleshooting a session without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name.
   *
   * @param levelName level such as {@code INFO} or {@code debug}; blank values leave the level untouched
   * @return {@code true} when the backend accepted the change
   * @throws IllegalArgumentException if {@code levelName} is not a recognised level
   */
  public static boolean applyRootLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      return false;
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("Unknown logging level: " + levelName);
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Logging level {} requested but backend {} does not support dynamic level updates",
        normalized, factory.getClass().getName());
    return false;
  }
}
