package com.gentoro.mistadopt.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>All classes obtain their logger through {@link #getLogger(Class)} so that levels configured
 * under {@code logging.level.*} in {@code application.yaml} are applied consistently.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels from configuration, e.g. {@code logging.level.root: INFO} or {@code
   * logging.level.com.gentoro.mistadopt.http: DEBUG}.
   */
  public static void applyConfiguration(Configuration config) {
    if (config == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Iterator<String> keys = config.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String value = config.getString(key, null);
      if (value == null || value.isBlank()) continue;

      // hierarchical configurations escape dots inside a YAML key as ".."
      String loggerName = key.substring(LEVEL_PREFIX.length()).replace("..", ".");
      if (loggerName.startsWith(".")) loggerName = loggerName.substring(1);
      if (loggerName.isEmpty() || "root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
