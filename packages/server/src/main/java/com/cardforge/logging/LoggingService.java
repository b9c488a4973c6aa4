package com.cardforge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying level overrides from the application
 * configuration.
 *
 * <p>Levels are read from the {@code logging.level} subtree, e.g.:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.cardforge.pipeline: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context. Unknown level names are ignored
   * with a warning; when SLF4J is not bound to Logback this is a no-op.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String loggerName = it.next();
      String value = levels.getString(loggerName);
      Level level = Level.toLevel(value, null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      // hierarchical configurations escape dots inside node names as ".."
      String name = loggerName.replace("..", ".");
      String target = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(target).setLevel(level);
    }
  }
}
