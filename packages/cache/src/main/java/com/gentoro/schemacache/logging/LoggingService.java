package com.gentoro.schemacache.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and apply configured log levels. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from the cache configuration.
   *
   * <p>Expected YAML structure:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.schemacache.loader: DEBUG
   * </pre>
   *
   * Anything that is not a Logback context (e.g. another SLF4J binding on the classpath) is left
   * untouched.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.debug("SLF4J is not bound to Logback; ignoring logging.level settings");
      return;
    }

    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      String value = levels.getString(name, null);
      if (value == null || value.isBlank()) continue;
      // dotted logger names come back from the YAML tree with their dots doubled
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      setLevel(ctx.getLogger(loggerName), value);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
