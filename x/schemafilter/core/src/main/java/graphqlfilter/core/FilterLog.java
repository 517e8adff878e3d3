package graphqlfilter.core;

import graphqlfilter.api.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger gated by the verbosity threshold of one filter run.
 *
 * <p>The threshold comes from {@link graphqlfilter.api.FilterOptions#logLevel()} and is checked at
 * every call, so two runs with different thresholds can log side by side. The SLF4J binding still
 * decides what finally reaches the output.
 */
public final class FilterLog {

  private final Logger logger;
  private final LogLevel threshold;

  private FilterLog(Logger logger, LogLevel threshold) {
    this.logger = logger;
    this.threshold = threshold;
  }

  /**
   * Creates a log for the given owner class.
   *
   * @param owner the class whose logger is used
   * @param threshold the lowest level that is emitted
   * @return the log
   */
  public static FilterLog of(Class<?> owner, LogLevel threshold) {
    return new FilterLog(LoggerFactory.getLogger(owner), threshold);
  }

  /** A log that never emits anything. */
  public static FilterLog silent(Class<?> owner) {
    return of(owner, LogLevel.NONE);
  }

  /** Returns a log for another class sharing this log's threshold. */
  public FilterLog forClass(Class<?> owner) {
    return new FilterLog(LoggerFactory.getLogger(owner), threshold);
  }

  public LogLevel threshold() {
    return threshold;
  }

  public boolean isEnabled(LogLevel level) {
    if (!threshold.allows(level)) {
      return false;
    }
    return switch (level) {
      case DEBUG -> logger.isDebugEnabled();
      case INFO -> logger.isInfoEnabled();
      case WARN -> logger.isWarnEnabled();
      case NONE -> false;
    };
  }

  public void debug(String format, Object... arguments) {
    if (threshold.allows(LogLevel.DEBUG)) {
      logger.debug(format, arguments);
    }
  }

  public void info(String format, Object... arguments) {
    if (threshold.allows(LogLevel.INFO)) {
      logger.info(format, arguments);
    }
  }

  public void warn(String format, Object... arguments) {
    if (threshold.allows(LogLevel.WARN)) {
      logger.warn(format, arguments);
    }
  }
}
