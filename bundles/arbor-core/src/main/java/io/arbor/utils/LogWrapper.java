package io.arbor.utils;

import org.slf4j.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Thin helper around an SLF4J {@link Logger} which checks the level before formatting.
 */
public final class LogWrapper {

  /** Logger. */
  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger the wrapped logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }

  /**
   * Log an error.
   *
   * @param message message pattern
   * @param objects arguments of the pattern
   */
  public void error(final String message, final Object... objects) {
    if (logger.isErrorEnabled()) {
      logger.error(message, objects);
    }
  }

  /**
   * Log a warning.
   *
   * @param message message pattern
   * @param objects arguments of the pattern
   */
  public void warn(final String message, final Object... objects) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, objects);
    }
  }

  /**
   * Log an informational message.
   *
   * @param message message pattern
   * @param objects arguments of the pattern
   */
  public void info(final String message, final Object... objects) {
    if (logger.isInfoEnabled()) {
      logger.info(message, objects);
    }
  }

  /**
   * Log debugging information.
   *
   * @param message message pattern
   * @param objects arguments of the pattern
   */
  public void debug(final String message, final Object... objects) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, objects);
    }
  }
}
