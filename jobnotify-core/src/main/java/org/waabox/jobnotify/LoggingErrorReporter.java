package org.waabox.jobnotify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link ErrorReporter}, which writes every reported error to
 * the log at ERROR level.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LoggingErrorReporter implements ErrorReporter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LoggingErrorReporter.class);

  /** {@inheritDoc} */
  @Override
  public void report(final Throwable error) {
    log.error("Failed to process notification: {}", error.getMessage(),
        error);
  }
}
