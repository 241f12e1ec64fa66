package org.waabox.jobnotify;

/**
 * Signals a failure of the underlying database connection while
 * subscribing, waiting or draining notifications.
 *
 * <p>This is an unchecked exception. It propagates to the caller of the
 * listener untouched; reconnection policy belongs to the connection pool.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListenerConnectionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ListenerConnectionException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ListenerConnectionException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
