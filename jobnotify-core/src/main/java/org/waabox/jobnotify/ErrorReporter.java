package org.waabox.jobnotify;

/**
 * A sink for errors raised while converting a notification's fields.
 *
 * <p>The listener invokes the reporter once per conversion fault. It is
 * never invoked for payloads that are not valid JSON nor for fields of the
 * wrong type; those are dropped silently.
 *
 * <p>Implementations must not block. An exception thrown by the reporter
 * is logged by the listener and otherwise ignored.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ErrorReporter {

  /**
   * Reports an error raised while transforming a message.
   *
   * @param error the raised error, never null
   */
  void report(Throwable error);
}
