package org.waabox.jobnotify;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.Test;

/** Tests for {@link LoggingErrorReporter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LoggingErrorReporterTest {

  @Test
  void whenReporting_givenConversionFault_shouldOnlyLog() {
    final DateTimeParseException error = captureParseError();

    assertDoesNotThrow(() -> new LoggingErrorReporter().report(error));
  }

  /** Produces the error a bad run_at raises.
   *
   * @return the parse error.
   */
  private static DateTimeParseException captureParseError() {
    try {
      OffsetDateTime.parse("blah");
    } catch (final DateTimeParseException e) {
      return e;
    }
    throw new IllegalStateException("blah should not parse");
  }
}
