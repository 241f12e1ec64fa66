package org.waabox.jobnotify.transform;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.waabox.jobnotify.RawMessage;

/**
 * The transform for {@code new_job} messages, sent when a job is enqueued.
 *
 * <p>Expected payload:
 * <pre>{@code
 * {"message_type": "new_job", "priority": 90,
 *  "run_at": "2017-06-30T18:33:33.402669Z", "id": 44}
 * }</pre>
 *
 * <p>{@code priority} must be an integral number and {@code run_at} a
 * string, otherwise the message is abstained. {@code run_at} is then
 * parsed as an ISO-8601 timestamp with offset; a parse failure is a fault.
 * {@code id} is passed through as is.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NewJobTransform implements MessageTransform {

  /** The priority field. */
  public static final String PRIORITY = "priority";

  /** The scheduled run time field. */
  public static final String RUN_AT = "run_at";

  /** The job id field. */
  public static final String ID = "id";

  /** {@inheritDoc} */
  @Override
  public TransformResult apply(final Map<String, Object> fields) {
    final Object priority = fields.get(PRIORITY);
    if (!isIntegral(priority)) {
      return TransformResult.abstained(PRIORITY + " is not an integer: "
          + priority);
    }

    final Object runAt = fields.get(RUN_AT);
    if (!(runAt instanceof String)) {
      return TransformResult.abstained(RUN_AT + " is not a string: "
          + runAt);
    }

    final Instant parsedRunAt;
    try {
      parsedRunAt = parseTimestamp((String) runAt);
    } catch (final DateTimeParseException e) {
      return TransformResult.faulted(e);
    }

    final Map<String, Object> result = new LinkedHashMap<>(fields);
    result.remove(RawMessage.MESSAGE_TYPE);
    result.put(RUN_AT, parsedRunAt);
    return TransformResult.accepted(result);
  }

  /**
   * Parses an ISO-8601 timestamp with offset, keeping sub-second digits.
   *
   * @param text the timestamp, never null
   *
   * @return the instant, never null
   *
   * @throws DateTimeParseException if the text is not a valid timestamp
   */
  static Instant parseTimestamp(final String text) {
    return OffsetDateTime.parse(text).toInstant();
  }

  /**
   * Checks whether a decoded value is an integral number.
   *
   * @param value the value, may be null
   *
   * @return true for Integer, Long, Short, Byte and BigInteger values
   */
  private static boolean isIntegral(final Object value) {
    return value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger;
  }
}
