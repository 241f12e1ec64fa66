package org.waabox.jobnotify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded notification payload, before type-specific validation.
 *
 * <p>The fields keep the key order of the payload and still contain the
 * {@code message_type} entry.
 *
 * @param type   the message type tag, never null
 * @param fields the decoded fields, never null, unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RawMessage(String type, Map<String, Object> fields) {

  /** The payload key that carries the message type tag. */
  public static final String MESSAGE_TYPE = "message_type";

  /** Validates and defensively copies the record components.
   *
   * @param type   the message type tag, never null
   * @param fields the decoded fields, never null
   */
  public RawMessage {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(fields, "fields must not be null");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
