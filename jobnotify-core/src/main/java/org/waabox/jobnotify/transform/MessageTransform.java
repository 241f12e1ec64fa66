package org.waabox.jobnotify.transform;

import java.util.Map;

/**
 * Validates and normalizes the fields of one message type.
 *
 * <p>Implementations must not throw for expected conditions. A field of the
 * wrong type yields {@link TransformResult#abstained(String)}; a failed
 * conversion of a well-shaped field yields
 * {@link TransformResult#faulted(Throwable)} carrying the raised error.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface MessageTransform {

  /**
   * Transforms the raw fields of a message.
   *
   * @param fields the decoded fields, including {@code message_type}, never
   *               null
   *
   * @return the outcome of the transformation, never null
   */
  TransformResult apply(Map<String, Object> fields);
}
