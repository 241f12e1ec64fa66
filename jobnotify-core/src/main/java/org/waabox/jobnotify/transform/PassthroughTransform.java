package org.waabox.jobnotify.transform;

import java.util.LinkedHashMap;
import java.util.Map;

import org.waabox.jobnotify.RawMessage;

/**
 * The transform applied to message types without a registered transform.
 *
 * <p>Removes {@code message_type} and accepts the remaining fields as
 * they are.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PassthroughTransform implements MessageTransform {

  /** {@inheritDoc} */
  @Override
  public TransformResult apply(final Map<String, Object> fields) {
    final Map<String, Object> result = new LinkedHashMap<>(fields);
    result.remove(RawMessage.MESSAGE_TYPE);
    return TransformResult.accepted(result);
  }
}
