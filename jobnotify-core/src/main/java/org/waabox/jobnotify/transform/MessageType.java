package org.waabox.jobnotify.transform;

import java.util.function.Supplier;

/**
 * The message types with a dedicated transform.
 *
 * <p>Any other tag is handled by {@link PassthroughTransform}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MessageType {

  /** A job was inserted and may be ready to work. */
  NEW_JOB("new_job", NewJobTransform::new);

  /** The tag sent in {@code message_type}, never null. */
  private final String tag;

  /** Creates the transform for this type, never null. */
  private final Supplier<MessageTransform> transformFactory;

  /** Creates a message type.
   *
   * @param theTag              the wire tag
   * @param theTransformFactory the transform factory
   */
  MessageType(final String theTag,
      final Supplier<MessageTransform> theTransformFactory) {
    tag = theTag;
    transformFactory = theTransformFactory;
  }

  /**
   * Returns the wire tag of this type.
   *
   * @return the tag, never null
   */
  public String tag() {
    return tag;
  }

  /**
   * Creates a new transform for this type.
   *
   * @return the transform, never null
   */
  public MessageTransform newTransform() {
    return transformFactory.get();
  }
}
