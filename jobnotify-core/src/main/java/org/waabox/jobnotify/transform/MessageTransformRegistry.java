package org.waabox.jobnotify.transform;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable mapping from message type tag to {@link MessageTransform}.
 *
 * <p>Tags without a registered transform resolve to
 * {@link PassthroughTransform}.
 *
 * <p>Usage example:
 * <pre>{@code
 * MessageTransformRegistry registry = MessageTransformRegistry.builder()
 *     .registerDefaults()
 *     .register("job_finished", fields -> TransformResult.accepted(fields))
 *     .build();
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MessageTransformRegistry {

  /** The registered transforms keyed by tag, never null. */
  private final Map<String, MessageTransform> transforms;

  /** The transform for unregistered tags, never null. */
  private final MessageTransform fallback;

  /** Creates a registry.
   *
   * @param theTransforms the transforms by tag
   * @param theFallback   the transform for unknown tags
   */
  private MessageTransformRegistry(
      final Map<String, MessageTransform> theTransforms,
      final MessageTransform theFallback) {
    transforms = Collections.unmodifiableMap(new HashMap<>(theTransforms));
    fallback = theFallback;
  }

  /**
   * Creates a registry holding the transform of every {@link MessageType}.
   *
   * @return the registry, never null
   */
  public static MessageTransformRegistry defaults() {
    return builder().registerDefaults().build();
  }

  /**
   * Creates a new builder with no registered transforms.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the transform for a tag.
   *
   * @param tag the message type tag, never null
   *
   * @return the registered transform, or the passthrough transform if the
   *         tag is not registered, never null
   */
  public MessageTransform transformFor(final String tag) {
    Objects.requireNonNull(tag, "tag must not be null");
    return transforms.getOrDefault(tag, fallback);
  }

  /** Builder for {@link MessageTransformRegistry}. */
  public static final class Builder {

    /** The transforms registered so far. */
    private final Map<String, MessageTransform> transforms = new HashMap<>();

    /** Creates an empty builder. */
    private Builder() {
    }

    /**
     * Registers the transform of every {@link MessageType}.
     *
     * @return this builder for chaining, never null
     */
    public Builder registerDefaults() {
      for (final MessageType type : MessageType.values()) {
        transforms.put(type.tag(), type.newTransform());
      }
      return this;
    }

    /**
     * Registers a transform for a tag, replacing any previous one.
     *
     * @param tag       the message type tag, never null or blank
     * @param transform the transform, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if the tag is blank
     */
    public Builder register(final String tag,
        final MessageTransform transform) {
      Objects.requireNonNull(tag, "tag must not be null");
      Objects.requireNonNull(transform, "transform must not be null");
      if (tag.isBlank()) {
        throw new IllegalArgumentException("tag must not be blank");
      }
      transforms.put(tag, transform);
      return this;
    }

    /**
     * Builds the registry.
     *
     * @return the registry, never null
     */
    public MessageTransformRegistry build() {
      return new MessageTransformRegistry(transforms,
          new PassthroughTransform());
    }
  }
}
