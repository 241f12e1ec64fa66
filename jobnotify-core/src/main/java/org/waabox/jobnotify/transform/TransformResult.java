package org.waabox.jobnotify.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of a {@link MessageTransform}.
 *
 * <p>One of three states:
 * <ul>
 *   <li>{@link Outcome#ACCEPTED}: carries the validated fields;</li>
 *   <li>{@link Outcome#ABSTAINED}: the message does not match the type's
 *       schema and is dropped silently;</li>
 *   <li>{@link Outcome#FAULTED}: a conversion raised an error; the message
 *       is dropped and the error reported.</li>
 * </ul>
 *
 * <p>This class is immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransformResult {

  /** The possible outcomes. */
  public enum Outcome {

    /** The message is valid. */
    ACCEPTED,

    /** The message does not match the schema. */
    ABSTAINED,

    /** A field conversion raised an error. */
    FAULTED
  }

  /** The outcome, never null. */
  private final Outcome outcome;

  /** The validated fields, only for ACCEPTED. */
  private final Map<String, Object> fields;

  /** The reason of an abstention, only for ABSTAINED. */
  private final String reason;

  /** The raised error, only for FAULTED. */
  private final Throwable error;

  /** Private constructor; use static factories.
   *
   * @param theOutcome the outcome
   * @param theFields  the validated fields, may be null
   * @param theReason  the abstention reason, may be null
   * @param theError   the raised error, may be null
   */
  private TransformResult(final Outcome theOutcome,
      final Map<String, Object> theFields, final String theReason,
      final Throwable theError) {
    outcome = theOutcome;
    fields = theFields;
    reason = theReason;
    error = theError;
  }

  /**
   * Creates an accepted result.
   *
   * @param fields the validated fields, never null. Copied, keeping order.
   *
   * @return the result, never null
   */
  public static TransformResult accepted(final Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    return new TransformResult(Outcome.ACCEPTED,
        Collections.unmodifiableMap(new LinkedHashMap<>(fields)), null, null);
  }

  /**
   * Creates an abstained result.
   *
   * @param reason a short description of the mismatch, never null
   *
   * @return the result, never null
   */
  public static TransformResult abstained(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new TransformResult(Outcome.ABSTAINED, null, reason, null);
  }

  /**
   * Creates a faulted result.
   *
   * @param error the raised error, never null
   *
   * @return the result, never null
   */
  public static TransformResult faulted(final Throwable error) {
    Objects.requireNonNull(error, "error must not be null");
    return new TransformResult(Outcome.FAULTED, null, null, error);
  }

  /**
   * Returns the outcome.
   *
   * @return the outcome, never null
   */
  public Outcome outcome() {
    return outcome;
  }

  /**
   * Returns the validated fields.
   *
   * @return the unmodifiable fields, never null
   *
   * @throws IllegalStateException if the result is not ACCEPTED
   */
  public Map<String, Object> fields() {
    if (outcome != Outcome.ACCEPTED) {
      throw new IllegalStateException("No fields for a " + outcome
          + " result");
    }
    return fields;
  }

  /**
   * Returns the reason of the abstention.
   *
   * @return the reason, never null
   *
   * @throws IllegalStateException if the result is not ABSTAINED
   */
  public String reason() {
    if (outcome != Outcome.ABSTAINED) {
      throw new IllegalStateException("No reason for a " + outcome
          + " result");
    }
    return reason;
  }

  /**
   * Returns the raised error.
   *
   * @return the error, never null
   *
   * @throws IllegalStateException if the result is not FAULTED
   */
  public Throwable error() {
    if (outcome != Outcome.FAULTED) {
      throw new IllegalStateException("No error for a " + outcome
          + " result");
    }
    return error;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    switch (outcome) {
      case ACCEPTED:
        return "TransformResult{ACCEPTED, fields=" + fields + "}";
      case ABSTAINED:
        return "TransformResult{ABSTAINED, reason=" + reason + "}";
      default:
        return "TransformResult{FAULTED, error=" + error + "}";
    }
  }
}
