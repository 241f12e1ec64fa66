package org.waabox.jobnotify.metrics;

/**
 * Why a notification was dropped from a batch.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum DiscardReason {

  /** The payload is not a JSON object with a string message type. */
  UNDECODABLE,

  /** A field has the wrong type for its message type. */
  SCHEMA_MISMATCH,

  /** A field conversion raised an error, which was reported. */
  CONVERSION_FAULT
}
