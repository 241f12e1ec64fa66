package org.waabox.jobnotify;

import java.util.Objects;

/**
 * An asynchronous notification pushed by the database to a subscribed
 * connection.
 *
 * <p>The payload is opaque at this level; it is only interpreted by the
 * {@link PayloadDecoder}. Notifications are not retained after a collection
 * cycle processes them.
 *
 * @param channel    the channel the notification was sent on, never null
 * @param payload    the payload string, never null (may be empty)
 * @param backendPid the pid of the backend that sent the notification
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Notification(String channel, String payload, int backendPid) {

  /** Validates the record components.
   *
   * @param channel    the channel name, never null
   * @param payload    the payload, never null
   * @param backendPid the sending backend pid
   */
  public Notification {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
  }
}
