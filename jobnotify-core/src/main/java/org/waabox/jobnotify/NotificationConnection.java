package org.waabox.jobnotify;

import java.time.Duration;
import java.util.List;

/**
 * A borrowed, single-owner database connection able to subscribe to
 * notification channels and hand out the notifications pushed to it.
 *
 * <p>Implementations wrap a connection lent by an external pool. They are
 * not thread-safe and must be used from one logical caller at a time. They
 * never close the underlying connection.
 *
 * <p>All methods may throw {@link ListenerConnectionException} when the
 * underlying connection fails. Such failures are not retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface NotificationConnection {

  /**
   * Returns the identifier of the backend session serving this connection.
   *
   * @return the backend pid
   */
  int backendPid();

  /**
   * Starts listening on the given channel.
   *
   * @param channel the channel name, never null
   */
  void subscribe(String channel);

  /**
   * Stops listening on the given channel.
   *
   * <p>Notifications that were already buffered client-side are not
   * discarded by this call; callers must drain them with
   * {@link #pollNotifications()}.
   *
   * @param channel the channel name, never null
   */
  void unsubscribe(String channel);

  /**
   * Blocks the calling thread until at least one notification is ready or
   * the timeout elapses.
   *
   * @param timeout the maximum time to wait, never null. A zero timeout
   *                checks for ready data without blocking.
   *
   * @return true if notifications are ready to be polled, false if the
   *         timeout elapsed first
   */
  boolean awaitNotifications(Duration timeout);

  /**
   * Returns every notification currently buffered on the connection,
   * without blocking.
   *
   * @return the buffered notifications in arrival order, never null, empty
   *         when nothing is pending
   */
  List<Notification> pollNotifications();
}
