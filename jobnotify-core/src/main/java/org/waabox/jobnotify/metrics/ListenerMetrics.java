package org.waabox.jobnotify.metrics;

/**
 * An abstraction for recording operational metrics of a job listener.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopListenerMetrics} when metrics
 * collection is not required.
 *
 * <p>Implementations are called from the listener's thread and must not
 * block.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ListenerMetrics {

  /**
   * Records that a wait woke up and drained notifications.
   *
   * @param channel           the listener channel, never null
   * @param notificationCount the number of drained notifications
   */
  void batchReceived(String channel, int notificationCount);

  /**
   * Records a dropped notification.
   *
   * @param messageType the message type tag, or null if the payload could
   *                    not be decoded
   * @param reason      why the notification was dropped, never null
   */
  void messageDiscarded(String messageType, DiscardReason reason);

  /**
   * Records the messages of one type returned from a batch.
   *
   * @param messageType the message type tag, never null
   * @param count       the number of accepted messages
   */
  void messagesAccepted(String messageType, int count);
}
